package com.trading.quant.indicators;

/**
 * Moving averages over a whole price series.
 *
 * <p>
 * Each function returns one value per complete window, so the output is
 * shorter than the input. Output index {@code i} lines up with input index
 * {@code i + (input.length - output.length)}.
 */
public final class MovingAverages {

    private MovingAverages() {
        // Utility class
    }

    /** Arithmetic mean of each trailing window of {@code period} values. */
    public static double[] sma(double[] prices, int period) {
        Series.requireWindow("prices", prices, period);
        double[] out = new double[prices.length - period + 1];
        double sum = 0.0;
        for (int i = 0; i < prices.length; i++) {
            sum += prices[i];
            if (i >= period)
                sum -= prices[i - period];
            if (i >= period - 1)
                out[i - period + 1] = sum / period;
        }
        return out;
    }

    /**
     * Exponential moving average with {@code alpha = 2 / (period + 1)}, seeded
     * with the SMA of the first window.
     */
    public static double[] ema(double[] prices, int period) {
        Series.requireWindow("prices", prices, period);
        final double alpha = 2.0 / (period + 1);
        double[] out = new double[prices.length - period + 1];

        double seed = 0.0;
        for (int i = 0; i < period; i++)
            seed += prices[i];
        out[0] = seed / period;

        for (int i = period; i < prices.length; i++) {
            int k = i - period + 1;
            out[k] = alpha * prices[i] + (1.0 - alpha) * out[k - 1];
        }
        return out;
    }

    /** Linearly weighted average; the newest value weighs {@code period}, the oldest 1. */
    public static double[] wma(double[] prices, int period) {
        Series.requireWindow("prices", prices, period);
        final double weightSum = period * (period + 1) / 2.0;
        double[] out = new double[prices.length - period + 1];
        for (int i = period - 1; i < prices.length; i++) {
            double weighted = 0.0;
            for (int j = 0; j < period; j++)
                weighted += prices[i - period + 1 + j] * (j + 1);
            out[i - period + 1] = weighted / weightSum;
        }
        return out;
    }

    /**
     * Double exponential moving average, {@code 2 * EMA - EMA(EMA)}. Needs
     * {@code 2 * period - 1} prices.
     */
    public static double[] dema(double[] prices, int period) {
        double[] ema1 = ema(prices, period);
        double[] ema2 = ema(ema1, period);
        int offset = ema1.length - ema2.length;
        double[] out = new double[ema2.length];
        for (int i = 0; i < ema2.length; i++)
            out[i] = 2.0 * ema1[i + offset] - ema2[i];
        return out;
    }
}
