package com.trading.quant.indicators;

import com.trading.quant.api.InvalidInputException;

/**
 * Volume-based indicators. All of them read the series in order; OBV and
 * A/D are running totals.
 */
public final class VolumeIndicators {
    public static final int DEFAULT_VOLUME_MA_PERIOD = 20;
    public static final int DEFAULT_VOLUME_RSI_PERIOD = 14;
    public static final int DEFAULT_VOLUME_RATIO_PERIOD = 26;

    private VolumeIndicators() {
        // Utility class
    }

    /**
     * On-balance volume, starting from the first bar's volume. Volume is added
     * on an up close, subtracted on a down close and ignored on an unchanged
     * close.
     */
    public static double[] onBalanceVolume(double[] prices, double[] volumes) {
        InvalidInputException.requireNonEmpty("prices", prices);
        InvalidInputException.requireSameLength("prices", prices, "volumes", volumes);

        double[] out = new double[prices.length];
        double obv = volumes[0];
        out[0] = obv;
        for (int i = 1; i < prices.length; i++) {
            if (prices[i] > prices[i - 1])
                obv += volumes[i];
            else if (prices[i] < prices[i - 1])
                obv -= volumes[i];
            out[i] = obv;
        }
        return out;
    }

    public static double[] volumeMovingAverage(double[] volumes) {
        return volumeMovingAverage(volumes, DEFAULT_VOLUME_MA_PERIOD);
    }

    public static double[] volumeMovingAverage(double[] volumes, int period) {
        Series.requireWindow("volumes", volumes, period);
        return MovingAverages.sma(volumes, period);
    }

    public static double[] volumeRsi(double[] volumes) {
        return volumeRsi(volumes, DEFAULT_VOLUME_RSI_PERIOD);
    }

    /** {@link Momentum#rsi} applied to volume changes. */
    public static double[] volumeRsi(double[] volumes, int period) {
        Series.requirePeriod("period", period);
        Series.requireLength("volumes", volumes, period + 1);
        return Momentum.wilderRsi(volumes, period);
    }

    public static double[] volumeRatio(double[] prices, double[] volumes) {
        return volumeRatio(prices, volumes, DEFAULT_VOLUME_RATIO_PERIOD);
    }

    /**
     * Volume ratio. For each window of {@code period} bars ending at
     * {@code i >= period}, bars are classed against the close at
     * {@code i - period}:
     *
     * <pre>
     * VR = 100 * (up + unchanged / 2) / (down + unchanged / 2)
     * </pre>
     *
     * A window with no down or unchanged volume reads 100.
     */
    public static double[] volumeRatio(double[] prices, double[] volumes, int period) {
        InvalidInputException.requireSameLength("prices", prices, "volumes", volumes);
        Series.requirePeriod("period", period);
        Series.requireLength("prices", prices, period + 1);

        double[] out = new double[prices.length - period];
        for (int i = period; i < prices.length; i++) {
            double reference = prices[i - period];
            double up = 0.0, down = 0.0, flat = 0.0;
            for (int w = i - period + 1; w <= i; w++) {
                if (prices[w] > reference)
                    up += volumes[w];
                else if (prices[w] < reference)
                    down += volumes[w];
                else
                    flat += volumes[w];
            }
            double denominator = down + flat / 2.0;
            out[i - period] = denominator == 0.0 ? 100.0 : 100.0 * (up + flat / 2.0) / denominator;
        }
        return out;
    }

    /**
     * Accumulation/distribution line:
     * {@code sum(((close - low) - (high - close)) / (high - low) * volume)}.
     * A bar with {@code high == low} leaves the line unchanged.
     */
    public static double[] accumulationDistribution(double[] high, double[] low, double[] close, double[] volumes) {
        InvalidInputException.requireNonEmpty("high", high);
        Series.requireSameLength("high", high, "low", low, "close", close);
        InvalidInputException.requireSameLength("high", high, "volumes", volumes);

        double[] out = new double[high.length];
        double ad = 0.0;
        for (int i = 0; i < high.length; i++) {
            double range = high[i] - low[i];
            if (range != 0.0) {
                double multiplier = ((close[i] - low[i]) - (high[i] - close[i])) / range;
                ad += multiplier * volumes[i];
            }
            out[i] = ad;
        }
        return out;
    }
}
