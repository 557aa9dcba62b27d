package com.trading.quant.indicators;

import com.trading.quant.api.InvalidInputException;

/**
 * Volatility channels and average true range.
 */
public final class VolatilityBands {
    public static final int DEFAULT_BAND_PERIOD = 20;
    public static final double DEFAULT_BAND_WIDTH = 2.0;
    public static final int DEFAULT_ATR_PERIOD = 14;

    private VolatilityBands() {
        // Utility class
    }

    public static Bands bollinger(double[] prices) {
        return bollinger(prices, DEFAULT_BAND_PERIOD, DEFAULT_BAND_WIDTH);
    }

    /**
     * Bollinger bands: the window SMA plus and minus {@code width} population
     * standard deviations of the window.
     */
    public static Bands bollinger(double[] prices, int period, double width) {
        return meanDeviationChannel(prices, period, width);
    }

    public static Bands standardDeviationChannel(double[] prices) {
        return standardDeviationChannel(prices, DEFAULT_BAND_PERIOD, DEFAULT_BAND_WIDTH);
    }

    /**
     * Channel around the window mean, {@code width} population standard
     * deviations wide on each side. Numerically the same construction as
     * {@link #bollinger}.
     */
    public static Bands standardDeviationChannel(double[] prices, int period, double width) {
        return meanDeviationChannel(prices, period, width);
    }

    private static Bands meanDeviationChannel(double[] prices, int period, double width) {
        Series.requireWindow("prices", prices, period);
        InvalidInputException.requirePositive("width", width);

        int n = prices.length - period + 1;
        double[] upper = new double[n];
        double[] middle = new double[n];
        double[] lower = new double[n];

        for (int i = period - 1; i < prices.length; i++) {
            double sum = 0.0;
            for (int w = i - period + 1; w <= i; w++)
                sum += prices[w];
            double mean = sum / period;

            double ss = 0.0;
            for (int w = i - period + 1; w <= i; w++)
                ss += (prices[w] - mean) * (prices[w] - mean);
            double sd = Math.sqrt(ss / period);

            int t = i - period + 1;
            middle[t] = mean;
            upper[t] = mean + width * sd;
            lower[t] = mean - width * sd;
        }
        return new Bands(upper, middle, lower);
    }

    public static double[] averageTrueRange(double[] high, double[] low, double[] close) {
        return averageTrueRange(high, low, close, DEFAULT_ATR_PERIOD);
    }

    /**
     * Wilder-smoothed true range. The true range of bar {@code i >= 1} is the
     * largest of {@code high - low}, {@code |high - prevClose|} and
     * {@code |low - prevClose|}. Returns {@code length - period} values.
     */
    public static double[] averageTrueRange(double[] high, double[] low, double[] close, int period) {
        Series.requireSameLength("high", high, "low", low, "close", close);
        Series.requirePeriod("period", period);
        Series.requireLength("high", high, period + 1);

        WilderSmoother smoother = new WilderSmoother(period);
        double[] out = new double[high.length - period];
        for (int i = 1; i < high.length; i++) {
            double tr = Math.max(high[i] - low[i],
                    Math.max(Math.abs(high[i] - close[i - 1]), Math.abs(low[i] - close[i - 1])));
            double atr = smoother.apply(tr);
            if (i >= period)
                out[i - period] = atr;
        }
        return out;
    }
}
