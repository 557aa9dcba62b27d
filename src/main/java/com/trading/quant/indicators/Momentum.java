package com.trading.quant.indicators;

import com.trading.quant.api.InvalidInputException;

/**
 * Momentum oscillators: MACD, RSI and the KDJ stochastic.
 */
public final class Momentum {
    public static final int DEFAULT_MACD_FAST = 12;
    public static final int DEFAULT_MACD_SLOW = 26;
    public static final int DEFAULT_MACD_SIGNAL = 9;
    public static final int DEFAULT_RSI_PERIOD = 14;
    public static final int DEFAULT_KDJ_PERIOD = 9;
    public static final int DEFAULT_KDJ_SMOOTHING = 3;

    /** Starting value of the K and D recursions. */
    private static final double KDJ_SEED = 50.0;

    private Momentum() {
        // Utility class
    }

    public static MacdResult macd(double[] prices) {
        return macd(prices, DEFAULT_MACD_FAST, DEFAULT_MACD_SLOW, DEFAULT_MACD_SIGNAL);
    }

    /**
     * <pre>
     * macd      = EMA(fast) - EMA(slow)
     * signal    = EMA(macd, signalPeriod)
     * histogram = macd - signal
     * </pre>
     *
     * @throws InvalidInputException if a period is not positive, if
     *                               {@code fast >= slow}, or if the series is
     *                               too short for the slow and signal windows.
     */
    public static MacdResult macd(double[] prices, int fastPeriod, int slowPeriod, int signalPeriod) {
        InvalidInputException.requireNonEmpty("prices", prices);
        Series.requirePeriod("fastPeriod", fastPeriod);
        Series.requirePeriod("slowPeriod", slowPeriod);
        Series.requirePeriod("signalPeriod", signalPeriod);
        if (fastPeriod >= slowPeriod)
            throw new InvalidInputException("fastPeriod " + fastPeriod + " must be below slowPeriod " + slowPeriod);

        double[] fast = MovingAverages.ema(prices, fastPeriod);
        double[] slow = MovingAverages.ema(prices, slowPeriod);
        int offset = fast.length - slow.length;

        double[] line = new double[slow.length];
        for (int i = 0; i < line.length; i++)
            line[i] = fast[i + offset] - slow[i];

        double[] signal = MovingAverages.ema(line, signalPeriod);
        int signalOffset = line.length - signal.length;
        double[] histogram = new double[signal.length];
        for (int i = 0; i < signal.length; i++)
            histogram[i] = line[i + signalOffset] - signal[i];

        return new MacdResult(line, signal, histogram);
    }

    public static double[] rsi(double[] prices) {
        return rsi(prices, DEFAULT_RSI_PERIOD);
    }

    /**
     * Relative strength index with Wilder smoothing of gains and losses.
     * Returns {@code prices.length - period} values in {@code [0, 100]}.
     *
     * <p>
     * A window with no losses reads 100; a window with neither gains nor
     * losses reads 50.
     */
    public static double[] rsi(double[] prices, int period) {
        Series.requirePeriod("period", period);
        Series.requireLength("prices", prices, period + 1);
        return wilderRsi(prices, period);
    }

    /** RSI on any series; also backs the volume RSI. */
    static double[] wilderRsi(double[] values, int period) {
        WilderSmoother gains = new WilderSmoother(period);
        WilderSmoother losses = new WilderSmoother(period);
        double[] out = new double[values.length - period];

        for (int i = 1; i < values.length; i++) {
            double change = values[i] - values[i - 1];
            double avgGain = gains.apply(Math.max(0.0, change));
            double avgLoss = losses.apply(Math.max(0.0, -change));
            if (i < period)
                continue;

            double rsi;
            if (avgLoss == 0.0) {
                rsi = avgGain == 0.0 ? 50.0 : 100.0;
            } else {
                rsi = 100.0 - 100.0 / (1.0 + avgGain / avgLoss);
            }
            out[i - period] = rsi;
        }
        return out;
    }

    public static KdjResult kdj(double[] high, double[] low, double[] close) {
        return kdj(high, low, close, DEFAULT_KDJ_PERIOD, DEFAULT_KDJ_SMOOTHING, DEFAULT_KDJ_SMOOTHING);
    }

    /**
     * Stochastic oscillator.
     *
     * <pre>
     * RSV = 100 * (close - lowest low) / (highest high - lowest low)   over period
     * K   = (K_prev * (kPeriod - 1) + RSV) / kPeriod,   K_0 = 50
     * D   = (D_prev * (dPeriod - 1) + K) / dPeriod,     D_0 = 50
     * J   = 3K - 2D
     * </pre>
     *
     * A window whose high equals its low has RSV 50.
     */
    public static KdjResult kdj(double[] high, double[] low, double[] close, int period, int kPeriod, int dPeriod) {
        Series.requireSameLength("high", high, "low", low, "close", close);
        Series.requirePeriod("period", period);
        Series.requirePeriod("kPeriod", kPeriod);
        Series.requirePeriod("dPeriod", dPeriod);
        Series.requireLength("high", high, period);

        int n = high.length - period + 1;
        double[] k = new double[n];
        double[] d = new double[n];
        double[] j = new double[n];
        double kValue = KDJ_SEED;
        double dValue = KDJ_SEED;

        for (int i = period - 1; i < high.length; i++) {
            double highest = Double.NEGATIVE_INFINITY;
            double lowest = Double.POSITIVE_INFINITY;
            for (int w = i - period + 1; w <= i; w++) {
                highest = Math.max(highest, high[w]);
                lowest = Math.min(lowest, low[w]);
            }
            double rsv = highest == lowest ? 50.0 : 100.0 * (close[i] - lowest) / (highest - lowest);

            kValue = (kValue * (kPeriod - 1) + rsv) / kPeriod;
            dValue = (dValue * (dPeriod - 1) + kValue) / dPeriod;
            int t = i - period + 1;
            k[t] = kValue;
            d[t] = dValue;
            j[t] = 3.0 * kValue - 2.0 * dValue;
        }
        return new KdjResult(k, d, j);
    }
}
