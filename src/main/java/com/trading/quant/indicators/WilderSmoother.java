package com.trading.quant.indicators;

import com.trading.quant.fn.Fn1;

/**
 * Wilder's running average.
 *
 * <pre>
 * avg[0] = mean(first period inputs)
 * avg[t] = (avg[t-1] * (period - 1) + x[t]) / period
 * </pre>
 *
 * The first {@code period - 1} calls return NaN while the seed window fills.
 */
final class WilderSmoother implements Fn1 {
    private final int period;
    private double sum;
    private int count;
    private double average = Double.NaN;

    WilderSmoother(int period) {
        if (period < 1)
            throw new IllegalArgumentException("Period must be >= 1");
        this.period = period;
    }

    @Override
    public double apply(double input) {
        if (count < period) {
            sum += input;
            count++;
            if (count == period)
                average = sum / period;
            return average;
        }
        average = (average * (period - 1) + input) / period;
        return average;
    }
}
