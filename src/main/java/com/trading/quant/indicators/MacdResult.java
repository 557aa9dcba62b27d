package com.trading.quant.indicators;

/**
 * MACD line, its signal line and their difference. The three series are
 * aligned at the end; {@code signal} and {@code histogram} are shorter than
 * {@code macd} by {@code signalPeriod - 1}.
 */
public record MacdResult(double[] macd, double[] signal, double[] histogram) {

    public MacdResult {
        macd = macd.clone();
        signal = signal.clone();
        histogram = histogram.clone();
    }

    @Override
    public double[] macd() {
        return macd.clone();
    }

    @Override
    public double[] signal() {
        return signal.clone();
    }

    @Override
    public double[] histogram() {
        return histogram.clone();
    }
}
