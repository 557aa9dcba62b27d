package com.trading.quant.indicators;

/** Stochastic K and D lines and {@code J = 3K - 2D}, one value per window. */
public record KdjResult(double[] k, double[] d, double[] j) {

    public KdjResult {
        k = k.clone();
        d = d.clone();
        j = j.clone();
    }

    @Override
    public double[] k() {
        return k.clone();
    }

    @Override
    public double[] d() {
        return d.clone();
    }

    @Override
    public double[] j() {
        return j.clone();
    }
}
