package com.trading.quant.indicators;

/** Upper, middle and lower lines of a price channel, aligned index by index. */
public record Bands(double[] upper, double[] middle, double[] lower) {

    public Bands {
        upper = upper.clone();
        middle = middle.clone();
        lower = lower.clone();
    }

    @Override
    public double[] upper() {
        return upper.clone();
    }

    @Override
    public double[] middle() {
        return middle.clone();
    }

    @Override
    public double[] lower() {
        return lower.clone();
    }
}
