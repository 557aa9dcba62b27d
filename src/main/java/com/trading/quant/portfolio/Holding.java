package com.trading.quant.portfolio;

/**
 * A position: units held at a unit price.
 */
public record Holding(double price, double quantity) {

    public double value() {
        return price * quantity;
    }
}
