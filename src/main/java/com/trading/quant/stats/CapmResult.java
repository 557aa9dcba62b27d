package com.trading.quant.stats;

/** Single-index regression of asset returns on market returns. */
public record CapmResult(double alpha, double beta, double rSquared) {
}
