package com.trading.quant.stats;

/**
 * Fit of {@code y = intercept + slope * x}.
 *
 * @param standardError {@code sqrt(SSres / (n - 2))}; NaN with two
 *                      observations.
 */
public record SimpleRegressionResult(double intercept, double slope, double rSquared, double standardError) {
}
