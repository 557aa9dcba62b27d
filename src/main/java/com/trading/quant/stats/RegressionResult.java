package com.trading.quant.stats;

/**
 * Fit of {@code y = intercept + sum(coefficients[j] * x_j)}.
 *
 * @param adjustedRSquared NaN when there are no residual degrees of freedom.
 */
public record RegressionResult(double intercept, double[] coefficients, double rSquared, double adjustedRSquared) {
}
