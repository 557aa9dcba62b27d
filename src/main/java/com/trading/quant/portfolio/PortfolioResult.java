package com.trading.quant.portfolio;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Snapshot of an optimized portfolio.
 *
 * @param sharpeRatio Only populated by the max-Sharpe optimizer, otherwise
 *                    {@code null}.
 */
public record PortfolioResult(
        double[] weights,
        double expectedReturn,
        double variance,
        double volatility,
        @JsonInclude(JsonInclude.Include.NON_NULL) Double sharpeRatio) {

    public PortfolioResult {
        weights = weights.clone();
    }

    @Override
    public double[] weights() {
        return weights.clone();
    }

    static PortfolioResult of(double[] weights, double expectedReturn, double variance, Double sharpeRatio) {
        return new PortfolioResult(weights, expectedReturn, variance, Math.sqrt(variance), sharpeRatio);
    }
}
