package com.trading.quant.portfolio;

import com.trading.quant.api.InvalidInputException;

/**
 * Mean and variance of a weighted portfolio.
 */
public final class PortfolioMath {

    private PortfolioMath() {
        // Utility class
    }

    /** {@code sum(r_i * w_i)}. */
    public static double expectedReturn(double[] returns, double[] weights) {
        InvalidInputException.requireSameLength("returns", returns, "weights", weights);
        double sum = 0.0;
        for (int i = 0; i < returns.length; i++)
            sum += returns[i] * weights[i];
        return sum;
    }

    /** {@code w' Sigma w}, by explicit double loop. */
    public static double variance(double[][] covariance, double[] weights) {
        requireSquare(covariance, weights.length);
        final int n = weights.length;
        double variance = 0.0;
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                variance += weights[i] * weights[j] * covariance[i][j];
            }
        }
        return variance;
    }

    public static double volatility(double[][] covariance, double[] weights) {
        return Math.sqrt(variance(covariance, weights));
    }

    /** Excess return per unit of volatility; 0 when volatility is 0. */
    public static double sharpeRatio(double[] returns, double[][] covariance, double[] weights,
            double riskFreeRate) {
        double portfolioReturn = expectedReturn(returns, weights);
        double vol = volatility(covariance, weights);
        if (vol == 0.0)
            return 0.0;
        return (portfolioReturn - riskFreeRate) / vol;
    }

    /** Throws unless the matrix is {@code n x n}. */
    static void requireSquare(double[][] covariance, int n) {
        if (covariance.length != n)
            throw new InvalidInputException(
                    "Covariance dimension " + covariance.length + " does not match " + n + " weights");
        for (int i = 0; i < n; i++) {
            if (covariance[i].length != n)
                throw new InvalidInputException("Covariance matrix must be square, row " + i + " has length "
                        + covariance[i].length);
        }
    }
}
