package com.trading.quant.risk;

import com.trading.quant.api.InvalidInputException;
import com.trading.quant.portfolio.WeightConstraints;
import com.trading.quant.stats.Descriptive;

/**
 * Period and compounded returns.
 */
public final class ReturnMetrics {

    private ReturnMetrics() {
        // Utility class
    }

    /** {@code (final - initial) / initial}. */
    public static double simpleReturn(double initialValue, double finalValue) {
        if (initialValue == 0.0) {
            throw new InvalidInputException("Initial value must not be 0");
        }
        return (finalValue - initialValue) / initialValue;
    }

    /** {@code (1 + mean)^periodsPerYear - 1}. */
    public static double annualizedReturn(double[] returns, double periodsPerYear) {
        InvalidInputException.requirePositive("periodsPerYear", periodsPerYear);
        return Math.pow(1.0 + Descriptive.mean(returns), periodsPerYear) - 1.0;
    }

    /** {@code prod(1 + r_i) - 1}; an empty series compounds to 0. */
    public static double cumulativeReturn(double[] returns) {
        double growth = 1.0;
        for (double r : returns) {
            growth *= 1.0 + r;
        }
        return growth - 1.0;
    }

    /**
     * {@code sum(r_i * w_i)}.
     *
     * @throws InvalidInputException if the weights do not sum to 1 within
     *                               {@link WeightConstraints#SUM_TOLERANCE}.
     */
    public static double weightedReturn(double[] returns, double[] weights) {
        InvalidInputException.requireNonEmpty("returns", returns);
        InvalidInputException.requireSameLength("returns", returns, "weights", weights);
        double sum = 0.0;
        double total = 0.0;
        for (int i = 0; i < returns.length; i++) {
            sum += returns[i] * weights[i];
            total += weights[i];
        }
        if (Math.abs(total - 1.0) > WeightConstraints.SUM_TOLERANCE) {
            throw new InvalidInputException("Weights must sum to 1, got " + total);
        }
        return sum;
    }
}
