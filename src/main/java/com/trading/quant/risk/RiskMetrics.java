package com.trading.quant.risk;

import java.util.Arrays;

import com.trading.quant.api.InvalidInputException;
import com.trading.quant.stats.Descriptive;

/**
 * Risk measures of a single return or price series.
 *
 * <p>
 * Returns are decimal fractions per period ({@code 0.01} is 1%). VaR and CVaR
 * are reported as positive numbers for losses.
 */
public final class RiskMetrics {

    private RiskMetrics() {
        // Utility class
    }

    /** Sample standard deviation; 0 for a single observation. */
    public static double volatility(double[] returns) {
        return Descriptive.standardDeviation(returns);
    }

    /**
     * Scales per-period volatility by {@code sqrt(periodsPerYear)}, e.g. 252 for
     * daily data.
     */
    public static double annualizedVolatility(double[] returns, double periodsPerYear) {
        InvalidInputException.requirePositive("periodsPerYear", periodsPerYear);
        return volatility(returns) * Math.sqrt(periodsPerYear);
    }

    /**
     * {@code (mean - rf) / volatility}, with {@code rf} in the same period as
     * the returns. A flat series has Sharpe 0.
     */
    public static double sharpeRatio(double[] returns, double riskFreeRate) {
        double vol = volatility(returns);
        if (vol == 0.0)
            return 0.0;
        return (Descriptive.mean(returns) - riskFreeRate) / vol;
    }

    /**
     * Largest peak-to-trough decline as a fraction of the running peak.
     *
     * @param prices chronological price series.
     */
    public static double maxDrawdown(double[] prices) {
        InvalidInputException.requireNonEmpty("prices", prices);
        double peak = prices[0];
        double maxDd = 0.0;
        for (int i = 1; i < prices.length; i++) {
            if (prices[i] > peak) {
                peak = prices[i];
            }
            double dd = (peak - prices[i]) / peak;
            if (dd > maxDd) {
                maxDd = dd;
            }
        }
        return maxDd;
    }

    /**
     * Historical VaR: {@code -sorted[floor((1 - confidence) * n)]}.
     *
     * @param confidence in {@code (0, 1)}, e.g. 0.95.
     */
    public static double valueAtRisk(double[] returns, double confidence) {
        double[] sorted = sortedTail(returns, confidence);
        return -sorted[tailIndex(sorted.length, confidence)];
    }

    /**
     * Expected shortfall: the mean loss over the sorted returns up to and
     * including the VaR observation.
     */
    public static double conditionalValueAtRisk(double[] returns, double confidence) {
        double[] sorted = sortedTail(returns, confidence);
        int idx = tailIndex(sorted.length, confidence);
        double loss = 0.0;
        for (int i = 0; i <= idx; i++) {
            loss -= sorted[i];
        }
        return loss / (idx + 1);
    }

    private static double[] sortedTail(double[] returns, double confidence) {
        InvalidInputException.requireNonEmpty("returns", returns);
        InvalidInputException.requireOpenUnit("confidence", confidence);
        double[] sorted = returns.clone();
        Arrays.sort(sorted);
        return sorted;
    }

    private static int tailIndex(int n, double confidence) {
        return (int) Math.floor((1.0 - confidence) * n);
    }
}
