package com.trading.quant.valuation;

import com.trading.quant.api.InvalidInputException;
import com.trading.quant.api.UndefinedResultException;

/**
 * Dividend discount models. Rates are annual decimals; the required return
 * must lie in {@code (0, 1)} and exceed every perpetual growth rate.
 */
public final class DividendDiscount {

    private DividendDiscount() {
        // Utility class
    }

    /** Perpetuity of a fixed dividend: {@code D / r}. */
    public static double zeroGrowth(double dividend, double requiredReturn) {
        InvalidInputException.requireOpenUnit("requiredReturn", requiredReturn);
        InvalidInputException.requirePositive("dividend", dividend);
        return dividend / requiredReturn;
    }

    /** Gordon model on the current dividend: {@code D0 (1 + g) / (r - g)}. */
    public static double constantGrowth(double currentDividend, double growthRate, double requiredReturn) {
        InvalidInputException.requireOpenUnit("requiredReturn", requiredReturn);
        InvalidInputException.requirePositive("currentDividend", currentDividend);
        return terminalValue(currentDividend, growthRate, requiredReturn);
    }

    /**
     * High growth for {@code highGrowthYears}, then a Gordon terminal value at
     * {@code stableGrowthRate}.
     */
    public static double twoStage(double currentDividend, double highGrowthRate, int highGrowthYears,
            double stableGrowthRate, double requiredReturn) {
        InvalidInputException.requireOpenUnit("requiredReturn", requiredReturn);
        InvalidInputException.requirePositive("currentDividend", currentDividend);
        InvalidInputException.requirePositive("highGrowthYears", highGrowthYears);
        if (highGrowthRate >= requiredReturn) {
            throw new UndefinedResultException("High growth rate must be below the required return");
        }

        double pv = 0.0;
        double dividend = currentDividend;
        for (int year = 1; year <= highGrowthYears; year++) {
            dividend *= 1 + highGrowthRate;
            pv += dividend / Math.pow(1 + requiredReturn, year);
        }
        return pv + terminalValue(dividend, stableGrowthRate, requiredReturn)
                / Math.pow(1 + requiredReturn, highGrowthYears);
    }

    /**
     * High growth, then a transition in which the growth rate falls linearly
     * towards {@code stableGrowthRate} in {@code transitionYears + 1} equal
     * steps, then a Gordon terminal value.
     */
    public static double threeStage(double currentDividend, double highGrowthRate, int highGrowthYears,
            int transitionYears, double stableGrowthRate, double requiredReturn) {
        InvalidInputException.requireOpenUnit("requiredReturn", requiredReturn);
        InvalidInputException.requirePositive("currentDividend", currentDividend);
        InvalidInputException.requirePositive("highGrowthYears", highGrowthYears);
        InvalidInputException.requirePositive("transitionYears", transitionYears);

        double pv = 0.0;
        double dividend = currentDividend;
        for (int year = 1; year <= highGrowthYears; year++) {
            dividend *= 1 + highGrowthRate;
            pv += dividend / Math.pow(1 + requiredReturn, year);
        }

        double step = (highGrowthRate - stableGrowthRate) / (transitionYears + 1);
        for (int year = 1; year <= transitionYears; year++) {
            dividend *= 1 + highGrowthRate - step * year;
            pv += dividend / Math.pow(1 + requiredReturn, highGrowthYears + year);
        }

        return pv + terminalValue(dividend, stableGrowthRate, requiredReturn)
                / Math.pow(1 + requiredReturn, highGrowthYears + transitionYears);
    }

    public static double dividendYield(double dividend, double price) {
        InvalidInputException.requirePositive("price", price);
        return dividend / price;
    }

    public static double payoutRatio(double dividend, double earningsPerShare) {
        InvalidInputException.requirePositive("earningsPerShare", earningsPerShare);
        return dividend / earningsPerShare;
    }

    private static double terminalValue(double lastDividend, double growthRate, double requiredReturn) {
        if (growthRate >= requiredReturn) {
            throw new UndefinedResultException(
                    "Growth rate " + growthRate + " must be below required return " + requiredReturn);
        }
        return lastDividend * (1 + growthRate) / (requiredReturn - growthRate);
    }
}
