package com.trading.quant.valuation;

import com.trading.quant.api.InvalidInputException;
import com.trading.quant.api.UndefinedResultException;

/**
 * Enterprise and equity value from forecast free cash flows.
 */
public final class DiscountedCashFlow {

    private DiscountedCashFlow() {
        // Utility class
    }

    /**
     * PV of the forecast cash flows plus PV of the terminal value, both
     * discounted annually at {@code discountRate}.
     *
     * @throws UndefinedResultException if the Gordon terminal value is used
     *                                  and {@code g >= r}.
     */
    public static double enterpriseValue(DcfInputs in) {
        final double r = in.discountRate();
        final double[] fcf = in.freeCashFlows();
        final int n = fcf.length;

        double pv = 0.0;
        for (int t = 0; t < n; t++) {
            pv += fcf[t] / Math.pow(1 + r, t + 1);
        }

        double terminal;
        if (in.usesExitMultiple()) {
            terminal = in.terminalYearCashFlow() * in.terminalMultiple();
        } else {
            terminal = gordonGrowth(fcf[n - 1] * (1 + in.terminalGrowthRate()), in.terminalGrowthRate(), r);
        }
        return pv + terminal / Math.pow(1 + r, n);
    }

    /** {@code EV - debt + cash - minorityInterest}. */
    public static double equityValue(double enterpriseValue, double debt, double cash, double minorityInterest) {
        return enterpriseValue - debt + cash - minorityInterest;
    }

    public static double equityValue(double enterpriseValue, double debt, double cash) {
        return equityValue(enterpriseValue, debt, cash, 0.0);
    }

    public static double valuePerShare(double equityValue, double sharesOutstanding) {
        InvalidInputException.requirePositive("sharesOutstanding", sharesOutstanding);
        return equityValue / sharesOutstanding;
    }

    /**
     * Weighted average cost of capital:
     *
     * <pre>
     * WACC = E/V * Re + D/V * Rd * (1 - t)
     * </pre>
     */
    public static double wacc(double equityValue, double debtValue, double costOfEquity, double costOfDebt,
            double taxRate) {
        double total = equityValue + debtValue;
        if (total == 0.0) {
            throw new UndefinedResultException("WACC is undefined when equity plus debt is 0");
        }
        return equityValue / total * costOfEquity + debtValue / total * costOfDebt * (1 - taxRate);
    }

    /**
     * Value of a growing perpetuity, {@code CF1 / (r - g)}.
     *
     * @param nextCashFlow cash flow one period from now.
     */
    public static double gordonGrowth(double nextCashFlow, double growthRate, double discountRate) {
        InvalidInputException.requirePositive("discountRate", discountRate);
        if (growthRate >= discountRate) {
            throw new UndefinedResultException(
                    "Growth rate " + growthRate + " must be below discount rate " + discountRate);
        }
        return nextCashFlow / (discountRate - growthRate);
    }
}
