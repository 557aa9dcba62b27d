package com.trading.quant.bond;

import static com.trading.quant.api.InvalidInputException.requireNonEmpty;
import static com.trading.quant.api.InvalidInputException.requirePositive;

import com.trading.quant.api.InvalidInputException;

/**
 * Present value of a bond and its closed-form sensitivity to yield.
 *
 * <pre>
 * P = c (1 - (1 + y)^-n) / y + F / (1 + y)^n        y = periodic yield
 * P = F + c n                                        |y| &lt; 1e-10
 * </pre>
 *
 * This is the only bond pricing routine in the engine; duration, convexity and
 * the yield solver all call it.
 */
public final class BondPricer {
    /** Periodic yields below this magnitude use the zero-yield limit. */
    public static final double ZERO_YIELD = 1e-10;

    private BondPricer() {
        // Utility class
    }

    public static double price(Bond bond, double yield) {
        final double c = bond.couponPayment();
        final double n = bond.periodCount();
        final double y = bond.periodicYield(yield);

        if (Math.abs(y) < ZERO_YIELD) {
            return bond.faceValue() + c * n;
        }

        double pvCoupons = c * (1.0 - Math.pow(1.0 + y, -n)) / y;
        double pvFace = bond.faceValue() / Math.pow(1.0 + y, n);
        return pvCoupons + pvFace;
    }

    public static double price(double faceValue, double couponRate, double yield, double yearsToMaturity,
            int couponFrequency) {
        return price(new Bond(faceValue, couponRate, yearsToMaturity, couponFrequency), yield);
    }

    /**
     * dP/dy with respect to the annual yield.
     *
     * <pre>
     * dP/dy_p = -c (1 - v^n) / y_p^2 + c n v^(n+1) / y_p - F n v^(n+1),   v = 1 / (1 + y_p)
     * dP/dy   = dP/dy_p / f
     * </pre>
     */
    public static double yieldDerivative(Bond bond, double yield) {
        final double c = bond.couponPayment();
        final double n = bond.periodCount();
        final double f = bond.couponFrequency();
        final double face = bond.faceValue();
        final double y = bond.periodicYield(yield);

        if (Math.abs(y) < ZERO_YIELD) {
            return -(c * n * (n + 1) / 2.0 + face * n) / f;
        }

        double v = 1.0 / (1.0 + y);
        double vn = Math.pow(v, n);
        double vn1 = vn * v;

        double dAnnuity = -c * (1.0 - vn) / (y * y) + c * n * vn1 / y;
        double dFace = -face * n * vn1;
        return (dAnnuity + dFace) / f;
    }

    /** {@code F / (1 + y)^T} with annual compounding. */
    public static double zeroCouponPrice(double faceValue, double yield, double yearsToMaturity) {
        requirePositive("faceValue", faceValue);
        requirePositive("yearsToMaturity", yearsToMaturity);
        return faceValue / Math.pow(1.0 + yield, yearsToMaturity);
    }

    /** Coupon accrued linearly since the last payment date. */
    public static double accruedInterest(double faceValue, double couponRate, int couponFrequency,
            double daysSinceLastCoupon, double daysInCouponPeriod) {
        requirePositive("faceValue", faceValue);
        requirePositive("couponFrequency", couponFrequency);
        requirePositive("daysInCouponPeriod", daysInCouponPeriod);
        if (daysSinceLastCoupon < 0 || daysSinceLastCoupon > daysInCouponPeriod) {
            throw new InvalidInputException("daysSinceLastCoupon must be within [0, " + daysInCouponPeriod
                    + "], was " + daysSinceLastCoupon);
        }
        double coupon = faceValue * couponRate / couponFrequency;
        return coupon * daysSinceLastCoupon / daysInCouponPeriod;
    }

    public static double cleanPrice(double dirtyPrice, double accruedInterest) {
        return dirtyPrice - accruedInterest;
    }

    public static double dirtyPrice(double cleanPrice, double accruedInterest) {
        return cleanPrice + accruedInterest;
    }

    /**
     * Discounts {@code cashFlows[k]} over {@code k + 1} periods at
     * {@code discountRate / periodsPerYear}.
     */
    public static double presentValue(double[] cashFlows, double discountRate, int periodsPerYear) {
        requireNonEmpty("cashFlows", cashFlows);
        requirePositive("periodsPerYear", periodsPerYear);
        if (discountRate < 0 || discountRate > 1) {
            throw new InvalidInputException("discountRate must be within [0, 1], was " + discountRate);
        }
        double r = discountRate / periodsPerYear;
        double pv = 0.0;
        for (int k = 0; k < cashFlows.length; k++) {
            pv += cashFlows[k] / Math.pow(1.0 + r, k + 1);
        }
        return pv;
    }
}
