package com.trading.quant.bond;

import com.trading.quant.api.UndefinedResultException;

/**
 * Second-order yield sensitivity of a bond and the duration/convexity price
 * approximation.
 */
public final class ConvexityCalculator {

    private ConvexityCalculator() {
        // Utility class
    }

    /**
     * {@code sum(PV_i * i (i + 1) / f^2) / (PV * (1 + y/f)^2)}, in years squared.
     */
    public static double convexity(Bond bond, double yield) {
        final int n = bond.periods();
        final double f = bond.couponFrequency();
        final double y = bond.periodicYield(yield);

        double weighted = 0.0;
        double pv = 0.0;
        for (int i = 1; i <= n; i++) {
            double cf = bond.cashFlow(i) / Math.pow(1.0 + y, i);
            weighted += cf * (i * (i + 1.0)) / (f * f);
            pv += cf;
        }
        if (pv == 0.0)
            throw new UndefinedResultException("Bond present value is zero, convexity undefined");
        return weighted / (pv * (1.0 + y) * (1.0 + y));
    }

    public static double effective(Bond bond, double yield) {
        return effective(bond, yield, DurationCalculator.DEFAULT_YIELD_BUMP);
    }

    /** {@code (P(y + dy) + P(y - dy) - 2 P(y)) / (P(y) dy^2)}. */
    public static double effective(Bond bond, double yield, double bump) {
        double p0 = BondPricer.price(bond, yield);
        double up = BondPricer.price(bond, yield + bump);
        double down = BondPricer.price(bond, yield - bump);
        return (up + down - 2.0 * p0) / (p0 * bump * bump);
    }

    /**
     * Fractional price change for a yield shift:
     * {@code -D * dy + 0.5 * C * dy^2}.
     */
    public static double estimatePriceChange(double modifiedDuration, double convexity, double yieldChange) {
        return -modifiedDuration * yieldChange + 0.5 * convexity * yieldChange * yieldChange;
    }
}
