package com.trading.quant.bond;

import com.trading.quant.api.UndefinedResultException;

/**
 * First-order yield sensitivity of a bond.
 */
public final class DurationCalculator {
    public static final double DEFAULT_YIELD_BUMP = 0.01;

    private DurationCalculator() {
        // Utility class
    }

    /** PV-weighted average time to cash flow, in years. */
    public static double macaulay(Bond bond, double yield) {
        final int n = bond.periods();
        final double f = bond.couponFrequency();
        final double y = bond.periodicYield(yield);

        double weighted = 0.0;
        double pv = 0.0;
        for (int i = 1; i <= n; i++) {
            double cf = bond.cashFlow(i) / Math.pow(1.0 + y, i);
            weighted += cf * (i / f);
            pv += cf;
        }
        if (pv == 0.0)
            throw new UndefinedResultException("Bond present value is zero, duration undefined");
        return weighted / pv;
    }

    /** Macaulay duration divided by {@code 1 + y/f}. */
    public static double modified(Bond bond, double yield) {
        return macaulay(bond, yield) / (1.0 + bond.periodicYield(yield));
    }

    public static double effective(Bond bond, double yield) {
        return effective(bond, yield, DEFAULT_YIELD_BUMP);
    }

    /** {@code -(P(y + dy) - P(y - dy)) / (2 P(y) dy)}. */
    public static double effective(Bond bond, double yield, double bump) {
        double p0 = BondPricer.price(bond, yield);
        double up = BondPricer.price(bond, yield + bump);
        double down = BondPricer.price(bond, yield - bump);
        return -(up - down) / (2.0 * p0 * bump);
    }
}
