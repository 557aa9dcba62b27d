package com.trading.quant.portfolio;

import java.util.List;

import com.trading.quant.api.UndefinedResultException;

/**
 * Valuation of a book of {@link Holding}s.
 */
public final class Holdings {

    private Holdings() {
        // Utility class
    }

    /** {@code sum(price * quantity)}; an empty book is worth 0. */
    public static double value(List<Holding> holdings) {
        double total = 0.0;
        for (Holding h : holdings) {
            total += h.value();
        }
        return total;
    }

    /**
     * @throws UndefinedResultException if {@code portfolioValue} is 0.
     */
    public static double weight(double assetValue, double portfolioValue) {
        if (portfolioValue == 0.0) {
            throw new UndefinedResultException("Weight is undefined for a portfolio worth 0");
        }
        return assetValue / portfolioValue;
    }

    /**
     * Value weight of each holding, in input order. A book worth 0 gets all-zero
     * weights.
     */
    public static double[] weights(List<Holding> holdings) {
        double total = value(holdings);
        double[] w = new double[holdings.size()];
        if (total == 0.0) {
            return w;
        }
        for (int i = 0; i < w.length; i++) {
            w[i] = weight(holdings.get(i).value(), total);
        }
        return w;
    }

    /**
     * Change in book value relative to an earlier snapshot. With no earlier
     * snapshot ({@code null} or empty) the return is 0.
     *
     * @throws UndefinedResultException if the earlier book was worth 0.
     */
    public static double periodReturn(List<Holding> current, List<Holding> previous) {
        if (previous == null || previous.isEmpty()) {
            return 0.0;
        }
        double before = value(previous);
        if (before == 0.0) {
            throw new UndefinedResultException("Return is undefined when the previous portfolio was worth 0");
        }
        return (value(current) - before) / before;
    }
}
