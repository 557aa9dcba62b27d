package com.trading.quant.portfolio;

import com.trading.quant.api.InvalidInputException;

import lombok.Builder;
import lombok.Value;

/**
 * Feasible region for a weight vector.
 *
 * <p>
 * A vector is feasible when its weights sum to 1 within
 * {@link #SUM_TOLERANCE} and every configured bound holds. Unset bounds
 * ({@code null}) are not checked.
 *
 * <pre>
 * WeightConstraints c = WeightConstraints.builder()
 *         .longOnly(true)
 *         .maxWeight(0.4)
 *         .build();
 * </pre>
 */
@Value
public class WeightConstraints {
    public static final double SUM_TOLERANCE = 0.01;

    /** Only the sum-to-one check. */
    public static final WeightConstraints NONE = WeightConstraints.builder().build();

    /** No short positions. */
    boolean longOnly;
    /** Lower bound applied to every asset. */
    Double minWeight;
    /** Upper bound applied to every asset. */
    Double maxWeight;
    /** Per-asset lower bounds. */
    double[] min;
    /** Per-asset upper bounds. */
    double[] max;

    @Builder
    private WeightConstraints(boolean longOnly, Double minWeight, Double maxWeight, double[] min, double[] max) {
        this.longOnly = longOnly;
        this.minWeight = minWeight;
        this.maxWeight = maxWeight;
        this.min = min == null ? null : min.clone();
        this.max = max == null ? null : max.clone();
    }

    public double[] getMin() {
        return min == null ? null : min.clone();
    }

    public double[] getMax() {
        return max == null ? null : max.clone();
    }

    public static WeightConstraints longOnly() {
        return WeightConstraints.builder().longOnly(true).build();
    }

    /**
     * Rejects per-asset bound vectors whose length differs from the number of
     * assets.
     */
    public void checkDimension(int assets) {
        if (min != null && min.length != assets)
            throw new InvalidInputException("min bounds length " + min.length + " does not match " + assets + " assets");
        if (max != null && max.length != assets)
            throw new InvalidInputException("max bounds length " + max.length + " does not match " + assets + " assets");
    }

    public boolean isSatisfiedBy(double[] weights) {
        if (Math.abs(Weights.sum(weights) - 1.0) > SUM_TOLERANCE)
            return false;

        for (int i = 0; i < weights.length; i++) {
            double w = weights[i];
            if (longOnly && w < 0)
                return false;
            if (minWeight != null && w < minWeight)
                return false;
            if (maxWeight != null && w > maxWeight)
                return false;
            if (min != null && (i >= min.length || w < min[i]))
                return false;
            if (max != null && (i >= max.length || w > max[i]))
                return false;
        }
        return true;
    }
}
