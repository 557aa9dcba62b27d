package com.trading.quant.portfolio;

import java.util.Arrays;

import com.trading.quant.api.InvalidInputException;
import com.trading.quant.api.UndefinedResultException;

/**
 * Weight vector helpers. All methods return new arrays.
 */
public final class Weights {

    private Weights() {
        // Utility class
    }

    public static double sum(double[] weights) {
        double s = 0.0;
        for (double w : weights)
            s += w;
        return s;
    }

    /** {@code 1/n} in every slot. */
    public static double[] equal(int n) {
        if (n <= 0)
            throw new InvalidInputException("Number of assets must be > 0, was " + n);
        double[] w = new double[n];
        Arrays.fill(w, 1.0 / n);
        return w;
    }

    /** Rescales so the weights sum to 1. */
    public static double[] normalize(double[] weights) {
        double s = sum(weights);
        if (s == 0.0)
            throw new UndefinedResultException("Weights sum to zero, cannot normalize");
        double[] out = new double[weights.length];
        for (int i = 0; i < weights.length; i++)
            out[i] = weights[i] / s;
        return out;
    }

    /** Clamps each weight to {@code [min, max]}, then normalizes. */
    public static double[] clip(double[] weights, double min, double max) {
        double[] clipped = new double[weights.length];
        for (int i = 0; i < weights.length; i++)
            clipped[i] = Math.max(min, Math.min(max, weights[i]));
        return normalize(clipped);
    }
}
