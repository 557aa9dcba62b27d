package com.trading.quant.stats;

import com.trading.quant.api.InvalidInputException;

/**
 * Sample moments of a single series.
 */
public final class Descriptive {
    /**
     * A variance at or below this fraction of the mean square is treated as
     * zero; it absorbs the rounding left by decimals such as 0.1.
     */
    public static final double RELATIVE_VARIANCE_FLOOR = 1e-12;

    private Descriptive() {
        // Utility class
    }

    public static double mean(double[] values) {
        InvalidInputException.requireNonEmpty("values", values);
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * Unbiased sample variance, {@code sum((x - mean)^2) / (n - 1)}. A single
     * observation has variance 0.
     */
    public static double sampleVariance(double[] values) {
        double mean = mean(values);
        if (values.length == 1) {
            return 0.0;
        }
        double ss = 0.0;
        for (double v : values) {
            double d = v - mean;
            ss += d * d;
        }
        return ss / (values.length - 1);
    }

    public static double standardDeviation(double[] values) {
        return Math.sqrt(sampleVariance(values));
    }

    /** True if the sample variance is negligible relative to the values' scale. */
    public static boolean isConstant(double[] values) {
        double variance = sampleVariance(values);
        double meanSquare = 0.0;
        for (double v : values) {
            meanSquare += v * v;
        }
        meanSquare /= values.length;
        return variance <= RELATIVE_VARIANCE_FLOOR * meanSquare;
    }
}
