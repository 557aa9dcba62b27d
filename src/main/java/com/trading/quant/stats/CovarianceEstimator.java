package com.trading.quant.stats;

import com.trading.quant.api.InvalidInputException;

/**
 * Sample covariance and Pearson correlation, pairwise and as matrices.
 *
 * <p>
 * Matrix inputs are laid out one row per asset, one column per observation;
 * every row must have the same length.
 */
public final class CovarianceEstimator {

    private CovarianceEstimator() {
        // Utility class
    }

    /** {@code sum((x - mx)(y - my)) / (n - 1)}. */
    public static double covariance(double[] x, double[] y) {
        InvalidInputException.requireNonEmpty("x", x);
        InvalidInputException.requireSameLength("x", x, "y", y);
        if (x.length == 1) {
            return 0.0;
        }
        double mx = Descriptive.mean(x);
        double my = Descriptive.mean(y);
        double sum = 0.0;
        for (int i = 0; i < x.length; i++) {
            sum += (x[i] - mx) * (y[i] - my);
        }
        return sum / (x.length - 1);
    }

    /**
     * Pearson correlation in {@code [-1, 1]}. Returns 0 when either series has
     * zero variance.
     */
    public static double correlation(double[] x, double[] y) {
        InvalidInputException.requireNonEmpty("x", x);
        InvalidInputException.requireSameLength("x", x, "y", y);
        double mx = Descriptive.mean(x);
        double my = Descriptive.mean(y);

        double num = 0.0;
        double ssx = 0.0;
        double ssy = 0.0;
        for (int i = 0; i < x.length; i++) {
            double dx = x[i] - mx;
            double dy = y[i] - my;
            num += dx * dy;
            ssx += dx * dx;
            ssy += dy * dy;
        }

        double den = Math.sqrt(ssx * ssy);
        if (den == 0.0)
            return 0.0;
        return num / den;
    }

    public static double[][] covarianceMatrix(double[][] rows) {
        requireRectangular(rows);
        int n = rows.length;
        double[][] cov = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i; j < n; j++) {
                double c = covariance(rows[i], rows[j]);
                cov[i][j] = c;
                cov[j][i] = c;
            }
        }
        return cov;
    }

    public static double[][] correlationMatrix(double[][] rows) {
        requireRectangular(rows);
        int n = rows.length;
        double[][] corr = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i; j < n; j++) {
                double c = correlation(rows[i], rows[j]);
                corr[i][j] = c;
                corr[j][i] = c;
            }
        }
        return corr;
    }

    private static void requireRectangular(double[][] rows) {
        if (rows == null || rows.length == 0) {
            throw new InvalidInputException("Returns matrix must not be empty");
        }
        for (int i = 0; i < rows.length; i++) {
            InvalidInputException.requireNonEmpty("rows[" + i + "]", rows[i]);
            if (rows[i].length != rows[0].length) {
                throw new InvalidInputException("All series must have the same length: row " + i + " has "
                        + rows[i].length + ", row 0 has " + rows[0].length);
            }
        }
    }
}
