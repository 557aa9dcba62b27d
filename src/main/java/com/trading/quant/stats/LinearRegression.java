package com.trading.quant.stats;

import com.trading.quant.api.InvalidInputException;
import com.trading.quant.api.UndefinedResultException;
import com.trading.quant.math.LinearSystem;

/**
 * Ordinary least squares.
 *
 * <p>
 * Both fits report R² clamped to {@code [0, 1]}; a constant {@code y}
 * (SST = 0) gives R² = 0.
 */
public final class LinearRegression {

    private LinearRegression() {
        // Utility class
    }

    /**
     * One-regressor fit from sums of products:
     *
     * <pre>
     * slope     = (n*Sxy - Sx*Sy) / (n*Sxx - Sx^2)
     * intercept = (Sy - slope*Sx) / n
     * </pre>
     *
     * @throws InvalidInputException    if fewer than 2 points or the lengths
     *                                  differ.
     * @throws UndefinedResultException if {@code x} is constant.
     */
    public static SimpleRegressionResult simple(double[] x, double[] y) {
        InvalidInputException.requireSameLength("x", x, "y", y);
        final int n = x.length;
        if (n < 2) {
            throw new InvalidInputException("At least 2 points are required, got " + n);
        }

        double sx = 0, sy = 0, sxy = 0, sxx = 0;
        for (int i = 0; i < n; i++) {
            sx += x[i];
            sy += y[i];
            sxy += x[i] * y[i];
            sxx += x[i] * x[i];
        }

        double den = n * sxx - sx * sx;
        if (den <= Descriptive.RELATIVE_VARIANCE_FLOOR * n * sxx) {
            throw new UndefinedResultException("Regressor has zero variance");
        }
        double slope = (n * sxy - sx * sy) / den;
        double intercept = (sy - slope * sx) / n;

        double yMean = sy / n;
        double sst = 0, ssr = 0;
        for (int i = 0; i < n; i++) {
            double fitted = intercept + slope * x[i];
            sst += (y[i] - yMean) * (y[i] - yMean);
            ssr += (y[i] - fitted) * (y[i] - fitted);
        }

        double r2 = sst == 0.0 ? 0.0 : 1.0 - ssr / sst;
        double se = n > 2 ? Math.sqrt(ssr / (n - 2)) : Double.NaN;
        return new SimpleRegressionResult(intercept, slope, clampUnit(r2), se);
    }

    /**
     * Multi-regressor fit through the normal equations
     * {@code (X'X) b = X'y}, where {@code X} is the design matrix with a leading
     * column of ones.
     *
     * @param y       dependent series, length {@code n}.
     * @param factors {@code k} regressor series, each of length {@code n}.
     * @throws InvalidInputException    if {@code factors} is empty, a series
     *                                  has the wrong length, or
     *                                  {@code n < k + 1}.
     * @throws UndefinedResultException if {@code X'X} is singular.
     */
    public static RegressionResult multiple(double[] y, double[][] factors) {
        if (factors == null || factors.length == 0) {
            throw new InvalidInputException("At least one regressor is required");
        }
        InvalidInputException.requireNonEmpty("y", y);
        final int n = y.length;
        final int k = factors.length;
        for (int j = 0; j < k; j++) {
            InvalidInputException.requireSameLength("y", y, "factors[" + j + "]", factors[j]);
        }
        if (n < k + 1) {
            throw new InvalidInputException(n + " observations are not enough for " + k + " regressors");
        }

        final int p = k + 1;
        double[][] xtx = new double[p][p];
        double[] xty = new double[p];
        double[] row = new double[p];
        for (int m = 0; m < n; m++) {
            row[0] = 1.0;
            for (int j = 0; j < k; j++) {
                row[j + 1] = factors[j][m];
            }
            for (int i = 0; i < p; i++) {
                xty[i] += row[i] * y[m];
                for (int j = 0; j < p; j++) {
                    xtx[i][j] += row[i] * row[j];
                }
            }
        }

        double[] beta = LinearSystem.solve(xtx, xty);

        double yMean = Descriptive.mean(y);
        double sst = 0, ssr = 0;
        for (int m = 0; m < n; m++) {
            double fitted = beta[0];
            for (int j = 0; j < k; j++) {
                fitted += beta[j + 1] * factors[j][m];
            }
            sst += (y[m] - yMean) * (y[m] - yMean);
            ssr += (y[m] - fitted) * (y[m] - fitted);
        }

        double r2 = sst == 0.0 ? 0.0 : 1.0 - ssr / sst;
        int dof = n - k - 1;
        double adjR2 = dof == 0 ? Double.NaN : clampUnit(1.0 - (1.0 - r2) * (n - 1) / dof);

        double[] coefficients = new double[k];
        System.arraycopy(beta, 1, coefficients, 0, k);
        return new RegressionResult(beta[0], coefficients, clampUnit(r2), adjR2);
    }

    private static double clampUnit(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
