package com.trading.quant.math;

import com.trading.quant.api.InvalidInputException;
import com.trading.quant.api.UndefinedResultException;

/**
 * Dense linear system solver.
 *
 * <p>
 * Gaussian elimination on the augmented matrix {@code [A | b]} with partial
 * pivoting: at column {@code i} the row with the largest {@code |a[k][i]|},
 * {@code k >= i}, is swapped into position {@code i} before elimination. Back
 * substitution then yields {@code x}. The inputs are copied, never modified.
 */
public final class LinearSystem {

    /** Pivots smaller than this are treated as zero. */
    public static final double SINGULAR_PIVOT = 1e-10;

    private LinearSystem() {
        // Utility class
    }

    /**
     * Solves {@code A x = b}.
     *
     * @throws InvalidInputException     if {@code A} is not square or does not
     *                                   match {@code b}.
     * @throws UndefinedResultException if a pivot is smaller than
     *                                   {@link #SINGULAR_PIVOT}.
     */
    public static double[] solve(double[][] a, double[] b) {
        final int n = a.length;
        if (n == 0 || b.length != n) {
            throw new InvalidInputException("Matrix dimension " + n + " does not match vector length " + b.length);
        }

        double[][] aug = new double[n][n + 1];
        for (int i = 0; i < n; i++) {
            if (a[i].length != n) {
                throw new InvalidInputException("Matrix must be square, row " + i + " has length " + a[i].length);
            }
            System.arraycopy(a[i], 0, aug[i], 0, n);
            aug[i][n] = b[i];
        }

        // Forward elimination
        for (int i = 0; i < n; i++) {
            int maxRow = i;
            for (int k = i + 1; k < n; k++) {
                if (Math.abs(aug[k][i]) > Math.abs(aug[maxRow][i])) {
                    maxRow = k;
                }
            }
            double[] tmp = aug[i];
            aug[i] = aug[maxRow];
            aug[maxRow] = tmp;

            double pivot = aug[i][i];
            if (Math.abs(pivot) < SINGULAR_PIVOT) {
                throw new UndefinedResultException("Matrix is singular (pivot " + pivot + " at column " + i + ")");
            }

            for (int k = i + 1; k < n; k++) {
                double factor = aug[k][i] / pivot;
                for (int j = i; j <= n; j++) {
                    aug[k][j] -= factor * aug[i][j];
                }
            }
        }

        // Back substitution
        double[] x = new double[n];
        for (int i = n - 1; i >= 0; i--) {
            double sum = aug[i][n];
            for (int j = i + 1; j < n; j++) {
                sum -= aug[i][j] * x[j];
            }
            x[i] = sum / aug[i][i];
        }
        return x;
    }
}
