package com.trading.quant.math;

import com.trading.quant.api.SolverResult;
import com.trading.quant.fn.Fn1;

import lombok.extern.log4j.Log4j2;

/**
 * One-dimensional root finders shared by the option and bond solvers.
 *
 * <p>
 * Neither method throws on non-convergence. The caller gets the last iterate
 * with {@link SolverResult#converged()} set to {@code false} and decides
 * whether that estimate is usable.
 */
@Log4j2
public final class RootFinders {

    /** Derivative magnitude below which Newton-Raphson stops (flat region). */
    public static final double MIN_DERIVATIVE = 1e-10;

    private RootFinders() {
        // Utility class
    }

    /**
     * Bisection for {@code f(x) = target} on {@code [low, high]}, assuming
     * {@code f} is increasing on the interval.
     *
     * <p>
     * Each step evaluates the midpoint; if {@code |f(mid) - target| < tolerance}
     * the midpoint is returned as converged. Otherwise the half that still
     * brackets the target is kept.
     */
    public static SolverResult bisect(Fn1 f, double target, double low, double high,
            double tolerance, int maxIterations) {
        double lo = low;
        double hi = high;
        double mid = (lo + hi) / 2;

        for (int i = 0; i < maxIterations; i++) {
            mid = (lo + hi) / 2;
            double diff = f.apply(mid) - target;

            if (Math.abs(diff) < tolerance) {
                log.debug("Bisection converged to {} after {} iterations", mid, i + 1);
                return new SolverResult(mid, i + 1, true);
            }

            if (diff > 0) {
                hi = mid;
            } else {
                lo = mid;
            }
        }

        return new SolverResult(mid, maxIterations, false);
    }

    /**
     * Newton-Raphson for {@code f(x) = target} starting at {@code initial}.
     *
     * <p>
     * Every iterate is clamped to {@code [lowerBound, upperBound]}. The search
     * stops early, unconverged, when {@code |f'(x)| < MIN_DERIVATIVE}. There is
     * no bracketing fallback.
     */
    public static SolverResult newton(Fn1 f, Fn1 derivative, double target, double initial,
            double lowerBound, double upperBound, double tolerance, int maxIterations) {
        double x = initial;

        for (int i = 0; i < maxIterations; i++) {
            double error = f.apply(x) - target;

            if (Math.abs(error) < tolerance) {
                log.debug("Newton-Raphson converged to {} after {} iterations", x, i + 1);
                return new SolverResult(x, i + 1, true);
            }

            double slope = derivative.apply(x);
            if (Math.abs(slope) < MIN_DERIVATIVE) {
                log.debug("Newton-Raphson stopped on flat derivative at x={}", x);
                return new SolverResult(x, i + 1, false);
            }

            x = x - error / slope;
            x = Math.max(lowerBound, Math.min(upperBound, x));
        }

        return new SolverResult(x, maxIterations, false);
    }
}
