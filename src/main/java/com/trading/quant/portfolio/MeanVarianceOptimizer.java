package com.trading.quant.portfolio;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import com.trading.quant.api.InvalidInputException;
import com.trading.quant.io.EngineSettings;

import lombok.extern.log4j.Log4j2;

/**
 * Mean-variance portfolio construction by random local search.
 *
 * <p>
 * There is no quadratic-programming solver behind this class. Every variant
 * runs the same loop:
 * <ol>
 * <li>Start from equal weights.</li>
 * <li>For each of {@code iterations} steps, perturb every weight by an
 * independent {@code (u - 0.5) * learningRate}, {@code u ~ U[0, 1)}.</li>
 * <li>Renormalize the candidate to sum to 1.</li>
 * <li>Skip it if it violates the constraints.</li>
 * <li>Replace the incumbent if the variant's {@link AcceptanceRule} says it
 * improves.</li>
 * </ol>
 * The result is feasible but not guaranteed optimal, and two runs with
 * different random streams generally differ. Pass a seeded {@link Random} to
 * reproduce a run.
 *
 * <p>
 * The target-return and target-risk rules are greedy on two criteria at once
 * (closer to target AND better on the other axis). A move that helps one
 * criterion but hurts the other is always rejected, so the search can stall
 * short of the target.
 */
@Log4j2
public final class MeanVarianceOptimizer {
    private final int iterations;
    private final double learningRate;
    private final int defaultFrontierPortfolios;
    private final Random random;

    public MeanVarianceOptimizer(Random random) {
        this(new EngineSettings.OptimizerSettings(), random);
    }

    public MeanVarianceOptimizer(EngineSettings.OptimizerSettings settings, Random random) {
        this.iterations = settings.getIterations();
        this.learningRate = settings.getLearningRate();
        this.defaultFrontierPortfolios = settings.getFrontierPortfolios();
        this.random = random;
    }

    /** Decides whether a feasible candidate replaces the incumbent. */
    @FunctionalInterface
    interface AcceptanceRule {
        boolean improves(double[] candidate, double[] incumbent);
    }

    // ── Variants ───────────────────────────────────────────────────

    /** Tangency portfolio: accepts a candidate with a higher Sharpe ratio. */
    public PortfolioResult maxSharpe(double[] returns, double[][] covariance, double riskFreeRate,
            WeightConstraints constraints) {
        validate(returns, covariance);
        double[] w = search(returns.length, constraints,
                (c, inc) -> PortfolioMath.sharpeRatio(returns, covariance, c, riskFreeRate)
                        > PortfolioMath.sharpeRatio(returns, covariance, inc, riskFreeRate));

        double variance = PortfolioMath.variance(covariance, w);
        return PortfolioResult.of(w, PortfolioMath.expectedReturn(returns, w), variance,
                PortfolioMath.sharpeRatio(returns, covariance, w, riskFreeRate));
    }

    /**
     * Global minimum-variance portfolio when expected returns are not known;
     * the reported expected return is 0.
     */
    public PortfolioResult minimumVariance(double[][] covariance, WeightConstraints constraints) {
        return minimumVariance(new double[covariance.length], covariance, constraints);
    }

    /** Accepts a candidate with lower variance. */
    public PortfolioResult minimumVariance(double[] returns, double[][] covariance,
            WeightConstraints constraints) {
        validate(returns, covariance);
        double[] w = search(returns.length, constraints,
                (c, inc) -> PortfolioMath.variance(covariance, c) < PortfolioMath.variance(covariance, inc));
        return PortfolioResult.of(w, PortfolioMath.expectedReturn(returns, w),
                PortfolioMath.variance(covariance, w), null);
    }

    /**
     * Accepts a candidate that is strictly closer to {@code targetReturn} and
     * has strictly lower variance.
     */
    public PortfolioResult targetReturn(double[] returns, double[][] covariance, double targetReturn,
            WeightConstraints constraints) {
        validate(returns, covariance);
        double[] w = search(returns.length, constraints, (c, inc) -> {
            double gapC = Math.abs(PortfolioMath.expectedReturn(returns, c) - targetReturn);
            double gapInc = Math.abs(PortfolioMath.expectedReturn(returns, inc) - targetReturn);
            return gapC < gapInc
                    && PortfolioMath.variance(covariance, c) < PortfolioMath.variance(covariance, inc);
        });
        return PortfolioResult.of(w, PortfolioMath.expectedReturn(returns, w),
                PortfolioMath.variance(covariance, w), null);
    }

    /**
     * Accepts a candidate whose variance is strictly closer to
     * {@code targetRisk^2} and whose expected return is strictly higher.
     */
    public PortfolioResult targetRisk(double[] returns, double[][] covariance, double targetRisk,
            WeightConstraints constraints) {
        validate(returns, covariance);
        InvalidInputException.requirePositive("targetRisk", targetRisk);
        final double targetVariance = targetRisk * targetRisk;
        double[] w = search(returns.length, constraints, (c, inc) -> {
            double gapC = Math.abs(PortfolioMath.variance(covariance, c) - targetVariance);
            double gapInc = Math.abs(PortfolioMath.variance(covariance, inc) - targetVariance);
            return gapC < gapInc
                    && PortfolioMath.expectedReturn(returns, c) > PortfolioMath.expectedReturn(returns, inc);
        });
        return PortfolioResult.of(w, PortfolioMath.expectedReturn(returns, w),
                PortfolioMath.variance(covariance, w), null);
    }

    /**
     * Dispatches to target-return, target-risk or max-Sharpe depending on
     * which target is given.
     *
     * @param targetReturn nullable
     * @param targetRisk   nullable
     * @throws InvalidInputException if both targets are given.
     */
    public PortfolioResult optimize(double[] returns, double[][] covariance, double riskFreeRate,
            WeightConstraints constraints, Double targetReturn, Double targetRisk) {
        if (targetReturn != null && targetRisk != null)
            throw new InvalidInputException("Specify either a target return or a target risk, not both");
        if (targetReturn != null)
            return targetReturn(returns, covariance, targetReturn, constraints);
        if (targetRisk != null)
            return targetRisk(returns, covariance, targetRisk, constraints);
        return maxSharpe(returns, covariance, riskFreeRate, constraints);
    }

    public List<PortfolioResult> efficientFrontier(double[] returns, double[][] covariance,
            WeightConstraints constraints) {
        return efficientFrontier(returns, covariance, defaultFrontierPortfolios, constraints);
    }

    /**
     * Runs {@link #targetReturn} at {@code numPortfolios} equally spaced
     * targets between the lowest and highest single-asset return.
     */
    public List<PortfolioResult> efficientFrontier(double[] returns, double[][] covariance, int numPortfolios,
            WeightConstraints constraints) {
        if (numPortfolios < 2)
            throw new InvalidInputException("numPortfolios must be >= 2, was " + numPortfolios);
        validate(returns, covariance);

        double minReturn = Double.POSITIVE_INFINITY;
        double maxReturn = Double.NEGATIVE_INFINITY;
        for (double r : returns) {
            minReturn = Math.min(minReturn, r);
            maxReturn = Math.max(maxReturn, r);
        }

        List<PortfolioResult> frontier = new ArrayList<>(numPortfolios);
        for (int i = 0; i < numPortfolios; i++) {
            double target = minReturn + (maxReturn - minReturn) * i / (numPortfolios - 1);
            frontier.add(targetReturn(returns, covariance, target, constraints));
        }
        return frontier;
    }

    // ── Shared search ──────────────────────────────────────────────

    private double[] search(int n, WeightConstraints constraints, AcceptanceRule rule) {
        WeightConstraints c = constraints != null ? constraints : WeightConstraints.NONE;
        c.checkDimension(n);

        double[] best = Weights.equal(n);
        if (!c.isSatisfiedBy(best))
            throw new InvalidInputException("Equal-weight starting portfolio violates the constraints");

        double[] candidate = new double[n];
        int accepted = 0;
        int rejected = 0;

        for (int iter = 0; iter < iterations; iter++) {
            for (int i = 0; i < n; i++)
                candidate[i] = best[i] + (random.nextDouble() - 0.5) * learningRate;

            double sum = Weights.sum(candidate);
            if (sum == 0.0) {
                rejected++;
                continue;
            }
            double[] normalized = new double[n];
            for (int i = 0; i < n; i++)
                normalized[i] = candidate[i] / sum;

            if (!c.isSatisfiedBy(normalized)) {
                rejected++;
                continue;
            }

            if (rule.improves(normalized, best)) {
                best = normalized;
                accepted++;
            }
        }

        log.debug("Local search over {} assets: {} iterations, {} accepted, {} infeasible",
                n, iterations, accepted, rejected);
        return best;
    }

    private static void validate(double[] returns, double[][] covariance) {
        InvalidInputException.requireNonEmpty("returns", returns);
        PortfolioMath.requireSquare(covariance, returns.length);
    }
}
