package com.trading.quant;

import java.util.Random;

import com.trading.quant.bond.Bond;
import com.trading.quant.bond.ConvexityCalculator;
import com.trading.quant.bond.DurationCalculator;
import com.trading.quant.bond.YieldSolver;
import com.trading.quant.io.EngineSettings;
import com.trading.quant.options.BinomialTree;
import com.trading.quant.options.ImpliedVolatilitySolver;
import com.trading.quant.portfolio.MeanVarianceOptimizer;

import lombok.extern.log4j.Log4j2;

/**
 * Quant Engine: stateless analytics for derivatives, fixed income and
 * portfolios.
 *
 * <h2>Layout</h2>
 * <ul>
 * <li>{@link com.trading.quant.options} Black-Scholes, binomial lattice,
 * Greeks, implied volatility.</li>
 * <li>{@link com.trading.quant.bond} price, yield to maturity, duration,
 * convexity.</li>
 * <li>{@link com.trading.quant.portfolio} mean-variance optimization and the
 * efficient frontier.</li>
 * <li>{@link com.trading.quant.stats} covariance, OLS, CAPM and Fama-French
 * regressions.</li>
 * <li>{@link com.trading.quant.risk} volatility, drawdown, VaR and return
 * measures.</li>
 * <li>{@link com.trading.quant.valuation} DCF, dividend discount and
 * multiples.</li>
 * <li>{@link com.trading.quant.indicators} moving averages, oscillators,
 * bands and volume indicators.</li>
 * </ul>
 *
 * <p>
 * Closed-form calculations are static. The iterative ones (lattice, root
 * finders, optimizer) take their tuning from {@link EngineSettings}; this class
 * wires them once so callers do not thread settings through every call.
 *
 * <pre>
 * QuantEngine engine = QuantEngine.create(EngineSettings.defaults(), new Random(42));
 * SolverResult iv = engine.impliedVolatilitySolver().solve(10.45, 100, 100, 1, 0.05, OptionType.CALL);
 * </pre>
 */
@Log4j2
public final class QuantEngine {
    private final EngineSettings settings;
    private final BinomialTree binomialTree;
    private final ImpliedVolatilitySolver impliedVolatilitySolver;
    private final YieldSolver yieldSolver;
    private final MeanVarianceOptimizer optimizer;

    private QuantEngine(EngineSettings settings, Random random) {
        this.settings = settings;
        this.binomialTree = new BinomialTree(settings.getOptions().getBinomialSteps());
        this.impliedVolatilitySolver = new ImpliedVolatilitySolver(settings.getOptions());
        this.yieldSolver = new YieldSolver(settings.getBond());
        this.optimizer = new MeanVarianceOptimizer(settings.getOptimizer(), random);
    }

    /** Engine configured from {@code quant-engine.json} on the classpath. */
    public static QuantEngine create() {
        return create(EngineSettings.fromClasspath());
    }

    public static QuantEngine create(EngineSettings settings) {
        return create(settings, new Random());
    }

    /**
     * @param random source for the optimizer's perturbations; seed it to make
     *               optimization runs reproducible.
     */
    public static QuantEngine create(EngineSettings settings, Random random) {
        if (settings == null)
            throw new NullPointerException("settings");
        if (random == null)
            throw new NullPointerException("random");
        log.debug("Creating engine: {} lattice steps, {} optimizer iterations",
                settings.getOptions().getBinomialSteps(), settings.getOptimizer().getIterations());
        return new QuantEngine(settings, random);
    }

    public EngineSettings settings() {
        return settings;
    }

    public BinomialTree binomialTree() {
        return binomialTree;
    }

    public ImpliedVolatilitySolver impliedVolatilitySolver() {
        return impliedVolatilitySolver;
    }

    public YieldSolver yieldSolver() {
        return yieldSolver;
    }

    public MeanVarianceOptimizer optimizer() {
        return optimizer;
    }

    /** Yield bump used by the effective duration and convexity shortcuts. */
    public double yieldBump() {
        return settings.getBond().getYieldBump();
    }

    /** Effective duration with the configured yield bump. */
    public double effectiveDuration(Bond bond, double yield) {
        return DurationCalculator.effective(bond, yield, yieldBump());
    }

    /** Effective convexity with the configured yield bump. */
    public double effectiveConvexity(Bond bond, double yield) {
        return ConvexityCalculator.effective(bond, yield, yieldBump());
    }
}
