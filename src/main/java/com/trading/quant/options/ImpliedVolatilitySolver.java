package com.trading.quant.options;

import static com.trading.quant.api.InvalidInputException.requirePositive;

import com.trading.quant.api.SolverResult;
import com.trading.quant.io.EngineSettings;
import com.trading.quant.math.RootFinders;

import lombok.extern.log4j.Log4j2;

/**
 * Backs out the Black-Scholes volatility that reproduces a market price.
 *
 * <p>
 * Bisection over {@code [low, high]} (default {@code [0.001, 5.0]}). The
 * Black-Scholes price is increasing in volatility, so the bracket always
 * halves towards the root. When the iteration cap is hit the last midpoint is
 * returned with {@code converged == false}; prices outside the attainable
 * range end up pinned near a bracket edge this way.
 */
@Log4j2
public final class ImpliedVolatilitySolver {
    private final double low;
    private final double high;
    private final double tolerance;
    private final int maxIterations;

    public ImpliedVolatilitySolver() {
        this(new EngineSettings.OptionSettings());
    }

    public ImpliedVolatilitySolver(EngineSettings.OptionSettings settings) {
        this(settings.getImpliedVolLow(), settings.getImpliedVolHigh(),
                settings.getImpliedVolTolerance(), settings.getImpliedVolMaxIterations());
    }

    public ImpliedVolatilitySolver(double low, double high, double tolerance, int maxIterations) {
        this.low = low;
        this.high = high;
        this.tolerance = tolerance;
        this.maxIterations = maxIterations;
    }

    public SolverResult solve(double marketPrice, double spot, double strike, double expiry, double rate,
            OptionType type) {
        requirePositive("marketPrice", marketPrice);
        BlackScholes.validate(spot, strike, expiry, low);

        SolverResult result = RootFinders.bisect(
                sigma -> BlackScholes.price(spot, strike, expiry, rate, sigma, type),
                marketPrice, low, high, tolerance, maxIterations);

        if (!result.converged()) {
            log.warn("Implied volatility did not converge for price={} S={} K={} T={} {}; returning {}",
                    marketPrice, spot, strike, expiry, type, result.value());
        }
        return result;
    }
}
