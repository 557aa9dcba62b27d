package com.trading.quant.options;

import com.trading.quant.math.Gaussian;

/**
 * Closed-form Greeks of the Black-Scholes price. These are the analytic
 * partial derivatives, not bump-and-reprice estimates.
 *
 * <p>
 * Scaling: theta is per day (divided by 365), vega and rho are per
 * percentage point (divided by 100).
 */
public final class GreeksCalculator {
    private static final double DAYS_PER_YEAR = 365.0;
    private static final double PER_PERCENT = 100.0;

    private GreeksCalculator() {
        // Utility class
    }

    /** {@code N(d1)} for calls, {@code N(d1) - 1} for puts. */
    public static double delta(double spot, double strike, double expiry, double rate, double volatility,
            OptionType type) {
        BlackScholes.validate(spot, strike, expiry, volatility);
        double nd1 = Gaussian.cdf(BlackScholes.d1(spot, strike, expiry, rate, volatility));
        return type == OptionType.CALL ? nd1 : nd1 - 1.0;
    }

    /** Same for calls and puts. */
    public static double gamma(double spot, double strike, double expiry, double rate, double volatility) {
        BlackScholes.validate(spot, strike, expiry, volatility);
        double d1 = BlackScholes.d1(spot, strike, expiry, rate, volatility);
        return Gaussian.pdf(d1) / (spot * volatility * Math.sqrt(expiry));
    }

    /** Same for calls and puts. */
    public static double vega(double spot, double strike, double expiry, double rate, double volatility) {
        BlackScholes.validate(spot, strike, expiry, volatility);
        double d1 = BlackScholes.d1(spot, strike, expiry, rate, volatility);
        return spot * Gaussian.pdf(d1) * Math.sqrt(expiry) / PER_PERCENT;
    }

    /**
     * Call: {@code -S phi(d1) sigma / (2 sqrt T) - r K e^(-rT) N(d2)}.
     * Put: {@code -S phi(d1) sigma / (2 sqrt T) + r K e^(-rT) N(-d2)}.
     */
    public static double theta(double spot, double strike, double expiry, double rate, double volatility,
            OptionType type) {
        BlackScholes.validate(spot, strike, expiry, volatility);
        double d1 = BlackScholes.d1(spot, strike, expiry, rate, volatility);
        double d2 = d1 - volatility * Math.sqrt(expiry);

        double decay = -spot * Gaussian.pdf(d1) * volatility / (2.0 * Math.sqrt(expiry));
        double carry = rate * strike * Math.exp(-rate * expiry);
        double annual = type == OptionType.CALL
                ? decay - carry * Gaussian.cdf(d2)
                : decay + carry * Gaussian.cdf(-d2);
        return annual / DAYS_PER_YEAR;
    }

    /** Call: {@code K T e^(-rT) N(d2)}; put: {@code -K T e^(-rT) N(-d2)}. */
    public static double rho(double spot, double strike, double expiry, double rate, double volatility,
            OptionType type) {
        BlackScholes.validate(spot, strike, expiry, volatility);
        double d2 = BlackScholes.d2(spot, strike, expiry, rate, volatility);
        double kt = strike * expiry * Math.exp(-rate * expiry);
        double annual = type == OptionType.CALL ? kt * Gaussian.cdf(d2) : -kt * Gaussian.cdf(-d2);
        return annual / PER_PERCENT;
    }

    public static Greeks all(double spot, double strike, double expiry, double rate, double volatility,
            OptionType type) {
        return new Greeks(
                delta(spot, strike, expiry, rate, volatility, type),
                gamma(spot, strike, expiry, rate, volatility),
                theta(spot, strike, expiry, rate, volatility, type),
                vega(spot, strike, expiry, rate, volatility),
                rho(spot, strike, expiry, rate, volatility, type));
    }

    public static Greeks all(OptionContract c) {
        return all(c.spot(), c.strike(), c.expiry(), c.rate(), c.volatility(), c.type());
    }
}
