package com.trading.quant.options;

import static com.trading.quant.api.InvalidInputException.requirePositive;

import com.trading.quant.math.Gaussian;

/**
 * Black-Scholes closed form for European options on a non-dividend-paying
 * underlying.
 *
 * <pre>
 * d1 = (ln(S/K) + (r + sigma^2/2) T) / (sigma sqrt(T))
 * d2 = d1 - sigma sqrt(T)
 * call = S N(d1) - K e^(-rT) N(d2)
 * put  = K e^(-rT) N(-d2) - S N(-d1)
 * </pre>
 */
public final class BlackScholes {

    private BlackScholes() {
        // Utility class
    }

    public static double price(double spot, double strike, double expiry, double rate, double volatility,
            OptionType type) {
        validate(spot, strike, expiry, volatility);
        double d1 = d1(spot, strike, expiry, rate, volatility);
        double d2 = d1 - volatility * Math.sqrt(expiry);
        double discountedStrike = strike * Math.exp(-rate * expiry);

        if (type == OptionType.CALL) {
            return spot * Gaussian.cdf(d1) - discountedStrike * Gaussian.cdf(d2);
        }
        return discountedStrike * Gaussian.cdf(-d2) - spot * Gaussian.cdf(-d1);
    }

    public static double price(OptionContract c) {
        return price(c.spot(), c.strike(), c.expiry(), c.rate(), c.volatility(), c.type());
    }

    public static double d1(double spot, double strike, double expiry, double rate, double volatility) {
        return (Math.log(spot / strike) + (rate + 0.5 * volatility * volatility) * expiry)
                / (volatility * Math.sqrt(expiry));
    }

    public static double d2(double spot, double strike, double expiry, double rate, double volatility) {
        return d1(spot, strike, expiry, rate, volatility) - volatility * Math.sqrt(expiry);
    }

    static void validate(double spot, double strike, double expiry, double volatility) {
        requirePositive("spot", spot);
        requirePositive("strike", strike);
        requirePositive("expiry", expiry);
        requirePositive("volatility", volatility);
    }
}
