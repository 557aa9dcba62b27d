package com.trading.quant.options;

import static com.trading.quant.api.InvalidInputException.requirePositive;

import java.util.Objects;

/**
 * Inputs of a vanilla option valuation.
 *
 * @param spot       Underlying price, &gt; 0.
 * @param strike     Strike price, &gt; 0.
 * @param expiry     Time to expiry in years, &gt; 0.
 * @param rate       Continuously compounded risk-free rate, any real.
 * @param volatility Annualized volatility, &gt; 0.
 * @param type       Call or put.
 */
public record OptionContract(double spot, double strike, double expiry, double rate,
        double volatility, OptionType type) {

    public OptionContract {
        requirePositive("spot", spot);
        requirePositive("strike", strike);
        requirePositive("expiry", expiry);
        requirePositive("volatility", volatility);
        Objects.requireNonNull(type, "type");
    }
}
