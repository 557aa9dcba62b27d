package com.trading.quant.options;

import java.util.Locale;

import com.trading.quant.api.InvalidInputException;

/**
 * Call or put. Owns the payoff so the lattice and the closed form agree on it.
 */
public enum OptionType {
    CALL {
        @Override
        public double intrinsic(double spot, double strike) {
            return Math.max(0.0, spot - strike);
        }
    },
    PUT {
        @Override
        public double intrinsic(double spot, double strike) {
            return Math.max(0.0, strike - spot);
        }
    };

    /** Exercise value at the given spot. */
    public abstract double intrinsic(double spot, double strike);

    /** Parses {@code "call"} / {@code "put"}, case-insensitive. */
    public static OptionType fromString(String s) {
        if (s == null)
            throw new InvalidInputException("Option type must not be null");
        return switch (s.trim().toLowerCase(Locale.ROOT)) {
            case "call", "c" -> CALL;
            case "put", "p" -> PUT;
            default -> throw new InvalidInputException("Unknown option type: " + s);
        };
    }
}
