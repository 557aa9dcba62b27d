package com.trading.quant.fn;

/**
 * Functional interface for a scalar computation with 1 input.
 *
 * <p>
 * Used by {@link com.trading.quant.math.RootFinders} to describe the function
 * whose root is searched, e.g. an option price as a function of volatility or
 * a bond price as a function of yield.
 *
 * <p>
 * Examples:
 * <ul>
 * <li>{@code sigma -> BlackScholes.price(s, k, t, r, sigma, OptionType.CALL)}</li>
 * <li>{@code Math::log}</li>
 * </ul>
 */
@FunctionalInterface
public interface Fn1 {
    /**
     * Applies the function.
     *
     * @param a The input value.
     * @return The result.
     */
    double apply(double a);
}
