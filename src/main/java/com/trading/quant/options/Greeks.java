package com.trading.quant.options;

/**
 * Analytic Black-Scholes sensitivities.
 *
 * @param delta dV/dS.
 * @param gamma d2V/dS2.
 * @param theta Time decay per calendar day (year / 365).
 * @param vega  Change for a 1 percentage point move in volatility.
 * @param rho   Change for a 1 percentage point move in the rate.
 */
public record Greeks(double delta, double gamma, double theta, double vega, double rho) {
}
