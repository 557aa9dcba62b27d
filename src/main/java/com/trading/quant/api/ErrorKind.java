package com.trading.quant.api;

/**
 * Closed set of failure categories raised by the engine.
 *
 * <p>
 * Non-convergence of an iterative solver is deliberately absent: solvers
 * return a {@link SolverResult} whose {@code converged} flag carries that
 * outcome instead of throwing.
 */
public enum ErrorKind {
    /** Non-positive price/rate/volatility/maturity, length mismatch, empty input. */
    INVALID_DOMAIN_INPUT,
    /** Zero denominator, growth rate at or above discount rate, singular matrix. */
    MATHEMATICALLY_UNDEFINED
}
