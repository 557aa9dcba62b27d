package com.trading.quant.api;

/**
 * Outcome of an iterative root search.
 *
 * @param value      Best estimate found. When {@code converged} is false this is
 *                   the last iterate, not a guaranteed root.
 * @param iterations Number of function evaluations performed.
 * @param converged  Whether the tolerance was met within the iteration cap.
 */
public record SolverResult(double value, int iterations, boolean converged) {
}
