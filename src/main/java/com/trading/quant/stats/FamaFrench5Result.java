package com.trading.quant.stats;

/**
 * Loadings of the five-factor model, which adds profitability (RMW) and
 * investment (CMA) to the three-factor regression.
 */
public record FamaFrench5Result(double alpha, double beta, double smb, double hml, double rmw, double cma,
        double rSquared) {
}
