package com.trading.quant.stats;

/**
 * Loadings of the three-factor model
 * {@code R - Rf = alpha + beta*(Rm - Rf) + smb*SMB + hml*HML}.
 */
public record FamaFrench3Result(double alpha, double beta, double smb, double hml, double rSquared) {
}
