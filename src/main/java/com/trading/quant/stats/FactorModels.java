package com.trading.quant.stats;

import com.trading.quant.api.InvalidInputException;
import com.trading.quant.api.UndefinedResultException;

/**
 * CAPM and Fama-French factor regressions.
 *
 * <p>
 * Factor fits run through {@link LinearRegression#multiple}; inputs are
 * expected to be excess returns where the model calls for them.
 */
public final class FactorModels {

    private FactorModels() {
        // Utility class
    }

    // ── CAPM ───────────────────────────────────────────────────────

    /** {@code E(Ri) = Rf + beta * (E(Rm) - Rf)}. */
    public static double expectedReturn(double riskFreeRate, double marketReturn, double beta) {
        return riskFreeRate + beta * (marketReturn - riskFreeRate);
    }

    public static double marketRiskPremium(double marketReturn, double riskFreeRate) {
        return marketReturn - riskFreeRate;
    }

    /**
     * {@code Cov(asset, market) / Var(market)} from historical returns.
     *
     * @throws UndefinedResultException if the market series is constant.
     */
    public static double beta(double[] assetReturns, double[] marketReturns) {
        InvalidInputException.requireSameLength("assetReturns", assetReturns, "marketReturns", marketReturns);
        if (assetReturns.length < 2) {
            throw new InvalidInputException("At least 2 points are required to estimate beta");
        }
        if (Descriptive.isConstant(marketReturns)) {
            throw new UndefinedResultException("Market returns have zero variance");
        }
        return CovarianceEstimator.covariance(assetReturns, marketReturns) / Descriptive.sampleVariance(marketReturns);
    }

    /** Jensen's alpha: realised minus CAPM-expected return. */
    public static double alpha(double actualReturn, double expectedReturn) {
        return actualReturn - expectedReturn;
    }

    /** {@code (Rp - Rf) / beta}. */
    public static double treynorRatio(double portfolioReturn, double riskFreeRate, double beta) {
        if (beta == 0.0) {
            throw new UndefinedResultException("Treynor ratio is undefined for beta 0");
        }
        return (portfolioReturn - riskFreeRate) / beta;
    }

    /** Regresses asset returns on market returns. */
    public static CapmResult capm(double[] assetReturns, double[] marketReturns) {
        InvalidInputException.requireSameLength("assetReturns", assetReturns, "marketReturns", marketReturns);
        if (assetReturns.length < 2) {
            throw new InvalidInputException("At least 2 points are required for a CAPM regression");
        }
        RegressionResult fit = LinearRegression.multiple(assetReturns, new double[][] { marketReturns });
        return new CapmResult(fit.intercept(), fit.coefficients()[0], fit.rSquared());
    }

    // ── Fama-French ────────────────────────────────────────────────

    /** Requires at least 4 observations. */
    public static FamaFrench3Result famaFrench3(double[] excessReturns, double[] marketExcess, double[] smb,
            double[] hml) {
        requireObservations(excessReturns, 4);
        RegressionResult fit = LinearRegression.multiple(excessReturns, new double[][] { marketExcess, smb, hml });
        double[] b = fit.coefficients();
        return new FamaFrench3Result(fit.intercept(), b[0], b[1], b[2], fit.rSquared());
    }

    /** Requires at least 6 observations. */
    public static FamaFrench5Result famaFrench5(double[] excessReturns, double[] marketExcess, double[] smb,
            double[] hml, double[] rmw, double[] cma) {
        requireObservations(excessReturns, 6);
        RegressionResult fit = LinearRegression.multiple(excessReturns,
                new double[][] { marketExcess, smb, hml, rmw, cma });
        double[] b = fit.coefficients();
        return new FamaFrench5Result(fit.intercept(), b[0], b[1], b[2], b[3], b[4], fit.rSquared());
    }

    private static void requireObservations(double[] series, int min) {
        if (series == null || series.length < min) {
            throw new InvalidInputException("At least " + min + " observations are required, got "
                    + (series == null ? 0 : series.length));
        }
    }
}
