package com.trading.quant.bond;

import static com.trading.quant.api.InvalidInputException.requirePositive;

import com.trading.quant.api.SolverResult;
import com.trading.quant.io.EngineSettings;
import com.trading.quant.math.RootFinders;

import lombok.extern.log4j.Log4j2;

/**
 * Yield to maturity by Newton-Raphson, plus simple yield measures.
 *
 * <p>
 * The search starts at the coupon rate, steps with the closed-form
 * {@link BondPricer#yieldDerivative} and clamps each iterate to
 * {@code [-1, 1]}. It gives up on a flat derivative or after
 * {@code maxIterations}. There is no bisection fallback, so a poor start on a
 * deep-discount long bond can return {@code converged == false}.
 */
@Log4j2
public final class YieldSolver {
    private final double tolerance;
    private final int maxIterations;
    private final double lowerBound;
    private final double upperBound;

    public YieldSolver() {
        this(new EngineSettings.BondSettings());
    }

    public YieldSolver(EngineSettings.BondSettings settings) {
        this(settings.getYtmTolerance(), settings.getYtmMaxIterations(),
                settings.getYtmLowerBound(), settings.getYtmUpperBound());
    }

    public YieldSolver(double tolerance, int maxIterations, double lowerBound, double upperBound) {
        this.tolerance = tolerance;
        this.maxIterations = maxIterations;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
    }

    public SolverResult yieldToMaturity(Bond bond, double price) {
        requirePositive("price", price);

        SolverResult result = RootFinders.newton(
                y -> BondPricer.price(bond, y),
                y -> BondPricer.yieldDerivative(bond, y),
                price, bond.couponRate(), lowerBound, upperBound, tolerance, maxIterations);

        if (!result.converged()) {
            log.warn("YTM did not converge for {} at price {}; returning {}", bond, price, result.value());
        }
        return result;
    }

    public SolverResult yieldToMaturity(double faceValue, double couponRate, double price, double yearsToMaturity,
            int couponFrequency) {
        return yieldToMaturity(new Bond(faceValue, couponRate, yearsToMaturity, couponFrequency), price);
    }

    /** Annual coupon divided by price. */
    public static double currentYield(double annualCoupon, double price) {
        requirePositive("price", price);
        return annualCoupon / price;
    }

    /** {@code (sell + coupons - buy) / buy}. */
    public static double holdingPeriodReturn(double purchasePrice, double sellingPrice, double couponPayments) {
        requirePositive("purchasePrice", purchasePrice);
        return (sellingPrice + couponPayments - purchasePrice) / purchasePrice;
    }

    public static double annualizedHoldingPeriodReturn(double purchasePrice, double sellingPrice,
            double couponPayments, double holdingPeriodYears) {
        requirePositive("holdingPeriodYears", holdingPeriodYears);
        double hpr = holdingPeriodReturn(purchasePrice, sellingPrice, couponPayments);
        return Math.pow(1.0 + hpr, 1.0 / holdingPeriodYears) - 1.0;
    }
}
