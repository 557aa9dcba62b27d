package com.trading.quant.bond;

import static com.trading.quant.api.InvalidInputException.requirePositive;

import com.trading.quant.api.InvalidInputException;

/**
 * A fixed-coupon bullet bond.
 *
 * <p>
 * {@code yearsToMaturity * couponFrequency} may be fractional: the closed-form
 * price and its derivative take a real exponent. Only the per-cash-flow
 * schedule ({@link #periods()}, {@link #cashFlow(int)}) needs whole periods.
 *
 * @param faceValue        Redemption amount, &gt; 0.
 * @param couponRate       Annual coupon rate as a decimal (may be 0).
 * @param yearsToMaturity  Remaining life in years, &gt; 0.
 * @param couponFrequency  Coupons per year, &gt; 0.
 */
public record Bond(double faceValue, double couponRate, double yearsToMaturity, int couponFrequency) {
    private static final double WHOLE_PERIOD_TOLERANCE = 1e-9;

    public Bond {
        requirePositive("faceValue", faceValue);
        requirePositive("yearsToMaturity", yearsToMaturity);
        if (couponFrequency <= 0)
            throw new InvalidInputException("couponFrequency must be > 0, was " + couponFrequency);
    }

    /** Coupon paid each period. */
    public double couponPayment() {
        return faceValue * couponRate / couponFrequency;
    }

    /** Remaining coupon periods, possibly fractional. */
    public double periodCount() {
        return yearsToMaturity * couponFrequency;
    }

    public boolean hasWholePeriods() {
        double p = periodCount();
        return Math.abs(p - Math.rint(p)) <= WHOLE_PERIOD_TOLERANCE;
    }

    /**
     * Number of remaining coupon periods.
     *
     * @throws InvalidInputException if the life is not a whole number of
     *                               periods.
     */
    public int periods() {
        if (!hasWholePeriods())
            throw new InvalidInputException(
                    "yearsToMaturity * couponFrequency must be a whole number of periods, was " + periodCount());
        return (int) Math.rint(periodCount());
    }

    /** Annual yield converted to a per-period rate. */
    public double periodicYield(double annualYield) {
        return annualYield / couponFrequency;
    }

    /** Cash flow paid at period {@code i}, 1-based; the last one includes the face. */
    public double cashFlow(int i) {
        return i == periods() ? faceValue + couponPayment() : couponPayment();
    }
}
