package com.trading.quant.bond;

import com.trading.quant.api.InvalidInputException;
import org.junit.Test;
import static org.junit.Assert.*;

public class BondPricerTest {

    @Test
    public void testParBond() {
        assertEquals(1000.0, BondPricer.price(1000, 0.05, 0.05, 10, 2), 1e-6);
    }

    @Test
    public void testPriceFallsAsYieldRises() {
        Bond bond = new Bond(1000, 0.05, 10, 2);
        double prev = Double.POSITIVE_INFINITY;
        for (double y = -0.02; y <= 0.15; y += 0.01) {
            double p = BondPricer.price(bond, y);
            assertTrue("y=" + y, p < prev);
            prev = p;
        }
    }

    @Test
    public void testZeroYield() {
        // Undiscounted: face plus all coupons
        assertEquals(1500.0, BondPricer.price(new Bond(1000, 0.05, 10, 2), 0.0), 1e-9);
    }

    @Test
    public void testYieldDerivativeMatchesFiniteDifference() {
        Bond bond = new Bond(1000, 0.06, 7, 2);
        double h = 1e-5;
        for (double y : new double[] { 0.0, 0.03, 0.08 }) {
            double fd = (BondPricer.price(bond, y + h) - BondPricer.price(bond, y - h)) / (2 * h);
            assertEquals("y=" + y, fd, BondPricer.yieldDerivative(bond, y), 1e-2);
        }
    }

    @Test
    public void testZeroCouponPrice() {
        assertEquals(1000 / 1.1025, BondPricer.zeroCouponPrice(1000, 0.05, 2), 1e-9);
    }

    @Test
    public void testAccruedInterestAndCleanDirty() {
        double accrued = BondPricer.accruedInterest(1000, 0.06, 2, 90, 180);
        assertEquals(15.0, accrued, 1e-12);
        assertEquals(1015.0, BondPricer.dirtyPrice(1000, accrued), 1e-12);
        assertEquals(1000.0, BondPricer.cleanPrice(1015, accrued), 1e-12);

        try {
            BondPricer.accruedInterest(1000, 0.06, 2, 200, 180);
            fail("Should reject days beyond the coupon period");
        } catch (InvalidInputException e) {
            // Expected
        }
    }

    @Test
    public void testPresentValue() {
        assertEquals(100 / 1.1 + 100 / 1.21, BondPricer.presentValue(new double[] { 100, 100 }, 0.1, 1), 1e-9);
        assertEquals(100 / 1.05, BondPricer.presentValue(new double[] { 100 }, 0.1, 2), 1e-9);

        try {
            BondPricer.presentValue(new double[] { 100 }, 1.5, 1);
            fail("Should reject a rate above 1");
        } catch (InvalidInputException e) {
            // Expected
        }
        try {
            BondPricer.presentValue(new double[0], 0.1, 1);
            fail("Should reject empty cash flows");
        } catch (InvalidInputException e) {
            // Expected
        }
    }

    @Test
    public void testBondValidation() {
        Bond bond = new Bond(1000, 0.04, 2.5, 2);
        assertEquals(5, bond.periods());
        assertEquals(20.0, bond.couponPayment(), 1e-12);
        assertEquals(1020.0, bond.cashFlow(5), 1e-12);

        Bond broken = new Bond(1000, 0.04, 2.3, 2);
        assertFalse(broken.hasWholePeriods());
        assertEquals(4.6, broken.periodCount(), 1e-12);
        try {
            broken.periods();
            fail("Should reject a cash-flow schedule with a fractional number of periods");
        } catch (InvalidInputException e) {
            assertTrue(e.getMessage().contains("whole number"));
        }
        try {
            new Bond(0, 0.04, 2, 2);
            fail("Should reject zero face value");
        } catch (InvalidInputException e) {
            // Expected
        }
        try {
            new Bond(1000, 0.04, 2, 0);
            fail("Should reject zero coupon frequency");
        } catch (InvalidInputException e) {
            // Expected
        }
    }

    @Test
    public void testFractionalPeriods() {
        // 2.5 years of annual coupons: closed form with a real exponent
        assertEquals(977.4068266223544, BondPricer.price(1000, 0.05, 0.06, 2.5, 1), 1e-9);
        assertEquals(1000.0, BondPricer.price(1000, 0.05, 0.05, 2.5, 1), 1e-9);
        assertEquals(1125.0, BondPricer.price(1000, 0.05, 0.0, 2.5, 1), 1e-9);

        Bond bond = new Bond(1000, 0.05, 2.5, 1);
        double h = 1e-5;
        double numeric = (BondPricer.price(bond, 0.06 + h) - BondPricer.price(bond, 0.06 - h)) / (2 * h);
        assertEquals(numeric, BondPricer.yieldDerivative(bond, 0.06), 1e-3);
    }
}
