package com.trading.quant.bond;

import com.trading.quant.api.InvalidInputException;
import org.junit.Test;
import static org.junit.Assert.*;

public class ConvexityCalculatorTest {

    @Test
    public void testZeroCouponConvexity() {
        Bond zero = new Bond(1000, 0.0, 5, 1);
        assertEquals(30 / 1.1025, ConvexityCalculator.convexity(zero, 0.05), 1e-9);
    }

    @Test
    public void testEffectiveApproximatesAnalytic() {
        Bond bond = new Bond(1000, 0.05, 10, 2);
        assertEquals(ConvexityCalculator.convexity(bond, 0.05), ConvexityCalculator.effective(bond, 0.05), 0.5);
    }

    @Test
    public void testEstimatePriceChange() {
        assertEquals(-0.0485, ConvexityCalculator.estimatePriceChange(5, 30, 0.01), 1e-12);
        assertEquals(0.0515, ConvexityCalculator.estimatePriceChange(5, 30, -0.01), 1e-12);
    }

    @Test
    public void testTaylorEstimateTracksRepricing() {
        Bond bond = new Bond(1000, 0.05, 10, 2);
        double y = 0.05, dy = 0.005;
        double estimate = ConvexityCalculator.estimatePriceChange(
                DurationCalculator.modified(bond, y), ConvexityCalculator.convexity(bond, y), dy);
        double actual = BondPricer.price(bond, y + dy) / BondPricer.price(bond, y) - 1;
        assertEquals(actual, estimate, 1e-4);
    }

    @Test
    public void testFractionalPeriods() {
        Bond bond = new Bond(1000, 0.05, 2.5, 1);
        assertTrue(ConvexityCalculator.effective(bond, 0.05) > 0.0);

        try {
            ConvexityCalculator.convexity(bond, 0.05);
            fail("Should require whole periods for the cash-flow schedule");
        } catch (InvalidInputException e) {
            // Expected
        }
    }
}
