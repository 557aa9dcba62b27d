package com.trading.quant.risk;

import com.trading.quant.api.InvalidInputException;
import org.junit.Test;
import static org.junit.Assert.*;

public class ReturnMetricsTest {

    @Test
    public void testSimpleReturn() {
        assertEquals(0.1, ReturnMetrics.simpleReturn(100, 110), 1e-12);
        assertEquals(-0.25, ReturnMetrics.simpleReturn(80, 60), 1e-12);
        try {
            ReturnMetrics.simpleReturn(0, 10);
            fail("Should reject a zero initial value");
        } catch (InvalidInputException e) {
            // Expected
        }
    }

    @Test
    public void testAnnualizedReturn() {
        assertEquals(Math.pow(1.01, 12) - 1, ReturnMetrics.annualizedReturn(new double[] { 0.005, 0.015 }, 12),
                1e-12);
    }

    @Test
    public void testCumulativeReturn() {
        assertEquals(-0.01, ReturnMetrics.cumulativeReturn(new double[] { 0.1, -0.1 }), 1e-12);
        assertEquals(0.0, ReturnMetrics.cumulativeReturn(new double[0]), 0.0);
    }

    @Test
    public void testWeightedReturn() {
        assertEquals(0.14, ReturnMetrics.weightedReturn(new double[] { 0.1, 0.2 }, new double[] { 0.6, 0.4 }),
                1e-12);
        try {
            ReturnMetrics.weightedReturn(new double[] { 0.1, 0.2 }, new double[] { 0.5, 0.4 });
            fail("Should reject weights that do not sum to 1");
        } catch (InvalidInputException e) {
            assertTrue(e.getMessage().contains("sum to 1"));
        }
        try {
            ReturnMetrics.weightedReturn(new double[] { 0.1, 0.2 }, new double[] { 1.0 });
            fail("Should reject mismatched lengths");
        } catch (InvalidInputException e) {
            // Expected
        }
    }
}
