package com.trading.quant.indicators;

import com.trading.quant.api.InvalidInputException;
import org.junit.Test;
import static org.junit.Assert.*;

public class VolatilityBandsTest {

    @Test
    public void testBollingerUsesPopulationDeviation() {
        double[] prices = { 2, 4, 4, 4, 5, 5, 7, 9 };
        Bands b = VolatilityBands.bollinger(prices, 8, 2.0);
        assertEquals(1, b.middle().length);
        assertEquals(5.0, b.middle()[0], 1e-12);
        assertEquals(9.0, b.upper()[0], 1e-12);
        assertEquals(1.0, b.lower()[0], 1e-12);
    }

    @Test
    public void testStandardDeviationChannelMatchesBollinger() {
        double[] prices = new double[30];
        for (int i = 0; i < prices.length; i++)
            prices[i] = 100 + 3 * Math.cos(i * 0.7);
        Bands a = VolatilityBands.bollinger(prices);
        Bands b = VolatilityBands.standardDeviationChannel(prices);
        assertEquals(11, a.middle().length);
        assertArrayEquals(a.upper(), b.upper(), 0.0);
        assertArrayEquals(a.lower(), b.lower(), 0.0);
        assertArrayEquals(MovingAverages.sma(prices, 20), a.middle(), 1e-9);
    }

    @Test
    public void testBandValidation() {
        try {
            VolatilityBands.bollinger(new double[] { 1, 2, 3 }, 2, 0.0);
            fail("Should reject a zero band width");
        } catch (InvalidInputException e) {
            // Expected
        }
        try {
            VolatilityBands.bollinger(new double[] { 1, 2, 3 }, 4, 2.0);
            fail("Should reject a period longer than the series");
        } catch (InvalidInputException e) {
            // Expected
        }
    }

    @Test
    public void testAverageTrueRange() {
        double[] high = { 10, 11, 12, 11, 13 };
        double[] low = { 9, 10, 10, 9, 11 };
        double[] close = { 9.5, 10.5, 11, 10, 12 };
        // True ranges 1.5, 2, 2, 3 with a 2-bar Wilder average
        double[] atr = VolatilityBands.averageTrueRange(high, low, close, 2);
        assertArrayEquals(new double[] { 1.75, 1.875, 2.4375 }, atr, 1e-12);

        try {
            VolatilityBands.averageTrueRange(high, low, close, 5);
            fail("Should need period + 1 bars");
        } catch (InvalidInputException e) {
            // Expected
        }
    }
}
