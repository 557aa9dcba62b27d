package com.trading.quant.options;

import org.junit.Test;
import static org.junit.Assert.*;

public class GreeksCalculatorTest {
    private static final double S = 100, K = 100, T = 1, R = 0.05, VOL = 0.2;

    @Test
    public void testAtTheMoneyCall() {
        Greeks g = GreeksCalculator.all(S, K, T, R, VOL, OptionType.CALL);
        assertEquals(0.6368, g.delta(), 1e-4);
        assertEquals(0.01876, g.gamma(), 1e-5);
        assertEquals(0.3752, g.vega(), 1e-4);
        assertEquals(-0.01757, g.theta(), 1e-5);
        assertEquals(0.5323, g.rho(), 1e-4);
    }

    @Test
    public void testCallPutRelations() {
        Greeks call = GreeksCalculator.all(S, K, T, R, VOL, OptionType.CALL);
        Greeks put = GreeksCalculator.all(S, K, T, R, VOL, OptionType.PUT);
        double discountedStrike = K * Math.exp(-R * T);

        assertEquals(1.0, call.delta() - put.delta(), 1e-9);
        assertEquals(call.gamma(), put.gamma(), 0.0);
        assertEquals(call.vega(), put.vega(), 0.0);
        // theta_c - theta_p = -rK e^{-rT} / 365
        assertEquals(-R * discountedStrike / 365, call.theta() - put.theta(), 1e-9);
        // rho_c - rho_p = K T e^{-rT} / 100
        assertEquals(T * discountedStrike / 100, call.rho() - put.rho(), 1e-9);
    }

    @Test
    public void testPutDeltaAndRhoAreNegative() {
        Greeks put = GreeksCalculator.all(new OptionContract(100, 105, 0.5, 0.03, 0.25, OptionType.PUT));
        assertTrue(put.delta() < 0 && put.delta() > -1);
        assertTrue(put.rho() < 0);
    }

    @Test
    public void testDeltaMatchesFiniteDifference() {
        double h = 1e-3;
        double up = BlackScholes.price(S + h, K, T, R, VOL, OptionType.CALL);
        double down = BlackScholes.price(S - h, K, T, R, VOL, OptionType.CALL);
        assertEquals((up - down) / (2 * h), GreeksCalculator.delta(S, K, T, R, VOL, OptionType.CALL), 1e-4);
    }
}
