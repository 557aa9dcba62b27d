package com.trading.quant.options;

import com.trading.quant.api.InvalidInputException;
import org.junit.Test;
import static org.junit.Assert.*;

public class BinomialTreeTest {

    @Test
    public void testEuropeanConvergesToBlackScholes() {
        BinomialTree tree = new BinomialTree(2000);
        for (OptionType type : OptionType.values()) {
            double lattice = tree.european(100, 100, 1, 0.05, 0.2, type);
            double bs = BlackScholes.price(100, 100, 1, 0.05, 0.2, type);
            assertEquals(type.name(), bs, lattice, 0.01);
        }
    }

    @Test
    public void testAmericanPutCarriesEarlyExercisePremium() {
        BinomialTree tree = new BinomialTree();
        double american = tree.american(100, 110, 1, 0.08, 0.25, OptionType.PUT);
        double european = tree.european(100, 110, 1, 0.08, 0.25, OptionType.PUT);
        assertTrue(american > european);
        assertTrue(american >= 10.0); // never below intrinsic
    }

    @Test
    public void testAmericanCallEqualsEuropeanWithoutDividends() {
        BinomialTree tree = new BinomialTree(200);
        double american = tree.american(100, 95, 0.5, 0.05, 0.3, OptionType.CALL);
        double european = tree.european(100, 95, 0.5, 0.05, 0.3, OptionType.CALL);
        assertEquals(european, american, 1e-9);
    }

    @Test
    public void testDeepInTheMoneyAmericanPutIsIntrinsic() {
        double price = new BinomialTree(100).american(20, 100, 1, 0.05, 0.2, OptionType.PUT);
        assertEquals(80.0, price, 1e-9);
    }

    @Test
    public void testContractOverload() {
        BinomialTree tree = new BinomialTree(50);
        OptionContract c = new OptionContract(100, 100, 1, 0.05, 0.2, OptionType.PUT);
        assertEquals(tree.american(100, 100, 1, 0.05, 0.2, OptionType.PUT),
                tree.price(c, ExerciseStyle.AMERICAN), 0.0);
    }

    @Test
    public void testDefaultSteps() {
        assertEquals(BinomialTree.DEFAULT_STEPS, new BinomialTree().steps());
    }

    @Test
    public void testInvalidSteps() {
        try {
            new BinomialTree(0);
            fail("Should throw InvalidInputException for zero steps");
        } catch (InvalidInputException e) {
            assertTrue(e.getMessage().contains("steps"));
        }
    }
}
