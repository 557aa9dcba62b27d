package com.trading.quant.stats;

import java.util.Random;

import com.trading.quant.api.InvalidInputException;
import com.trading.quant.api.UndefinedResultException;
import org.junit.Test;
import static org.junit.Assert.*;

public class LinearRegressionTest {

    @Test
    public void testSimplePerfectFit() {
        double[] x = { 1, 2, 3, 4, 5 };
        double[] y = { 3, 5, 7, 9, 11 };
        SimpleRegressionResult r = LinearRegression.simple(x, y);
        assertEquals(2.0, r.slope(), 1e-12);
        assertEquals(1.0, r.intercept(), 1e-12);
        assertEquals(1.0, r.rSquared(), 1e-12);
        assertEquals(0.0, r.standardError(), 1e-9);
    }

    @Test
    public void testSimpleNoisyFit() {
        double[] x = { 1, 2, 3, 4 };
        double[] y = { 1, 3, 2, 4 };
        SimpleRegressionResult r = LinearRegression.simple(x, y);
        assertEquals(0.8, r.slope(), 1e-12);
        assertEquals(0.5, r.intercept(), 1e-12);
        assertEquals(0.64, r.rSquared(), 1e-12);
        // SSres = 1.8 over 2 degrees of freedom
        assertEquals(Math.sqrt(0.9), r.standardError(), 1e-12);
    }

    @Test
    public void testSimpleTwoPoints() {
        SimpleRegressionResult r = LinearRegression.simple(new double[] { 0, 1 }, new double[] { 1, 3 });
        assertEquals(2.0, r.slope(), 1e-12);
        assertTrue(Double.isNaN(r.standardError()));
    }

    @Test
    public void testSimpleConstantY() {
        SimpleRegressionResult r = LinearRegression.simple(new double[] { 1, 2, 3 }, new double[] { 4, 4, 4 });
        assertEquals(0.0, r.slope(), 0.0);
        assertEquals(0.0, r.rSquared(), 0.0);
    }

    @Test
    public void testSimpleConstantX() {
        try {
            LinearRegression.simple(new double[] { 2, 2, 2 }, new double[] { 1, 2, 3 });
            fail("Should throw UndefinedResultException for a constant regressor");
        } catch (UndefinedResultException e) {
            // Expected
        }
    }

    @Test
    public void testSimpleConstantDecimalX() {
        double[] x = { 0.1, 0.1, 0.1, 0.1, 0.1, 0.1, 0.1 };
        double[] y = { 1, 2, 3, 4, 5, 6, 7 };
        try {
            LinearRegression.simple(x, y);
            fail("Should throw UndefinedResultException for a constant regressor");
        } catch (UndefinedResultException e) {
            // Expected
        }
    }

    @Test
    public void testSimpleSmallButRealSpread() {
        double[] x = { 1000.0, 1000.01, 1000.02 };
        double[] y = { 1, 2, 3 };
        assertEquals(100.0, LinearRegression.simple(x, y).slope(), 1e-2);
    }

    @Test
    public void testSimpleValidation() {
        try {
            LinearRegression.simple(new double[] { 1 }, new double[] { 1 });
            fail("Should reject a single point");
        } catch (InvalidInputException e) {
            // Expected
        }
        try {
            LinearRegression.simple(new double[] { 1, 2 }, new double[] { 1, 2, 3 });
            fail("Should reject mismatched lengths");
        } catch (InvalidInputException e) {
            // Expected
        }
    }

    @Test
    public void testMultipleRecoversCoefficients() {
        double[] a = { 1, 2, 3, 4, 5, 6 };
        double[] b = { 2, 1, 4, 3, 6, 5 };
        double[] y = new double[a.length];
        for (int i = 0; i < y.length; i++)
            y[i] = 1 + 2 * a[i] + 3 * b[i];

        RegressionResult r = LinearRegression.multiple(y, new double[][] { a, b });
        assertEquals(1.0, r.intercept(), 1e-9);
        assertArrayEquals(new double[] { 2.0, 3.0 }, r.coefficients(), 1e-9);
        assertEquals(1.0, r.rSquared(), 1e-12);
        assertEquals(1.0, r.adjustedRSquared(), 1e-12);
    }

    @Test
    public void testMultipleNoResidualDegreesOfFreedom() {
        RegressionResult r = LinearRegression.multiple(new double[] { 1, 3 }, new double[][] { { 0, 1 } });
        assertEquals(2.0, r.coefficients()[0], 1e-12);
        assertTrue(Double.isNaN(r.adjustedRSquared()));
    }

    @Test
    public void testRSquaredStaysInUnitInterval() {
        Random rnd = new Random(42);
        for (int trial = 0; trial < 20; trial++) {
            int n = 8 + trial;
            double[] y = new double[n];
            double[] f1 = new double[n];
            double[] f2 = new double[n];
            for (int i = 0; i < n; i++) {
                y[i] = rnd.nextGaussian();
                f1[i] = rnd.nextGaussian();
                f2[i] = rnd.nextGaussian();
            }
            RegressionResult multi = LinearRegression.multiple(y, new double[][] { f1, f2 });
            assertTrue(multi.rSquared() >= 0 && multi.rSquared() <= 1);
            assertTrue(multi.adjustedRSquared() >= 0 && multi.adjustedRSquared() <= 1);

            SimpleRegressionResult simple = LinearRegression.simple(f1, y);
            assertTrue(simple.rSquared() >= 0 && simple.rSquared() <= 1);
        }
    }

    @Test
    public void testMultipleCollinearFactors() {
        double[] a = { 1, 2, 3, 4, 5 };
        double[] b = { 2, 4, 6, 8, 10 };
        try {
            LinearRegression.multiple(new double[] { 1, 2, 2, 3, 5 }, new double[][] { a, b });
            fail("Should throw UndefinedResultException for collinear regressors");
        } catch (UndefinedResultException e) {
            // Expected
        }
    }

    @Test
    public void testMultipleValidation() {
        try {
            LinearRegression.multiple(new double[] { 1, 2, 3 }, new double[0][]);
            fail("Should reject an empty factor set");
        } catch (InvalidInputException e) {
            // Expected
        }
        try {
            LinearRegression.multiple(new double[] { 1, 2, 3 }, new double[][] { { 1, 2 } });
            fail("Should reject a short factor series");
        } catch (InvalidInputException e) {
            // Expected
        }
        try {
            LinearRegression.multiple(new double[] { 1, 2 }, new double[][] { { 1, 2 }, { 3, 5 } });
            fail("Should reject fewer observations than parameters");
        } catch (InvalidInputException e) {
            // Expected
        }
    }
}
