package com.trading.quant.stats;

import com.trading.quant.api.InvalidInputException;
import org.junit.Test;
import static org.junit.Assert.*;

public class CovarianceEstimatorTest {

    @Test
    public void testDescriptive() {
        double[] v = { 2, 4, 4, 4, 5, 5, 7, 9 };
        assertEquals(5.0, Descriptive.mean(v), 1e-12);
        assertEquals(32.0 / 7, Descriptive.sampleVariance(v), 1e-12);
        assertEquals(Math.sqrt(32.0 / 7), Descriptive.standardDeviation(v), 1e-12);
        assertEquals(0.0, Descriptive.sampleVariance(new double[] { 3 }), 0.0);
    }

    @Test
    public void testCovarianceAndCorrelation() {
        double[] x = { 1, 2, 3, 4 };
        double[] y = { 2, 4, 6, 8 };
        assertEquals(2 * Descriptive.sampleVariance(x), CovarianceEstimator.covariance(x, y), 1e-12);
        assertEquals(1.0, CovarianceEstimator.correlation(x, y), 1e-12);
        assertEquals(-1.0, CovarianceEstimator.correlation(x, new double[] { 4, 3, 2, 1 }), 1e-12);
    }

    @Test
    public void testCorrelationWithConstantSeriesIsZero() {
        assertEquals(0.0, CovarianceEstimator.correlation(new double[] { 1, 2, 3 }, new double[] { 5, 5, 5 }), 0.0);
    }

    @Test
    public void testMatrices() {
        double[][] rows = {
                { 0.01, -0.02, 0.015, 0.03 },
                { 0.02, -0.01, 0.005, 0.01 },
                { -0.01, 0.02, 0.0, -0.005 }
        };
        double[][] cov = CovarianceEstimator.covarianceMatrix(rows);
        double[][] corr = CovarianceEstimator.correlationMatrix(rows);
        for (int i = 0; i < 3; i++) {
            assertEquals(Descriptive.sampleVariance(rows[i]), cov[i][i], 1e-15);
            assertEquals(1.0, corr[i][i], 1e-12);
            for (int j = 0; j < 3; j++) {
                assertEquals(cov[i][j], cov[j][i], 0.0);
                assertTrue(Math.abs(corr[i][j]) <= 1.0 + 1e-12);
            }
        }
    }

    @Test
    public void testRaggedMatrix() {
        try {
            CovarianceEstimator.covarianceMatrix(new double[][] { { 1, 2, 3 }, { 1, 2 } });
            fail("Should reject series of different lengths");
        } catch (InvalidInputException e) {
            assertTrue(e.getMessage().contains("same length"));
        }
        try {
            CovarianceEstimator.correlationMatrix(new double[0][]);
            fail("Should reject an empty matrix");
        } catch (InvalidInputException e) {
            // Expected
        }
    }

    @Test
    public void testIsConstant() {
        assertTrue(Descriptive.isConstant(new double[] { 0.1, 0.1, 0.1, 0.1, 0.1, 0.1, 0.1 }));
        assertTrue(Descriptive.isConstant(new double[] { 0, 0, 0 }));
        assertTrue(Descriptive.isConstant(new double[] { 5 }));
        assertFalse(Descriptive.isConstant(new double[] { 0.1, 0.1, 0.1001 }));
    }
}
