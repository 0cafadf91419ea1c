package com.stochastic.sde.control;

import org.junit.Test;

import static org.junit.Assert.*;

public class ErrorNormTest {

    @Test
    public void testScaleUsesLargerEndpointMagnitude() {
        var norm = new ErrorNorm(2, 0.01, 0.1);
        double[] error = { 0.02, 0.02 };
        norm.scale(error, new double[] { 1.0, -4.0 }, new double[] { 2.0, 0.5 });

        assertEquals(0.02 / (0.01 + 0.2), error[0], 1e-15);
        assertEquals(0.02 / (0.01 + 0.4), error[1], 1e-15);
    }

    @Test
    public void testZeroTolerancesOnZeroStateStayFinite() {
        var norm = new ErrorNorm(Double.POSITIVE_INFINITY, 0.0, 0.0);
        double[] error = { 1e-20 };
        norm.scale(error, new double[] { 0.0 }, new double[] { 0.0 });

        assertTrue(Double.isFinite(error[0]));
        assertEquals(1e-20 / Math.ulp(1.0), error[0], 1e-30);
    }

    @Test
    public void testNorms() {
        double[] v = { 3.0, -4.0 };
        assertEquals(5.0, new ErrorNorm(2, 1, 1).norm(v), 1e-15);
        assertEquals(4.0, new ErrorNorm(Double.POSITIVE_INFINITY, 1, 1).norm(v), 0.0);
        assertEquals(7.0, new ErrorNorm(1, 1, 1).norm(v), 0.0);
        assertEquals(Math.cbrt(27 + 64), new ErrorNorm(3, 1, 1).norm(v), 1e-12);
    }

    @Test
    public void testMaxNormPropagatesNaN() {
        assertTrue(Double.isNaN(new ErrorNorm(Double.POSITIVE_INFINITY, 1, 1).norm(new double[] { 1, Double.NaN, 2 })));
    }

    @Test
    public void testInvalidArguments() {
        try {
            new ErrorNorm(0.5, 1, 1);
            fail("p < 1 should be rejected");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("Norm order"));
        }
        try {
            new ErrorNorm(2, -1e-3, 1);
            fail("Negative abstol should be rejected");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("Tolerances"));
        }
    }
}
