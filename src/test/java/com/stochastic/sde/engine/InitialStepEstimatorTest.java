package com.stochastic.sde.engine;

import com.stochastic.sde.api.SdeFunction;
import org.junit.Test;

import static org.junit.Assert.*;

public class InitialStepEstimatorTest {

    @Test
    public void testVanishingCoefficientsFallBackToFloor() {
        double dt = InitialStepEstimator.estimate(new double[] { 1.0, 2.0 }, 0.0, 1e-3, 1e-6,
                SdeFunction.zero(), SdeFunction.zero(), 1.5);
        assertEquals(1e-6, dt, 0.0);
    }

    @Test
    public void testGeometricBrownianMotionGivesSmallPositiveStep() {
        SdeFunction f = SdeFunction.scalar((t, u) -> 1.01 * u);
        SdeFunction g = SdeFunction.scalar((t, u) -> 0.87 * u);
        double dt = InitialStepEstimator.estimate(new double[] { 0.5 }, 0.0, 1e-3, 1e-6, f, g, 1.5);

        assertTrue(dt > 0);
        assertTrue(Double.isFinite(dt));
        assertTrue("dt=" + dt, dt < 0.01);
    }

    @Test
    public void testLooserToleranceAllowsLargerStep() {
        SdeFunction f = SdeFunction.scalar((t, u) -> -u);
        SdeFunction g = SdeFunction.scalar((t, u) -> 0.3 * u);
        double tight = InitialStepEstimator.estimate(new double[] { 1.0 }, 0.0, 1e-6, 1e-6, f, g, 1.5);
        double loose = InitialStepEstimator.estimate(new double[] { 1.0 }, 0.0, 1e-2, 1e-2, f, g, 1.5);

        assertTrue(loose > tight);
    }

    @Test
    public void testNonFiniteDriftPropagates() {
        SdeFunction f = (t, u, du) -> du[0] = Double.NaN;
        double dt = InitialStepEstimator.estimate(new double[] { 1.0 }, 0.0, 1e-3, 1e-6, f, SdeFunction.zero(), 0.5);
        assertFalse(Double.isFinite(dt) && dt > 0);
    }
}
