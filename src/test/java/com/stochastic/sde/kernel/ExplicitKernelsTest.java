package com.stochastic.sde.kernel;

import com.stochastic.sde.api.NoiseIncrement;
import com.stochastic.sde.api.NonFiniteStateException;
import com.stochastic.sde.api.SdeFunction;
import com.stochastic.sde.api.StepWorkspace;
import org.junit.Test;

import static com.stochastic.sde.kernel.KernelFixtures.increment;
import static org.junit.Assert.*;

public class ExplicitKernelsTest {
    private static final double A = 1.5;
    private static final double B = 0.5;
    private static final SdeFunction F = SdeFunction.scalar((t, u) -> A * u);
    private static final SdeFunction G = SdeFunction.scalar((t, u) -> B * u);

    @Test
    public void testEulerMaruyamaStep() {
        var kernel = new EulerMaruyamaKernel(F, G, 1);
        var ws = new StepWorkspace(1);
        kernel.perform(0.0, 0.1, new double[] { 2.0 }, increment(0.1, new double[] { 0.3 }, null), ws);

        // 2 + 0.1 * 1.5 * 2 + 0.5 * 2 * 0.3
        assertEquals(2.6, ws.uNext()[0], 1e-14);
        assertTrue(ws.startValuesValid());
        assertEquals(3.0, ws.fStart()[0], 0.0);
        assertEquals(1.0, ws.gStart()[0], 0.0);
        assertFalse(kernel.providesErrorTerms());
        assertEquals(0.5, kernel.order(), 0.0);
    }

    @Test
    public void testRkMilsteinStep() {
        double u = 2.0, h = 0.1, dW = 0.3;
        var kernel = new RkMilsteinKernel(F, G, 1);
        var ws = new StepWorkspace(1);
        kernel.perform(0.0, h, new double[] { u }, increment(h, new double[] { dW }, null), ws);

        double k = u + h * A * u;
        double support = k + B * u * Math.sqrt(h);
        double expected = k + B * u * dW + (B * support - B * u) / (2 * Math.sqrt(h)) * (dW * dW - h);
        assertEquals(expected, ws.uNext()[0], 1e-14);
        assertEquals(1.0, kernel.order(), 0.0);
    }

    @Test
    public void testRkMilsteinReducesToEulerForAdditiveNoise() {
        SdeFunction constant = (t, u, du) -> du[0] = 0.7;
        var em = new EulerMaruyamaKernel(F, constant, 1);
        var milstein = new RkMilsteinKernel(F, constant, 1);
        var wsEm = new StepWorkspace(1);
        var wsMil = new StepWorkspace(1);
        NoiseIncrement inc = increment(0.05, new double[] { -0.2 }, null);

        em.perform(0.3, 0.05, new double[] { 1.2 }, inc, wsEm);
        milstein.perform(0.3, 0.05, new double[] { 1.2 }, inc, wsMil);

        assertEquals(wsEm.uNext()[0], wsMil.uNext()[0], 1e-15);
    }

    @Test
    public void testNonFiniteStateDetected() {
        SdeFunction exploding = (t, u, du) -> {
            du[0] = 0.0;
            du[1] = Double.POSITIVE_INFINITY;
        };
        var kernel = new EulerMaruyamaKernel(exploding, SdeFunction.zero(), 2);
        try {
            kernel.perform(0.5, 0.1, new double[] { 1, 1 }, increment(0.1, new double[] { 0, 0 }, null),
                    new StepWorkspace(2));
            fail("Infinite drift should be detected");
        } catch (NonFiniteStateException e) {
            assertEquals(1, e.component());
            assertEquals(0.5, e.time(), 0.0);
            assertEquals(0.1, e.dt(), 0.0);
        }
    }

    @Test
    public void testUserExceptionsPropagate() {
        SdeFunction failing = (t, u, du) -> {
            throw new ArithmeticException("boom");
        };
        var kernel = new EulerMaruyamaKernel(failing, G, 1);
        try {
            kernel.perform(0, 0.1, new double[] { 1 }, increment(0.1, new double[] { 0 }, null), new StepWorkspace(1));
            fail("Exception from the drift should propagate");
        } catch (ArithmeticException e) {
            assertEquals("boom", e.getMessage());
        }
    }
}
