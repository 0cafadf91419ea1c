package com.stochastic.sde.control;

import com.stochastic.sde.api.NoiseIncrement;
import com.stochastic.sde.api.SdeFunction;
import com.stochastic.sde.api.StepWorkspace;
import org.junit.Test;

import static org.junit.Assert.*;

public class ErrorEstimatorsTest {

    private static NoiseIncrement increment(double dt, double dW) {
        NoiseIncrement inc = new NoiseIncrement(1, false, 0);
        inc.reset(dt);
        inc.dW()[0] = dW;
        return inc;
    }

    @Test
    public void testEmbeddedCombinesDeterministicAndNoiseTerms() {
        var estimator = new EmbeddedErrorEstimator(new ErrorNorm(Double.POSITIVE_INFINITY, 0.1, 0.0), 2.0, 2);
        var ws = new StepWorkspace(2);
        ws.deterministicError()[0] = -0.01;
        ws.deterministicError()[1] = 0.001;
        ws.noiseError()[0] = 0.02;
        ws.noiseError()[1] = -0.05;
        ws.markErrorTermsValid();

        double e = estimator.estimate(0, 0.1, new double[] { 1, 1 }, null, ws);

        // max(2 * 0.01 + 0.02, 2 * 0.001 + 0.05) / 0.1
        assertEquals(0.52, e, 1e-14);
    }

    @Test
    public void testEmbeddedRequiresErrorTerms() {
        var estimator = new EmbeddedErrorEstimator(new ErrorNorm(2, 0.1, 0.1), 1.0, 1);
        try {
            estimator.estimate(0, 0.1, new double[] { 1 }, null, new StepWorkspace(1));
            fail("Missing error terms should be reported");
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage().contains("embedded error terms"));
        }
    }

    @Test
    public void testLocalExtrapolationIsZeroForConstantCoefficients() {
        SdeFunction f = (t, u, du) -> du[0] = 2.0;
        SdeFunction g = (t, u, du) -> du[0] = 0.5;
        var estimator = new LocalExtrapolationErrorEstimator(f, g, new ErrorNorm(2, 1e-3, 1e-3), 1.0, 1);
        var ws = new StepWorkspace(1);
        ws.uNext()[0] = 1.3;

        assertEquals(0.0, estimator.estimate(0, 0.1, new double[] { 1 }, increment(0.1, 0.2), ws), 0.0);
    }

    @Test
    public void testLocalExtrapolationMeasuresCoefficientChange() {
        SdeFunction f = (t, u, du) -> du[0] = u[0];
        SdeFunction g = (t, u, du) -> du[0] = 0.5 * u[0];
        var estimator = new LocalExtrapolationErrorEstimator(f, g, new ErrorNorm(2, 0.01, 0.0), 1.0, 1);
        var ws = new StepWorkspace(1);
        ws.uNext()[0] = 1.2;

        double e = estimator.estimate(0, 0.1, new double[] { 1 }, increment(0.1, -0.3), ws);

        // drift change 0.1 * 0.2 = 0.02, diffusion change 0.1 * -0.3 = -0.03
        assertEquals(0.05 / 0.01, e, 1e-12);
    }

    @Test
    public void testLocalExtrapolationReusesPublishedStartValues() {
        SdeFunction f = (t, u, du) -> du[0] = u[0];
        SdeFunction g = SdeFunction.zero();
        var estimator = new LocalExtrapolationErrorEstimator(f, g, new ErrorNorm(2, 1.0, 0.0), 1.0, 1);
        var ws = new StepWorkspace(1);
        ws.fStart()[0] = 0.5;
        ws.gStart()[0] = 0.0;
        ws.markStartValuesValid();
        ws.uNext()[0] = 1.0;

        // Published f0 = 0.5 is used instead of f(uPrev) = 3
        double e = estimator.estimate(0, 1.0, new double[] { 3 }, increment(1.0, 0.0), ws);
        assertEquals(0.5, e, 1e-15);
    }
}
