package com.stochastic.sde.kernel;

import com.stochastic.sde.api.NoiseIncrement;
import com.stochastic.sde.api.SdeFunction;
import com.stochastic.sde.api.StepWorkspace;

/**
 * Derivative-free Milstein (Runge-Kutta Milstein) for diagonal noise.
 * <p>
 * Formula:
 * {@code K = u + f dt; v = K + g sqrt(dt);
 * u' = K + g dW + (g(t, v) - g) / (2 sqrt(dt)) * (dW^2 - dt)}
 */
public final class RkMilsteinKernel extends AbstractStepKernel {
    private final SdeFunction f;
    private final SdeFunction g;
    private final double[] support;
    private final double[] gSupport;

    public RkMilsteinKernel(SdeFunction f, SdeFunction g, int dimension) {
        super("RKMil", 1.0, dimension);
        this.f = f;
        this.g = g;
        this.support = new double[dimension];
        this.gSupport = new double[dimension];
    }

    @Override
    protected void advance(double t, double dt, double[] uPrev, NoiseIncrement noise, StepWorkspace ws) {
        double[] fu = ws.fStart();
        double[] gu = ws.gStart();
        f.evaluate(t, uPrev, fu);
        g.evaluate(t, uPrev, gu);
        ws.markStartValuesValid();

        double sqrtDt = noise.sqrtDt();
        double[] uNext = ws.uNext();
        for (int i = 0; i < dimension; i++) {
            uNext[i] = uPrev[i] + dt * fu[i];
            support[i] = uNext[i] + gu[i] * sqrtDt;
        }
        g.evaluate(t, support, gSupport);

        double[] dW = noise.dW();
        double scale = 1.0 / (2.0 * sqrtDt);
        for (int i = 0; i < dimension; i++) {
            double w = dW[i];
            uNext[i] += gu[i] * w + (gSupport[i] - gu[i]) * scale * (w * w - dt);
        }
    }
}
