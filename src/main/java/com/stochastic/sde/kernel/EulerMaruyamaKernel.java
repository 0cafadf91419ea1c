package com.stochastic.sde.kernel;

import com.stochastic.sde.api.NoiseIncrement;
import com.stochastic.sde.api.SdeFunction;
import com.stochastic.sde.api.StepWorkspace;

/**
 * Euler-Maruyama.
 * <p>
 * Formula: {@code u' = u + f(t,u) dt + g(t,u) dW}
 */
public final class EulerMaruyamaKernel extends AbstractStepKernel {
    private final SdeFunction f;
    private final SdeFunction g;

    public EulerMaruyamaKernel(SdeFunction f, SdeFunction g, int dimension) {
        super("EM", 0.5, dimension);
        this.f = f;
        this.g = g;
    }

    @Override
    protected void advance(double t, double dt, double[] uPrev, NoiseIncrement noise, StepWorkspace ws) {
        double[] fu = ws.fStart();
        double[] gu = ws.gStart();
        f.evaluate(t, uPrev, fu);
        g.evaluate(t, uPrev, gu);
        ws.markStartValuesValid();

        double[] dW = noise.dW();
        double[] uNext = ws.uNext();
        for (int i = 0; i < dimension; i++)
            uNext[i] = uPrev[i] + dt * fu[i] + gu[i] * dW[i];
    }
}
