package com.stochastic.sde.kernel;

import com.stochastic.sde.api.NoiseIncrement;
import com.stochastic.sde.api.SdeFunction;
import com.stochastic.sde.api.StepWorkspace;

/**
 * SRA1 with the tableau unrolled.
 * <p>
 * Formula:
 * {@code g1 = g(t + h), g2 = g(t); H = u + 3/4 h f1 + 3/2 chi2 g1;
 * u' = u + h (f1 + 2 f(t + 3/4 h, H)) / 3 + dW g1 + chi2 (g2 - g1)}
 */
public final class Sra1OptimizedKernel extends AbstractStepKernel {
    private final SdeFunction f;
    private final SdeFunction g;
    private final double[] f1, f2, g1, g2, stage;

    public Sra1OptimizedKernel(SdeFunction f, SdeFunction g, int dimension) {
        super("SRA1", 2.0, dimension);
        this.f = f;
        this.g = g;
        this.f1 = new double[dimension];
        this.f2 = new double[dimension];
        this.g1 = new double[dimension];
        this.g2 = new double[dimension];
        this.stage = new double[dimension];
    }

    @Override
    public boolean providesErrorTerms() {
        return true;
    }

    @Override
    public boolean needsAuxiliaryNoise() {
        return true;
    }

    @Override
    protected void advance(double t, double dt, double[] uPrev, NoiseIncrement noise, StepWorkspace ws) {
        double[] dW = noise.dW();
        double[] dZ = noise.dZ();

        f.evaluate(t, uPrev, f1);
        g.evaluate(t + dt, uPrev, g1);
        g.evaluate(t, uPrev, g2);
        for (int k = 0; k < dimension; k++) {
            double chi2 = IteratedIntegrals.chi2(dW[k], dZ[k]);
            stage[k] = uPrev[k] + 0.75 * dt * f1[k] + 1.5 * chi2 * g1[k];
        }
        f.evaluate(t + 0.75 * dt, stage, f2);

        double[] uNext = ws.uNext();
        double[] errD = ws.deterministicError();
        double[] errN = ws.noiseError();
        for (int k = 0; k < dimension; k++) {
            double chi2 = IteratedIntegrals.chi2(dW[k], dZ[k]);
            double noiseError = chi2 * (g2[k] - g1[k]);
            uNext[k] = uPrev[k] + dt * (f1[k] + 2.0 * f2[k]) / 3.0 + dW[k] * g1[k] + noiseError;
            errD[k] = 2.0 / 3.0 * dt * (f2[k] - f1[k]);
            errN[k] = noiseError;
        }
        ws.markErrorTermsValid();
    }
}
