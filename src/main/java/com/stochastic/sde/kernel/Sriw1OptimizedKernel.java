package com.stochastic.sde.kernel;

import com.stochastic.sde.api.NoiseIncrement;
import com.stochastic.sde.api.SdeFunction;
import com.stochastic.sde.api.StepWorkspace;

/**
 * SRIW1 with the tableau unrolled. Produces the same update as
 * {@link SriKernel} with the SRIW1 tableau, with five function evaluations
 * instead of eight.
 */
public final class Sriw1OptimizedKernel extends AbstractStepKernel {
    private static final double TWO_THIRDS = 2.0 / 3.0;
    private static final double FOUR_THIRDS = 4.0 / 3.0;
    private static final double FIVE_THIRDS = 5.0 / 3.0;

    private final SdeFunction f;
    private final SdeFunction g;

    private final double[] f1, f2, g1, g2, g3, g4;
    private final double[] h02, h12, h13, h14;

    public Sriw1OptimizedKernel(SdeFunction f, SdeFunction g, int dimension) {
        super("SRIW1", 1.5, dimension);
        this.f = f;
        this.g = g;
        this.f1 = new double[dimension];
        this.f2 = new double[dimension];
        this.g1 = new double[dimension];
        this.g2 = new double[dimension];
        this.g3 = new double[dimension];
        this.g4 = new double[dimension];
        this.h02 = new double[dimension];
        this.h12 = new double[dimension];
        this.h13 = new double[dimension];
        this.h14 = new double[dimension];
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
        double sqrtDt = noise.sqrtDt();
        double[] dW = noise.dW();
        double[] dZ = noise.dZ();

        f.evaluate(t, uPrev, f1);
        g.evaluate(t, uPrev, g1);
        for (int k = 0; k < dimension; k++) {
            double chi2 = IteratedIntegrals.chi2(dW[k], dZ[k]);
            h02[k] = uPrev[k] + 0.75 * dt * f1[k] + 1.5 * chi2 * g1[k];
            h12[k] = uPrev[k] + 0.25 * dt * f1[k] + 0.5 * sqrtDt * g1[k];
            h13[k] = uPrev[k] + dt * f1[k] - sqrtDt * g1[k];
        }
        f.evaluate(t + 0.75 * dt, h02, f2);
        g.evaluate(t + 0.25 * dt, h12, g2);
        g.evaluate(t + dt, h13, g3);
        for (int k = 0; k < dimension; k++)
            h14[k] = uPrev[k] + 0.25 * dt * f1[k] + sqrtDt * (-5.0 * g1[k] + 3.0 * g2[k] + 0.5 * g3[k]);
        g.evaluate(t + 0.25 * dt, h14, g4);

        double[] uNext = ws.uNext();
        double[] errD = ws.deterministicError();
        double[] errN = ws.noiseError();
        for (int k = 0; k < dimension; k++) {
            double w = dW[k];
            double chi1 = IteratedIntegrals.chi1(w, dt, sqrtDt);
            double chi2 = IteratedIntegrals.chi2(w, dZ[k]);
            double chi3 = IteratedIntegrals.chi3(w, dt);
            double noiseError = chi2 * (2.0 * g1[k] - FOUR_THIRDS * g2[k] - TWO_THIRDS * g3[k])
                    + chi3 * (-2.0 * g1[k] + FIVE_THIRDS * g2[k] - TWO_THIRDS * g3[k] + g4[k]);
            uNext[k] = uPrev[k]
                    + dt * (f1[k] + 2.0 * f2[k]) / 3.0
                    + w * (-g1[k] + FOUR_THIRDS * g2[k] + TWO_THIRDS * g3[k])
                    + chi1 * (-g1[k] + FOUR_THIRDS * g2[k] - g3[k] / 3.0)
                    + noiseError;
            errD[k] = TWO_THIRDS * dt * (f2[k] - f1[k]);
            errN[k] = noiseError;
        }
        ws.markErrorTermsValid();
    }
}
