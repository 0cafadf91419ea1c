package com.stochastic.sde.kernel;

import com.stochastic.sde.api.NoiseIncrement;
import com.stochastic.sde.api.SdeFunction;
import com.stochastic.sde.api.StepWorkspace;
import com.stochastic.sde.tableau.SraTableau;

/**
 * General Rößler SRA scheme for additive noise. The diffusion is evaluated at
 * the stage times and the state at the start of the step.
 *
 * Embedded error terms:
 * {@code E_D = h * sum_j (alpha_j - e1_j) f_j}, {@code E_N = sum_j beta2_j chi2 g_j}.
 */
public final class SraKernel extends AbstractStepKernel {
    private final SdeFunction f;
    private final SdeFunction g;

    private final int stages;
    private final double[] c0, c1, alpha, beta1, beta2;
    private final double[][] a0, b0;

    private final double[][] h0;
    private final double[][] fs;
    private final double[][] gs;
    private final double[] chi2;

    public SraKernel(SdeFunction f, SdeFunction g, int dimension, SraTableau tableau) {
        super("SRA(" + tableau.name() + ")", tableau.order(), dimension);
        this.f = f;
        this.g = g;
        this.stages = tableau.stages();
        this.c0 = tableau.c0();
        this.c1 = tableau.c1();
        this.a0 = tableau.a0();
        this.b0 = tableau.b0();
        this.alpha = tableau.alpha();
        this.beta1 = tableau.beta1();
        this.beta2 = tableau.beta2();

        this.h0 = new double[stages][dimension];
        this.fs = new double[stages][dimension];
        this.gs = new double[stages][dimension];
        this.chi2 = new double[dimension];
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
        for (int k = 0; k < dimension; k++)
            chi2[k] = IteratedIntegrals.chi2(dW[k], dZ[k]);

        for (int i = 0; i < stages; i++)
            g.evaluate(t + c1[i] * dt, uPrev, gs[i]);

        for (int i = 0; i < stages; i++) {
            double[] stage = h0[i];
            for (int k = 0; k < dimension; k++) {
                double drift = 0.0, diffusion = 0.0;
                for (int j = 0; j < i; j++) {
                    drift += a0[i][j] * fs[j][k];
                    diffusion += b0[i][j] * gs[j][k];
                }
                stage[k] = uPrev[k] + dt * drift + chi2[k] * diffusion;
            }
            f.evaluate(t + c0[i] * dt, stage, fs[i]);
        }

        double[] uNext = ws.uNext();
        double[] errD = ws.deterministicError();
        double[] errN = ws.noiseError();
        for (int k = 0; k < dimension; k++) {
            double drift = 0.0, diffusion = 0.0, ed = 0.0, en = 0.0;
            for (int i = 0; i < stages; i++) {
                double fi = fs[i][k];
                double gi = gs[i][k];
                drift += alpha[i] * fi;
                ed += (i == 0 ? alpha[i] - 1.0 : alpha[i]) * fi;
                diffusion += gi * (beta1[i] * dW[k] + beta2[i] * chi2[k]);
                en += beta2[i] * chi2[k] * gi;
            }
            uNext[k] = uPrev[k] + dt * drift + diffusion;
            errD[k] = dt * ed;
            errN[k] = en;
        }
        ws.markErrorTermsValid();
    }
}
