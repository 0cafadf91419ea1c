package com.stochastic.sde.kernel;

import com.stochastic.sde.api.NoiseIncrement;
import com.stochastic.sde.api.SdeFunction;
import com.stochastic.sde.api.StepWorkspace;
import com.stochastic.sde.tableau.SriTableau;

/**
 * General Rößler SRI scheme driven by an arbitrary {@link SriTableau}, for
 * diagonal or scalar noise.
 *
 * Fills the embedded error terms:
 * {@code E_D = h * sum_j (alpha_j - e1_j) f_j} (difference to the Euler drift),
 * {@code E_N = sum_j (beta3_j chi2 + beta4_j chi3) g_j}.
 */
public final class SriKernel extends AbstractStepKernel {
    private final SdeFunction f;
    private final SdeFunction g;

    private final int stages;
    private final double[] c0, c1, alpha, beta1, beta2, beta3, beta4;
    private final double[][] a0, a1, b0, b1;

    private final double[][] h0;
    private final double[][] h1;
    private final double[][] fs;
    private final double[][] gs;
    private final double[] chi1;
    private final double[] chi2;
    private final double[] chi3;

    public SriKernel(SdeFunction f, SdeFunction g, int dimension, SriTableau tableau) {
        super("SRI(" + tableau.name() + ")", tableau.order(), dimension);
        this.f = f;
        this.g = g;
        this.stages = tableau.stages();
        this.c0 = tableau.c0();
        this.c1 = tableau.c1();
        this.a0 = tableau.a0();
        this.a1 = tableau.a1();
        this.b0 = tableau.b0();
        this.b1 = tableau.b1();
        this.alpha = tableau.alpha();
        this.beta1 = tableau.beta1();
        this.beta2 = tableau.beta2();
        this.beta3 = tableau.beta3();
        this.beta4 = tableau.beta4();

        this.h0 = new double[stages][dimension];
        this.h1 = new double[stages][dimension];
        this.fs = new double[stages][dimension];
        this.gs = new double[stages][dimension];
        this.chi1 = new double[dimension];
        this.chi2 = new double[dimension];
        this.chi3 = new double[dimension];
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
        for (int k = 0; k < dimension; k++) {
            chi1[k] = IteratedIntegrals.chi1(dW[k], dt, sqrtDt);
            chi2[k] = IteratedIntegrals.chi2(dW[k], dZ[k]);
            chi3[k] = IteratedIntegrals.chi3(dW[k], dt);
        }

        for (int i = 0; i < stages; i++) {
            double[] stage0 = h0[i];
            double[] stage1 = h1[i];
            for (int k = 0; k < dimension; k++) {
                double driftA0 = 0.0, driftA1 = 0.0, noiseB0 = 0.0, noiseB1 = 0.0;
                for (int j = 0; j < i; j++) {
                    driftA0 += a0[i][j] * fs[j][k];
                    driftA1 += a1[i][j] * fs[j][k];
                    noiseB0 += b0[i][j] * gs[j][k];
                    noiseB1 += b1[i][j] * gs[j][k];
                }
                stage0[k] = uPrev[k] + dt * driftA0 + chi2[k] * noiseB0;
                stage1[k] = uPrev[k] + dt * driftA1 + sqrtDt * noiseB1;
            }
            f.evaluate(t + c0[i] * dt, stage0, fs[i]);
            g.evaluate(t + c1[i] * dt, stage1, gs[i]);
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
                diffusion += gi * (beta1[i] * dW[k] + beta2[i] * chi1[k] + beta3[i] * chi2[k] + beta4[i] * chi3[k]);
                en += gi * (beta3[i] * chi2[k] + beta4[i] * chi3[k]);
            }
            uNext[k] = uPrev[k] + dt * drift + diffusion;
            errD[k] = dt * ed;
            errN[k] = en;
        }
        ws.markErrorTermsValid();
    }
}
