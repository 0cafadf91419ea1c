package com.stochastic.sde.kernel;

import com.stochastic.sde.api.NoiseIncrement;
import com.stochastic.sde.api.SdeFunction;
import com.stochastic.sde.api.StepWorkspace;
import com.stochastic.sde.api.UnimplementedSchemeException;
import com.stochastic.sde.tableau.SraTableau;

import static com.stochastic.sde.kernel.StageVectors.dot;

/**
 * SRA scheme for one-dimensional states, combining stage arrays with the
 * tableau by dot products.
 */
public final class SraVectorizedKernel extends AbstractStepKernel {
    private final SdeFunction f;
    private final SdeFunction g;

    private final int stages;
    private final double[] c0, c1, alpha, beta1, beta2;
    private final double[][] a0, b0;
    private final double[] alphaMinusEuler;

    private final double[] fs;
    private final double[] gs;
    private final double[] arg = new double[1];
    private final double[] out = new double[1];

    public SraVectorizedKernel(SdeFunction f, SdeFunction g, int dimension, SraTableau tableau) {
        super("SRAVectorized(" + tableau.name() + ")", tableau.order(), dimension);
        if (dimension != 1)
            throw new UnimplementedSchemeException(
                    "Vectorized SRA requires a one-dimensional state, got dimension " + dimension);
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
        this.alphaMinusEuler = tableau.alpha();
        this.alphaMinusEuler[0] -= 1.0;
        this.fs = new double[stages];
        this.gs = new double[stages];
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
        double u = uPrev[0];
        double w = noise.dW()[0];
        double chi2 = IteratedIntegrals.chi2(w, noise.dZ()[0]);

        for (int i = 0; i < stages; i++) {
            g.evaluate(t + c1[i] * dt, uPrev, out);
            gs[i] = out[0];
        }
        for (int i = 0; i < stages; i++) {
            arg[0] = u + dt * dot(a0[i], fs, i) + chi2 * dot(b0[i], gs, i);
            f.evaluate(t + c0[i] * dt, arg, out);
            fs[i] = out[0];
        }

        double errorNoise = chi2 * dot(beta2, gs);
        ws.uNext()[0] = u + dt * dot(alpha, fs) + w * dot(beta1, gs) + errorNoise;
        ws.deterministicError()[0] = dt * dot(alphaMinusEuler, fs);
        ws.noiseError()[0] = errorNoise;
        ws.markErrorTermsValid();
    }
}
