package com.stochastic.sde.control;

import com.stochastic.sde.api.ErrorEstimator;
import com.stochastic.sde.api.NoiseIncrement;
import com.stochastic.sde.api.StepWorkspace;

/**
 * Error estimate from the embedded terms written by SRI/SRA kernels.
 * <p>
 * Formula: {@code e = || (delta |E_D| + |E_N|) / scale ||_p}
 */
public final class EmbeddedErrorEstimator implements ErrorEstimator {
    private final ErrorNorm norm;
    private final double delta;
    private final double[] scratch;

    public EmbeddedErrorEstimator(ErrorNorm norm, double delta, int dimension) {
        this.norm = norm;
        this.delta = delta;
        this.scratch = new double[dimension];
    }

    @Override
    public double estimate(double t, double dt, double[] uPrev, NoiseIncrement noise, StepWorkspace ws) {
        if (!ws.errorTermsValid())
            throw new IllegalStateException("Kernel did not provide embedded error terms for this attempt");
        double[] errD = ws.deterministicError();
        double[] errN = ws.noiseError();
        for (int i = 0; i < scratch.length; i++)
            scratch[i] = delta * Math.abs(errD[i]) + Math.abs(errN[i]);
        norm.scale(scratch, uPrev, ws.uNext());
        return norm.norm(scratch);
    }
}
