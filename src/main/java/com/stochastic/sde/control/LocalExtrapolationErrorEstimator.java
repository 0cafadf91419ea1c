package com.stochastic.sde.control;

import com.stochastic.sde.api.ErrorEstimator;
import com.stochastic.sde.api.NoiseIncrement;
import com.stochastic.sde.api.SdeFunction;
import com.stochastic.sde.api.StepWorkspace;

/**
 * Heuristic estimate for schemes without an embedded pair (EM, RKMil): compares
 * drift and diffusion at both ends of the step.
 * <p>
 * Formula:
 * {@code d_i = max(|delta dt df_i + dg_i dW_i|, |delta dt df_i - dg_i dW_i|)},
 * {@code e = || d / scale ||_p}
 */
public final class LocalExtrapolationErrorEstimator implements ErrorEstimator {
    private final SdeFunction f;
    private final SdeFunction g;
    private final ErrorNorm norm;
    private final double delta;
    private final double[] fStart, gStart, fEnd, gEnd, scratch;

    public LocalExtrapolationErrorEstimator(SdeFunction f, SdeFunction g, ErrorNorm norm, double delta,
            int dimension) {
        this.f = f;
        this.g = g;
        this.norm = norm;
        this.delta = delta;
        this.fStart = new double[dimension];
        this.gStart = new double[dimension];
        this.fEnd = new double[dimension];
        this.gEnd = new double[dimension];
        this.scratch = new double[dimension];
    }

    @Override
    public double estimate(double t, double dt, double[] uPrev, NoiseIncrement noise, StepWorkspace ws) {
        double[] f0, g0;
        if (ws.startValuesValid()) {
            f0 = ws.fStart();
            g0 = ws.gStart();
        } else {
            f.evaluate(t, uPrev, fStart);
            g.evaluate(t, uPrev, gStart);
            f0 = fStart;
            g0 = gStart;
        }
        double[] uNext = ws.uNext();
        f.evaluate(t + dt, uNext, fEnd);
        g.evaluate(t + dt, uNext, gEnd);

        double[] dW = noise.dW();
        for (int i = 0; i < scratch.length; i++) {
            double drift = delta * dt * (fEnd[i] - f0[i]);
            double diffusion = (gEnd[i] - g0[i]) * dW[i];
            scratch[i] = Math.max(Math.abs(drift + diffusion), Math.abs(drift - diffusion));
        }
        norm.scale(scratch, uPrev, uNext);
        return norm.norm(scratch);
    }
}
