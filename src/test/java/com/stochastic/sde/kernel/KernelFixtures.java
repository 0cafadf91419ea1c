package com.stochastic.sde.kernel;

import com.stochastic.sde.api.NoiseIncrement;
import com.stochastic.sde.api.SdeFunction;

/**
 * Shared problems and hand-filled noise for kernel tests.
 */
final class KernelFixtures {
    private KernelFixtures() {
    }

    static NoiseIncrement increment(double dt, double[] dW, double[] dZ) {
        NoiseIncrement inc = new NoiseIncrement(dW.length, dZ != null, 0);
        inc.reset(dt);
        System.arraycopy(dW, 0, inc.dW(), 0, dW.length);
        if (dZ != null)
            System.arraycopy(dZ, 0, inc.dZ(), 0, dZ.length);
        return inc;
    }

    /** Time-dependent, nonlinear drift for diagonal-noise comparisons. */
    static final SdeFunction DRIFT = (t, u, du) -> {
        for (int i = 0; i < u.length; i++)
            du[i] = (1.01 - 0.2 * i) * u[i] + Math.sin(t) - 0.1 * u[i] * u[i];
    };

    /** Multiplicative diffusion for diagonal-noise comparisons. */
    static final SdeFunction DIFFUSION = (t, u, du) -> {
        for (int i = 0; i < u.length; i++)
            du[i] = (0.87 - 0.3 * i) * u[i] + 0.1 * t;
    };

    /** State-independent diffusion for additive-noise comparisons. */
    static final SdeFunction ADDITIVE = (t, u, du) -> {
        for (int i = 0; i < u.length; i++)
            du[i] = 0.5 * (1 + t) + 0.2 * i;
    };
}
