package com.stochastic.sde.api;

/**
 * Reduces the outcome of an attempted step to a scalar, normalized error. A value
 * of at most 1 means the step is within tolerance.
 */
@FunctionalInterface
public interface ErrorEstimator {

    /**
     * @param t         Time at the start of the step.
     * @param dt        Attempted step size.
     * @param uPrev     State at the start of the step.
     * @param noise     Noise consumed by the attempt.
     * @param workspace Kernel output for the attempt.
     * @return Non-negative error norm; never NaN for finite inputs.
     */
    double estimate(double t, double dt, double[] uPrev, NoiseIncrement noise, StepWorkspace workspace);
}
