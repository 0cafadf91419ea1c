package com.stochastic.sde.api;

/**
 * A stepping scheme: advances the state by one step given the noise consumed
 * over that step.
 *
 * One implementation exists per algorithm family. The kernel is selected once
 * when a run is configured and held as a fixed strategy for the whole run; the
 * stepping loop never branches on the algorithm identity.
 *
 * Implementations own their stage scratch arrays and are therefore bound to a
 * single run. They must not retain {@code uPrev} beyond the call.
 */
public interface StepKernel {

    /** @return Human-readable scheme name, used in logs and error messages. */
    String name();

    /** @return The strong order of the scheme, fed to the step-size controller. */
    double order();

    /**
     * Computes the candidate next state into {@code workspace.uNext()}.
     *
     * @param t         Time at the start of the step.
     * @param dt        Step size.
     * @param uPrev     State at the start of the step (read-only).
     * @param noise     Noise drawn for this step.
     * @param workspace Output and scratch space.
     * @throws NonFiniteStateException if the candidate state contains NaN or
     *                                 infinite values.
     */
    void perform(double t, double dt, double[] uPrev, NoiseIncrement noise, StepWorkspace workspace);

    /**
     * @return true if the kernel fills embedded error terms, making it usable
     *         with the embedded error estimator.
     */
    default boolean providesErrorTerms() {
        return false;
    }

    /** @return true if the scheme needs the auxiliary dZ increments. */
    default boolean needsAuxiliaryNoise() {
        return false;
    }
}
