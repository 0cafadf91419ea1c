package com.stochastic.sde.api;

/**
 * Adaptive step-size policy. Stateful: keeps the short error history needed for
 * its decisions, so an instance belongs to exactly one run.
 */
public interface StepSizeController {

    /**
     * Decides whether the attempted step is accepted and proposes the next dt.
     *
     * @param error Normalized error of the attempt.
     * @param dt    Attempted step size.
     * @param order Strong order of the scheme in use.
     */
    StepDecision decide(double error, double dt, double order);

    /**
     * Forces a rejection without an error estimate (e.g. after a non-finite
     * step) and returns the reduced step size to retry with.
     */
    double forceReject(double dt);

    /** Clears the error history. */
    void reset();
}
