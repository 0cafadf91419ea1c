package com.stochastic.sde.api;

/**
 * Result of one step-size controller call.
 *
 * @param accepted true if the attempted step is within tolerance.
 * @param dtNext   Proposed size of the next attempt (the retry when rejected).
 * @param q        The raw scaling factor that produced {@code dtNext}.
 */
public record StepDecision(boolean accepted, double dtNext, double q) {
}
