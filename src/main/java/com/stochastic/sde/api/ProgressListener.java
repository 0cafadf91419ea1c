package com.stochastic.sde.api;

/**
 * Observability hook for an integration run.
 *
 * Callbacks are executed on the integrator thread inside the stepping loop and
 * their return values are never consumed. Implementations must be lightweight;
 * anything slow belongs behind an asynchronous relay such as
 * {@code com.stochastic.sde.wiring.DisruptorProgressPublisher}.
 *
 * The state array passed to {@link #onProgress} is the integrator's live state;
 * implementations must copy it if they need it after returning.
 */
public interface ProgressListener {

    /** Called once before the first step. */
    void onIntegrationStart(double t0, double tEnd, double dt);

    /** Called every {@code progressSteps} accepted steps. */
    void onProgress(long acceptedSteps, double t, double dt, double[] u);

    /**
     * Called when an attempt is rejected.
     *
     * @param error Normalized error of the attempt, or NaN if the step was
     *              rejected for producing a non-finite state.
     */
    void onStepRejected(long acceptedSteps, double t, double dtRejected, double dtNext, double error);

    /** Called once when the run terminates, successfully or not. */
    void onIntegrationEnd(long acceptedSteps, long rejectedSteps, double t, ReturnCode retcode);
}
