package com.stochastic.sde.api;

/**
 * A step produced a NaN or infinite component.
 *
 * <p>
 * The integrator recovers from this locally by rejecting the step and shrinking
 * dt. It only escapes the run as the cause of a {@link StepSizeCollapseException}.
 */
public class NonFiniteStateException extends SolverException {
    private final double time;
    private final double dt;
    private final int component;

    public NonFiniteStateException(String kernel, double time, double dt, int component, double value) {
        super(String.format("%s produced non-finite value %s in component %d at t=%g (dt=%g)",
                kernel, value, component, time, dt));
        this.time = time;
        this.dt = dt;
        this.component = component;
    }

    public double time() {
        return time;
    }

    public double dt() {
        return dt;
    }

    public int component() {
        return component;
    }
}
