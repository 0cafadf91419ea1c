package com.stochastic.sde.api;

/**
 * A jump channel reported a negative, NaN or infinite rate, typically after a
 * leap drove a population below zero.
 *
 * <p>
 * Raised by the jump process while drawing counts. The integrator rethrows it
 * with the partial solution attached and {@link ReturnCode#INVALID_JUMP_RATE}.
 */
public class InvalidJumpRateException extends SolverException {
    private final int channel;
    private final double time;
    private final double rate;

    public InvalidJumpRateException(int channel, double time, double rate) {
        super(String.format("Invalid rate %s for channel %d at t=%g", rate, channel, time));
        this.channel = channel;
        this.time = time;
        this.rate = rate;
    }

    /** Copies {@code cause} and attaches the partial solution of the aborted run. */
    public InvalidJumpRateException(InvalidJumpRateException cause, Solution partialSolution) {
        super(cause.getMessage(), partialSolution, cause);
        this.channel = cause.channel;
        this.time = cause.time;
        this.rate = cause.rate;
    }

    public int channel() {
        return channel;
    }

    public double time() {
        return time;
    }

    public double rate() {
        return rate;
    }
}
