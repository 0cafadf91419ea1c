package com.stochastic.sde.api;

/**
 * Base class of every failure raised by the integrator.
 *
 * <p>
 * Fatal conditions that occur after stepping has begun attach the partial
 * {@link Solution} accumulated so far, so callers never receive silently
 * truncated data.
 */
public class SolverException extends RuntimeException {
    private final transient Solution partialSolution;

    public SolverException(String message) {
        this(message, null, null);
    }

    public SolverException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public SolverException(String message, Solution partialSolution, Throwable cause) {
        super(message, cause);
        this.partialSolution = partialSolution;
    }

    /** @return The partial solution at the point of failure, or null if none was produced. */
    public Solution partialSolution() {
        return partialSolution;
    }
}
