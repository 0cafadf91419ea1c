package com.stochastic.sde.api;

/**
 * Rejections drove dt below dtmin. The run is aborted and the last valid state is
 * reported through the partial solution.
 */
public class StepSizeCollapseException extends SolverException {
    public StepSizeCollapseException(String message, Solution partialSolution, Throwable cause) {
        super(message, partialSolution, cause);
    }
}
