package com.stochastic.sde.api;

/**
 * The number of accepted steps exceeded {@code maxiters}. The partial solution
 * holds the time series accumulated up to that point.
 */
public class IterationBudgetExceededException extends SolverException {
    public IterationBudgetExceededException(String message, Solution partialSolution) {
        super(message, partialSolution, null);
    }
}
