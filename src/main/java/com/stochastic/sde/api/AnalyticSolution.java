package com.stochastic.sde.api;

/**
 * Closed-form solution {@code u(t) = analytic(t, u0, W(t))} used to validate an
 * integration against the exact path driven by the same Wiener process.
 */
@FunctionalInterface
public interface AnalyticSolution {

    /**
     * @param t   Time at which to evaluate.
     * @param u0  Initial condition of the problem.
     * @param w   Value of the Wiener process at {@code t}.
     * @param out Output buffer, same length as {@code u0}.
     */
    void evaluate(double t, double[] u0, double[] w, double[] out);
}
