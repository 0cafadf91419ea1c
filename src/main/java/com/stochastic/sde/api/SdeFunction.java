package com.stochastic.sde.api;

/**
 * Functional interface for the drift {@code f(t,u)} or diffusion
 * {@code g(t,u)} of an SDE.
 *
 * <p>
 * The output array is pre-allocated by the integrator and passed in, allowing
 * for zero-allocation evaluation on the stepping hot path. Implementations must
 * not retain references to either array beyond the call.
 *
 * <p>
 * Examples:
 * <ul>
 * <li>Geometric Brownian motion drift: {@code (t, u, du) -> du[0] = mu * u[0]}</li>
 * <li>Value-returning scalar form: {@code SdeFunction.scalar((t, u) -> mu * u)}</li>
 * </ul>
 */
@FunctionalInterface
public interface SdeFunction {

    /**
     * Evaluates the function in place.
     *
     * @param t  Current time.
     * @param u  Current state (read-only).
     * @param du Output buffer, same length as {@code u}.
     */
    void evaluate(double t, double[] u, double[] du);

    /**
     * Adapts a value-returning scalar function to the in-place array contract.
     * Every component of the state is mapped independently.
     */
    static SdeFunction scalar(ScalarFn fn) {
        return (t, u, du) -> {
            for (int i = 0; i < u.length; i++)
                du[i] = fn.apply(t, u[i]);
        };
    }

    /** Function that is identically zero. */
    static SdeFunction zero() {
        return (t, u, du) -> java.util.Arrays.fill(du, 0.0);
    }

    /**
     * Scalar drift or diffusion {@code (t, u) -> du}.
     */
    @FunctionalInterface
    interface ScalarFn {
        double apply(double t, double u);
    }
}
