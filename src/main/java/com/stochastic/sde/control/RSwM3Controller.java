package com.stochastic.sde.control;

import com.stochastic.sde.api.StepDecision;
import com.stochastic.sde.api.StepSizeController;

/**
 * Step-size policy used with Rejection Sampling with Memory.
 * <p>
 * Formula: {@code q = (1 / (gamma * e))^(1 / (order + 1/2))},
 * {@code dt' = dt * min(qmax, max(qmin, q))}
 * <p>
 * Rules:
 * <ul>
 * <li>The step is accepted iff {@code e <= 1}.</li>
 * <li>The first accept after a rejection does not grow dt.</li>
 * <li>A rejection never retries with a dt at least as large as the rejected one.</li>
 * <li>Accepted changes smaller than {@code discardLength} keep dt unchanged.</li>
 * <li>{@code e = 0} grows dt by {@code qmax}; a non-finite {@code e} is rejected
 * with {@code qmin}.</li>
 * </ul>
 */
public final class RSwM3Controller implements StepSizeController {
    private static final double FORCED_REJECT_FACTOR = 0.5;

    private final double gamma;
    private final double qmin;
    private final double qmax;
    private final double discardLength;
    private final ControllerState state = new ControllerState();

    public RSwM3Controller(double gamma, double qmin, double qmax, double discardLength) {
        if (!(gamma > 0))
            throw new IllegalArgumentException("gamma must be positive: " + gamma);
        if (!(qmin > 0) || !(qmin < 1))
            throw new IllegalArgumentException("qmin must lie in (0, 1): " + qmin);
        if (!(qmax >= 1))
            throw new IllegalArgumentException("qmax must be >= 1: " + qmax);
        this.gamma = gamma;
        this.qmin = qmin;
        this.qmax = qmax;
        this.discardLength = discardLength;
    }

    @Override
    public StepDecision decide(double error, double dt, double order) {
        if (!Double.isFinite(error) || error < 0) {
            state.onReject();
            return new StepDecision(false, dt * qmin, qmin);
        }

        double q = error == 0.0 ? qmax : Math.pow(1.0 / (gamma * error), 1.0 / (order + 0.5));
        double factor = Math.min(qmax, Math.max(qmin, q));

        if (error <= 1.0) {
            if (state.consecutiveRejections() > 0)
                factor = Math.min(factor, 1.0);
            double dtNext = dt * factor;
            if (Math.abs(dtNext - dt) < discardLength)
                dtNext = dt;
            state.onAccept(error, dt);
            return new StepDecision(true, dtNext, q);
        }

        if (factor >= 1.0)
            factor = qmin;
        state.onReject();
        return new StepDecision(false, dt * factor, q);
    }

    @Override
    public double forceReject(double dt) {
        state.onReject();
        return dt * FORCED_REJECT_FACTOR;
    }

    @Override
    public void reset() {
        state.reset();
    }

    public ControllerState state() {
        return state;
    }
}
