package com.stochastic.sde.engine;

import com.stochastic.sde.api.*;
import com.stochastic.sde.config.SolverOptions;
import com.stochastic.sde.noise.NoiseSource;
import com.stochastic.sde.util.WarningRateLimiter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The stepping loop that advances one trajectory from {@code t0} to {@code T}.
 *
 * Per attempt:
 * 1. Clamp: if the step would overshoot {@code T} (within a time epsilon of
 * {@code 100 * ulp(max(|t0|, |T|))}) it is shortened to land on {@code T}
 * exactly and marked final.
 * 2. Draw: the noise source produces the increment for {@code [t, t + dt]}.
 * 3. Step: the kernel computes the candidate state.
 * 4. Decide: in adaptive mode the error estimator and the step-size controller
 * accept or reject the candidate; in fixed-step mode every finite candidate is
 * accepted.
 * 5. Commit or retry: an accepted step commits state, time and noise and is
 * recorded in the time series every {@code timeseriesSteps} steps; a rejected
 * step discards the candidate and its noise and retries from the same
 * {@code t} with the reduced dt.
 *
 * A candidate with NaN or infinite components is rejected and retried with
 * half the step size; a fixed-step run goes back to its configured dt after
 * the retry is accepted. Once a retry would have to go below {@code dtmin} the run
 * fails with {@link StepSizeCollapseException}. Exceeding {@code maxiters}
 * accepted steps fails with {@link IterationBudgetExceededException}. An
 * invalid jump rate fails with {@link InvalidJumpRateException}. All three
 * carry the partial solution.
 *
 * An instance performs a single run and is not thread-safe.
 */
public final class SdeIntegrator {
    private static final Logger log = LogManager.getLogger(SdeIntegrator.class);

    private static final double TIME_EPSILON_ULPS = 100.0;
    private static final double NON_FINITE_SHRINK = 0.5;

    private final WarningRateLimiter warnLimiter = new WarningRateLimiter(log, 1000);

    private final SdeProblem problem;
    private final StepKernel kernel;
    private final NoiseSource noise;
    private final ErrorEstimator estimator;
    private final StepSizeController controller;
    private final SolverOptions options;
    private final boolean adaptive;

    private ProgressListener listener;

    // Run state, exposed through the partial solution on failure.
    private double[] u;
    private double t;
    private long accepted;
    private long rejected;
    private TimeSeries timeseries;
    private boolean used;

    /**
     * @param estimator  Error estimator, or null for a fixed-step run.
     * @param controller Step-size controller, or null for a fixed-step run.
     */
    public SdeIntegrator(SdeProblem problem, StepKernel kernel, NoiseSource noise, ErrorEstimator estimator,
            StepSizeController controller, SolverOptions options) {
        if ((estimator == null) != (controller == null))
            throw new IllegalArgumentException("Estimator and controller must be supplied together");
        this.problem = problem;
        this.kernel = kernel;
        this.noise = noise;
        this.estimator = estimator;
        this.controller = controller;
        this.options = options;
        this.adaptive = controller != null;
    }

    public void setListener(ProgressListener listener) {
        this.listener = listener;
    }

    /**
     * Integrates from {@code t0} to {@code tEnd}.
     *
     * @param dt0 Initial step size, must be positive.
     * @throws StepSizeCollapseException        if the step size collapses below dtmin.
     * @throws IterationBudgetExceededException if more than maxiters steps are needed.
     */
    public Solution run(double t0, double tEnd, double dt0) {
        if (used)
            throw new IllegalStateException("SdeIntegrator instances perform a single run");
        used = true;
        if (!(tEnd > t0))
            throw new InputException("Final time must be greater than the start time: [" + t0 + ", " + tEnd + "]");
        if (!(dt0 > 0) || !Double.isFinite(dt0))
            throw new InputException("Initial step size must be positive and finite, got " + dt0);

        final ProgressListener l = this.listener;
        final boolean hasListener = l != null;
        final int dim = problem.dimension();
        final double dtmin = options.dtmin();
        final double dtmax = Double.isNaN(options.dtmax()) ? (tEnd - t0) / 2 : options.dtmax();
        final double timeEps = TIME_EPSILON_ULPS * Math.ulp(Math.max(Math.abs(t0), Math.abs(tEnd)));
        final int saveEvery = options.timeseriesSteps();
        final long progressEvery = options.progressSteps();
        final long maxiters = options.maxiters();
        final double order = kernel.order();

        u = problem.initialState();
        t = t0;
        accepted = 0;
        rejected = 0;
        timeseries = options.saveTimeseries() ? new TimeSeries() : null;
        if (timeseries != null)
            timeseries.append(t, u, noise.w());

        double dt = adaptive ? clamp(dt0, dtmin, dtmax) : dt0;
        double tCompensation = 0.0;
        StepWorkspace ws = new StepWorkspace(dim);

        if (log.isDebugEnabled())
            log.debug("Run {} over [{}, {}] dt={} adaptive={}", kernel.name(), t0, tEnd, dt, adaptive);
        if (hasListener)
            l.onIntegrationStart(t0, tEnd, dt);

        while (tEnd - t > timeEps) {
            if (accepted >= maxiters)
                throw fail(ReturnCode.MAX_ITERS, String.format(
                        "Exceeded maxiters=%d at t=%g before reaching %g", maxiters, t, tEnd), null);

            boolean last = false;
            double h = dt;
            if (t + h >= tEnd - timeEps) {
                h = tEnd - t;
                last = true;
            } else if (t + h == t) {
                throw fail(ReturnCode.DT_LESS_THAN_MIN, String.format(
                        "Step size %g no longer advances time at t=%g", h, t), null);
            }

            NoiseIncrement inc;
            try {
                inc = noise.draw(t, h, u);
            } catch (InvalidJumpRateException e) {
                throw fail(ReturnCode.INVALID_JUMP_RATE, e.getMessage(), e);
            }
            ws.clear();
            try {
                kernel.perform(t, h, u, inc, ws);
            } catch (NonFiniteStateException e) {
                double next = adaptive ? controller.forceReject(h) : h * NON_FINITE_SHRINK;
                noise.reject(next);
                rejected++;
                if (h <= dtmin)
                    throw fail(ReturnCode.DT_LESS_THAN_MIN, String.format(
                            "Non-finite state at t=%g with dt=%g already at dtmin=%g", t, h, dtmin), e);
                next = Math.max(next, dtmin);
                warnLimiter.warn(String.format("%s; retrying with dt=%g", e.getMessage(), next), null);
                if (hasListener)
                    l.onStepRejected(accepted, t, h, next, Double.NaN);
                dt = next;
                continue;
            }

            // Fixed-step runs return to dt0 after a shortened retry.
            double dtNext = adaptive ? dt : dt0;
            if (adaptive) {
                double error = estimator.estimate(t, h, u, inc, ws);
                StepDecision decision = controller.decide(error, h, order);
                if (!decision.accepted()) {
                    double next = decision.dtNext();
                    noise.reject(next);
                    rejected++;
                    if (next < dtmin) {
                        if (h <= dtmin)
                            throw fail(ReturnCode.DT_LESS_THAN_MIN, String.format(
                                    "Step size fell below dtmin=%g at t=%g (error=%g)", dtmin, t, error), null);
                        next = dtmin;
                    }
                    if (hasListener)
                        l.onStepRejected(accepted, t, h, next, error);
                    dt = next;
                    continue;
                }
                dtNext = clamp(decision.dtNext(), dtmin, dtmax);
            }

            System.arraycopy(ws.uNext(), 0, u, 0, dim);
            if (last) {
                t = tEnd;
            } else {
                // Compensated summation keeps t within a few ulps of t0 + sum(h).
                double y = h - tCompensation;
                double sum = t + y;
                tCompensation = (sum - t) - y;
                t = sum;
            }
            noise.accept();
            accepted++;
            if (timeseries != null && (last || accepted % saveEvery == 0))
                timeseries.append(t, u, noise.w());
            if (hasListener && accepted % progressEvery == 0)
                l.onProgress(accepted, t, h, u);
            dt = dtNext;
        }

        Solution solution = buildSolution(ReturnCode.SUCCESS);
        if (hasListener)
            l.onIntegrationEnd(accepted, rejected, t, ReturnCode.SUCCESS);
        return solution;
    }

    private static double clamp(double dt, double dtmin, double dtmax) {
        return Math.max(dtmin, Math.min(dtmax, dt));
    }

    /** Attaches the partial solution to a fatal error and notifies the listener. */
    private SolverException fail(ReturnCode retcode, String message, Throwable cause) {
        Solution partial = buildSolution(retcode);
        log.error("{} failed: {}", kernel.name(), message);
        if (listener != null)
            listener.onIntegrationEnd(accepted, rejected, t, retcode);
        if (retcode == ReturnCode.MAX_ITERS)
            return new IterationBudgetExceededException(message, partial);
        if (cause instanceof InvalidJumpRateException rate)
            return new InvalidJumpRateException(rate, partial);
        return new StepSizeCollapseException(message, partial, cause);
    }

    private Solution buildSolution(ReturnCode retcode) {
        double[] w = noise.w().clone();
        double[] uAnalytic = null;
        double[][] seriesAnalytic = null;
        if (problem.hasAnalytic()) {
            AnalyticSolution analytic = problem.analytic();
            double[] u0 = problem.initialState();
            uAnalytic = new double[u.length];
            analytic.evaluate(t, u0, w, uAnalytic);
            if (timeseries != null) {
                seriesAnalytic = new double[timeseries.size()][];
                for (int i = 0; i < timeseries.size(); i++) {
                    seriesAnalytic[i] = new double[u.length];
                    analytic.evaluate(timeseries.t(i), u0, timeseries.w(i), seriesAnalytic[i]);
                }
            }
        }
        return new Solution(t, u, w, timeseries, uAnalytic, seriesAnalytic, noise.maxStackSize(), accepted,
                rejected, retcode);
    }

    public long acceptedSteps() {
        return accepted;
    }

    public long rejectedSteps() {
        return rejected;
    }
}
