package com.stochastic.sde;

import com.stochastic.sde.api.*;
import com.stochastic.sde.config.Algorithm;
import com.stochastic.sde.config.SolverOptions;
import com.stochastic.sde.control.EmbeddedErrorEstimator;
import com.stochastic.sde.control.ErrorNorm;
import com.stochastic.sde.control.LocalExtrapolationErrorEstimator;
import com.stochastic.sde.control.RSwM3Controller;
import com.stochastic.sde.engine.InitialStepEstimator;
import com.stochastic.sde.engine.SdeIntegrator;
import com.stochastic.sde.noise.NoiseShape;
import com.stochastic.sde.noise.NoiseSource;
import com.stochastic.sde.noise.PoissonJumpProcess;
import com.stochastic.sde.noise.RandomProviders;
import com.stochastic.sde.noise.WienerProcess;
import com.stochastic.sde.util.CompositeProgressListener;
import com.stochastic.sde.util.LoggingProgressListener;
import com.stochastic.sde.util.StepStatisticsListener;

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Entry point: validates a problem and its options, assembles the run
 * (kernel, noise source, error estimator, step-size controller) and drives the
 * {@link SdeIntegrator}.
 * <p>
 * This class handles:
 * <ul>
 * <li>Time span validation, before any state is touched</li>
 * <li>Scheme selection through {@link Algorithm}, including unsupported
 * combinations</li>
 * <li>Automatic initial step size when {@code dt = 0}</li>
 * <li>Progress listeners, shared by every run of this solver</li>
 * </ul>
 * A solver may be reused for many sequential solves. Concurrent solves need
 * one solver per thread (see {@link EnsembleSolver}).
 */
public class SdeSolver {
    private static final Logger log = LogManager.getLogger(SdeSolver.class);

    private static final double[] DEFAULT_TIME_SPAN = { 0.0, 1.0 };

    private final CompositeProgressListener compositeListener = new CompositeProgressListener();

    /**
     * Registers a progress listener. Adds to the composite listener rather than
     * replacing already registered listeners.
     */
    public void setListener(ProgressListener listener) {
        compositeListener.add(listener);
    }

    /** Enables step statistics. Use the returned listener to dump them. */
    public StepStatisticsListener enableStepStatistics() {
        var statistics = new StepStatisticsListener();
        compositeListener.add(statistics);
        return statistics;
    }

    /** Enables progress logging through Log4j. */
    public SdeSolver enableProgressLogging() {
        compositeListener.add(new LoggingProgressListener());
        return this;
    }

    /** Solves over the default time span {@code [0, 1]}. */
    public Solution solve(SdeProblem problem, SolverOptions options) {
        return solve(problem, DEFAULT_TIME_SPAN, options);
    }

    /**
     * Solves {@code problem} over {@code timeSpan = [t0, T]}.
     *
     * @throws InputException               if the time span or problem is invalid.
     * @throws UnimplementedSchemeException if the options select an unsupported
     *                                      scheme combination.
     * @throws StepSizeCollapseException    if the step size collapses below dtmin.
     * @throws IterationBudgetExceededException if more than maxiters steps are
     *                                          needed.
     */
    public Solution solve(SdeProblem problem, double[] timeSpan, SolverOptions options) {
        validateTimeSpan(timeSpan);
        if (problem == null)
            throw new InputException("Problem must not be null");
        if (options == null)
            options = SolverOptions.defaults();
        double t0 = timeSpan[0];
        double tEnd = timeSpan[1];

        Algorithm algorithm = options.algorithm();
        validateProblem(problem, algorithm, options);

        StepKernel kernel = algorithm.createKernel(problem, options.tableau());
        double dt = options.dt() > 0 ? options.dt() : initialStep(problem, t0, algorithm, options);

        UniformRandomProvider rng = options.hasSeed()
                ? RandomProviders.create(options.seed())
                : RandomProviders.createUnseeded();
        NoiseSource noise = createNoiseSource(problem, algorithm, kernel, rng, options);

        ErrorEstimator estimator = null;
        StepSizeController controller = null;
        if (options.adaptive()) {
            var norm = new ErrorNorm(options.internalNorm(), options.abstol(), options.reltol());
            estimator = kernel.providesErrorTerms()
                    ? new EmbeddedErrorEstimator(norm, options.delta(), problem.dimension())
                    : new LocalExtrapolationErrorEstimator(problem.drift(), problem.diffusion(), norm,
                            options.delta(), problem.dimension());
            controller = createController(options);
        }

        log.debug("Solving {} on [{}, {}] with {} (dt={})", problem, t0, tEnd, options, dt);

        var integrator = new SdeIntegrator(problem, kernel, noise, estimator, controller, options);
        if (compositeListener.size() > 0)
            integrator.setListener(compositeListener);
        return integrator.run(t0, tEnd, dt);
    }

    static void validateTimeSpan(double[] timeSpan) {
        if (timeSpan == null || timeSpan.length != 2)
            throw new InputException("Time span must be two numbers [t0, T], got "
                    + (timeSpan == null ? "null" : timeSpan.length + " entries"));
        if (!Double.isFinite(timeSpan[0]) || !Double.isFinite(timeSpan[1]))
            throw new InputException("Time span must be finite: [" + timeSpan[0] + ", " + timeSpan[1] + "]");
        if (!(timeSpan[1] > timeSpan[0]))
            throw new InputException("Final time must be greater than the start time: ["
                    + timeSpan[0] + ", " + timeSpan[1] + "]");
    }

    private static void validateProblem(SdeProblem problem, Algorithm algorithm, SolverOptions options) {
        if (algorithm.isTauLeaping()) {
            if (!problem.hasJumps())
                throw new InputException("Tau-leaping requires a problem with a jump process");
            if (options.adaptive())
                throw new UnimplementedSchemeException("Adaptive tau-leaping is not implemented");
            if (!(options.dt() > 0))
                throw new InputException("Tau-leaping requires an explicit dt > 0");
            return;
        }
        if (!problem.hasDiffusionTerms())
            throw new InputException(algorithm + " requires drift and diffusion functions");
        if (algorithm.requiresAdditiveNoise() && problem.noiseType() != NoiseType.ADDITIVE)
            log.warn("{} assumes additive noise but the problem declares {} noise; "
                    + "the diffusion is evaluated at the state at the start of each step", algorithm,
                    problem.noiseType());
    }

    private static double initialStep(SdeProblem problem, double t0, Algorithm algorithm, SolverOptions options) {
        double order = switch (algorithm) {
            case EM -> 0.5;
            case RK_MIL -> 1.0;
            default -> 1.5;
        };
        double dt = InitialStepEstimator.estimate(problem.initialState(), t0, options.abstol(), options.reltol(),
                problem.drift(), problem.diffusion(), order);
        if (!(dt > 0) || !Double.isFinite(dt))
            throw new InputException("Could not determine an initial step size (got " + dt
                    + "); the drift or diffusion is not finite at the initial state");
        log.debug("Estimated initial dt={}", dt);
        return dt;
    }

    private static NoiseSource createNoiseSource(SdeProblem problem, Algorithm algorithm, StepKernel kernel,
            UniformRandomProvider rng, SolverOptions options) {
        boolean retainHistory = options.saveTimeseries();
        if (algorithm.isTauLeaping())
            return new PoissonJumpProcess(problem.jumps(), problem.dimension(), rng, retainHistory);
        NoiseShape shape = NoiseShape.of(problem.noiseType(), problem.dimension());
        return new WienerProcess(shape, rng, kernel.needsAuxiliaryNoise(), options.noiseRefinement(),
                options.discardLength(), retainHistory);
    }

    private static StepSizeController createController(SolverOptions options) {
        return switch (options.adaptiveController()) {
            case RSWM3 -> new RSwM3Controller(options.gamma(), options.qmin(), options.qmax(),
                    options.discardLength());
        };
    }
}
