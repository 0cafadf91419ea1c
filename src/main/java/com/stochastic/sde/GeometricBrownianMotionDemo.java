package com.stochastic.sde;

import com.stochastic.sde.api.SdeFunction;
import com.stochastic.sde.api.SdeProblem;
import com.stochastic.sde.api.Solution;
import com.stochastic.sde.config.SolverOptions;
import com.stochastic.sde.io.OptionsDefinition;
import com.stochastic.sde.io.OptionsLoader;
import com.stochastic.sde.util.LoggingProgressListener;
import com.stochastic.sde.wiring.DisruptorProgressPublisher;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Solves geometric Brownian motion {@code du = mu u dt + sigma u dW} with
 * options read from {@code options/gbm_adaptive.json}, compares against the
 * closed-form path and runs a small ensemble.
 * <p>
 * Progress is relayed to the log through a Disruptor ring buffer so that the
 * stepping loop never waits on logging I/O.
 */
public class GeometricBrownianMotionDemo {
    private static final Logger log = LogManager.getLogger(GeometricBrownianMotionDemo.class);

    private static final double MU = 1.01;
    private static final double SIGMA = 0.87;
    private static final double U0 = 0.5;

    public static void main(String[] args) throws Exception {
        OptionsDefinition definition = OptionsLoader.readResource("options/gbm_adaptive.json");
        SolverOptions options = OptionsLoader.toOptions(definition);
        double[] timeSpan = definition.getTimeSpan() != null ? definition.getTimeSpan() : new double[] { 0, 1 };

        SdeProblem problem = gbm();
        log.info("Solving {} with {}", problem, options);

        SdeSolver solver = new SdeSolver();
        var statistics = solver.enableStepStatistics();
        try (var relay = new DisruptorProgressPublisher(problem.dimension(), new LoggingProgressListener())) {
            solver.setListener(relay);
            Solution solution = solver.solve(problem, timeSpan, options);
            log.info("u(T)={} analytic={} error={}", solution.u(0), solution.uAnalytic()[0], solution.finalError());
        }
        log.info("\n{}", statistics.dump());

        try (var ensemble = new EnsembleSolver(Runtime.getRuntime().availableProcessors())) {
            List<Solution> paths = ensemble.solve(problem, timeSpan,
                    options.toBuilder().saveTimeseries(false).build(), 1000);
            double mean = EnsembleSolver.meanFinalState(paths)[0];
            double expected = U0 * Math.exp(MU * (timeSpan[1] - timeSpan[0]));
            log.info("Ensemble mean u(T)={} expected E[u(T)]={}", mean, expected);
        }
    }

    static SdeProblem gbm() {
        return SdeProblem.builder()
                .drift(SdeFunction.scalar((t, u) -> MU * u))
                .diffusion(SdeFunction.scalar((t, u) -> SIGMA * u))
                .initialState(U0)
                .analytic((t, u0, w, out) -> out[0] = u0[0] * Math.exp((MU - SIGMA * SIGMA / 2) * t + SIGMA * w[0]))
                .build();
    }
}
