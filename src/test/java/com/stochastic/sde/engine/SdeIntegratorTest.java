package com.stochastic.sde.engine;

import com.stochastic.sde.api.*;
import com.stochastic.sde.config.NoiseRefinement;
import com.stochastic.sde.config.SolverOptions;
import com.stochastic.sde.control.EmbeddedErrorEstimator;
import com.stochastic.sde.control.ErrorNorm;
import com.stochastic.sde.control.RSwM3Controller;
import com.stochastic.sde.kernel.EulerMaruyamaKernel;
import com.stochastic.sde.kernel.Sriw1OptimizedKernel;
import com.stochastic.sde.noise.NoiseShape;
import com.stochastic.sde.noise.RandomProviders;
import com.stochastic.sde.noise.WienerProcess;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.Assert.*;

public class SdeIntegratorTest {
    private static final double DT = 1.0 / 64;

    private static final SdeProblem GBM = SdeProblem.builder()
            .drift(SdeFunction.scalar((t, u) -> 1.01 * u))
            .diffusion(SdeFunction.scalar((t, u) -> 0.87 * u))
            .initialState(0.5)
            .analytic((t, u0, w, out) -> out[0] = u0[0] * Math.exp((1.01 - 0.87 * 0.87 / 2) * t + 0.87 * w[0]))
            .build();

    private static WienerProcess wiener(SdeProblem problem, long seed, boolean auxiliary, NoiseRefinement refinement,
            boolean history) {
        return new WienerProcess(NoiseShape.of(problem.noiseType(), problem.dimension()), RandomProviders.create(seed),
                auxiliary, refinement, 1e-15, history);
    }

    private static SdeIntegrator fixedStep(SdeProblem problem, SolverOptions options) {
        return new SdeIntegrator(problem, new EulerMaruyamaKernel(problem.drift(), problem.diffusion(), 1),
                wiener(problem, 7, false, NoiseRefinement.DISCARD, true), null, null, options);
    }

    @Test
    public void testFixedStepLandsOnFinalTime() {
        Solution sol = fixedStep(GBM, SolverOptions.builder().dt(DT).build()).run(0, 1, DT);

        assertTrue(sol.isSuccess());
        assertEquals(1.0, sol.t(), 0.0);
        assertEquals(64, sol.acceptedSteps());
        assertEquals(0, sol.rejectedSteps());
        assertEquals(65, sol.timeseries().size());
        assertEquals(1.0, sol.timeseries().lastTime(), 0.0);
    }

    @Test
    public void testTimeseriesCadence() {
        Solution every4 = fixedStep(GBM, SolverOptions.builder().dt(DT).timeseriesSteps(4).build()).run(0, 1, DT);
        assertEquals(17, every4.timeseries().size());

        Solution every5 = fixedStep(GBM, SolverOptions.builder().dt(DT).timeseriesSteps(5).build()).run(0, 1, DT);
        // t0, twelve multiples of 5, and the final step
        assertEquals(14, every5.timeseries().size());
        assertEquals(1.0, every5.timeseries().lastTime(), 0.0);
    }

    @Test
    public void testNonDyadicStepStillEndsExactly() {
        Solution sol = fixedStep(GBM, SolverOptions.builder().dt(0.1).build()).run(0, 1, 0.1);
        assertEquals(1.0, sol.t(), 0.0);
        assertEquals(10, sol.acceptedSteps());
    }

    @Test
    public void testLastStepIsShortened() {
        Solution sol = fixedStep(GBM, SolverOptions.builder().dt(0.3).build()).run(0, 1, 0.3);
        assertEquals(4, sol.acceptedSteps());
        assertEquals(1.0, sol.t(), 0.0);
        double[] times = sol.timeseries().times();
        assertEquals(0.9, times[3], 1e-15);
    }

    @Test
    public void testAnalyticSeriesFollowsTimeseries() {
        Solution sol = fixedStep(GBM, SolverOptions.builder().dt(DT).timeseriesSteps(8).build()).run(0, 1, DT);

        assertTrue(sol.hasAnalytic());
        double[][] analytic = sol.timeseriesAnalytic();
        assertEquals(sol.timeseries().size(), analytic.length);
        assertEquals(0.5, analytic[0][0], 1e-15);
        double expected = 0.5 * Math.exp((1.01 - 0.87 * 0.87 / 2) + 0.87 * sol.w()[0]);
        assertEquals(expected, sol.uAnalytic()[0], 1e-12);
    }

    @Test
    public void testIterationBudgetCarriesPartialSolution() {
        var integrator = fixedStep(GBM, SolverOptions.builder().dt(DT).maxiters(10).build());
        try {
            integrator.run(0, 1, DT);
            fail("maxiters should have been exceeded");
        } catch (IterationBudgetExceededException e) {
            Solution partial = e.partialSolution();
            assertEquals(ReturnCode.MAX_ITERS, partial.retcode());
            assertEquals(10, partial.acceptedSteps());
            assertEquals(10 * DT, partial.t(), 0.0);
            assertEquals(11, partial.timeseries().size());
        }
    }

    @Test
    public void testNonFiniteDriftCollapsesStepSize() {
        SdeProblem broken = SdeProblem.builder()
                .drift((t, u, du) -> du[0] = Double.NaN)
                .diffusion(SdeFunction.zero())
                .initialState(1.0)
                .build();
        var integrator = fixedStep(broken, SolverOptions.builder().dt(0.1).build());
        try {
            integrator.run(0, 1, 0.1);
            fail("A NaN drift should collapse the step size");
        } catch (StepSizeCollapseException e) {
            assertEquals(ReturnCode.DT_LESS_THAN_MIN, e.partialSolution().retcode());
            assertEquals(0.0, e.partialSolution().t(), 0.0);
            assertTrue(e.getCause() instanceof NonFiniteStateException);
            assertTrue(integrator.rejectedSteps() > 10);
        }
    }

    @Test
    public void testFixedStepReturnsToConfiguredStepAfterNonFiniteAttempt() {
        AtomicBoolean first = new AtomicBoolean(true);
        SdeProblem glitch = SdeProblem.builder()
                .drift((t, u, du) -> du[0] = first.getAndSet(false) ? Double.NaN : -u[0])
                .diffusion(SdeFunction.zero())
                .initialState(1.0)
                .build();
        Solution sol = fixedStep(glitch, SolverOptions.builder().dt(0.1).build()).run(0, 1, 0.1);

        assertTrue(sol.isSuccess());
        assertEquals(1, sol.rejectedSteps());
        // 0.05 retry, nine steps of 0.1, then the clamped 0.05
        assertEquals(11, sol.acceptedSteps());
        assertEquals(12, sol.timeseries().size());
        double[] times = sol.timeseries().times();
        assertEquals(0.05, times[1], 0.0);
        assertEquals(0.15, times[2], 1e-15);
        assertEquals(0.95, times[10], 1e-14);
        assertEquals(1.0, sol.t(), 0.0);
    }

    @Test
    public void testListenerCadence() {
        List<String> events = new ArrayList<>();
        var integrator = fixedStep(GBM, SolverOptions.builder().dt(DT).progressSteps(16).build());
        integrator.setListener(new ProgressListener() {
            @Override
            public void onIntegrationStart(double t0, double tEnd, double dt) {
                events.add("start");
            }

            @Override
            public void onProgress(long acceptedSteps, double t, double dt, double[] u) {
                events.add("progress:" + acceptedSteps);
            }

            @Override
            public void onStepRejected(long acceptedSteps, double t, double dtRejected, double dtNext, double error) {
                events.add("rejected");
            }

            @Override
            public void onIntegrationEnd(long acceptedSteps, long rejectedSteps, double t, ReturnCode retcode) {
                events.add("end:" + retcode);
            }
        });

        integrator.run(0, 1, DT);

        assertEquals(List.of("start", "progress:16", "progress:32", "progress:48", "progress:64", "end:SUCCESS"),
                events);
    }

    @Test
    public void testAdaptiveRunWithBridgeRefinement() {
        var options = SolverOptions.builder().adaptive(true).noiseRefinement(NoiseRefinement.BROWNIAN_BRIDGE)
                .abstol(1e-3).reltol(1e-3).build();
        var noise = wiener(GBM, 11, true, NoiseRefinement.BROWNIAN_BRIDGE, true);
        var integrator = new SdeIntegrator(GBM, new Sriw1OptimizedKernel(GBM.drift(), GBM.diffusion(), 1), noise,
                new EmbeddedErrorEstimator(new ErrorNorm(2, 1e-3, 1e-3), 1.0 / 6, 1),
                new RSwM3Controller(2.0, 0.2, 1.125, 1e-15), options);

        Solution sol = integrator.run(0, 1, 1e-3);

        assertTrue(sol.isSuccess());
        assertEquals(1.0, sol.t(), 0.0);
        assertTrue(sol.rejectedSteps() == 0 || sol.maxStackSize() >= 1);
        assertEquals(sol.acceptedSteps() + 1, sol.timeseries().size());
        double[] times = sol.timeseries().times();
        for (int i = 1; i < times.length; i++)
            assertTrue(times[i] > times[i - 1]);
    }

    @Test
    public void testSingleUse() {
        var integrator = fixedStep(GBM, SolverOptions.builder().dt(DT).build());
        integrator.run(0, 1, DT);
        try {
            integrator.run(0, 1, DT);
            fail("Second run should be refused");
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage().contains("single run"));
        }
    }

    @Test(expected = InputException.class)
    public void testNonPositiveInitialStep() {
        fixedStep(GBM, SolverOptions.defaults()).run(0, 1, 0);
    }
}
