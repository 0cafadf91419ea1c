package com.stochastic.sde;

import com.stochastic.sde.api.JumpProblem;
import com.stochastic.sde.api.SdeProblem;
import com.stochastic.sde.api.Solution;
import com.stochastic.sde.config.Algorithm;
import com.stochastic.sde.config.SolverOptions;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Tau-leaping on a birth-death process: births at rate {@code b}, deaths at
 * rate {@code d * u}. The population settles around {@code b / d}.
 */
public class BirthDeathDemo {
    private static final Logger log = LogManager.getLogger(BirthDeathDemo.class);

    public static void main(String[] args) {
        double birth = 10.0;
        double death = 0.1;
        var jumps = new JumpProblem(2, new double[] { birth, death },
                (u, p, t, out) -> {
                    out[0] = p[0];
                    out[1] = p[1] * Math.max(u[0], 0);
                },
                (du, u, p, t, counts, mark) -> du[0] = counts[0] - counts[1]);
        SdeProblem problem = SdeProblem.builder().initialState(0.0).jumps(jumps).build();

        SolverOptions options = SolverOptions.builder()
                .algorithm(Algorithm.TAU_LEAPING)
                .dt(0.01)
                .timeseriesSteps(100)
                .seed(7)
                .build();
        Solution solution = new SdeSolver().enableProgressLogging().solve(problem, new double[] { 0, 100 }, options);

        for (int i = 0; i < solution.timeseries().size(); i += 10)
            log.info("t={} population={}", solution.timeseries().t(i), solution.timeseries().u(i)[0]);
        log.info("Final population {} (equilibrium {}), births={} deaths={}", solution.u(0), birth / death,
                solution.w()[0], solution.w()[1]);
    }
}
