package com.stochastic.sde;

import com.stochastic.sde.api.SdeProblem;
import com.stochastic.sde.api.Solution;
import com.stochastic.sde.api.SolverException;
import com.stochastic.sde.config.SolverOptions;
import com.stochastic.sde.noise.RandomProviders;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs independent trajectories of one problem on a thread pool.
 *
 * Trajectory {@code i} is solved with seed {@code streamSeed(baseSeed, i)} by
 * its own {@link SdeSolver}, so results depend only on the base seed and the
 * index, never on scheduling. The problem's drift, diffusion and jump
 * functions are shared between threads and must be stateless.
 */
public final class EnsembleSolver implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(EnsembleSolver.class);

    private final ExecutorService executor;

    public EnsembleSolver(int threads) {
        if (threads <= 0)
            throw new IllegalArgumentException("Thread count must be positive: " + threads);
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(threads, r -> {
            Thread thread = new Thread(r, "sde-ensemble-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Solves {@code trajectories} independent paths.
     *
     * @return Solutions in trajectory order.
     * @throws SolverException if any trajectory fails; the first failure (in
     *                         trajectory order) is rethrown.
     */
    public List<Solution> solve(SdeProblem problem, double[] timeSpan, SolverOptions options, int trajectories) {
        if (trajectories <= 0)
            throw new IllegalArgumentException("Trajectory count must be positive: " + trajectories);
        SdeSolver.validateTimeSpan(timeSpan);
        SolverOptions base = options != null ? options : SolverOptions.defaults();
        long baseSeed = base.hasSeed() ? base.seed() : RandomProviders.createUnseeded().nextLong();

        log.info("Solving ensemble of {} trajectories with {} (base seed {})", trajectories, base.algorithm(),
                baseSeed);

        List<Future<Solution>> futures = new ArrayList<>(trajectories);
        for (int i = 0; i < trajectories; i++) {
            SolverOptions trajectoryOptions = base.toBuilder()
                    .seed(RandomProviders.streamSeed(baseSeed, i))
                    .build();
            futures.add(executor.submit(() -> new SdeSolver().solve(problem, timeSpan, trajectoryOptions)));
        }

        List<Solution> solutions = new ArrayList<>(trajectories);
        for (int i = 0; i < futures.size(); i++) {
            try {
                solutions.add(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelAll(futures);
                throw new SolverException("Interrupted while waiting for trajectory " + i, e);
            } catch (ExecutionException e) {
                cancelAll(futures);
                if (e.getCause() instanceof SolverException se)
                    throw se;
                throw new SolverException("Trajectory " + i + " failed", e.getCause());
            }
        }
        return solutions;
    }

    /** Sample mean of the final states. */
    public static double[] meanFinalState(List<Solution> solutions) {
        if (solutions.isEmpty())
            throw new IllegalArgumentException("No solutions");
        double[] mean = new double[solutions.get(0).u().length];
        for (Solution s : solutions) {
            double[] u = s.u();
            for (int i = 0; i < mean.length; i++)
                mean[i] += u[i];
        }
        for (int i = 0; i < mean.length; i++)
            mean[i] /= solutions.size();
        return mean;
    }

    private static void cancelAll(List<Future<Solution>> futures) {
        for (Future<Solution> f : futures)
            f.cancel(true);
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS))
                executor.shutdownNow();
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
