package com.stochastic.sde.noise;

import com.stochastic.sde.api.InvalidJumpRateException;
import com.stochastic.sde.api.JumpProblem;
import com.stochastic.sde.api.NoiseIncrement;

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.PoissonSamplerCache;
import org.apache.commons.rng.sampling.distribution.SharedStateDiscreteSampler;

/**
 * Jump-count source for tau-leaping: over a leap of length {@code dt} channel
 * {@code j} fires {@code Poisson(rate_j(u, p, t) * dt)} times.
 *
 * A channel whose rate is exactly zero fires zero times without touching the
 * generator. The recorded path {@link #w()} is the cumulative count per channel.
 * A negative, NaN or infinite rate raises {@link InvalidJumpRateException}.
 *
 * Each channel keeps its last sampler and reuses it while the leap mean is
 * unchanged. New samplers for means up to {@value #MAX_CACHED_MEAN} come from a
 * shared {@link PoissonSamplerCache}, which holds the log-factorial setup of the
 * large-mean algorithm.
 */
public final class PoissonJumpProcess implements NoiseSource {
    private final JumpProblem jumps;
    private final UniformRandomProvider rng;
    private final NoiseIncrement increment;
    private final NoiseBuffer buffer;
    static final double MAX_CACHED_MEAN = 1024;

    private final PoissonSamplerCache samplerCache = new PoissonSamplerCache(0, MAX_CACHED_MEAN);
    private final double[] rates;
    private final SharedStateDiscreteSampler[] samplers;
    private final double[] samplerMeans;
    private boolean drawn;

    public PoissonJumpProcess(JumpProblem jumps, int stateDimension, UniformRandomProvider rng,
            boolean retainHistory) {
        this.jumps = jumps;
        this.rng = rng;
        this.increment = new NoiseIncrement(stateDimension, false, jumps.channels());
        this.buffer = new NoiseBuffer(jumps.channels(), retainHistory);
        this.rates = new double[jumps.channels()];
        this.samplers = new SharedStateDiscreteSampler[jumps.channels()];
        this.samplerMeans = new double[jumps.channels()];
    }

    @Override
    public NoiseIncrement draw(double t, double dt, double[] u) {
        if (!(dt > 0))
            throw new IllegalArgumentException("Leap length must be positive: " + dt);
        increment.reset(dt);
        jumps.rates().rates(u, jumps.parameters(), t, rates);

        double[] counts = increment.jumpCounts();
        for (int j = 0; j < rates.length; j++) {
            double rate = rates[j];
            if (!(rate >= 0) || Double.isInfinite(rate))
                throw new InvalidJumpRateException(j, t, rate);
            counts[j] = rate == 0.0 ? 0.0 : sampler(j, rate * dt).sample();
        }
        drawn = true;
        buffer.pushSpeculative(t, dt, counts);
        return increment;
    }

    private SharedStateDiscreteSampler sampler(int channel, double mean) {
        SharedStateDiscreteSampler sampler = samplers[channel];
        if (sampler == null || samplerMeans[channel] != mean) {
            sampler = samplerCache.createSharedStateSampler(rng, mean);
            samplers[channel] = sampler;
            samplerMeans[channel] = mean;
        }
        return sampler;
    }

    @Override
    public void accept() {
        if (!drawn)
            throw new IllegalStateException("accept() called without a preceding draw()");
        buffer.commit();
        drawn = false;
    }

    @Override
    public void reject(double dtNext) {
        if (!drawn)
            throw new IllegalStateException("reject() called without a preceding draw()");
        buffer.rollback();
        drawn = false;
    }

    @Override
    public double[] w() {
        return buffer.w();
    }

    @Override
    public NoiseBuffer buffer() {
        return buffer;
    }

    @Override
    public int maxStackSize() {
        return 0;
    }
}
