package com.stochastic.sde.noise;

import com.stochastic.sde.api.NoiseIncrement;

/**
 * Produces the noise consumed by each attempted step and keeps the record of
 * accepted increments.
 *
 * Protocol per attempt: {@link #draw} exactly once, then either
 * {@link #accept()} or {@link #reject(double)}. A rejected draw never reaches
 * the recorded path.
 */
public interface NoiseSource {

    /**
     * Draws the noise for an attempt over {@code [t, t + dt]}.
     *
     * @param t  Start of the step.
     * @param dt Step size.
     * @param u  State at the start of the step; state-dependent sources (jump
     *           rates) read it, Wiener sources ignore it.
     * @return The flyweight increment, valid until the next call.
     */
    NoiseIncrement draw(double t, double dt, double[] u);

    /** Commits the last draw to the recorded path. */
    void accept();

    /**
     * Discards the last draw.
     *
     * @param dtNext Size of the retry, which refinement policies may use to
     *               condition the next draw.
     */
    void reject(double dtNext);

    /** @return Live view of the current cumulative noise value. */
    double[] w();

    NoiseBuffer buffer();

    /** @return Diagnostic high-water mark of the future-information stack. */
    int maxStackSize();
}
