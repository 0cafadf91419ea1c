package com.stochastic.sde.noise;

import com.stochastic.sde.api.NoiseIncrement;
import com.stochastic.sde.config.NoiseRefinement;

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.NormalizedGaussianSampler;
import org.apache.commons.rng.sampling.distribution.ZigguratSampler;

/**
 * Gaussian noise source: samples {@code dW ~ N(0, dt)} (and, when requested, an
 * independent auxiliary {@code dZ ~ N(0, dt)}) for every attempted step.
 *
 * Rejection handling depends on the {@link NoiseRefinement} policy:
 * - DISCARD: the rejected sample is truncated from the buffer and forgotten.
 * The retry draws a statistically independent sample over the shorter
 * interval.
 * - BROWNIAN_BRIDGE: the rejected sample is pushed onto a
 * {@link ResettableStack}. Later draws consume the stack front to back,
 * splitting the top piece with a Brownian bridge when the requested interval
 * ends inside it. Pieces shorter than {@code discardLength} are dropped.
 *
 * Given the same seed and the same sequence of draw/accept/reject calls the
 * process produces identical increments.
 */
public final class WienerProcess implements NoiseSource {
    private final NoiseShape shape;
    private final NormalizedGaussianSampler gaussian;
    private final boolean auxiliary;
    private final NoiseRefinement refinement;
    private final double discardLength;

    private final NoiseIncrement increment;
    private final NoiseBuffer buffer;
    private final ResettableStack future;

    // Raw (un-broadcast) samples of the last draw, needed to push it back on rejection.
    private final double[] lastW;
    private final double[] lastZ;
    private double lastDt;
    private boolean drawn;

    public WienerProcess(NoiseShape shape, UniformRandomProvider rng, boolean auxiliary,
            NoiseRefinement refinement, double discardLength, boolean retainHistory) {
        this.shape = shape;
        this.gaussian = ZigguratSampler.NormalizedGaussian.of(rng);
        this.auxiliary = auxiliary;
        this.refinement = refinement;
        this.discardLength = discardLength;
        this.increment = new NoiseIncrement(shape.stateDimension(), auxiliary, 0);
        this.buffer = new NoiseBuffer(shape.stateDimension(), retainHistory);
        this.future = new ResettableStack(shape.samples(), auxiliary);
        this.lastW = new double[shape.samples()];
        this.lastZ = new double[shape.samples()];
    }

    @Override
    public NoiseIncrement draw(double t, double dt, double[] u) {
        if (!(dt > 0))
            throw new IllegalArgumentException("Noise interval must be positive: " + dt);
        increment.reset(dt);

        if (refinement == NoiseRefinement.BROWNIAN_BRIDGE && !future.isEmpty()) {
            drawFromFuture(dt);
        } else {
            drawFresh(dt, false);
        }

        shape.broadcast(lastW, increment.dW());
        if (auxiliary)
            shape.broadcast(lastZ, increment.dZ());
        lastDt = dt;
        drawn = true;

        buffer.pushSpeculative(t, dt, increment.dW());
        return increment;
    }

    /** Fills lastW/lastZ with fresh samples over {@code dt}, or adds them when accumulating. */
    private void drawFresh(double dt, boolean accumulate) {
        double s = Math.sqrt(dt);
        int n = shape.samples();
        for (int i = 0; i < n; i++) {
            double w = s * gaussian.sample();
            lastW[i] = accumulate ? lastW[i] + w : w;
        }
        if (auxiliary) {
            for (int i = 0; i < n; i++) {
                double z = s * gaussian.sample();
                lastZ[i] = accumulate ? lastZ[i] + z : z;
            }
        }
    }

    private void drawFromFuture(double dt) {
        int n = shape.samples();
        java.util.Arrays.fill(lastW, 0.0);
        if (auxiliary)
            java.util.Arrays.fill(lastZ, 0.0);

        double remaining = dt;
        while (remaining > 0 && !future.isEmpty()) {
            ResettableStack.Entry top = future.peek();
            if (top.dt - remaining <= discardLength) {
                // Whole piece fits inside the requested interval.
                for (int i = 0; i < n; i++)
                    lastW[i] += top.dW[i];
                if (auxiliary)
                    for (int i = 0; i < n; i++)
                        lastZ[i] += top.dZ[i];
                remaining -= top.dt;
                future.pop();
                continue;
            }

            // Bridge: split the piece at 'remaining'. The sub-increment is
            // N(ratio * dW, ratio * (1 - ratio) * top.dt).
            double ratio = remaining / top.dt;
            double sd = Math.sqrt(ratio * (1.0 - ratio) * top.dt);
            for (int i = 0; i < n; i++) {
                double sub = ratio * top.dW[i] + sd * gaussian.sample();
                lastW[i] += sub;
                top.dW[i] -= sub;
            }
            if (auxiliary) {
                for (int i = 0; i < n; i++) {
                    double sub = ratio * top.dZ[i] + sd * gaussian.sample();
                    lastZ[i] += sub;
                    top.dZ[i] -= sub;
                }
            }
            top.dt -= remaining;
            remaining = 0;
            if (top.dt < discardLength)
                future.pop();
        }

        if (remaining > discardLength)
            drawFresh(remaining, true);
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
        if (refinement == NoiseRefinement.BROWNIAN_BRIDGE)
            future.push(lastDt, lastW, lastZ);
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
        return future.maxSize();
    }

    /** @return Number of future pieces currently held for bridge refinement. */
    public int pendingFuturePieces() {
        return future.size();
    }

    public NoiseShape shape() {
        return shape;
    }
}
