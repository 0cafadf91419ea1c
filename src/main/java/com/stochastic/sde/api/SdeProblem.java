package com.stochastic.sde.api;

import java.util.Arrays;

/**
 * Problem definition for {@code du = f(t,u)dt + g(t,u)dW}, optionally extended
 * with a jump process for tau-leaping.
 *
 * <p>
 * Instances are immutable; the initial condition is copied on construction and
 * on every read so that a run can never write through to the problem.
 */
public final class SdeProblem {
    private final SdeFunction drift;
    private final SdeFunction diffusion;
    private final double[] u0;
    private final NoiseType noiseType;
    private final AnalyticSolution analytic;
    private final JumpProblem jumps;

    private SdeProblem(Builder b) {
        this.drift = b.drift;
        this.diffusion = b.diffusion;
        this.u0 = b.u0.clone();
        this.noiseType = b.noiseType;
        this.analytic = b.analytic;
        this.jumps = b.jumps;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Shortcut for a one-dimensional problem with scalar drift and diffusion.
     */
    public static SdeProblem scalar(SdeFunction.ScalarFn f, SdeFunction.ScalarFn g, double u0) {
        return builder()
                .drift(SdeFunction.scalar(f))
                .diffusion(SdeFunction.scalar(g))
                .initialState(u0)
                .build();
    }

    public SdeFunction drift() {
        return drift;
    }

    public SdeFunction diffusion() {
        return diffusion;
    }

    /** @return A fresh copy of the initial condition. */
    public double[] initialState() {
        return u0.clone();
    }

    public int dimension() {
        return u0.length;
    }

    public NoiseType noiseType() {
        return noiseType;
    }

    public boolean hasAnalytic() {
        return analytic != null;
    }

    public AnalyticSolution analytic() {
        return analytic;
    }

    public boolean hasJumps() {
        return jumps != null;
    }

    public JumpProblem jumps() {
        return jumps;
    }

    public boolean hasDiffusionTerms() {
        return drift != null && diffusion != null;
    }

    @Override
    public String toString() {
        return "SdeProblem{dim=" + u0.length + ", noise=" + noiseType + ", u0=" + Arrays.toString(u0)
                + (jumps != null ? ", jumps=" + jumps.channels() : "") + "}";
    }

    public static final class Builder {
        private SdeFunction drift;
        private SdeFunction diffusion;
        private double[] u0;
        private NoiseType noiseType = NoiseType.DIAGONAL;
        private AnalyticSolution analytic;
        private JumpProblem jumps;

        private Builder() {
        }

        public Builder drift(SdeFunction f) {
            this.drift = f;
            return this;
        }

        public Builder diffusion(SdeFunction g) {
            this.diffusion = g;
            return this;
        }

        public Builder initialState(double... u0) {
            this.u0 = u0.clone();
            return this;
        }

        public Builder noise(NoiseType type) {
            this.noiseType = type;
            return this;
        }

        public Builder analytic(AnalyticSolution analytic) {
            this.analytic = analytic;
            return this;
        }

        public Builder jumps(JumpProblem jumps) {
            this.jumps = jumps;
            return this;
        }

        public SdeProblem build() {
            if (u0 == null || u0.length == 0)
                throw new IllegalArgumentException("Initial state must have at least one component");
            for (double v : u0) {
                if (!Double.isFinite(v))
                    throw new IllegalArgumentException("Invalid value in initial state: " + v);
            }
            if ((drift == null) != (diffusion == null))
                throw new IllegalArgumentException("Drift and diffusion must be supplied together");
            if (drift == null && jumps == null)
                throw new IllegalArgumentException("Problem defines neither drift/diffusion nor jumps");
            if (noiseType == null)
                throw new IllegalArgumentException("Noise type must not be null");
            return new SdeProblem(this);
        }
    }
}
