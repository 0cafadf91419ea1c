package com.stochastic.sde.api;

/**
 * Mutable holder for the noise consumed by one attempted step.
 *
 * Pattern: Flyweight. One instance is allocated per run by the noise source and
 * refilled for every attempt, so the stepping loop does not allocate.
 *
 * Fields:
 * - dW: Wiener increments, one per state component. Under scalar noise every
 * entry carries the same sample.
 * - dZ: auxiliary independent increments used by the iterated integral
 * I_(1,0) in SRI/SRA schemes; null when the kernel does not need them.
 * - jumpCounts: Poisson firing counts per reaction channel for tau-leaping;
 * null for diffusion problems.
 */
public final class NoiseIncrement {
    private final double[] dW;
    private final double[] dZ;
    private final double[] jumpCounts;
    private double dt;
    private double sqrtDt;

    public NoiseIncrement(int dimension, boolean auxiliary, int jumpChannels) {
        this.dW = new double[dimension];
        this.dZ = auxiliary ? new double[dimension] : null;
        this.jumpCounts = jumpChannels > 0 ? new double[jumpChannels] : null;
    }

    /** Sets the interval this increment spans. Sample arrays are filled by the noise source. */
    public void reset(double dt) {
        this.dt = dt;
        this.sqrtDt = Math.sqrt(dt);
    }

    public double dt() {
        return dt;
    }

    public double sqrtDt() {
        return sqrtDt;
    }

    public double[] dW() {
        return dW;
    }

    public double[] dZ() {
        return dZ;
    }

    public boolean hasAuxiliary() {
        return dZ != null;
    }

    public double[] jumpCounts() {
        return jumpCounts;
    }

    public int dimension() {
        return dW.length;
    }
}
