package com.stochastic.sde.noise;

import com.stochastic.sde.api.NoiseType;

/**
 * Dimensionless shape of the noise drawn for a problem.
 *
 * The shape is derived directly from the state dimension and the declared noise
 * type: scalar noise draws one sample per step and broadcasts it to every
 * component, diagonal and additive noise draw one sample per component.
 */
public final class NoiseShape {
    private final int stateDimension;
    private final int samples;
    private final NoiseType type;

    private NoiseShape(int stateDimension, int samples, NoiseType type) {
        this.stateDimension = stateDimension;
        this.samples = samples;
        this.type = type;
    }

    public static NoiseShape of(NoiseType type, int stateDimension) {
        if (stateDimension <= 0)
            throw new IllegalArgumentException("State dimension must be positive: " + stateDimension);
        int samples = type == NoiseType.SCALAR ? 1 : stateDimension;
        return new NoiseShape(stateDimension, samples, type);
    }

    /** @return Number of independent samples drawn per step. */
    public int samples() {
        return samples;
    }

    /** @return Length of the increment arrays handed to kernels. */
    public int stateDimension() {
        return stateDimension;
    }

    public NoiseType type() {
        return type;
    }

    /** Expands the independent samples into a state-shaped increment. */
    public void broadcast(double[] samplesIn, double[] target) {
        if (samples == stateDimension) {
            System.arraycopy(samplesIn, 0, target, 0, stateDimension);
        } else {
            java.util.Arrays.fill(target, 0, stateDimension, samplesIn[0]);
        }
    }

    @Override
    public String toString() {
        return "NoiseShape{" + type + ", samples=" + samples + ", dim=" + stateDimension + "}";
    }
}
