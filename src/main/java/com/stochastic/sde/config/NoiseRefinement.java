package com.stochastic.sde.config;

/**
 * What happens to the noise consumed by a rejected step.
 */
public enum NoiseRefinement {
    /**
     * The rejected increment is truncated from the noise buffer and the retry
     * draws a fresh, independent increment for the shorter interval.
     */
    DISCARD,

    /**
     * The rejected increment is kept on a resettable stack as future
     * information. The retry draws a Brownian-bridge sample conditioned on it and
     * the remainder stays on the stack for the following steps.
     */
    BROWNIAN_BRIDGE
}
