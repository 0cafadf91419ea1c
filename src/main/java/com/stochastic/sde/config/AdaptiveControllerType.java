package com.stochastic.sde.config;

/**
 * Adaptive step-size controllers.
 */
public enum AdaptiveControllerType {
    /** Rejection Sampling with Memory, variant 3. */
    RSWM3
}
