package com.stochastic.sde.api;

/**
 * Structure of the noise term {@code g(t,u)dW}.
 */
public enum NoiseType {
    /** One Wiener process shared by every state component. */
    SCALAR,
    /** One independent Wiener process per state component, g acting elementwise. */
    DIAGONAL,
    /** Diagonal noise whose diffusion does not depend on the state. */
    ADDITIVE
}
