package com.stochastic.sde.tableau;

/**
 * Family of stochastic Runge-Kutta schemes a tableau belongs to.
 */
public enum TableauFamily {
    /** Rößler SRA: additive noise. */
    SRA,
    /** Rößler SRI: diagonal or scalar Itô noise. */
    SRI
}
