package com.stochastic.sde.tableau;

/**
 * Immutable coefficient table of a stochastic Runge-Kutta scheme.
 */
public interface Tableau {

    String name();

    TableauFamily family();

    /** @return Number of stages. */
    int stages();

    /** @return Strong order of the scheme. */
    double order();
}
