package com.stochastic.sde.api;

/**
 * The requested algorithm/tableau/controller combination has no implementation.
 * Raised while configuring a run, before the first step.
 */
public class UnimplementedSchemeException extends SolverException {
    public UnimplementedSchemeException(String message) {
        super(message);
    }
}
