package com.stochastic.sde.api;

/**
 * Malformed input detected before any stepping, e.g. an invalid time span.
 */
public class InputException extends SolverException {
    public InputException(String message) {
        super(message);
    }
}
