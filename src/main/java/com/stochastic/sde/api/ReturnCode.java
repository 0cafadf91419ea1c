package com.stochastic.sde.api;

/**
 * Outcome tag attached to every {@link Solution}.
 */
public enum ReturnCode {
    SUCCESS,
    MAX_ITERS,
    DT_LESS_THAN_MIN,
    INVALID_JUMP_RATE
}
