package com.stochastic.sde.control;

/**
 * Short error history kept by the step-size controller.
 */
public final class ControllerState {
    private double lastError = Double.NaN;
    private double lastAcceptedDt = Double.NaN;
    private int consecutiveRejections;

    void onAccept(double error, double dt) {
        lastError = error;
        lastAcceptedDt = dt;
        consecutiveRejections = 0;
    }

    void onReject() {
        consecutiveRejections++;
    }

    void reset() {
        lastError = Double.NaN;
        lastAcceptedDt = Double.NaN;
        consecutiveRejections = 0;
    }

    /** @return Error of the last accepted step, NaN before the first accept. */
    public double lastError() {
        return lastError;
    }

    public double lastAcceptedDt() {
        return lastAcceptedDt;
    }

    public int consecutiveRejections() {
        return consecutiveRejections;
    }

    @Override
    public String toString() {
        return "ControllerState{lastError=" + lastError + ", lastAcceptedDt=" + lastAcceptedDt
                + ", consecutiveRejections=" + consecutiveRejections + "}";
    }
}
