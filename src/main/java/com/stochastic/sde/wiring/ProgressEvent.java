package com.stochastic.sde.wiring;

import com.stochastic.sde.api.ReturnCode;

/**
 * A mutable holder for one progress notification, used within the LMAX
 * Disruptor RingBuffer.
 *
 * Pattern: Flyweight / Mutable Event
 *
 * Instances are pre-allocated when the ring buffer is built and reused for
 * every notification, so publishing from the stepping loop does not allocate.
 * The state snapshot is copied into a pre-sized array.
 *
 * Fields:
 * - type: which {@link com.stochastic.sde.api.ProgressListener} callback the
 * event replays.
 * - t, dt: time and step size (for START: t0 and the initial dt).
 * - tEnd: final time (START only).
 * - dtNext, error: retry step size and error of a rejection.
 * - u: state snapshot (PROGRESS only).
 * - retcode: outcome (END only).
 */
public final class ProgressEvent {
    public enum Type {
        START, PROGRESS, REJECTED, END
    }

    private Type type;
    private long acceptedSteps;
    private long rejectedSteps;
    private double t;
    private double tEnd;
    private double dt;
    private double dtNext;
    private double error;
    private final double[] u;
    private ReturnCode retcode;

    public ProgressEvent(int dimension) {
        this.u = new double[dimension];
    }

    public void setStart(double t0, double tEnd, double dt) {
        clear();
        this.type = Type.START;
        this.t = t0;
        this.tEnd = tEnd;
        this.dt = dt;
    }

    public void setProgress(long acceptedSteps, double t, double dt, double[] state) {
        clear();
        this.type = Type.PROGRESS;
        this.acceptedSteps = acceptedSteps;
        this.t = t;
        this.dt = dt;
        System.arraycopy(state, 0, u, 0, Math.min(state.length, u.length));
    }

    public void setRejected(long acceptedSteps, double t, double dtRejected, double dtNext, double error) {
        clear();
        this.type = Type.REJECTED;
        this.acceptedSteps = acceptedSteps;
        this.t = t;
        this.dt = dtRejected;
        this.dtNext = dtNext;
        this.error = error;
    }

    public void setEnd(long acceptedSteps, long rejectedSteps, double t, ReturnCode retcode) {
        clear();
        this.type = Type.END;
        this.acceptedSteps = acceptedSteps;
        this.rejectedSteps = rejectedSteps;
        this.t = t;
        this.retcode = retcode;
    }

    public Type type() {
        return type;
    }

    public long acceptedSteps() {
        return acceptedSteps;
    }

    public long rejectedSteps() {
        return rejectedSteps;
    }

    public double t() {
        return t;
    }

    public double tEnd() {
        return tEnd;
    }

    public double dt() {
        return dt;
    }

    public double dtNext() {
        return dtNext;
    }

    public double error() {
        return error;
    }

    /** @return The pre-allocated state snapshot. Valid until the slot is reused. */
    public double[] u() {
        return u;
    }

    public ReturnCode retcode() {
        return retcode;
    }

    public void clear() {
        type = null;
        acceptedSteps = 0;
        rejectedSteps = 0;
        t = 0;
        tEnd = 0;
        dt = 0;
        dtNext = 0;
        error = 0;
        retcode = null;
    }
}
