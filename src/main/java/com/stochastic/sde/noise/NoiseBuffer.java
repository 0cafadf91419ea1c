package com.stochastic.sde.noise;

import java.util.Arrays;

/**
 * Ordered record of the noise increments of accepted steps, indexed by time.
 *
 * Lifecycle of an increment:
 * 1. pushSpeculative: the increment drawn for an attempt is staged on top of
 * the committed record.
 * 2a. commit: the attempt was accepted; the increment becomes part of the path
 * and the running W is advanced.
 * 2b. truncate: the attempt was rejected; everything above the requested length
 * (including the staged increment) is dropped.
 *
 * Invariant: {@link #size()} equals the number of accepted steps. A staged
 * increment is never visible through {@link #increment(int)} or {@link #w()}.
 *
 * When history retention is disabled only the running W is kept, which bounds
 * memory for long runs. Truncating committed entries then is not possible.
 */
public final class NoiseBuffer {
    private static final int INITIAL_CAPACITY = 64;

    private final int dimension;
    private final boolean retainHistory;
    private final double[] w;

    private double[] times;
    private double[] dts;
    private double[][] increments;
    private int size;

    private final double[] pending;
    private double pendingTime;
    private double pendingDt;
    private boolean hasPending;

    public NoiseBuffer(int dimension, boolean retainHistory) {
        this.dimension = dimension;
        this.retainHistory = retainHistory;
        this.w = new double[dimension];
        this.pending = new double[dimension];
        int capacity = retainHistory ? INITIAL_CAPACITY : 0;
        this.times = new double[capacity];
        this.dts = new double[capacity];
        this.increments = new double[capacity][];
    }

    /** Stages the increment of an attempted step. Replaces any staged increment. */
    public void pushSpeculative(double t, double dt, double[] dW) {
        System.arraycopy(dW, 0, pending, 0, dimension);
        pendingTime = t;
        pendingDt = dt;
        hasPending = true;
    }

    /** Appends the staged increment to the committed record. */
    public void commit() {
        if (!hasPending)
            throw new IllegalStateException("No speculative increment to commit");
        if (retainHistory) {
            if (size == times.length)
                grow();
            times[size] = pendingTime;
            dts[size] = pendingDt;
            increments[size] = pending.clone();
        }
        for (int i = 0; i < dimension; i++)
            w[i] += pending[i];
        size++;
        hasPending = false;
    }

    /**
     * Discards every increment above {@code length}, including a staged one.
     * {@code truncate(size())} only drops the staged increment.
     */
    public void truncate(int length) {
        if (length < 0 || length > size)
            throw new IllegalArgumentException("Cannot truncate to " + length + " (size=" + size + ")");
        hasPending = false;
        if (length == size)
            return;
        if (!retainHistory)
            throw new IllegalStateException("Committed increments cannot be truncated without retained history");
        for (int k = length; k < size; k++)
            increments[k] = null;
        size = length;
        recomputeW();
    }

    /** Drops the staged increment, if any. */
    public void rollback() {
        truncate(size);
    }

    // Re-summed from the retained increments, never by subtraction.
    private void recomputeW() {
        Arrays.fill(w, 0.0);
        for (int k = 0; k < size; k++) {
            double[] inc = increments[k];
            for (int i = 0; i < dimension; i++)
                w[i] += inc[i];
        }
    }

    private void grow() {
        int capacity = Math.max(INITIAL_CAPACITY, times.length * 2);
        times = Arrays.copyOf(times, capacity);
        dts = Arrays.copyOf(dts, capacity);
        increments = Arrays.copyOf(increments, capacity);
    }

    /** @return Number of committed (accepted) increments. */
    public int size() {
        return size;
    }

    public boolean hasPending() {
        return hasPending;
    }

    public boolean retainsHistory() {
        return retainHistory;
    }

    public int dimension() {
        return dimension;
    }

    /** @return Live view of the running Wiener value. Callers must not modify it. */
    public double[] w() {
        return w;
    }

    /** @return The k-th committed increment. */
    public double[] increment(int k) {
        checkHistory(k);
        return increments[k].clone();
    }

    /** @return Start time of the k-th committed increment. */
    public double time(int k) {
        checkHistory(k);
        return times[k];
    }

    /** @return Length of the interval spanned by the k-th committed increment. */
    public double dt(int k) {
        checkHistory(k);
        return dts[k];
    }

    /** @return {@code W_k = dW_0 + ... + dW_(k-1)}, with {@code W_0 = 0}. */
    public double[] cumulative(int k) {
        if (k < 0 || k > size)
            throw new IndexOutOfBoundsException("Index out of bounds: " + k + " (size=" + size + ")");
        if (k == size)
            return w.clone();
        if (!retainHistory)
            throw new IllegalStateException("Increment history is not retained");
        double[] out = new double[dimension];
        for (int j = 0; j < k; j++) {
            double[] inc = increments[j];
            for (int i = 0; i < dimension; i++)
                out[i] += inc[i];
        }
        return out;
    }

    private void checkHistory(int k) {
        if (!retainHistory)
            throw new IllegalStateException("Increment history is not retained");
        if (k < 0 || k >= size)
            throw new IndexOutOfBoundsException("Index out of bounds: " + k + " (size=" + size + ")");
    }
}
