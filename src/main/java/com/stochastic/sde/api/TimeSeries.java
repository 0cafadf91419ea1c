package com.stochastic.sde.api;

import java.util.Arrays;

/**
 * Append-only sequence of {@code (t, u, W)} triples recorded during a run.
 *
 * Storage is a set of growable arrays. Rows are copied on append so that later
 * in-place mutation of the integrator's state cannot alter recorded history.
 * Instances are owned by a single run; they are not thread-safe.
 */
public final class TimeSeries {
    private static final int INITIAL_CAPACITY = 64;

    private double[] times = new double[INITIAL_CAPACITY];
    private double[][] states = new double[INITIAL_CAPACITY][];
    private double[][] wiener = new double[INITIAL_CAPACITY][];
    private int size;

    public void append(double t, double[] u, double[] w) {
        if (size > 0 && t < times[size - 1])
            throw new IllegalArgumentException("Time series must be non-decreasing: " + t + " < " + times[size - 1]);
        if (size == times.length)
            grow();
        times[size] = t;
        states[size] = u.clone();
        wiener[size] = w.clone();
        size++;
    }

    private void grow() {
        int capacity = times.length * 2;
        times = Arrays.copyOf(times, capacity);
        states = Arrays.copyOf(states, capacity);
        wiener = Arrays.copyOf(wiener, capacity);
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public double t(int i) {
        checkIndex(i);
        return times[i];
    }

    /** @return The recorded state at index i. Callers must not modify it. */
    public double[] u(int i) {
        checkIndex(i);
        return states[i];
    }

    /** @return The recorded Wiener value at index i. Callers must not modify it. */
    public double[] w(int i) {
        checkIndex(i);
        return wiener[i];
    }

    public double lastTime() {
        if (size == 0)
            throw new IllegalStateException("Time series is empty");
        return times[size - 1];
    }

    /** @return A copy of the recorded time points. */
    public double[] times() {
        return Arrays.copyOf(times, size);
    }

    private void checkIndex(int i) {
        if (i < 0 || i >= size)
            throw new IndexOutOfBoundsException("Index out of bounds: " + i + " (size=" + size + ")");
    }
}
