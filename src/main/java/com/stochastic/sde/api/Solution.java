package com.stochastic.sde.api;

/**
 * Output of an integration run. Immutable after construction.
 *
 * The time series and analytic series are only present when the run retained
 * them ({@code saveTimeseries}) and, for the analytic series, when the problem
 * supplied an {@link AnalyticSolution}.
 */
public final class Solution {
    private final double t;
    private final double[] u;
    private final double[] w;
    private final TimeSeries timeseries;
    private final double[] uAnalytic;
    private final double[][] timeseriesAnalytic;
    private final int maxStackSize;
    private final long acceptedSteps;
    private final long rejectedSteps;
    private final ReturnCode retcode;

    public Solution(double t, double[] u, double[] w, TimeSeries timeseries, double[] uAnalytic,
            double[][] timeseriesAnalytic, int maxStackSize, long acceptedSteps, long rejectedSteps,
            ReturnCode retcode) {
        this.t = t;
        this.u = u.clone();
        this.w = w.clone();
        this.timeseries = timeseries;
        this.uAnalytic = uAnalytic;
        this.timeseriesAnalytic = timeseriesAnalytic;
        this.maxStackSize = maxStackSize;
        this.acceptedSteps = acceptedSteps;
        this.rejectedSteps = rejectedSteps;
        this.retcode = retcode;
    }

    public double t() {
        return t;
    }

    public double[] u() {
        return u.clone();
    }

    /** Convenience accessor for one-dimensional problems. */
    public double u(int component) {
        return u[component];
    }

    public double[] w() {
        return w.clone();
    }

    public boolean hasTimeseries() {
        return timeseries != null;
    }

    public TimeSeries timeseries() {
        return timeseries;
    }

    public boolean hasAnalytic() {
        return uAnalytic != null;
    }

    public double[] uAnalytic() {
        return uAnalytic == null ? null : uAnalytic.clone();
    }

    public double[][] timeseriesAnalytic() {
        return timeseriesAnalytic;
    }

    /** High-water mark of the future-noise stack (0 when no refinement stack was used). */
    public int maxStackSize() {
        return maxStackSize;
    }

    public long acceptedSteps() {
        return acceptedSteps;
    }

    public long rejectedSteps() {
        return rejectedSteps;
    }

    public ReturnCode retcode() {
        return retcode;
    }

    public boolean isSuccess() {
        return retcode == ReturnCode.SUCCESS;
    }

    /**
     * Euclidean distance between the final state and the analytic final state.
     *
     * @throws IllegalStateException if no analytic solution is available.
     */
    public double finalError() {
        if (uAnalytic == null)
            throw new IllegalStateException("Solution carries no analytic value");
        double sum = 0.0;
        for (int i = 0; i < u.length; i++) {
            double d = u[i] - uAnalytic[i];
            sum += d * d;
        }
        return Math.sqrt(sum);
    }

    @Override
    public String toString() {
        return "Solution{t=" + t + ", u=" + java.util.Arrays.toString(u) + ", accepted=" + acceptedSteps
                + ", rejected=" + rejectedSteps + ", retcode=" + retcode + "}";
    }
}
