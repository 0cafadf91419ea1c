package com.stochastic.sde.util;

import com.stochastic.sde.api.ProgressListener;
import com.stochastic.sde.api.ReturnCode;

/**
 * Tracks step-size and timing statistics of a run.
 *
 * <p>
 * Captures:
 * <ul>
 * <li><b>Steps:</b> accepted and rejected counts, rejection ratio.</li>
 * <li><b>Step size:</b> min and max dt seen at progress points and rejections.</li>
 * <li><b>Wall time:</b> duration of the last run.</li>
 * </ul>
 */
public final class StepStatisticsListener implements ProgressListener {
    private long startNanos;
    private long lastRunNanos;
    private long acceptedSteps;
    private long rejectedSteps;
    private long progressEvents;
    private double minDt = Double.POSITIVE_INFINITY;
    private double maxDt = Double.NEGATIVE_INFINITY;
    private double maxRejectedError;
    private ReturnCode lastRetcode;

    @Override
    public void onIntegrationStart(double t0, double tEnd, double dt) {
        startNanos = System.nanoTime();
        observeDt(dt);
    }

    @Override
    public void onProgress(long acceptedSteps, double t, double dt, double[] u) {
        progressEvents++;
        observeDt(dt);
    }

    @Override
    public void onStepRejected(long acceptedSteps, double t, double dtRejected, double dtNext, double error) {
        observeDt(dtNext);
        if (error > maxRejectedError)
            maxRejectedError = error;
    }

    @Override
    public void onIntegrationEnd(long acceptedSteps, long rejectedSteps, double t, ReturnCode retcode) {
        lastRunNanos = System.nanoTime() - startNanos;
        this.acceptedSteps = acceptedSteps;
        this.rejectedSteps = rejectedSteps;
        this.lastRetcode = retcode;
    }

    private void observeDt(double dt) {
        if (dt < minDt)
            minDt = dt;
        if (dt > maxDt)
            maxDt = dt;
    }

    public long acceptedSteps() {
        return acceptedSteps;
    }

    public long rejectedSteps() {
        return rejectedSteps;
    }

    public long progressEvents() {
        return progressEvents;
    }

    public double rejectionRatio() {
        long total = acceptedSteps + rejectedSteps;
        return total > 0 ? (double) rejectedSteps / total : 0;
    }

    public double minDt() {
        return minDt == Double.POSITIVE_INFINITY ? 0 : minDt;
    }

    public double maxDt() {
        return maxDt == Double.NEGATIVE_INFINITY ? 0 : maxDt;
    }

    public double maxRejectedError() {
        return maxRejectedError;
    }

    public ReturnCode lastRetcode() {
        return lastRetcode;
    }

    public double lastRunMillis() {
        return lastRunNanos / 1_000_000.0;
    }

    public void reset() {
        acceptedSteps = 0;
        rejectedSteps = 0;
        progressEvents = 0;
        minDt = Double.POSITIVE_INFINITY;
        maxDt = Double.NEGATIVE_INFINITY;
        maxRejectedError = 0;
        lastRetcode = null;
    }

    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-12s | %10s | %10s | %12s | %12s | %10s\n", "Retcode", "Accepted", "Rejected",
                "Min dt", "Max dt", "Time (ms)"));
        sb.append("------------------------------------------------------------------------------------\n");
        sb.append(String.format("%-12s | %10d | %10d | %12.4g | %12.4g | %10.2f\n",
                lastRetcode,
                acceptedSteps,
                rejectedSteps,
                minDt(),
                maxDt(),
                lastRunMillis()));
        return sb.toString();
    }
}
