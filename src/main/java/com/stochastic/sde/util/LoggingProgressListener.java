package com.stochastic.sde.util;

import com.stochastic.sde.api.ProgressListener;
import com.stochastic.sde.api.ReturnCode;

import lombok.extern.log4j.Log4j2;

/**
 * Writes run progress to the log: start and end at INFO, periodic progress and
 * rejections at DEBUG.
 */
@Log4j2
public final class LoggingProgressListener implements ProgressListener {
    private double t0;
    private double tEnd;

    @Override
    public void onIntegrationStart(double t0, double tEnd, double dt) {
        this.t0 = t0;
        this.tEnd = tEnd;
        log.info("Integrating over [{}, {}] with dt={}", t0, tEnd, dt);
    }

    @Override
    public void onProgress(long acceptedSteps, double t, double dt, double[] u) {
        if (log.isDebugEnabled()) {
            double fraction = tEnd > t0 ? (t - t0) / (tEnd - t0) : 1.0;
            log.debug(String.format("%6.2f%% t=%.6g dt=%.3g steps=%d", 100 * fraction, t, dt, acceptedSteps));
        }
    }

    @Override
    public void onStepRejected(long acceptedSteps, double t, double dtRejected, double dtNext, double error) {
        log.debug("Rejected step at t={} dt={} error={} -> dt={}", t, dtRejected, error, dtNext);
    }

    @Override
    public void onIntegrationEnd(long acceptedSteps, long rejectedSteps, double t, ReturnCode retcode) {
        if (retcode == ReturnCode.SUCCESS)
            log.info("Integration finished at t={} ({} accepted, {} rejected)", t, acceptedSteps, rejectedSteps);
        else
            log.warn("Integration stopped at t={} with {} ({} accepted, {} rejected)", t, retcode,
                    acceptedSteps, rejectedSteps);
    }
}
