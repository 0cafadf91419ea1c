package com.stochastic.sde.util;

import com.stochastic.sde.api.ProgressListener;
import com.stochastic.sde.api.ReturnCode;
import java.util.Arrays;

/**
 * Aggregates multiple {@link ProgressListener} instances with zero-allocation
 * iteration.
 */
public class CompositeProgressListener implements ProgressListener {
    private ProgressListener[] listeners = new ProgressListener[0];

    public void add(ProgressListener listener) {
        ProgressListener[] old = listeners;
        ProgressListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onIntegrationStart(double t0, double tEnd, double dt) {
        for (ProgressListener l : listeners)
            l.onIntegrationStart(t0, tEnd, dt);
    }

    @Override
    public void onProgress(long acceptedSteps, double t, double dt, double[] u) {
        for (ProgressListener l : listeners)
            l.onProgress(acceptedSteps, t, dt, u);
    }

    @Override
    public void onStepRejected(long acceptedSteps, double t, double dtRejected, double dtNext, double error) {
        for (ProgressListener l : listeners)
            l.onStepRejected(acceptedSteps, t, dtRejected, dtNext, error);
    }

    @Override
    public void onIntegrationEnd(long acceptedSteps, long rejectedSteps, double t, ReturnCode retcode) {
        for (ProgressListener l : listeners)
            l.onIntegrationEnd(acceptedSteps, rejectedSteps, t, retcode);
    }
}
