package com.stochastic.sde.wiring;

import com.lmax.disruptor.EventHandler;
import com.stochastic.sde.api.ProgressListener;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Disruptor EventHandler that replays {@link ProgressEvent}s onto a
 * {@link ProgressListener} on the consumer thread.
 *
 * A failing delegate is logged and the event dropped, keeping the consumer
 * thread alive for the rest of the run.
 */
public final class ProgressEventHandler implements EventHandler<ProgressEvent> {
    private static final Logger log = LogManager.getLogger(ProgressEventHandler.class);

    private final ProgressListener delegate;

    public ProgressEventHandler(ProgressListener delegate) {
        this.delegate = delegate;
    }

    @Override
    public void onEvent(ProgressEvent event, long sequence, boolean endOfBatch) {
        try {
            switch (event.type()) {
                case START -> delegate.onIntegrationStart(event.t(), event.tEnd(), event.dt());
                case PROGRESS -> delegate.onProgress(event.acceptedSteps(), event.t(), event.dt(), event.u());
                case REJECTED -> delegate.onStepRejected(event.acceptedSteps(), event.t(), event.dt(),
                        event.dtNext(), event.error());
                case END -> delegate.onIntegrationEnd(event.acceptedSteps(), event.rejectedSteps(), event.t(),
                        event.retcode());
            }
        } catch (RuntimeException e) {
            log.error("Progress listener failed on {} event (sequence {})", event.type(), sequence, e);
        }
    }
}
