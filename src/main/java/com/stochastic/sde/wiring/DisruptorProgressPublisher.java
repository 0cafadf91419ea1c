package com.stochastic.sde.wiring;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.stochastic.sde.api.ProgressListener;
import com.stochastic.sde.api.ReturnCode;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * {@link ProgressListener} that hands every notification to a consumer thread
 * through an LMAX Disruptor ring buffer.
 *
 * The integrator thread only claims a slot, copies the notification into the
 * pre-allocated {@link ProgressEvent} and publishes it. The consumer replays the
 * events in order onto the delegate listener. The producer blocks only when the
 * ring buffer is full.
 *
 * One publisher serves one producer thread at a time.
 */
public final class DisruptorProgressPublisher implements ProgressListener, AutoCloseable {
    private static final Logger log = LogManager.getLogger(DisruptorProgressPublisher.class);
    public static final int DEFAULT_BUFFER_SIZE = 1024;

    private final Disruptor<ProgressEvent> disruptor;
    private final RingBuffer<ProgressEvent> ringBuffer;

    public DisruptorProgressPublisher(int dimension, ProgressListener consumer) {
        this(dimension, DEFAULT_BUFFER_SIZE, consumer);
    }

    /**
     * @param dimension  State dimension, sizes the snapshot in each event.
     * @param bufferSize Ring buffer size, a power of two.
     * @param consumer   Listener invoked on the consumer thread.
     */
    public DisruptorProgressPublisher(int dimension, int bufferSize, ProgressListener consumer) {
        this.disruptor = new Disruptor<>(
                () -> new ProgressEvent(dimension),
                bufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.SINGLE,
                new BlockingWaitStrategy());
        this.disruptor.handleEventsWith(new ProgressEventHandler(consumer));
        this.ringBuffer = disruptor.start();
        log.debug("Started progress relay (bufferSize={}, dimension={})", bufferSize, dimension);
    }

    @Override
    public void onIntegrationStart(double t0, double tEnd, double dt) {
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).setStart(t0, tEnd, dt);
        } finally {
            ringBuffer.publish(sequence);
        }
    }

    @Override
    public void onProgress(long acceptedSteps, double t, double dt, double[] u) {
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).setProgress(acceptedSteps, t, dt, u);
        } finally {
            ringBuffer.publish(sequence);
        }
    }

    @Override
    public void onStepRejected(long acceptedSteps, double t, double dtRejected, double dtNext, double error) {
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).setRejected(acceptedSteps, t, dtRejected, dtNext, error);
        } finally {
            ringBuffer.publish(sequence);
        }
    }

    @Override
    public void onIntegrationEnd(long acceptedSteps, long rejectedSteps, double t, ReturnCode retcode) {
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).setEnd(acceptedSteps, rejectedSteps, t, retcode);
        } finally {
            ringBuffer.publish(sequence);
        }
    }

    /** Drains the events already published, then stops the consumer thread. */
    @Override
    public void close() {
        disruptor.shutdown();
    }
}
