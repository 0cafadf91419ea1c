package com.stochastic.sde.util;

import org.apache.logging.log4j.Logger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Limits the rate of warning logs.
 * Used inside the stepping loop, where a persistently misbehaving drift or
 * diffusion would otherwise log on every rejected attempt.
 */
public class WarningRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final AtomicLong lastLogTime = new AtomicLong(Long.MIN_VALUE);
    private final AtomicLong suppressed = new AtomicLong();

    public WarningRateLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
    }

    public void warn(String message, Throwable t) {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        if (last == Long.MIN_VALUE || now - last > minIntervalNanos) {
            // Only one thread logs per interval.
            if (lastLogTime.compareAndSet(last, now)) {
                long skipped = suppressed.getAndSet(0);
                if (skipped > 0)
                    logger.warn("{} (Throttled, {} similar suppressed)", message, skipped, t);
                else
                    logger.warn(message, t);
                return;
            }
        }
        suppressed.incrementAndGet();
    }

    /** @return Warnings dropped since the last one that was logged. */
    public long suppressedCount() {
        return suppressed.get();
    }
}
