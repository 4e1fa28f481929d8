package com.control.cfs.util;

import org.apache.logging.log4j.Logger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Limits the rate of error logging.
 * Used on the streaming consumer thread, where a persistently bad producer
 * would otherwise flood the log with one line per sample.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final AtomicLong lastLogTime = new AtomicLong(0);
    private final AtomicLong suppressed = new AtomicLong(0);

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
    }

    /**
     * Logs at error level unless another message was logged within the
     * interval.
     *
     * @return true if the message was written.
     */
    public boolean log(String message, Throwable t) {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        if (last == 0 || now - last > minIntervalNanos) {
            // Only one thread logs per interval
            if (lastLogTime.compareAndSet(last, now)) {
                long dropped = suppressed.getAndSet(0);
                if (dropped > 0)
                    logger.error(message + " (Throttled, " + dropped + " suppressed)", t);
                else
                    logger.error(message + " (Throttled)", t);
                return true;
            }
        }
        suppressed.incrementAndGet();
        return false;
    }

    /** Messages swallowed since the last one that was written. */
    public long suppressedCount() {
        return suppressed.get();
    }
}
