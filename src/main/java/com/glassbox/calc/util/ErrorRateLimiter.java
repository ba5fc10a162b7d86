package com.glassbox.calc.util;

import java.util.concurrent.atomic.AtomicLong;

import org.apache.logging.log4j.Logger;

/**
 * Limits how often failures are written to a logger. Messages inside the
 * interval are counted and the count is reported with the next one written.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final AtomicLong lastLogTime;
    private final AtomicLong suppressed = new AtomicLong();

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
        this.lastLogTime = new AtomicLong(System.nanoTime() - minIntervalNanos - 1);
    }

    public void warn(String message) {
        if (acquire())
            logger.warn(withSuppressed(message));
    }

    public void error(String message, Throwable t) {
        if (acquire())
            logger.error(withSuppressed(message), t);
    }

    /** Messages dropped since the last one written. */
    public long suppressedCount() {
        return suppressed.get();
    }

    private boolean acquire() {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        // Only one caller wins the slot for an interval
        if (now - last > minIntervalNanos && lastLogTime.compareAndSet(last, now))
            return true;
        suppressed.incrementAndGet();
        return false;
    }

    private String withSuppressed(String message) {
        long n = suppressed.getAndSet(0);
        return n == 0 ? message : message + " (" + n + " similar suppressed)";
    }
}
