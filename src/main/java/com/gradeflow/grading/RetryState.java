package com.gradeflow.grading;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Provider call counters shared by every concurrent grading call of one job.
 * One instance per job, passed explicitly to the {@link RetryController}.
 */
public final class RetryState {
    private final AtomicInteger consecutiveRateLimitHits = new AtomicInteger();
    private final AtomicLong lastRequestTimeMillis = new AtomicLong();
    private final Object pacingLock = new Object();

    /**
     * @return the streak length including this hit
     */
    public int recordRateLimitHit() {
        return consecutiveRateLimitHits.incrementAndGet();
    }

    public void recordResponse() {
        consecutiveRateLimitHits.set(0);
    }

    public boolean isTripped(int threshold) {
        return consecutiveRateLimitHits.get() > threshold;
    }

    public int getConsecutiveRateLimitHits() {
        return consecutiveRateLimitHits.get();
    }

    /**
     * Epoch millis at which the most recent request was allowed to start, 0 before the first request
     */
    public long getLastRequestTime() {
        return lastRequestTimeMillis.get();
    }

    /**
     * Reserve the next request start time so that starts are at least {@code minInterval} apart.
     *
     * @return how long the caller has to wait before sending its request
     */
    public Duration reserveRequestSlot(Duration minInterval, long nowMillis) {
        synchronized (pacingLock) {
            long last = lastRequestTimeMillis.get();
            long start = nowMillis;
            if (last > 0 && !minInterval.isZero() && !minInterval.isNegative()) {
                start = Math.max(nowMillis, last + minInterval.toMillis());
            }
            lastRequestTimeMillis.set(start);
            return Duration.ofMillis(start - nowMillis);
        }
    }
}
