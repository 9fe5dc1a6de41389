package com.gradeflow.grading;

import java.time.Duration;

/**
 * Retry and circuit-breaker limits applied by {@link RetryController}
 *
 * @param maxRetries              retries after the first attempt; a call makes at most {@code maxRetries + 1} attempts
 * @param baseDelay               first computed backoff, doubled per attempt; at least one second
 * @param maxDelay                cap on computed backoff
 * @param circuitBreakerThreshold consecutive rate-limit hits tolerated before the provider is considered exhausted
 * @param minRequestInterval      minimum spacing between request starts across the job
 */
public record RetryPolicy(
        int maxRetries,
        Duration baseDelay,
        Duration maxDelay,
        int circuitBreakerThreshold,
        Duration minRequestInterval
) {
    public static final Duration MAX_COMPUTED_DELAY = Duration.ofSeconds(120);

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (baseDelay.compareTo(Duration.ofSeconds(1)) < 0) {
            throw new IllegalArgumentException("baseDelay must be at least 1s, got " + baseDelay);
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must not be below baseDelay");
        }
        if (circuitBreakerThreshold < 1) {
            throw new IllegalArgumentException("circuitBreakerThreshold must be >= 1");
        }
        if (minRequestInterval.isNegative()) {
            throw new IllegalArgumentException("minRequestInterval must not be negative");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(1), MAX_COMPUTED_DELAY, 10, Duration.ZERO);
    }
}
