package com.gradeflow.grading;

import java.time.Duration;
import java.util.Optional;

/**
 * Failure reported by the external grading provider
 */
public class ProviderException extends Exception {
    public static final int NO_STATUS = -1;

    private final int statusCode;
    private final Duration retryAfter;

    public ProviderException(String message) {
        this(NO_STATUS, message, null, null);
    }

    public ProviderException(int statusCode, String message) {
        this(statusCode, message, null, null);
    }

    public ProviderException(int statusCode, String message, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.retryAfter = retryAfter;
    }

    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Delay announced through the Retry-After response header, if any
     */
    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
