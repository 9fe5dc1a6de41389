package com.gradeflow.grading;

import java.time.Duration;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts provider-suggested retry delays from error payloads. No match is the normal case.
 */
public final class RetryDelayParser {
    private static final Pattern RETRY_DELAY = Pattern.compile(
            "retry_delay\\s*\\{\\s*seconds\\s*:\\s*(\\d+(?:\\.\\d+)?)\\s*}", Pattern.CASE_INSENSITIVE);
    private static final Pattern RETRY_DELAY_JSON = Pattern.compile(
            "\"retryDelay\"\\s*:\\s*\"(\\d+(?:\\.\\d+)?)s\"", Pattern.CASE_INSENSITIVE);

    private RetryDelayParser() {
    }

    /**
     * Parse {@code retry_delay { seconds: N }} (or its JSON form {@code "retryDelay": "Ns"}) out of free text
     */
    public static Optional<Duration> parse(String errorText) {
        if (errorText == null || errorText.isEmpty()) {
            return Optional.empty();
        }
        Matcher matcher = RETRY_DELAY.matcher(errorText);
        if (matcher.find()) {
            return toDuration(matcher.group(1));
        }
        matcher = RETRY_DELAY_JSON.matcher(errorText);
        if (matcher.find()) {
            return toDuration(matcher.group(1));
        }
        return Optional.empty();
    }

    /**
     * Parse a Retry-After header in its delta-seconds form
     */
    public static Optional<Duration> parseRetryAfterHeader(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            return Optional.empty();
        }
        String value = headerValue.trim();
        if (!value.matches("\\d+(?:\\.\\d+)?")) {
            return Optional.empty();
        }
        return toDuration(value);
    }

    private static Optional<Duration> toDuration(String seconds) {
        try {
            double value = Double.parseDouble(seconds);
            if (value < 0 || Double.isInfinite(value)) {
                return Optional.empty();
            }
            return Optional.of(Duration.ofMillis(Math.round(value * 1000.0)));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
