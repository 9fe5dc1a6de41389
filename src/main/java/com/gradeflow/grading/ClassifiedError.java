package com.gradeflow.grading;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * A provider failure reduced to its kind, a short message and an optional provider-suggested retry delay
 */
public final class ClassifiedError {
    private static final int MAX_MESSAGE_LENGTH = 300;

    private final ErrorKind kind;
    private final String message;
    private final Duration suggestedDelay;
    private final int attempts;

    public ClassifiedError(ErrorKind kind, String message, Duration suggestedDelay, int attempts) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.message = shorten(message);
        this.suggestedDelay = suggestedDelay;
        this.attempts = attempts;
    }

    public static ClassifiedError of(ErrorKind kind, String message) {
        return new ClassifiedError(kind, message, null, 0);
    }

    public ErrorKind getKind() { return kind; }
    public String getMessage() { return message; }
    public Optional<Duration> getSuggestedDelay() { return Optional.ofNullable(suggestedDelay); }
    public int getAttempts() { return attempts; }

    public ClassifiedError withAttempts(int attemptCount) {
        return new ClassifiedError(kind, message, suggestedDelay, attemptCount);
    }

    public ClassifiedError withKind(ErrorKind newKind) {
        return new ClassifiedError(newKind, message, suggestedDelay, attempts);
    }

    /**
     * Human-readable reason used on terminal submission records
     */
    public String describe() {
        StringBuilder reason = new StringBuilder(kind.getLabel());
        if (!message.isEmpty()) {
            reason.append(": ").append(message);
        }
        if (attempts > 1) {
            reason.append(" (after ").append(attempts).append(" attempts)");
        }
        return reason.toString();
    }

    private static String shorten(String raw) {
        if (raw == null) {
            return "";
        }
        String flat = raw.replaceAll("\\s+", " ").trim();
        return flat.length() > MAX_MESSAGE_LENGTH ? flat.substring(0, MAX_MESSAGE_LENGTH) + "..." : flat;
    }

    @Override
    public String toString() {
        return "ClassifiedError{" +
                "kind=" + kind +
                ", message='" + message + '\'' +
                ", suggestedDelay=" + suggestedDelay +
                ", attempts=" + attempts +
                '}';
    }
}
