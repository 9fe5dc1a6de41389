package com.gradeflow.grading;

import java.util.Objects;

/**
 * Result of a call made through {@link RetryController}: a value or a classified error, never both
 */
public final class CallOutcome<T> {
    private final T value;
    private final ClassifiedError error;
    private final int attempts;

    private CallOutcome(T value, ClassifiedError error, int attempts) {
        this.value = value;
        this.error = error;
        this.attempts = attempts;
    }

    public static <T> CallOutcome<T> success(T value, int attempts) {
        return new CallOutcome<>(Objects.requireNonNull(value, "value"), null, attempts);
    }

    public static <T> CallOutcome<T> failure(ClassifiedError error) {
        return new CallOutcome<>(null, Objects.requireNonNull(error, "error"), error.getAttempts());
    }

    public boolean isSuccess() { return error == null; }
    public T getValue() { return value; }
    public ClassifiedError getError() { return error; }
    public int getAttempts() { return attempts; }

    @Override
    public String toString() {
        return isSuccess()
                ? "CallOutcome{success after " + attempts + " attempt(s)}"
                : "CallOutcome{" + error + "}";
    }
}
