package com.gradeflow.grading;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Runs one provider request with exponential backoff, jitter and provider-suggested delays.
 *
 * <p>Failures never escape: every call ends in a {@link CallOutcome}. Rate-limit and transient
 * failures back off with independent attempt counters but share one retry budget, so a call makes
 * at most {@code maxRetries + 1} attempts. Malformed responses and configuration errors return
 * immediately. Rate-limit hits feed the job's {@link RetryState}; once the streak exceeds the
 * circuit-breaker threshold the controller answers {@link ErrorKind#PROVIDER_EXHAUSTED}.
 */
public class RetryController {
    private static final Logger logger = LoggerFactory.getLogger(RetryController.class);

    private final RetryPolicy policy;
    private final RetryState state;
    private final Sleeper sleeper;
    private final DoubleSupplier jitter;
    private final Clock clock;

    public RetryController(RetryPolicy policy, RetryState state) {
        this(policy, state, Sleeper.threadSleeper(), () -> ThreadLocalRandom.current().nextDouble(), Clock.systemUTC());
    }

    public RetryController(RetryPolicy policy, RetryState state, Sleeper sleeper, DoubleSupplier jitter, Clock clock) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.state = Objects.requireNonNull(state, "state");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.jitter = Objects.requireNonNull(jitter, "jitter");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public <T> CallOutcome<T> call(Callable<T> request) {
        int attempts = 0;
        int rateLimitAttempts = 0;
        int transientAttempts = 0;

        while (true) {
            if (state.isTripped(policy.circuitBreakerThreshold())) {
                return CallOutcome.failure(exhausted(attempts));
            }
            try {
                sleeper.sleep(state.reserveRequestSlot(policy.minRequestInterval(), clock.millis()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return CallOutcome.failure(interrupted(attempts));
            }

            attempts++;
            ClassifiedError error;
            try {
                T value = request.call();
                state.recordResponse();
                return CallOutcome.success(value, attempts);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return CallOutcome.failure(interrupted(attempts));
            } catch (Exception e) {
                error = ErrorClassifier.classify(e).withAttempts(attempts);
            }

            Duration delay;
            switch (error.getKind()) {
                case RATE_LIMITED:
                    int streak = state.recordRateLimitHit();
                    if (state.isTripped(policy.circuitBreakerThreshold())) {
                        logger.error("Circuit breaker tripped after {} consecutive rate-limit hits", streak);
                        return CallOutcome.failure(exhausted(attempts));
                    }
                    delay = nextDelay(error, rateLimitAttempts++);
                    break;
                case TRANSIENT:
                    delay = nextDelay(error, transientAttempts++);
                    break;
                case MALFORMED:
                    // the provider did answer, so the rate-limit streak is over
                    state.recordResponse();
                    return CallOutcome.failure(error);
                default:
                    return CallOutcome.failure(error);
            }

            if (attempts > policy.maxRetries()) {
                logger.warn("Giving up after {} attempts: {}", attempts, error.describe());
                return CallOutcome.failure(error);
            }

            logger.warn("{} on attempt {}/{}, retrying in {} ms",
                    error.getKind().getLabel(), attempts, policy.maxRetries() + 1, delay.toMillis());
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return CallOutcome.failure(interrupted(attempts));
            }
        }
    }

    /**
     * Provider-suggested delay when present, otherwise the computed backoff for this attempt
     */
    Duration nextDelay(ClassifiedError error, int attempt) {
        return error.getSuggestedDelay().orElseGet(() -> computeBackoff(attempt));
    }

    /**
     * {@code min(baseDelay * 2^attempt + uniform(0, 1s), maxDelay)}
     */
    public Duration computeBackoff(int attempt) {
        long baseMillis = policy.baseDelay().toMillis();
        long capMillis = policy.maxDelay().toMillis();
        int exponent = Math.max(0, Math.min(attempt, 30));
        double exponential = baseMillis * Math.pow(2, exponent);
        double jitterMillis = Math.max(0.0, Math.min(1.0, jitter.getAsDouble())) * 1000.0;
        long delay = (long) Math.min(exponential + jitterMillis, (double) capMillis);
        return Duration.ofMillis(delay);
    }

    public RetryState getState() {
        return state;
    }

    private ClassifiedError exhausted(int attempts) {
        return new ClassifiedError(ErrorKind.PROVIDER_EXHAUSTED,
                "more than " + policy.circuitBreakerThreshold() + " consecutive rate-limit responses",
                null, attempts);
    }

    private static ClassifiedError interrupted(int attempts) {
        return new ClassifiedError(ErrorKind.TRANSIENT, "interrupted while waiting for the provider", null, attempts);
    }
}
