package com.gradeflow.grading;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Maps exceptions raised around a provider call to an {@link ErrorKind}.
 * Never throws.
 */
public final class ErrorClassifier {
    private static final int MAX_CHAIN = 20;
    private static final Pattern STATUS_429 = Pattern.compile("\\b429\\b");

    private ErrorClassifier() {
    }

    public static ClassifiedError classify(Throwable failure) {
        List<Throwable> chain = causeChain(failure);
        String message = failure != null && failure.getMessage() != null
                ? failure.getMessage()
                : (failure != null ? failure.getClass().getSimpleName() : "unknown error");
        Duration suggested = suggestedDelay(chain);

        for (Throwable t : chain) {
            if (t instanceof MalformedResponseException) {
                return new ClassifiedError(ErrorKind.MALFORMED, t.getMessage(), null, 0);
            }
            if (t instanceof FatalConfigurationException) {
                return new ClassifiedError(ErrorKind.FATAL_CONFIGURATION, t.getMessage(), null, 0);
            }
        }

        for (Throwable t : chain) {
            if (!(t instanceof ProviderException)) {
                continue;
            }
            ProviderException pe = (ProviderException) t;
            int status = pe.getStatusCode();
            if (status == 429) {
                return new ClassifiedError(ErrorKind.RATE_LIMITED, pe.getMessage(), suggested, 0);
            }
            if (status == 401 || status == 403 || status == 404) {
                return new ClassifiedError(ErrorKind.FATAL_CONFIGURATION, pe.getMessage(), null, 0);
            }
            if (status == 400 || status == 422) {
                return new ClassifiedError(ErrorKind.MALFORMED, pe.getMessage(), null, 0);
            }
            if (status == 408 || (status >= 500 && status <= 599)) {
                if (isRateLimitText(lower(pe.getMessage()))) {
                    return new ClassifiedError(ErrorKind.RATE_LIMITED, pe.getMessage(), suggested, 0);
                }
                return new ClassifiedError(ErrorKind.TRANSIENT, pe.getMessage(), suggested, 0);
            }
        }

        StringBuilder all = new StringBuilder();
        for (Throwable t : chain) {
            if (t.getMessage() != null) {
                all.append(' ').append(lower(t.getMessage()));
            }
        }
        if (isRateLimitText(all.toString())) {
            return new ClassifiedError(ErrorKind.RATE_LIMITED, message, suggested, 0);
        }

        // network failures, timeouts and anything unrecognised
        return new ClassifiedError(ErrorKind.TRANSIENT, message, suggested, 0);
    }

    private static boolean isRateLimitText(String lowerText) {
        return lowerText.contains("rate limit")
                || lowerText.contains("ratelimit")
                || lowerText.contains("too many requests")
                || lowerText.contains("quota")
                || lowerText.contains("resource_exhausted")
                || lowerText.contains("resource exhausted")
                || lowerText.contains("retry_delay")
                || STATUS_429.matcher(lowerText).find();
    }

    private static Duration suggestedDelay(List<Throwable> chain) {
        for (Throwable t : chain) {
            var parsed = RetryDelayParser.parse(t.getMessage());
            if (parsed.isPresent()) {
                return parsed.get();
            }
        }
        for (Throwable t : chain) {
            if (t instanceof ProviderException) {
                var header = ((ProviderException) t).getRetryAfter();
                if (header.isPresent()) {
                    return header.get();
                }
            }
        }
        return null;
    }

    private static List<Throwable> causeChain(Throwable failure) {
        List<Throwable> chain = new ArrayList<>();
        Throwable current = failure;
        while (current != null && chain.size() < MAX_CHAIN) {
            chain.add(current);
            Throwable next = current.getCause();
            if (next == current) {
                break;
            }
            current = next;
        }
        return chain;
    }

    private static String lower(String s) {
        return s == null ? "" : s.toLowerCase(Locale.ROOT);
    }
}
