package com.gradeflow.grading;

/**
 * Classification of a failed provider interaction
 */
public enum ErrorKind {
    RATE_LIMITED("Rate limited", true),
    TRANSIENT("Transient provider error", true),
    MALFORMED("Malformed provider response", false),
    INVALID_RESPONSE("Invalid provider response", false),
    PROVIDER_EXHAUSTED("Provider exhausted", false),
    FATAL_CONFIGURATION("Fatal configuration", false);

    private final String label;
    private final boolean retryable;

    ErrorKind(String label, boolean retryable) {
        this.label = label;
        this.retryable = retryable;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Whether the retry controller backs off and tries again for this kind
     */
    public boolean isRetryable() {
        return retryable;
    }
}
