package com.gradeflow.models;

/**
 * Lifecycle of one submission inside a grading job
 */
public enum SubmissionStatus {
    PENDING(false),
    EXTRACTING(false),
    GRADING(false),
    VALIDATING(false),
    DONE(true),
    FAILED(true),
    NOT_SUBMITTED(true),
    NO_FILES(true),
    NO_READABLE_FILES(true),
    PREVIOUSLY_GRADED(true);

    private final boolean terminal;

    SubmissionStatus(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }

    /**
     * Terminal states reached without grading because there was nothing to grade
     */
    public boolean isShortCircuit() {
        return this == NOT_SUBMITTED || this == NO_FILES || this == NO_READABLE_FILES || this == PREVIOUSLY_GRADED;
    }
}
