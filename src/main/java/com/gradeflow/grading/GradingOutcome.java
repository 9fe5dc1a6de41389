package com.gradeflow.grading;

import com.gradeflow.models.ScoreResult;

import java.util.Objects;

/**
 * What {@link GradingAgent#grade} hands back: an unvalidated score result or a classified error
 */
public final class GradingOutcome {
    private final ScoreResult rawResult;
    private final ClassifiedError error;
    private final int providerCalls;

    private GradingOutcome(ScoreResult rawResult, ClassifiedError error, int providerCalls) {
        this.rawResult = rawResult;
        this.error = error;
        this.providerCalls = providerCalls;
    }

    public static GradingOutcome graded(ScoreResult rawResult, int providerCalls) {
        return new GradingOutcome(Objects.requireNonNull(rawResult, "rawResult"), null, providerCalls);
    }

    public static GradingOutcome failed(ClassifiedError error, int providerCalls) {
        return new GradingOutcome(null, Objects.requireNonNull(error, "error"), providerCalls);
    }

    public boolean isGraded() { return error == null; }
    public ScoreResult getRawResult() { return rawResult; }
    public ClassifiedError getError() { return error; }

    /**
     * Provider requests issued for this submission, retries and reformulations included
     */
    public int getProviderCalls() { return providerCalls; }
}
