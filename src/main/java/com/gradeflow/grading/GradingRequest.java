package com.gradeflow.grading;

import com.gradeflow.models.RubricDefinition;

import java.util.Objects;

/**
 * What is sent to the grading provider for one submission
 *
 * @param strictness    0 = lenient, 1 = strict
 * @param reformulation 0 for the first request, incremented each time a malformed answer forces a rephrased request
 */
public record GradingRequest(String text, RubricDefinition rubric, double strictness, int reformulation) {

    public GradingRequest {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(rubric, "rubric");
        if (strictness < 0.0 || strictness > 1.0 || Double.isNaN(strictness)) {
            throw new IllegalArgumentException("strictness must be within [0,1], got " + strictness);
        }
    }

    public boolean isReformulated() {
        return reformulation > 0;
    }

    public GradingRequest reformulated() {
        return new GradingRequest(text, rubric, strictness, reformulation + 1);
    }
}
