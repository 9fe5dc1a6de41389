package com.gradeflow.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable terminal record of one submission: status, human-readable reason and, when graded, the results
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SubmissionRecord {
    private final String studentId;
    private final SubmissionStatus status;
    private final String reason;
    private final double maxScore;
    private final String extractedText;
    private final ScoreResult rawResult;
    private final ScoreResult validatedResult;
    private final AccuracyMetrics metrics;
    private final List<String> corrections;
    private final Instant completedAt;

    @JsonCreator
    public SubmissionRecord(
            @JsonProperty("studentId") String studentId,
            @JsonProperty("status") SubmissionStatus status,
            @JsonProperty("reason") String reason,
            @JsonProperty("maxScore") double maxScore,
            @JsonProperty("extractedText") String extractedText,
            @JsonProperty("rawResult") ScoreResult rawResult,
            @JsonProperty("validatedResult") ScoreResult validatedResult,
            @JsonProperty("metrics") AccuracyMetrics metrics,
            @JsonProperty("corrections") List<String> corrections,
            @JsonProperty("completedAt") Instant completedAt) {
        this.studentId = Objects.requireNonNull(studentId, "studentId");
        this.status = Objects.requireNonNull(status, "status");
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Submission record requires a terminal status, got " + status);
        }
        this.reason = reason != null ? reason : "";
        this.maxScore = maxScore;
        this.extractedText = extractedText;
        this.rawResult = rawResult;
        this.validatedResult = validatedResult;
        this.metrics = metrics;
        this.corrections = corrections != null ? List.copyOf(corrections) : List.of();
        this.completedAt = completedAt != null ? completedAt : Instant.now();
    }

    public static SubmissionRecord graded(String studentId, String extractedText, ScoreResult raw,
                                          ScoreResult validated, AccuracyMetrics metrics, List<String> corrections) {
        return new SubmissionRecord(studentId, SubmissionStatus.DONE, "Graded", validated.getMaxScore(),
                extractedText, raw, validated, metrics, corrections, Instant.now());
    }

    public static SubmissionRecord ungraded(String studentId, SubmissionStatus status, String reason, double maxScore) {
        return ungraded(studentId, status, reason, maxScore, null);
    }

    public static SubmissionRecord ungraded(String studentId, SubmissionStatus status, String reason,
                                            double maxScore, String extractedText) {
        return new SubmissionRecord(studentId, status, reason, maxScore, extractedText,
                null, null, null, List.of(), Instant.now());
    }

    public String getStudentId() { return studentId; }
    public SubmissionStatus getStatus() { return status; }
    public String getReason() { return reason; }
    public double getMaxScore() { return maxScore; }
    /**
     * Kept in memory for the grading stages only; never written to reports
     */
    @JsonIgnore
    public String getExtractedText() { return extractedText; }
    public ScoreResult getRawResult() { return rawResult; }
    public ScoreResult getValidatedResult() { return validatedResult; }
    public AccuracyMetrics getMetrics() { return metrics; }
    public List<String> getCorrections() { return corrections; }
    public Instant getCompletedAt() { return completedAt; }

    /**
     * Validated total, or 0 for submissions that were never graded
     */
    public double getTotalScore() {
        return validatedResult != null ? validatedResult.getTotalScore() : 0.0;
    }

    @JsonIgnore
    public double getPercentage() {
        return maxScore > 0 ? getTotalScore() / maxScore * 100.0 : 0.0;
    }

    @Override
    public String toString() {
        return "SubmissionRecord{" +
                "studentId='" + studentId + '\'' +
                ", status=" + status +
                ", reason='" + reason + '\'' +
                ", totalScore=" + getTotalScore() +
                '}';
    }
}
