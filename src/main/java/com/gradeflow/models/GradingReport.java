package com.gradeflow.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Summary of a terminal grading job. Score statistics are percentages over graded submissions only.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GradingReport {
    private final String jobId;
    private final JobStatus status;
    private final String statusReason;
    private final Instant createdAt;
    private final Instant completedAt;
    private final Map<SubmissionStatus, Integer> countsByStatus;
    private final double averageScore;
    private final double minScore;
    private final double maxScore;
    private final double passRate;
    private final Map<String, Integer> gradeDistribution;
    private final List<SubmissionRecord> perSubmission;

    @JsonCreator
    public GradingReport(
            @JsonProperty("jobId") String jobId,
            @JsonProperty("status") JobStatus status,
            @JsonProperty("statusReason") String statusReason,
            @JsonProperty("createdAt") Instant createdAt,
            @JsonProperty("completedAt") Instant completedAt,
            @JsonProperty("countsByStatus") Map<SubmissionStatus, Integer> countsByStatus,
            @JsonProperty("averageScore") double averageScore,
            @JsonProperty("minScore") double minScore,
            @JsonProperty("maxScore") double maxScore,
            @JsonProperty("passRate") double passRate,
            @JsonProperty("gradeDistribution") Map<String, Integer> gradeDistribution,
            @JsonProperty("perSubmission") List<SubmissionRecord> perSubmission) {
        this.jobId = jobId;
        this.status = status;
        this.statusReason = statusReason != null ? statusReason : "";
        this.createdAt = createdAt;
        this.completedAt = completedAt;
        this.countsByStatus = countsByStatus != null ? Map.copyOf(countsByStatus) : Map.of();
        this.averageScore = averageScore;
        this.minScore = minScore;
        this.maxScore = maxScore;
        this.passRate = passRate;
        this.gradeDistribution = gradeDistribution != null ? Map.copyOf(gradeDistribution) : Map.of();
        this.perSubmission = perSubmission != null ? List.copyOf(perSubmission) : List.of();
    }

    public String getJobId() { return jobId; }
    public JobStatus getStatus() { return status; }
    public String getStatusReason() { return statusReason; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getCompletedAt() { return completedAt; }
    public Map<SubmissionStatus, Integer> getCountsByStatus() { return countsByStatus; }
    public double getAverageScore() { return averageScore; }
    public double getMinScore() { return minScore; }
    public double getMaxScore() { return maxScore; }
    public double getPassRate() { return passRate; }
    public Map<String, Integer> getGradeDistribution() { return gradeDistribution; }
    public List<SubmissionRecord> getPerSubmission() { return perSubmission; }

    public int count(SubmissionStatus status) {
        return countsByStatus.getOrDefault(status, 0);
    }

    public int getGraded() { return count(SubmissionStatus.DONE); }
    public int getFailed() { return count(SubmissionStatus.FAILED); }
    public int getPreviouslyGraded() { return count(SubmissionStatus.PREVIOUSLY_GRADED); }
    public int getNoFiles() { return count(SubmissionStatus.NO_FILES); }
    public int getNotSubmitted() { return count(SubmissionStatus.NOT_SUBMITTED); }
    public int getNoReadableFiles() { return count(SubmissionStatus.NO_READABLE_FILES); }

    @Override
    public String toString() {
        return "GradingReport{" +
                "jobId='" + jobId + '\'' +
                ", status=" + status +
                ", graded=" + getGraded() +
                ", failed=" + getFailed() +
                ", averageScore=" + String.format("%.1f", averageScore) +
                '}';
    }
}
