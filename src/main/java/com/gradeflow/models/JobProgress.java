package com.gradeflow.models;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Point-in-time view of a grading job
 *
 * @param countsByStatus number of submissions currently in each status, terminal or not
 */
public record JobProgress(
        String jobId,
        JobStatus status,
        int completedCount,
        int totalCount,
        Map<SubmissionStatus, Integer> countsByStatus,
        Instant createdAt,
        Instant completedAt
) {
    public JobProgress {
        countsByStatus = Map.copyOf(countsByStatus);
    }

    /**
     * Final progress of a terminal job; statuses with no submissions are left out
     */
    public static JobProgress of(GradingReport report) {
        Map<SubmissionStatus, Integer> counts = new EnumMap<>(SubmissionStatus.class);
        report.getCountsByStatus().forEach((status, count) -> {
            if (count > 0) {
                counts.put(status, count);
            }
        });
        int total = report.getPerSubmission().size();
        return new JobProgress(report.getJobId(), report.getStatus(), total, total, counts,
                report.getCreatedAt(), report.getCompletedAt());
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
