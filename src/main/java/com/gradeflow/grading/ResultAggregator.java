package com.gradeflow.grading;

import com.gradeflow.models.GradingReport;
import com.gradeflow.models.JobStatus;
import com.gradeflow.models.SubmissionRecord;
import com.gradeflow.models.SubmissionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the {@link GradingReport} of a terminal job from its submission records.
 * Score statistics are percentages over graded ({@code DONE}) submissions only.
 */
public class ResultAggregator {
    private static final Logger logger = LoggerFactory.getLogger(ResultAggregator.class);

    public static final double DEFAULT_PASSING_THRESHOLD = 0.7;

    private final double passingThreshold;

    public ResultAggregator() {
        this(DEFAULT_PASSING_THRESHOLD);
    }

    public ResultAggregator(double passingThreshold) {
        if (passingThreshold < 0.0 || passingThreshold > 1.0) {
            throw new IllegalArgumentException("passingThreshold must be within [0,1]: " + passingThreshold);
        }
        this.passingThreshold = passingThreshold;
    }

    public GradingReport aggregate(String jobId, JobStatus status, String statusReason,
                                   Instant createdAt, Instant completedAt, List<SubmissionRecord> records) {
        Map<SubmissionStatus, Integer> counts = new EnumMap<>(SubmissionStatus.class);
        for (SubmissionStatus s : SubmissionStatus.values()) {
            if (s.isTerminal()) {
                counts.put(s, 0);
            }
        }

        Map<String, Integer> distribution = new LinkedHashMap<>();
        for (String letter : new String[]{"A", "B", "C", "D", "F"}) {
            distribution.put(letter, 0);
        }

        int graded = 0;
        int passed = 0;
        double sum = 0.0;
        double min = Double.MAX_VALUE;
        double max = 0.0;
        for (SubmissionRecord record : records) {
            counts.merge(record.getStatus(), 1, Integer::sum);
            if (record.getStatus() != SubmissionStatus.DONE) {
                continue;
            }
            double percentage = record.getPercentage();
            graded++;
            sum += percentage;
            min = Math.min(min, percentage);
            max = Math.max(max, percentage);
            if (percentage >= passingThreshold * 100.0) {
                passed++;
            }
            distribution.merge(letterGrade(percentage), 1, Integer::sum);
        }

        double average = graded > 0 ? sum / graded : 0.0;
        double passRate = graded > 0 ? (double) passed / graded : 0.0;
        if (graded == 0) {
            min = 0.0;
        }

        GradingReport report = new GradingReport(jobId, status, statusReason, createdAt, completedAt, counts,
                average, min, max, passRate, distribution, records);
        logger.info("Job {} finished {}: {} graded, {} failed, average {}%",
                jobId, status, report.getGraded(), report.getFailed(), String.format("%.1f", average));
        return report;
    }

    public double getPassingThreshold() {
        return passingThreshold;
    }

    public static String letterGrade(double percentage) {
        if (percentage >= 90) {
            return "A";
        } else if (percentage >= 80) {
            return "B";
        } else if (percentage >= 70) {
            return "C";
        } else if (percentage >= 60) {
            return "D";
        }
        return "F";
    }
}
