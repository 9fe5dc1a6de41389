package com.gradeflow;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gradeflow.models.GradingReport;
import com.gradeflow.models.JobStatus;
import com.gradeflow.models.RubricDefinition;
import com.gradeflow.models.SubmissionRequest;
import com.gradeflow.utils.CsvUtils;
import com.gradeflow.utils.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.time.Duration;
import java.util.List;

/**
 * Batch processing interface: grades one LMS snapshot against a rubric and writes the report as JSON and CSV
 */
public class GradingBatch {
    private static final Logger logger = LoggerFactory.getLogger(GradingBatch.class);

    private static final Duration POLL_INTERVAL = Duration.ofMillis(500);

    public static void main(String[] args) {
        if (args.length == 2 && args[0].equals("--sample-rubric")) {
            try {
                CsvUtils.createSampleRubricCsv(args[1]);
                System.out.println("Sample rubric written to " + args[1]);
            } catch (Exception e) {
                System.err.println("Could not write sample rubric: " + e.getMessage());
                System.exit(1);
            }
            return;
        }
        if (args.length < 2) {
            System.out.println("Usage: java GradingBatch <rubric.csv> <submissions.json> [report.json] [report.csv]");
            System.out.println("       java GradingBatch --sample-rubric <rubric.csv>");
            System.out.println("Rubric CSV columns: Criterion,MaxPoints,Description");
            System.out.println("Submissions JSON: [{\"studentId\": \"s1\", \"declaredStatus\": \"has_files\",");
            System.out.println("                    \"files\": [{\"name\": \"essay.txt\", \"location\": \"/path/or/url\"}]}]");
            return;
        }

        String rubricFile = args[0];
        String submissionsFile = args[1];
        String reportJson = args.length > 2 ? args[2] : "grading_report.json";
        String reportCsv = args.length > 3 ? args[3] : "grading_report.csv";

        ObjectMapper objectMapper = JsonUtils.createObjectMapper();
        try (GradingService service = GradingService.create()) {
            RubricDefinition rubric = CsvUtils.readRubricFromCsv(rubricFile);
            List<SubmissionRequest> submissions = JsonUtils.readSubmissions(objectMapper, new File(submissionsFile));

            String jobId = service.startJob(submissions, rubric).toCompletableFuture().join();
            logger.info("Started job {} for {} submissions", jobId, submissions.size());
            GradingReport report = service.awaitReport(jobId, POLL_INTERVAL).toCompletableFuture().join();

            JsonUtils.writeReport(objectMapper, new File(reportJson), report);
            CsvUtils.writeReportToCsv(reportCsv, report);

            System.out.println("Grading finished: " + report.getStatus()
                    + (report.getStatusReason().isEmpty() ? "" : " (" + report.getStatusReason() + ")"));
            System.out.printf("Graded %d, failed %d, not submitted %d, no files %d, unreadable %d, previously graded %d%n",
                    report.getGraded(), report.getFailed(), report.getNotSubmitted(), report.getNoFiles(),
                    report.getNoReadableFiles(), report.getPreviouslyGraded());
            System.out.printf("Average %.1f%%, pass rate %.0f%%%n", report.getAverageScore(), report.getPassRate() * 100);
            System.out.println("Report: " + reportJson + ", " + reportCsv);

            if (report.getStatus() == JobStatus.FAILED) {
                System.exit(1);
            }
        } catch (Exception e) {
            logger.error("Batch grading failed", e);
            System.err.println("Error processing batch: " + e.getMessage());
            System.exit(1);
        }
    }
}
