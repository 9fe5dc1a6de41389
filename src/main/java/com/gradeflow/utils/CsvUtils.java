package com.gradeflow.utils;

import com.gradeflow.grading.ResultAggregator;
import com.gradeflow.models.Criterion;
import com.gradeflow.models.CriterionScore;
import com.gradeflow.models.GradingReport;
import com.gradeflow.models.RubricDefinition;
import com.gradeflow.models.SubmissionRecord;
import com.gradeflow.models.SubmissionStatus;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileReader;
import java.io.FileWriter;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Utility class for CSV file operations
 */
public class CsvUtils {
    private static final Logger logger = LoggerFactory.getLogger(CsvUtils.class);

    /**
     * Read a rubric from a CSV file with the columns Criterion, MaxPoints and an optional Description
     */
    public static RubricDefinition readRubricFromCsv(String filePath) throws IOException {
        List<Criterion> criteria = new ArrayList<>();

        try (Reader reader = new FileReader(filePath, StandardCharsets.UTF_8);
             CSVParser csvParser = new CSVParser(reader, CSVFormat.DEFAULT.withFirstRecordAsHeader().withTrim())) {

            boolean hasDescription = csvParser.getHeaderMap().containsKey("Description");
            for (CSVRecord record : csvParser) {
                String name = record.get("Criterion");
                String maxPoints = record.get("MaxPoints");
                try {
                    criteria.add(new Criterion(name, Double.parseDouble(maxPoints),
                            hasDescription ? record.get("Description") : ""));
                } catch (NumberFormatException e) {
                    throw new IOException("Invalid MaxPoints '" + maxPoints + "' for criterion '" + name
                            + "' on line " + record.getRecordNumber(), e);
                }
                logger.debug("Loaded rubric criterion: {}", name);
            }
        } catch (IllegalArgumentException e) {
            throw new IOException("Rubric CSV " + filePath + " must have Criterion and MaxPoints columns: " + e.getMessage(), e);
        }

        logger.info("Read {} rubric criteria from {}", criteria.size(), filePath);
        return new RubricDefinition(criteria);
    }

    /**
     * Write one row per submission of the report, with per-criterion columns in rubric order
     */
    public static void writeReportToCsv(String filePath, GradingReport report) throws IOException {
        List<String> criteria = new ArrayList<>();
        for (SubmissionRecord record : report.getPerSubmission()) {
            if (record.getValidatedResult() != null) {
                for (CriterionScore score : record.getValidatedResult().getCriteriaScores()) {
                    criteria.add(score.getName());
                }
                break;
            }
        }

        try (Writer writer = new FileWriter(filePath, StandardCharsets.UTF_8);
             CSVPrinter csvPrinter = new CSVPrinter(writer, CSVFormat.DEFAULT)) {

            List<String> header = new ArrayList<>(List.of(
                    "StudentID", "Status", "Reason", "TotalScore", "MaxScore", "Percentage", "Grade",
                    "Confidence", "ConfidenceLevel", "Corrections", "CompletedAt", "Feedback"
            ));
            for (String criterion : criteria) {
                header.add(criterion + "_Score");
                header.add(criterion + "_MaxPoints");
                header.add(criterion + "_Feedback");
            }
            csvPrinter.printRecord(header);

            for (SubmissionRecord record : report.getPerSubmission()) {
                boolean graded = record.getStatus() == SubmissionStatus.DONE;
                List<String> row = new ArrayList<>();
                row.add(record.getStudentId());
                row.add(record.getStatus().name());
                row.add(record.getReason());
                row.add(format(record.getTotalScore()));
                row.add(format(record.getMaxScore()));
                row.add(format(record.getPercentage()));
                row.add(graded ? ResultAggregator.letterGrade(record.getPercentage()) : "");
                row.add(record.getMetrics() != null ? String.format(Locale.ROOT, "%.3f", record.getMetrics().confidence()) : "");
                row.add(record.getMetrics() != null ? record.getMetrics().level().name() : "");
                row.add(String.join("; ", record.getCorrections()));
                row.add(record.getCompletedAt().toString());
                row.add(graded ? singleLine(record.getValidatedResult().getFeedback()) : "");

                for (String criterion : criteria) {
                    CriterionScore score = graded ? find(record, criterion) : null;
                    if (score != null) {
                        row.add(format(score.getPoints()));
                        row.add(format(score.getMaxPoints()));
                        row.add(singleLine(score.getFeedback()));
                    } else {
                        // Fill blanks if missing
                        row.add("");
                        row.add("");
                        row.add("");
                    }
                }
                csvPrinter.printRecord(row);
            }
        }

        logger.info("Wrote {} submission rows to {}", report.getPerSubmission().size(), filePath);
    }

    /**
     * Create sample rubric CSV file
     */
    public static void createSampleRubricCsv(String filePath) throws IOException {
        try (Writer writer = new FileWriter(filePath, StandardCharsets.UTF_8);
             CSVPrinter csvPrinter = new CSVPrinter(writer, CSVFormat.DEFAULT)) {

            csvPrinter.printRecord("Criterion", "MaxPoints", "Description");
            csvPrinter.printRecord("Content Quality", "30", "Depth and relevance of content");
            csvPrinter.printRecord("Organization", "30", "Logical structure and flow");
            csvPrinter.printRecord("Critical Thinking", "30", "Analysis and evaluation of evidence");
            csvPrinter.printRecord("Mechanics", "10", "Grammar, spelling, formatting");
        }

        logger.info("Created sample rubric CSV at {}", filePath);
    }

    private static CriterionScore find(SubmissionRecord record, String criterion) {
        for (CriterionScore score : record.getValidatedResult().getCriteriaScores()) {
            if (score.getName().equals(criterion)) {
                return score;
            }
        }
        return null;
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }

    private static String singleLine(String text) {
        return text != null ? text.replace("\r", " ").replace("\n", " ") : "";
    }
}
