package com.gradeflow.utils;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.gradeflow.models.GradingReport;
import com.gradeflow.models.SubmissionRequest;

import java.io.File;
import java.io.IOException;
import java.util.List;

/**
 * Jackson setup shared by the CLI and the HTTP server
 */
public final class JsonUtils {

    private JsonUtils() {
    }

    public static ObjectMapper createObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Read an LMS snapshot: a JSON array of submissions
     */
    public static List<SubmissionRequest> readSubmissions(ObjectMapper objectMapper, File file) throws IOException {
        return objectMapper.readValue(file, new TypeReference<List<SubmissionRequest>>() {});
    }

    public static void writeReport(ObjectMapper objectMapper, File file, GradingReport report) throws IOException {
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(file, report);
    }
}
