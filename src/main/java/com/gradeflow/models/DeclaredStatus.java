package com.gradeflow.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Submission state as reported by the LMS when the job starts
 */
public enum DeclaredStatus {
    NOT_SUBMITTED("not_submitted"),
    PREVIOUSLY_GRADED("previously_graded"),
    NO_FILES("no_files"),
    HAS_FILES("has_files");

    private final String value;

    DeclaredStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static DeclaredStatus fromValue(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Declared status is required");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (DeclaredStatus status : values()) {
            if (status.value.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown declared status: " + raw);
    }
}
