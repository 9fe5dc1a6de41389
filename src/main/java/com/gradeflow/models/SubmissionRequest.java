package com.gradeflow.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * One selected student's submission as snapshotted from the LMS at job start
 */
public final class SubmissionRequest {
    private final String studentId;
    private final DeclaredStatus declaredStatus;
    private final List<FileReference> files;

    @JsonCreator
    public SubmissionRequest(
            @JsonProperty("studentId") String studentId,
            @JsonProperty("declaredStatus") DeclaredStatus declaredStatus,
            @JsonProperty("files") List<FileReference> files) {
        this.studentId = Objects.requireNonNull(studentId, "studentId");
        this.declaredStatus = declaredStatus != null ? declaredStatus : DeclaredStatus.HAS_FILES;
        this.files = files != null ? List.copyOf(files) : List.of();
    }

    public static SubmissionRequest withFiles(String studentId, FileReference... files) {
        return new SubmissionRequest(studentId, DeclaredStatus.HAS_FILES, List.of(files));
    }

    public static SubmissionRequest declared(String studentId, DeclaredStatus status) {
        return new SubmissionRequest(studentId, status, List.of());
    }

    public String getStudentId() { return studentId; }
    public DeclaredStatus getDeclaredStatus() { return declaredStatus; }
    public List<FileReference> getFiles() { return files; }

    @Override
    public String toString() {
        return "SubmissionRequest{" +
                "studentId='" + studentId + '\'' +
                ", declaredStatus=" + declaredStatus +
                ", files=" + files.size() +
                '}';
    }
}
