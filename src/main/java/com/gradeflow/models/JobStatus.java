package com.gradeflow.models;

public enum JobStatus {
    RUNNING,
    COMPLETED,
    PARTIALLY_FAILED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
