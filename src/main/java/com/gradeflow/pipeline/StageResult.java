package com.gradeflow.pipeline;

import com.gradeflow.grading.ErrorKind;
import com.gradeflow.models.SubmissionRecord;

import java.util.Optional;

/**
 * Either the context to hand to the next stage or the submission's terminal record
 */
public final class StageResult {
    private final SubmissionContext next;
    private final SubmissionRecord terminal;
    private final ErrorKind errorKind;

    private StageResult(SubmissionContext next, SubmissionRecord terminal, ErrorKind errorKind) {
        this.next = next;
        this.terminal = terminal;
        this.errorKind = errorKind;
    }

    public static StageResult proceed(SubmissionContext context) {
        return new StageResult(context, null, null);
    }

    public static StageResult finish(SubmissionRecord record) {
        return new StageResult(null, record, null);
    }

    public static StageResult fail(SubmissionRecord record, ErrorKind errorKind) {
        return new StageResult(null, record, errorKind);
    }

    public boolean isTerminal() {
        return terminal != null;
    }

    public SubmissionContext getNext() {
        return next;
    }

    public SubmissionRecord getTerminal() {
        return terminal;
    }

    /**
     * The grading error behind a FAILED record, if the stage failed on one
     */
    public Optional<ErrorKind> getErrorKind() {
        return Optional.ofNullable(errorKind);
    }
}
