package com.gradeflow.pipeline;

import com.gradeflow.models.SubmissionStatus;

/**
 * One step of the submission pipeline. Stages block and must run off the actor threads.
 */
public interface PipelineStage {

    /**
     * Status the submission holds while this stage runs
     */
    SubmissionStatus status();

    StageResult run(SubmissionContext context);
}
