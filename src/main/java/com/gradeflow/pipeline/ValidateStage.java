package com.gradeflow.pipeline;

import com.gradeflow.grading.AccuracyValidator;
import com.gradeflow.grading.ValidationResult;
import com.gradeflow.models.SubmissionRecord;
import com.gradeflow.models.SubmissionStatus;

public class ValidateStage implements PipelineStage {
    private final AccuracyValidator validator;

    public ValidateStage(AccuracyValidator validator) {
        this.validator = validator;
    }

    @Override
    public SubmissionStatus status() {
        return SubmissionStatus.VALIDATING;
    }

    @Override
    public StageResult run(SubmissionContext context) {
        ValidationResult result = validator.validate(context.getRawResult(), context.getRubric());
        return StageResult.finish(SubmissionRecord.graded(context.getStudentId(), context.getExtractedText(),
                context.getRawResult(), result.validated(), result.metrics(), result.corrections()));
    }
}
