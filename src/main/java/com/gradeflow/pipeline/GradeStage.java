package com.gradeflow.pipeline;

import com.gradeflow.grading.GradingAgent;
import com.gradeflow.grading.GradingOutcome;
import com.gradeflow.models.SubmissionRecord;
import com.gradeflow.models.SubmissionStatus;

public class GradeStage implements PipelineStage {
    private final GradingAgent gradingAgent;
    private final double strictness;

    public GradeStage(GradingAgent gradingAgent, double strictness) {
        this.gradingAgent = gradingAgent;
        this.strictness = strictness;
    }

    @Override
    public SubmissionStatus status() {
        return SubmissionStatus.GRADING;
    }

    @Override
    public StageResult run(SubmissionContext context) {
        GradingOutcome outcome = gradingAgent.grade(context.getExtractedText(), context.getRubric(), strictness);
        if (outcome.isGraded()) {
            return StageResult.proceed(context.withRawResult(outcome.getRawResult()));
        }
        SubmissionRecord failed = SubmissionRecord.ungraded(context.getStudentId(), SubmissionStatus.FAILED,
                outcome.getError().describe(), context.getRubric().getMaxTotalPoints(), context.getExtractedText());
        return StageResult.fail(failed, outcome.getError().getKind());
    }
}
