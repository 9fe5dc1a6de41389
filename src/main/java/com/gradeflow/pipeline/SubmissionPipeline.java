package com.gradeflow.pipeline;

import com.gradeflow.models.RubricDefinition;
import com.gradeflow.models.SubmissionRecord;
import com.gradeflow.models.SubmissionRequest;
import com.gradeflow.models.SubmissionStatus;

import java.util.List;
import java.util.Optional;

/**
 * The fixed stage sequence Extract, Grade, Validate plus the short-circuit rules applied before it.
 * Shared by all submissions of a job; holds no per-submission state.
 */
public class SubmissionPipeline {
    public static final String CANCELLED_REASON = "Cancelled";

    private final List<PipelineStage> stages;
    private final RubricDefinition rubric;

    public SubmissionPipeline(ExtractStage extract, GradeStage grade, ValidateStage validate, RubricDefinition rubric) {
        this.stages = List.of(extract, grade, validate);
        this.rubric = rubric;
    }

    public List<PipelineStage> getStages() {
        return stages;
    }

    public RubricDefinition getRubric() {
        return rubric;
    }

    /**
     * Terminal record for submissions that have nothing to grade, decided from the LMS snapshot alone
     */
    public Optional<SubmissionRecord> shortCircuit(SubmissionRequest request) {
        double maxScore = rubric.getMaxTotalPoints();
        switch (request.getDeclaredStatus()) {
            case NOT_SUBMITTED:
                return Optional.of(SubmissionRecord.ungraded(request.getStudentId(),
                        SubmissionStatus.NOT_SUBMITTED, "No submission", maxScore));
            case PREVIOUSLY_GRADED:
                return Optional.of(SubmissionRecord.ungraded(request.getStudentId(),
                        SubmissionStatus.PREVIOUSLY_GRADED, "Already graded in the LMS", maxScore));
            case NO_FILES:
                return Optional.of(SubmissionRecord.ungraded(request.getStudentId(),
                        SubmissionStatus.NO_FILES, "Submission has no files", maxScore));
            default:
                if (request.getFiles().isEmpty()) {
                    return Optional.of(SubmissionRecord.ungraded(request.getStudentId(),
                            SubmissionStatus.NO_FILES, "Submission has no files", maxScore));
                }
                return Optional.empty();
        }
    }

    public SubmissionRecord cancelled(String studentId) {
        return SubmissionRecord.ungraded(studentId, SubmissionStatus.FAILED, CANCELLED_REASON, rubric.getMaxTotalPoints());
    }

    /**
     * Runs one submission to its terminal record on the calling thread, checking the token between stages
     */
    public StageResult run(SubmissionRequest request, CancellationToken token) {
        Optional<SubmissionRecord> shortCircuit = shortCircuit(request);
        if (shortCircuit.isPresent()) {
            return StageResult.finish(shortCircuit.get());
        }
        SubmissionContext context = new SubmissionContext(request, rubric);
        for (PipelineStage stage : stages) {
            if (token.isCancelled()) {
                return StageResult.finish(cancelled(request.getStudentId()));
            }
            StageResult result = stage.run(context);
            if (result.isTerminal()) {
                return result;
            }
            context = result.getNext();
        }
        throw new IllegalStateException("Pipeline ended without a terminal record for " + request.getStudentId());
    }
}
