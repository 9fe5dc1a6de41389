package com.gradeflow.pipeline;

import com.gradeflow.models.RubricDefinition;
import com.gradeflow.models.ScoreResult;
import com.gradeflow.models.SubmissionRequest;

/**
 * What a submission has accumulated so far on its way through the stages
 */
public final class SubmissionContext {
    private final SubmissionRequest request;
    private final RubricDefinition rubric;
    private final String extractedText;
    private final ScoreResult rawResult;

    public SubmissionContext(SubmissionRequest request, RubricDefinition rubric) {
        this(request, rubric, null, null);
    }

    private SubmissionContext(SubmissionRequest request, RubricDefinition rubric, String extractedText, ScoreResult rawResult) {
        this.request = request;
        this.rubric = rubric;
        this.extractedText = extractedText;
        this.rawResult = rawResult;
    }

    public SubmissionContext withExtractedText(String text) {
        return new SubmissionContext(request, rubric, text, rawResult);
    }

    public SubmissionContext withRawResult(ScoreResult result) {
        return new SubmissionContext(request, rubric, extractedText, result);
    }

    public SubmissionRequest getRequest() { return request; }
    public RubricDefinition getRubric() { return rubric; }
    public String getStudentId() { return request.getStudentId(); }
    public String getExtractedText() { return extractedText; }
    public ScoreResult getRawResult() { return rawResult; }
}
