package com.gradeflow.pipeline;

import com.gradeflow.extraction.ExtractionClient;
import com.gradeflow.extraction.ExtractionResult;
import com.gradeflow.models.SubmissionRecord;
import com.gradeflow.models.SubmissionStatus;

public class ExtractStage implements PipelineStage {
    private final ExtractionClient extractionClient;

    public ExtractStage(ExtractionClient extractionClient) {
        this.extractionClient = extractionClient;
    }

    @Override
    public SubmissionStatus status() {
        return SubmissionStatus.EXTRACTING;
    }

    @Override
    public StageResult run(SubmissionContext context) {
        ExtractionResult result = extractionClient.extract(context.getRequest().getFiles());
        if (!result.hasText()) {
            String reason = "No readable files: " + String.join("; ", result.failures());
            return StageResult.finish(SubmissionRecord.ungraded(context.getStudentId(),
                    SubmissionStatus.NO_READABLE_FILES, reason, context.getRubric().getMaxTotalPoints()));
        }
        return StageResult.proceed(context.withExtractedText(result.text()));
    }
}
