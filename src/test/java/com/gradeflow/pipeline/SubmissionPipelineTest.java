package com.gradeflow.pipeline;

import com.gradeflow.extraction.ExtractionClient;
import com.gradeflow.grading.AccuracyValidator;
import com.gradeflow.grading.ErrorKind;
import com.gradeflow.grading.FakeGradingProvider;
import com.gradeflow.grading.ProviderException;
import com.gradeflow.grading.RecordingSleeper;
import com.gradeflow.grading.RetryPolicy;
import com.gradeflow.models.Criterion;
import com.gradeflow.models.DeclaredStatus;
import com.gradeflow.models.FileReference;
import com.gradeflow.models.RubricDefinition;
import com.gradeflow.models.SubmissionRecord;
import com.gradeflow.models.SubmissionRequest;
import com.gradeflow.models.SubmissionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SubmissionPipelineTest {

    private static final RubricDefinition RUBRIC = RubricDefinition.of(
            new Criterion("Argument", 6),
            new Criterion("Sources", 4));

    @TempDir
    Path tempDir;

    private PipelineFactory factory;
    private SubmissionRequest essay;

    @BeforeEach
    void setUp() throws Exception {
        factory = new PipelineFactory(RetryPolicy.defaults(), 2, new ExtractionClient(),
                new AccuracyValidator(), new RecordingSleeper());
        Path file = tempDir.resolve("essay.txt");
        Files.writeString(file, "The argument is supported by three sources.");
        essay = SubmissionRequest.withFiles("s-1", new FileReference("essay.txt", file.toString()));
    }

    @Test
    void gradesSubmissionThroughAllStages() {
        FakeGradingProvider provider = FakeGradingProvider.scoring(0.5);
        SubmissionPipeline pipeline = factory.create(RUBRIC, 0.5, provider);

        StageResult result = pipeline.run(essay, new CancellationToken());

        assertTrue(result.isTerminal());
        SubmissionRecord record = result.getTerminal();
        assertEquals(SubmissionStatus.DONE, record.getStatus());
        assertEquals(5.0, record.getTotalScore());
        assertEquals(10.0, record.getMaxScore());
        assertNotNull(record.getMetrics());
        assertTrue(record.getExtractedText().startsWith("=== File: essay.txt ==="));
        assertTrue(provider.getRequests().get(0).text().contains("three sources"));
    }

    @Test
    void notSubmittedNeverReachesGrading() {
        FakeGradingProvider provider = FakeGradingProvider.scoring(1.0);
        SubmissionPipeline pipeline = factory.create(RUBRIC, 0.5, provider);

        SubmissionRecord record = pipeline.run(
                SubmissionRequest.declared("s-2", DeclaredStatus.NOT_SUBMITTED), new CancellationToken()).getTerminal();

        assertEquals(SubmissionStatus.NOT_SUBMITTED, record.getStatus());
        assertEquals(0.0, record.getTotalScore());
        assertEquals(0, provider.getCalls());
    }

    @Test
    void shortCircuitsFollowDeclaredStatus() {
        SubmissionPipeline pipeline = factory.create(RUBRIC, 0.5, FakeGradingProvider.scoring(1.0));

        assertEquals(SubmissionStatus.PREVIOUSLY_GRADED, pipeline.shortCircuit(
                SubmissionRequest.declared("a", DeclaredStatus.PREVIOUSLY_GRADED)).get().getStatus());
        assertEquals(SubmissionStatus.NO_FILES, pipeline.shortCircuit(
                SubmissionRequest.declared("b", DeclaredStatus.NO_FILES)).get().getStatus());
        assertEquals(SubmissionStatus.NO_FILES, pipeline.shortCircuit(
                new SubmissionRequest("c", DeclaredStatus.HAS_FILES, List.of())).get().getStatus());
        assertTrue(pipeline.shortCircuit(essay).isEmpty());
    }

    @Test
    void unreadableFilesEndWithoutGrading() {
        FakeGradingProvider provider = FakeGradingProvider.scoring(1.0);
        SubmissionPipeline pipeline = factory.create(RUBRIC, 0.5, provider);
        SubmissionRequest request = SubmissionRequest.withFiles("s-3",
                new FileReference("scan.png", tempDir.resolve("scan.png").toString()));

        SubmissionRecord record = pipeline.run(request, new CancellationToken()).getTerminal();

        assertEquals(SubmissionStatus.NO_READABLE_FILES, record.getStatus());
        assertTrue(record.getReason().startsWith("No readable files"));
        assertEquals(0, provider.getCalls());
    }

    @Test
    void providerFailureFailsSubmissionWithReason() {
        FakeGradingProvider provider = new FakeGradingProvider((request, call) -> {
            throw new ProviderException(401, "Incorrect API key provided");
        });
        StageResult result = factory.create(RUBRIC, 0.5, provider).run(essay, new CancellationToken());

        assertEquals(SubmissionStatus.FAILED, result.getTerminal().getStatus());
        assertEquals(ErrorKind.FATAL_CONFIGURATION, result.getErrorKind().orElseThrow());
        assertTrue(result.getTerminal().getReason().contains("Incorrect API key"));
    }

    @Test
    void cancelledTokenStopsBeforeNextStage() {
        FakeGradingProvider provider = FakeGradingProvider.scoring(1.0);
        CancellationToken token = new CancellationToken();
        assertTrue(token.cancel());
        assertFalse(token.cancel());

        SubmissionRecord record = factory.create(RUBRIC, 0.5, provider).run(essay, token).getTerminal();

        assertEquals(SubmissionStatus.FAILED, record.getStatus());
        assertEquals(SubmissionPipeline.CANCELLED_REASON, record.getReason());
        assertEquals(0, provider.getCalls());
    }
}
