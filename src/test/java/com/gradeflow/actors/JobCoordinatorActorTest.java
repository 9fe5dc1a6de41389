package com.gradeflow.actors;

import akka.actor.testkit.typed.javadsl.ActorTestKit;
import akka.actor.testkit.typed.javadsl.TestProbe;
import akka.actor.typed.ActorRef;
import com.gradeflow.extraction.ExtractionClient;
import com.gradeflow.grading.AccuracyValidator;
import com.gradeflow.grading.FakeGradingProvider;
import com.gradeflow.grading.GradingProvider;
import com.gradeflow.grading.ProviderException;
import com.gradeflow.grading.RecordingSleeper;
import com.gradeflow.grading.ResultAggregator;
import com.gradeflow.grading.RetryPolicy;
import com.gradeflow.models.Criterion;
import com.gradeflow.models.DeclaredStatus;
import com.gradeflow.models.FileReference;
import com.gradeflow.models.GradingReport;
import com.gradeflow.models.JobProgress;
import com.gradeflow.models.JobStatus;
import com.gradeflow.models.RubricDefinition;
import com.gradeflow.models.SubmissionRecord;
import com.gradeflow.models.SubmissionRequest;
import com.gradeflow.models.SubmissionStatus;
import com.gradeflow.pipeline.CancellationToken;
import com.gradeflow.pipeline.PipelineFactory;
import com.gradeflow.pipeline.SubmissionPipeline;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class JobCoordinatorActorTest {

    private static final RubricDefinition RUBRIC = RubricDefinition.of(
            new Criterion("Content", 8),
            new Criterion("Style", 2));
    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private static ActorTestKit testKit;
    private static ExecutorService executor;

    @TempDir
    Path tempDir;

    private Path essay;

    @BeforeAll
    static void startTestKit() {
        testKit = ActorTestKit.create(ConfigFactory.load());
        executor = Executors.newFixedThreadPool(12);
    }

    @AfterAll
    static void stopTestKit() {
        testKit.shutdownTestKit();
        executor.shutdownNow();
    }

    @BeforeEach
    void writeEssay() throws Exception {
        essay = tempDir.resolve("essay.txt");
        Files.writeString(essay, "A short essay about rivers and their deltas.");
    }

    private SubmissionRequest submission(String studentId) {
        return SubmissionRequest.withFiles(studentId, new FileReference("essay.txt", essay.toString()));
    }

    private SubmissionPipeline pipeline(GradingProvider provider, RetryPolicy policy) {
        return new PipelineFactory(policy, 2, new ExtractionClient(), new AccuracyValidator(), new RecordingSleeper())
                .create(RUBRIC, 0.5, provider);
    }

    private ActorRef<GradingMessages.Message> spawnJob(String jobId, List<SubmissionRequest> submissions,
                                                       SubmissionPipeline pipeline, int concurrency,
                                                       CancellationToken token,
                                                       TestProbe<GradingMessages.Message> supervisor) {
        return testKit.spawn(JobCoordinatorActor.create(jobId, submissions, pipeline, concurrency, token,
                new ResultAggregator(), supervisor.getRef(), executor, Instant.now()));
    }

    private static GradingReport awaitReport(TestProbe<GradingMessages.Message> supervisor) {
        return supervisor.expectMessageClass(GradingMessages.JobFinished.class, TIMEOUT).getReport();
    }

    @Test
    void neverRunsMoreThanConcurrencyGradingCalls() {
        FakeGradingProvider provider = new FakeGradingProvider((request, call) -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ProviderException("interrupted");
            }
            return FakeGradingProvider.validJson(request.rubric(), 0.9);
        });
        List<SubmissionRequest> submissions = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            submissions.add(submission("student-" + i));
        }
        TestProbe<GradingMessages.Message> supervisor = testKit.createTestProbe();

        spawnJob("job-e", submissions, pipeline(provider, RetryPolicy.defaults()), 3, new CancellationToken(), supervisor);
        GradingReport report = awaitReport(supervisor);

        assertEquals(JobStatus.COMPLETED, report.getStatus());
        assertEquals(10, report.getGraded());
        assertEquals(10, report.getPerSubmission().size());
        assertTrue(provider.getMaxActive() <= 3, "max active was " + provider.getMaxActive());
        assertEquals(10, provider.getCalls());
        for (int i = 0; i < 10; i++) {
            assertEquals("student-" + i, report.getPerSubmission().get(i).getStudentId());
        }
    }

    @Test
    void shortCircuitedSubmissionsNeedNoProvider() {
        FakeGradingProvider provider = FakeGradingProvider.scoring(1.0);
        TestProbe<GradingMessages.Message> supervisor = testKit.createTestProbe();

        spawnJob("job-c", List.of(
                SubmissionRequest.declared("a", DeclaredStatus.NOT_SUBMITTED),
                SubmissionRequest.declared("b", DeclaredStatus.PREVIOUSLY_GRADED)),
                pipeline(provider, RetryPolicy.defaults()), 2, new CancellationToken(), supervisor);
        GradingReport report = awaitReport(supervisor);

        assertEquals(JobStatus.COMPLETED, report.getStatus());
        assertEquals(1, report.getNotSubmitted());
        assertEquals(1, report.getPreviouslyGraded());
        assertEquals(0.0, report.getPerSubmission().get(0).getTotalScore());
        assertEquals(0, provider.getCalls());
    }

    @Test
    void failingSubmissionMakesJobPartiallyFailed() throws Exception {
        FakeGradingProvider provider = new FakeGradingProvider((request, call) -> {
            if (request.text().contains("broken")) {
                return "no json here";
            }
            return FakeGradingProvider.validJson(request.rubric(), 0.5);
        });
        Path broken = tempDir.resolve("broken.txt");
        Files.writeString(broken, "broken submission");
        TestProbe<GradingMessages.Message> supervisor = testKit.createTestProbe();

        spawnJob("job-p", List.of(
                submission("ok"),
                SubmissionRequest.withFiles("bad", new FileReference("broken.txt", broken.toString()))),
                pipeline(provider, RetryPolicy.defaults()), 2, new CancellationToken(), supervisor);
        GradingReport report = awaitReport(supervisor);

        assertEquals(JobStatus.PARTIALLY_FAILED, report.getStatus());
        assertEquals(1, report.getGraded());
        SubmissionRecord failed = report.getPerSubmission().get(1);
        assertEquals(SubmissionStatus.FAILED, failed.getStatus());
        assertTrue(failed.getReason().startsWith("Invalid provider response"));
    }

    @Test
    void exhaustedProviderFailsUndispatchedSubmissions() {
        FakeGradingProvider provider = new FakeGradingProvider((request, call) -> {
            throw new ProviderException(429, "Too Many Requests");
        });
        RetryPolicy policy = new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(120), 1, Duration.ZERO);
        TestProbe<GradingMessages.Message> supervisor = testKit.createTestProbe();

        spawnJob("job-x", List.of(submission("s1"), submission("s2"), submission("s3")),
                pipeline(provider, policy), 1, new CancellationToken(), supervisor);
        GradingReport report = awaitReport(supervisor);

        assertEquals(JobStatus.PARTIALLY_FAILED, report.getStatus());
        assertTrue(report.getStatusReason().startsWith("Provider exhausted"));
        assertEquals(3, report.getFailed());
        assertEquals(2, provider.getCalls());
        assertEquals("Provider exhausted", report.getPerSubmission().get(2).getReason());
    }

    @Test
    void cancellationFailsPendingAndInFlightSubmissions() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        FakeGradingProvider provider = new FakeGradingProvider((request, call) -> {
            started.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return FakeGradingProvider.validJson(request.rubric(), 1.0);
        });
        TestProbe<GradingMessages.Message> supervisor = testKit.createTestProbe();
        CancellationToken token = new CancellationToken();

        ActorRef<GradingMessages.Message> coordinator = spawnJob("job-k", List.of(
                SubmissionRequest.declared("absent", DeclaredStatus.NOT_SUBMITTED),
                submission("first"), submission("second")),
                pipeline(provider, RetryPolicy.defaults()), 1, token, supervisor);
        assertTrue(started.await(5, TimeUnit.SECONDS));

        TestProbe<GradingMessages.StatusReply> statusProbe = testKit.createTestProbe();
        coordinator.tell(new GradingMessages.GetProgress(statusProbe.getRef()));
        JobProgress progress = statusProbe.expectMessageClass(GradingMessages.StatusReply.class).getProgress().orElseThrow();
        assertEquals(JobStatus.RUNNING, progress.status());
        assertEquals(1, progress.completedCount());
        assertEquals(3, progress.totalCount());
        assertEquals(1, progress.countsByStatus().get(SubmissionStatus.GRADING));
        assertEquals(1, progress.countsByStatus().get(SubmissionStatus.PENDING));

        TestProbe<GradingMessages.CancelResult> cancelProbe = testKit.createTestProbe();
        coordinator.tell(new GradingMessages.Cancel(cancelProbe.getRef()));
        assertTrue(cancelProbe.expectMessageClass(GradingMessages.CancelResult.class).isAccepted());
        release.countDown();

        GradingReport report = awaitReport(supervisor);
        assertEquals(JobStatus.CANCELLED, report.getStatus());
        assertEquals(SubmissionStatus.NOT_SUBMITTED, report.getPerSubmission().get(0).getStatus());
        assertEquals("Cancelled", report.getPerSubmission().get(1).getReason());
        assertEquals("Cancelled", report.getPerSubmission().get(2).getReason());
        assertEquals(1, provider.getCalls());
        assertTrue(token.isCancelled());
    }

    @Test
    void finishedCoordinatorStillAnswersUntilStopped() {
        TestProbe<GradingMessages.Message> supervisor = testKit.createTestProbe();
        ActorRef<GradingMessages.Message> coordinator = spawnJob("job-f", List.of(
                SubmissionRequest.declared("a", DeclaredStatus.NOT_SUBMITTED)),
                pipeline(FakeGradingProvider.scoring(1.0), RetryPolicy.defaults()), 1, new CancellationToken(), supervisor);
        GradingReport report = awaitReport(supervisor);
        assertEquals(JobStatus.COMPLETED, report.getStatus());

        TestProbe<GradingMessages.StatusReply> statusProbe = testKit.createTestProbe();
        coordinator.tell(new GradingMessages.GetProgress(statusProbe.getRef()));
        JobProgress progress = statusProbe.expectMessageClass(GradingMessages.StatusReply.class, TIMEOUT)
                .getProgress().orElseThrow();
        assertTrue(progress.isTerminal());
        assertEquals(1, progress.completedCount());
        assertEquals(1, progress.countsByStatus().get(SubmissionStatus.NOT_SUBMITTED));

        TestProbe<GradingMessages.CancelResult> cancelProbe = testKit.createTestProbe();
        coordinator.tell(new GradingMessages.Cancel(cancelProbe.getRef()));
        assertFalse(cancelProbe.expectMessageClass(GradingMessages.CancelResult.class, TIMEOUT).isAccepted());

        testKit.stop(coordinator);
    }
}
