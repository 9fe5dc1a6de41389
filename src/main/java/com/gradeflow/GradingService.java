package com.gradeflow;

import akka.actor.typed.ActorSystem;
import akka.actor.typed.javadsl.AskPattern;
import akka.pattern.Patterns;
import com.gradeflow.actors.GradingMessages;
import com.gradeflow.actors.GradingSupervisorActor;
import com.gradeflow.extraction.ExtractionClient;
import com.gradeflow.grading.GradingProvider;
import com.gradeflow.grading.ResultAggregator;
import com.gradeflow.models.GradingReport;
import com.gradeflow.models.JobProgress;
import com.gradeflow.models.RubricDefinition;
import com.gradeflow.models.SubmissionRequest;
import com.gradeflow.pipeline.PipelineFactory;
import com.gradeflow.utils.ApiKeyLoader;
import com.gradeflow.utils.OpenAIClient;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Java control surface of the grading engine: start, cancel and inspect jobs.
 * Every job started here stays registered until the service is closed.
 */
public class GradingService implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(GradingService.class);

    private static final Duration ASK_TIMEOUT = Duration.ofSeconds(5);

    private final ActorSystem<GradingMessages.Message> system;
    private final GradingSettings settings;

    public GradingService(Config config, GradingProvider provider, PipelineFactory pipelineFactory) {
        this.settings = new GradingSettings(config);
        this.system = ActorSystem.create(
                GradingSupervisorActor.create(provider, settings.preflightCheck(), pipelineFactory,
                        new ResultAggregator(settings.getPassingThreshold()), settings.getConcurrency()),
                "gradeflow", config);
        logger.info("Grading service started with provider {}", provider.getName());
    }

    public GradingService(Config config, GradingProvider provider) {
        this(config, provider, defaultPipelineFactory(new GradingSettings(config)));
    }

    /**
     * Service over the OpenAI provider, configured from {@code application.conf}
     */
    public static GradingService create() {
        Config config = ConfigFactory.load();
        GradingSettings settings = new GradingSettings(config);
        String apiKey = ApiKeyLoader.loadOpenAIKey(settings.getConfiguredApiKey());
        OpenAIClient client = new OpenAIClient(apiKey, settings.getProviderBaseUrl(), settings.getProviderModel(),
                settings.getRequestTimeout());
        return new GradingService(config, client);
    }

    static PipelineFactory defaultPipelineFactory(GradingSettings settings) {
        return new PipelineFactory(settings.getRetryPolicy(), settings.getMaxReformulations(),
                new ExtractionClient(settings.getFileAccessPolicy(), settings.getMaxFileBytes()));
    }

    public CompletionStage<String> startJob(List<SubmissionRequest> submissions, RubricDefinition rubric,
                                            double strictness) {
        return AskPattern.<GradingMessages.Message, GradingMessages.JobStarted>ask(system,
                        replyTo -> new GradingMessages.StartJob(submissions, rubric, strictness, replyTo),
                        ASK_TIMEOUT, system.scheduler())
                .thenApply(GradingMessages.JobStarted::getJobId);
    }

    public CompletionStage<String> startJob(List<SubmissionRequest> submissions, RubricDefinition rubric) {
        return startJob(submissions, rubric, settings.getDefaultStrictness());
    }

    /**
     * @return false when the job is unknown or already terminal
     */
    public CompletionStage<Boolean> cancelJob(String jobId) {
        return AskPattern.<GradingMessages.Message, GradingMessages.CancelResult>ask(system,
                        replyTo -> new GradingMessages.CancelJob(jobId, replyTo),
                        ASK_TIMEOUT, system.scheduler())
                .thenApply(GradingMessages.CancelResult::isAccepted);
    }

    public CompletionStage<Optional<JobProgress>> status(String jobId) {
        return AskPattern.<GradingMessages.Message, GradingMessages.StatusReply>ask(system,
                        replyTo -> new GradingMessages.GetStatus(jobId, replyTo),
                        ASK_TIMEOUT, system.scheduler())
                .thenApply(GradingMessages.StatusReply::getProgress);
    }

    /**
     * Present only once the job is terminal
     */
    public CompletionStage<Optional<GradingReport>> getReport(String jobId) {
        return AskPattern.<GradingMessages.Message, GradingMessages.ReportReply>ask(system,
                        replyTo -> new GradingMessages.GetReport(jobId, replyTo),
                        ASK_TIMEOUT, system.scheduler())
                .thenApply(GradingMessages.ReportReply::getReport);
    }

    /**
     * Completes with the report once the job is terminal, polling its status
     */
    public CompletionStage<GradingReport> awaitReport(String jobId, Duration pollInterval) {
        return status(jobId).thenCompose(progress -> {
            if (progress.isEmpty()) {
                return CompletableFuture.<GradingReport>failedFuture(new IllegalArgumentException("Unknown job: " + jobId));
            }
            if (progress.get().isTerminal()) {
                return getReport(jobId).thenApply(Optional::get);
            }
            return Patterns.after(pollInterval, system.classicSystem().scheduler(), system.executionContext(),
                    () -> awaitReport(jobId, pollInterval));
        });
    }

    public GradingSettings getSettings() {
        return settings;
    }

    public ActorSystem<GradingMessages.Message> getSystem() {
        return system;
    }

    @Override
    public void close() {
        system.terminate();
    }
}
