package com.gradeflow.actors;

import akka.actor.typed.ActorRef;
import akka.actor.typed.Behavior;
import akka.actor.typed.DispatcherSelector;
import akka.actor.typed.javadsl.AbstractBehavior;
import akka.actor.typed.javadsl.ActorContext;
import akka.actor.typed.javadsl.Behaviors;
import akka.actor.typed.javadsl.Receive;
import com.gradeflow.grading.FatalConfigurationException;
import com.gradeflow.grading.GradingProvider;
import com.gradeflow.grading.PreflightCheck;
import com.gradeflow.grading.ResultAggregator;
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
import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Root actor holding the job table. Every started job is registered here under its id: a live
 * coordinator while running, the final report once terminal.
 */
public class GradingSupervisorActor extends AbstractBehavior<GradingMessages.Message> {
    private static final Logger logger = LoggerFactory.getLogger(GradingSupervisorActor.class);

    public static final String BLOCKING_DISPATCHER = "gradeflow-blocking-dispatcher";

    private final GradingProvider provider;
    private final PreflightCheck preflight;
    private final PipelineFactory pipelineFactory;
    private final ResultAggregator aggregator;
    private final int concurrency;
    private final Executor blockingExecutor;
    private final Map<String, JobEntry> jobs = new HashMap<>();

    private GradingSupervisorActor(ActorContext<GradingMessages.Message> context, GradingProvider provider,
                                   PreflightCheck preflight, PipelineFactory pipelineFactory,
                                   ResultAggregator aggregator, int concurrency) {
        super(context);
        this.provider = provider;
        this.preflight = preflight;
        this.pipelineFactory = pipelineFactory;
        this.aggregator = aggregator;
        this.concurrency = concurrency;
        this.blockingExecutor = lookupBlockingExecutor(context);
    }

    public static Behavior<GradingMessages.Message> create(GradingProvider provider, PreflightCheck preflight,
                                                           PipelineFactory pipelineFactory,
                                                           ResultAggregator aggregator, int concurrency) {
        return Behaviors.setup(context ->
                new GradingSupervisorActor(context, provider, preflight, pipelineFactory, aggregator, concurrency));
    }

    @Override
    public Receive<GradingMessages.Message> createReceive() {
        return newReceiveBuilder()
                .onMessage(GradingMessages.StartJob.class, this::onStartJob)
                .onMessage(GradingMessages.PreflightPassed.class, this::onPreflightPassed)
                .onMessage(GradingMessages.PreflightFailed.class, this::onPreflightFailed)
                .onMessage(GradingMessages.JobFinished.class, this::onJobFinished)
                .onMessage(GradingMessages.CoordinatorStopped.class, this::onCoordinatorStopped)
                .onMessage(GradingMessages.CancelJob.class, this::onCancelJob)
                .onMessage(GradingMessages.GetStatus.class, this::onGetStatus)
                .onMessage(GradingMessages.GetReport.class, this::onGetReport)
                .build();
    }

    private Behavior<GradingMessages.Message> onStartJob(GradingMessages.StartJob msg) {
        String jobId = UUID.randomUUID().toString();
        JobEntry entry = new JobEntry(jobId, msg.getSubmissions(), msg.getRubric(), msg.getStrictness(), Instant.now());
        jobs.put(jobId, entry);
        logger.info("Registered job {} with {} submissions", jobId, entry.submissions.size());
        msg.getReplyTo().tell(new GradingMessages.JobStarted(jobId));

        RubricDefinition rubric = msg.getRubric();
        double strictness = msg.getStrictness();
        CompletableFuture<GradingProvider> check = CompletableFuture.supplyAsync(() -> {
            try {
                return preflight.verify(rubric, strictness, provider);
            } catch (FatalConfigurationException e) {
                throw new CompletionException(e);
            }
        }, blockingExecutor);
        getContext().pipeToSelf(check, (verified, failure) -> failure == null
                ? new GradingMessages.PreflightPassed(jobId, verified)
                : new GradingMessages.PreflightFailed(jobId, rootMessage(failure)));
        return this;
    }

    private Behavior<GradingMessages.Message> onPreflightPassed(GradingMessages.PreflightPassed msg) {
        JobEntry entry = jobs.get(msg.getJobId());
        if (entry.cancelRequested) {
            logger.info("Job {} cancelled before dispatch", entry.jobId);
            entry.report = failAll(entry, JobStatus.CANCELLED, "Cancelled by request", SubmissionPipeline.CANCELLED_REASON);
            return this;
        }
        SubmissionPipeline pipeline = pipelineFactory.create(entry.rubric, entry.strictness, msg.getProvider());
        entry.coordinator = getContext().spawn(
                JobCoordinatorActor.create(entry.jobId, entry.submissions, pipeline, concurrency, entry.token,
                        aggregator, getContext().getSelf(), blockingExecutor, entry.createdAt),
                "job-" + entry.jobId);
        getContext().watchWith(entry.coordinator, new GradingMessages.CoordinatorStopped(entry.jobId));
        return this;
    }

    private Behavior<GradingMessages.Message> onPreflightFailed(GradingMessages.PreflightFailed msg) {
        JobEntry entry = jobs.get(msg.getJobId());
        logger.error("Job {} failed pre-flight: {}", entry.jobId, msg.getReason());
        String reason = "Fatal configuration: " + msg.getReason();
        entry.report = failAll(entry, JobStatus.FAILED, reason, reason);
        return this;
    }

    private Behavior<GradingMessages.Message> onJobFinished(GradingMessages.JobFinished msg) {
        JobEntry entry = jobs.get(msg.getReport().getJobId());
        entry.report = msg.getReport();
        // the coordinator keeps answering until here, so nothing forwarded to it is lost
        getContext().stop(entry.coordinator);
        entry.coordinator = null;
        return this;
    }

    private Behavior<GradingMessages.Message> onCoordinatorStopped(GradingMessages.CoordinatorStopped msg) {
        JobEntry entry = jobs.get(msg.getJobId());
        if (entry.report == null) {
            logger.error("Coordinator of job {} stopped without a report", entry.jobId);
            entry.coordinator = null;
            entry.report = failAll(entry, JobStatus.FAILED, "Job coordinator stopped unexpectedly",
                    "Job coordinator stopped unexpectedly");
        }
        return this;
    }

    private Behavior<GradingMessages.Message> onCancelJob(GradingMessages.CancelJob msg) {
        JobEntry entry = jobs.get(msg.getJobId());
        if (entry == null || entry.report != null) {
            msg.getReplyTo().tell(new GradingMessages.CancelResult(msg.getJobId(), false));
        } else if (entry.coordinator != null) {
            entry.coordinator.tell(new GradingMessages.Cancel(msg.getReplyTo()));
        } else {
            entry.cancelRequested = true;
            entry.token.cancel();
            msg.getReplyTo().tell(new GradingMessages.CancelResult(msg.getJobId(), true));
        }
        return this;
    }

    private Behavior<GradingMessages.Message> onGetStatus(GradingMessages.GetStatus msg) {
        JobEntry entry = jobs.get(msg.getJobId());
        if (entry == null) {
            msg.getReplyTo().tell(new GradingMessages.StatusReply(null));
        } else if (entry.report != null) {
            msg.getReplyTo().tell(new GradingMessages.StatusReply(JobProgress.of(entry.report)));
        } else if (entry.coordinator != null) {
            entry.coordinator.tell(new GradingMessages.GetProgress(msg.getReplyTo()));
        } else {
            Map<SubmissionStatus, Integer> counts = new EnumMap<>(SubmissionStatus.class);
            if (!entry.submissions.isEmpty()) {
                counts.put(SubmissionStatus.PENDING, entry.submissions.size());
            }
            msg.getReplyTo().tell(new GradingMessages.StatusReply(new JobProgress(entry.jobId, JobStatus.RUNNING,
                    0, entry.submissions.size(), counts, entry.createdAt, null)));
        }
        return this;
    }

    private Behavior<GradingMessages.Message> onGetReport(GradingMessages.GetReport msg) {
        JobEntry entry = jobs.get(msg.getJobId());
        msg.getReplyTo().tell(new GradingMessages.ReportReply(entry != null ? entry.report : null));
        return this;
    }

    private GradingReport failAll(JobEntry entry, JobStatus status, String statusReason, String submissionReason) {
        List<SubmissionRecord> records = new ArrayList<>();
        for (SubmissionRequest request : entry.submissions) {
            records.add(SubmissionRecord.ungraded(request.getStudentId(), SubmissionStatus.FAILED, submissionReason,
                    entry.rubric != null ? entry.rubric.getMaxTotalPoints() : 0.0));
        }
        return aggregator.aggregate(entry.jobId, status, statusReason, entry.createdAt, Instant.now(), records);
    }

    private static String rootMessage(Throwable failure) {
        Throwable cause = failure;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private static Executor lookupBlockingExecutor(ActorContext<?> context) {
        Config config = context.getSystem().settings().config();
        DispatcherSelector selector = config.hasPath(BLOCKING_DISPATCHER)
                ? DispatcherSelector.fromConfig(BLOCKING_DISPATCHER)
                : DispatcherSelector.blocking();
        return context.getSystem().dispatchers().lookup(selector);
    }

    private static final class JobEntry {
        private final String jobId;
        private final List<SubmissionRequest> submissions;
        private final RubricDefinition rubric;
        private final double strictness;
        private final Instant createdAt;
        private final CancellationToken token = new CancellationToken();
        private ActorRef<GradingMessages.Message> coordinator;
        private GradingReport report;
        private boolean cancelRequested;

        private JobEntry(String jobId, List<SubmissionRequest> submissions, RubricDefinition rubric,
                         double strictness, Instant createdAt) {
            this.jobId = jobId;
            this.submissions = submissions;
            this.rubric = rubric;
            this.strictness = strictness;
            this.createdAt = createdAt;
        }
    }
}
