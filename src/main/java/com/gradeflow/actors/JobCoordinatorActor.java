package com.gradeflow.actors;

import akka.actor.typed.ActorRef;
import akka.actor.typed.Behavior;
import akka.actor.typed.javadsl.AbstractBehavior;
import akka.actor.typed.javadsl.ActorContext;
import akka.actor.typed.javadsl.Behaviors;
import akka.actor.typed.javadsl.Receive;
import com.gradeflow.grading.ErrorKind;
import com.gradeflow.grading.ResultAggregator;
import com.gradeflow.models.GradingReport;
import com.gradeflow.models.JobProgress;
import com.gradeflow.models.JobStatus;
import com.gradeflow.models.SubmissionRecord;
import com.gradeflow.models.SubmissionRequest;
import com.gradeflow.models.SubmissionStatus;
import com.gradeflow.pipeline.CancellationToken;
import com.gradeflow.pipeline.SubmissionPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Owns one grading job: dispatches at most {@code concurrency} submission pipelines at a time,
 * collects exactly one terminal record per submission and hands the aggregated report to the supervisor.
 * Once finished it keeps answering progress and cancel requests until the supervisor stops it.
 */
public class JobCoordinatorActor extends AbstractBehavior<GradingMessages.Message> {
    private static final Logger logger = LoggerFactory.getLogger(JobCoordinatorActor.class);

    static final String PROVIDER_EXHAUSTED_REASON = "Provider exhausted";

    private final String jobId;
    private final List<SubmissionRequest> submissions;
    private final SubmissionPipeline pipeline;
    private final int concurrency;
    private final CancellationToken token;
    private final ResultAggregator aggregator;
    private final ActorRef<GradingMessages.Message> supervisor;
    private final Executor blockingExecutor;
    private final Instant createdAt;

    private final SubmissionStatus[] statuses;
    private final SubmissionRecord[] records;
    private final Deque<Integer> pending = new ArrayDeque<>();
    private int active;
    private int completed;
    private boolean exhausted;

    private JobCoordinatorActor(ActorContext<GradingMessages.Message> context, String jobId,
                                List<SubmissionRequest> submissions, SubmissionPipeline pipeline, int concurrency,
                                CancellationToken token, ResultAggregator aggregator,
                                ActorRef<GradingMessages.Message> supervisor, Executor blockingExecutor,
                                Instant createdAt) {
        super(context);
        this.jobId = jobId;
        this.submissions = submissions;
        this.pipeline = pipeline;
        this.concurrency = concurrency;
        this.token = token;
        this.aggregator = aggregator;
        this.supervisor = supervisor;
        this.blockingExecutor = blockingExecutor;
        this.createdAt = createdAt;
        this.statuses = new SubmissionStatus[submissions.size()];
        this.records = new SubmissionRecord[submissions.size()];
        Arrays.fill(statuses, SubmissionStatus.PENDING);
    }

    public static Behavior<GradingMessages.Message> create(String jobId, List<SubmissionRequest> submissions,
                                                           SubmissionPipeline pipeline, int concurrency,
                                                           CancellationToken token, ResultAggregator aggregator,
                                                           ActorRef<GradingMessages.Message> supervisor,
                                                           Executor blockingExecutor, Instant createdAt) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1");
        }
        return Behaviors.setup(context -> new JobCoordinatorActor(context, jobId, submissions, pipeline,
                concurrency, token, aggregator, supervisor, blockingExecutor, createdAt).start());
    }

    @Override
    public Receive<GradingMessages.Message> createReceive() {
        return newReceiveBuilder()
                .onMessage(GradingMessages.SubmissionStateChanged.class, this::onSubmissionStateChanged)
                .onMessage(GradingMessages.SubmissionCompleted.class, this::onSubmissionCompleted)
                .onMessage(GradingMessages.PipelineStopped.class, this::onPipelineStopped)
                .onMessage(GradingMessages.Cancel.class, this::onCancel)
                .onMessage(GradingMessages.GetProgress.class, this::onGetProgress)
                .build();
    }

    private Behavior<GradingMessages.Message> start() {
        logger.info("Job {} started with {} submissions, concurrency {}", jobId, submissions.size(), concurrency);
        for (int i = 0; i < submissions.size(); i++) {
            Optional<SubmissionRecord> shortCircuit = pipeline.shortCircuit(submissions.get(i));
            if (shortCircuit.isPresent()) {
                logger.warn("Job {}: {} not graded ({})", jobId, submissions.get(i).getStudentId(),
                        shortCircuit.get().getReason());
                record(i, shortCircuit.get());
            } else {
                pending.add(i);
            }
        }
        dispatch();
        return finishIfDone();
    }

    private void dispatch() {
        while (active < concurrency && !pending.isEmpty() && !exhausted && !token.isCancelled()) {
            int index = pending.poll();
            SubmissionRequest request = submissions.get(index);
            ActorRef<GradingMessages.Message> child = getContext().spawn(
                    SubmissionPipelineActor.create(index, request, pipeline, token, getContext().getSelf(), blockingExecutor),
                    "submission-" + index);
            getContext().watchWith(child, new GradingMessages.PipelineStopped(index));
            active++;
            logger.debug("Job {}: dispatched {} ({} active)", jobId, request.getStudentId(), active);
        }
    }

    private Behavior<GradingMessages.Message> onSubmissionStateChanged(GradingMessages.SubmissionStateChanged msg) {
        if (records[msg.getIndex()] == null) {
            statuses[msg.getIndex()] = msg.getStatus();
        }
        return this;
    }

    private Behavior<GradingMessages.Message> onSubmissionCompleted(GradingMessages.SubmissionCompleted msg) {
        int index = msg.getIndex();
        if (records[index] != null) {
            return this;
        }
        active--;
        SubmissionRecord record = msg.getRecord();
        record(index, record);
        if (record.getStatus() == SubmissionStatus.FAILED) {
            logger.warn("Job {}: {} failed: {}", jobId, record.getStudentId(), record.getReason());
        } else {
            logger.info("Job {}: {} finished {} ({}/{})", jobId, record.getStudentId(), record.getStatus(),
                    String.format("%.1f", record.getTotalScore()), String.format("%.1f", record.getMaxScore()));
        }

        if (msg.getErrorKind().orElse(null) == ErrorKind.PROVIDER_EXHAUSTED && !exhausted) {
            exhausted = true;
            logger.error("Job {}: provider exhausted, {} undispatched submissions will not be graded",
                    jobId, pending.size());
            failPending(PROVIDER_EXHAUSTED_REASON);
        }
        dispatch();
        return finishIfDone();
    }

    private Behavior<GradingMessages.Message> onPipelineStopped(GradingMessages.PipelineStopped msg) {
        int index = msg.getIndex();
        if (records[index] == null) {
            active--;
            String studentId = submissions.get(index).getStudentId();
            logger.error("Job {}: pipeline for {} stopped without a result", jobId, studentId);
            record(index, SubmissionRecord.ungraded(studentId, SubmissionStatus.FAILED,
                    "Pipeline stopped unexpectedly", pipeline.getRubric().getMaxTotalPoints()));
            dispatch();
            return finishIfDone();
        }
        return this;
    }

    private Behavior<GradingMessages.Message> onCancel(GradingMessages.Cancel msg) {
        if (token.cancel()) {
            logger.info("Job {}: cancellation requested, {} pending and {} in flight", jobId, pending.size(), active);
            failPending(SubmissionPipeline.CANCELLED_REASON);
        }
        msg.getReplyTo().tell(new GradingMessages.CancelResult(jobId, true));
        return finishIfDone();
    }

    private Behavior<GradingMessages.Message> onGetProgress(GradingMessages.GetProgress msg) {
        msg.getReplyTo().tell(new GradingMessages.StatusReply(progress()));
        return this;
    }

    private void failPending(String reason) {
        while (!pending.isEmpty()) {
            int index = pending.poll();
            record(index, SubmissionRecord.ungraded(submissions.get(index).getStudentId(), SubmissionStatus.FAILED,
                    reason, pipeline.getRubric().getMaxTotalPoints()));
        }
    }

    private void record(int index, SubmissionRecord record) {
        records[index] = record;
        statuses[index] = record.getStatus();
        completed++;
    }

    JobProgress progress() {
        Map<SubmissionStatus, Integer> counts = new EnumMap<>(SubmissionStatus.class);
        for (SubmissionStatus status : statuses) {
            counts.merge(status, 1, Integer::sum);
        }
        return new JobProgress(jobId, JobStatus.RUNNING, completed, submissions.size(), counts, createdAt, null);
    }

    private Behavior<GradingMessages.Message> finishIfDone() {
        if (completed < submissions.size()) {
            return this;
        }
        long failed = Arrays.stream(records).filter(r -> r.getStatus() == SubmissionStatus.FAILED).count();
        JobStatus status;
        String reason;
        if (token.isCancelled()) {
            status = JobStatus.CANCELLED;
            reason = "Cancelled by request";
        } else if (failed > 0) {
            status = JobStatus.PARTIALLY_FAILED;
            reason = exhausted
                    ? PROVIDER_EXHAUSTED_REASON + ", " + failed + " of " + records.length + " submissions failed"
                    : failed + " of " + records.length + " submissions failed";
        } else {
            status = JobStatus.COMPLETED;
            reason = "";
        }
        GradingReport report = aggregator.aggregate(jobId, status, reason, createdAt, Instant.now(),
                Arrays.asList(records));
        supervisor.tell(new GradingMessages.JobFinished(report));
        return finished(report);
    }

    private static Behavior<GradingMessages.Message> finished(GradingReport report) {
        JobProgress progress = JobProgress.of(report);
        return Behaviors.receive(GradingMessages.Message.class)
                .onMessage(GradingMessages.GetProgress.class, msg -> {
                    msg.getReplyTo().tell(new GradingMessages.StatusReply(progress));
                    return Behaviors.same();
                })
                .onMessage(GradingMessages.Cancel.class, msg -> {
                    msg.getReplyTo().tell(new GradingMessages.CancelResult(report.getJobId(), false));
                    return Behaviors.same();
                })
                .build();
    }
}
