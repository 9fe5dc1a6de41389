package com.gradeflow.actors;

import akka.actor.typed.ActorRef;
import akka.actor.typed.Behavior;
import akka.actor.typed.javadsl.AbstractBehavior;
import akka.actor.typed.javadsl.ActorContext;
import akka.actor.typed.javadsl.Behaviors;
import akka.actor.typed.javadsl.Receive;
import com.gradeflow.grading.ErrorKind;
import com.gradeflow.models.SubmissionRecord;
import com.gradeflow.models.SubmissionRequest;
import com.gradeflow.models.SubmissionStatus;
import com.gradeflow.pipeline.CancellationToken;
import com.gradeflow.pipeline.PipelineStage;
import com.gradeflow.pipeline.StageResult;
import com.gradeflow.pipeline.SubmissionContext;
import com.gradeflow.pipeline.SubmissionPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Drives one submission through Extract, Grade and Validate. Each stage runs on the blocking
 * executor and its result is piped back, so the actor itself never blocks. Stops after reporting
 * the terminal record to its coordinator.
 */
public class SubmissionPipelineActor extends AbstractBehavior<GradingMessages.Message> {
    private static final Logger logger = LoggerFactory.getLogger(SubmissionPipelineActor.class);

    private final int index;
    private final SubmissionRequest request;
    private final SubmissionPipeline pipeline;
    private final CancellationToken token;
    private final ActorRef<GradingMessages.Message> coordinator;
    private final Executor blockingExecutor;
    private SubmissionContext submissionContext;

    private SubmissionPipelineActor(ActorContext<GradingMessages.Message> context, int index, SubmissionRequest request,
                                    SubmissionPipeline pipeline, CancellationToken token,
                                    ActorRef<GradingMessages.Message> coordinator, Executor blockingExecutor) {
        super(context);
        this.index = index;
        this.request = request;
        this.pipeline = pipeline;
        this.token = token;
        this.coordinator = coordinator;
        this.blockingExecutor = blockingExecutor;
        this.submissionContext = new SubmissionContext(request, pipeline.getRubric());
    }

    public static Behavior<GradingMessages.Message> create(int index, SubmissionRequest request,
                                                           SubmissionPipeline pipeline, CancellationToken token,
                                                           ActorRef<GradingMessages.Message> coordinator,
                                                           Executor blockingExecutor) {
        return Behaviors.setup(context -> new SubmissionPipelineActor(
                context, index, request, pipeline, token, coordinator, blockingExecutor).begin());
    }

    @Override
    public Receive<GradingMessages.Message> createReceive() {
        return newReceiveBuilder()
                .onMessage(GradingMessages.StageDone.class, this::onStageDone)
                .onMessage(GradingMessages.StageCrashed.class, this::onStageCrashed)
                .build();
    }

    private Behavior<GradingMessages.Message> begin() {
        return pipeline.shortCircuit(request)
                .map(record -> complete(record, null))
                .orElseGet(() -> runStage(0));
    }

    private Behavior<GradingMessages.Message> runStage(int stageIndex) {
        if (token.isCancelled()) {
            return complete(pipeline.cancelled(request.getStudentId()), null);
        }
        PipelineStage stage = pipeline.getStages().get(stageIndex);
        coordinator.tell(new GradingMessages.SubmissionStateChanged(index, stage.status()));

        SubmissionContext current = submissionContext;
        getContext().pipeToSelf(
                CompletableFuture.supplyAsync(() -> stage.run(current), blockingExecutor),
                (result, failure) -> failure == null
                        ? new GradingMessages.StageDone(stageIndex, result)
                        : new GradingMessages.StageCrashed(stageIndex, failure));
        return this;
    }

    private Behavior<GradingMessages.Message> onStageDone(GradingMessages.StageDone msg) {
        StageResult result = msg.getResult();
        if (result.isTerminal()) {
            return complete(result.getTerminal(), result.getErrorKind().orElse(null));
        }
        submissionContext = result.getNext();
        return runStage(msg.getStage() + 1);
    }

    private Behavior<GradingMessages.Message> onStageCrashed(GradingMessages.StageCrashed msg) {
        Throwable cause = msg.getCause() instanceof CompletionException && msg.getCause().getCause() != null
                ? msg.getCause().getCause()
                : msg.getCause();
        SubmissionStatus stage = pipeline.getStages().get(msg.getStage()).status();
        logger.error("Unexpected failure while {} submission of {}", stage, request.getStudentId(), cause);
        SubmissionRecord failed = SubmissionRecord.ungraded(request.getStudentId(), SubmissionStatus.FAILED,
                "Unexpected failure during " + stage + ": " + cause.getMessage(),
                pipeline.getRubric().getMaxTotalPoints(), submissionContext.getExtractedText());
        return complete(failed, null);
    }

    private Behavior<GradingMessages.Message> complete(SubmissionRecord record, ErrorKind errorKind) {
        coordinator.tell(new GradingMessages.SubmissionCompleted(index, record, errorKind));
        return Behaviors.stopped();
    }
}
