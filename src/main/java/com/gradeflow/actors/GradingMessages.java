package com.gradeflow.actors;

import akka.actor.typed.ActorRef;
import com.gradeflow.grading.ErrorKind;
import com.gradeflow.grading.GradingProvider;
import com.gradeflow.models.GradingReport;
import com.gradeflow.models.JobProgress;
import com.gradeflow.models.RubricDefinition;
import com.gradeflow.models.SubmissionRecord;
import com.gradeflow.models.SubmissionRequest;
import com.gradeflow.models.SubmissionStatus;
import com.gradeflow.pipeline.StageResult;

import java.util.List;
import java.util.Optional;

/**
 * Message types for the grading actors
 */
public class GradingMessages {

    // Base message interface
    public interface Message {
        // Marker interface for all grading messages
    }

    // Control surface, sent to the supervisor

    public static class StartJob implements Message {
        private final List<SubmissionRequest> submissions;
        private final RubricDefinition rubric;
        private final double strictness;
        private final ActorRef<JobStarted> replyTo;

        public StartJob(List<SubmissionRequest> submissions, RubricDefinition rubric, double strictness,
                        ActorRef<JobStarted> replyTo) {
            this.submissions = List.copyOf(submissions);
            this.rubric = rubric;
            this.strictness = strictness;
            this.replyTo = replyTo;
        }

        public List<SubmissionRequest> getSubmissions() { return submissions; }
        public RubricDefinition getRubric() { return rubric; }
        public double getStrictness() { return strictness; }
        public ActorRef<JobStarted> getReplyTo() { return replyTo; }
    }

    public static class CancelJob implements Message {
        private final String jobId;
        private final ActorRef<CancelResult> replyTo;

        public CancelJob(String jobId, ActorRef<CancelResult> replyTo) {
            this.jobId = jobId;
            this.replyTo = replyTo;
        }

        public String getJobId() { return jobId; }
        public ActorRef<CancelResult> getReplyTo() { return replyTo; }
    }

    public static class GetStatus implements Message {
        private final String jobId;
        private final ActorRef<StatusReply> replyTo;

        public GetStatus(String jobId, ActorRef<StatusReply> replyTo) {
            this.jobId = jobId;
            this.replyTo = replyTo;
        }

        public String getJobId() { return jobId; }
        public ActorRef<StatusReply> getReplyTo() { return replyTo; }
    }

    public static class GetReport implements Message {
        private final String jobId;
        private final ActorRef<ReportReply> replyTo;

        public GetReport(String jobId, ActorRef<ReportReply> replyTo) {
            this.jobId = jobId;
            this.replyTo = replyTo;
        }

        public String getJobId() { return jobId; }
        public ActorRef<ReportReply> getReplyTo() { return replyTo; }
    }

    // Replies

    public static class JobStarted {
        private final String jobId;

        public JobStarted(String jobId) {
            this.jobId = jobId;
        }

        public String getJobId() { return jobId; }
    }

    public static class CancelResult {
        private final String jobId;
        private final boolean accepted;

        public CancelResult(String jobId, boolean accepted) {
            this.jobId = jobId;
            this.accepted = accepted;
        }

        public String getJobId() { return jobId; }

        /**
         * False when the job is unknown or already terminal
         */
        public boolean isAccepted() { return accepted; }
    }

    public static class StatusReply {
        private final JobProgress progress;

        public StatusReply(JobProgress progress) {
            this.progress = progress;
        }

        public Optional<JobProgress> getProgress() { return Optional.ofNullable(progress); }
    }

    public static class ReportReply {
        private final GradingReport report;

        public ReportReply(GradingReport report) {
            this.report = report;
        }

        public Optional<GradingReport> getReport() { return Optional.ofNullable(report); }
    }

    // Supervisor internals

    public static class PreflightPassed implements Message {
        private final String jobId;
        private final GradingProvider provider;

        public PreflightPassed(String jobId, GradingProvider provider) {
            this.jobId = jobId;
            this.provider = provider;
        }

        public String getJobId() { return jobId; }
        public GradingProvider getProvider() { return provider; }
    }

    public static class PreflightFailed implements Message {
        private final String jobId;
        private final String reason;

        public PreflightFailed(String jobId, String reason) {
            this.jobId = jobId;
            this.reason = reason;
        }

        public String getJobId() { return jobId; }
        public String getReason() { return reason; }
    }

    public static class JobFinished implements Message {
        private final GradingReport report;

        public JobFinished(GradingReport report) {
            this.report = report;
        }

        public GradingReport getReport() { return report; }
    }

    public static class CoordinatorStopped implements Message {
        private final String jobId;

        public CoordinatorStopped(String jobId) {
            this.jobId = jobId;
        }

        public String getJobId() { return jobId; }
    }

    // Job coordinator

    public static class Cancel implements Message {
        private final ActorRef<CancelResult> replyTo;

        public Cancel(ActorRef<CancelResult> replyTo) {
            this.replyTo = replyTo;
        }

        public ActorRef<CancelResult> getReplyTo() { return replyTo; }
    }

    public static class GetProgress implements Message {
        private final ActorRef<StatusReply> replyTo;

        public GetProgress(ActorRef<StatusReply> replyTo) {
            this.replyTo = replyTo;
        }

        public ActorRef<StatusReply> getReplyTo() { return replyTo; }
    }

    public static class SubmissionStateChanged implements Message {
        private final int index;
        private final SubmissionStatus status;

        public SubmissionStateChanged(int index, SubmissionStatus status) {
            this.index = index;
            this.status = status;
        }

        public int getIndex() { return index; }
        public SubmissionStatus getStatus() { return status; }
    }

    public static class SubmissionCompleted implements Message {
        private final int index;
        private final SubmissionRecord record;
        private final ErrorKind errorKind;

        public SubmissionCompleted(int index, SubmissionRecord record, ErrorKind errorKind) {
            this.index = index;
            this.record = record;
            this.errorKind = errorKind;
        }

        public int getIndex() { return index; }
        public SubmissionRecord getRecord() { return record; }
        public Optional<ErrorKind> getErrorKind() { return Optional.ofNullable(errorKind); }
    }

    public static class PipelineStopped implements Message {
        private final int index;

        public PipelineStopped(int index) {
            this.index = index;
        }

        public int getIndex() { return index; }
    }

    // Submission pipeline

    public static class StageDone implements Message {
        private final int stage;
        private final StageResult result;

        public StageDone(int stage, StageResult result) {
            this.stage = stage;
            this.result = result;
        }

        public int getStage() { return stage; }
        public StageResult getResult() { return result; }
    }

    public static class StageCrashed implements Message {
        private final int stage;
        private final Throwable cause;

        public StageCrashed(int stage, Throwable cause) {
            this.stage = stage;
            this.cause = cause;
        }

        public int getStage() { return stage; }
        public Throwable getCause() { return cause; }
    }
}
