package com.gradeflow.pipeline;

import com.gradeflow.extraction.ExtractionClient;
import com.gradeflow.grading.AccuracyValidator;
import com.gradeflow.grading.GradingAgent;
import com.gradeflow.grading.GradingProvider;
import com.gradeflow.grading.RetryController;
import com.gradeflow.grading.RetryPolicy;
import com.gradeflow.grading.RetryState;
import com.gradeflow.grading.ScoreResultParser;
import com.gradeflow.grading.Sleeper;
import com.gradeflow.models.RubricDefinition;

import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Wires the stages of one job. Each job gets its own {@link RetryState}; extraction and validation are shared.
 */
public class PipelineFactory {
    private final RetryPolicy retryPolicy;
    private final int maxReformulations;
    private final ExtractionClient extractionClient;
    private final AccuracyValidator validator;
    private final Sleeper sleeper;

    public PipelineFactory(RetryPolicy retryPolicy, int maxReformulations, ExtractionClient extractionClient) {
        this(retryPolicy, maxReformulations, extractionClient, new AccuracyValidator(), Sleeper.threadSleeper());
    }

    public PipelineFactory(RetryPolicy retryPolicy, int maxReformulations, ExtractionClient extractionClient,
                           AccuracyValidator validator, Sleeper sleeper) {
        this.retryPolicy = retryPolicy;
        this.maxReformulations = maxReformulations;
        this.extractionClient = extractionClient;
        this.validator = validator;
        this.sleeper = sleeper;
    }

    public SubmissionPipeline create(RubricDefinition rubric, double strictness, GradingProvider provider) {
        RetryController retryController = new RetryController(retryPolicy, new RetryState(), sleeper,
                () -> ThreadLocalRandom.current().nextDouble(), Clock.systemUTC());
        GradingAgent agent = new GradingAgent(provider, retryController, new ScoreResultParser(), maxReformulations);
        return new SubmissionPipeline(
                new ExtractStage(extractionClient),
                new GradeStage(agent, strictness),
                new ValidateStage(validator),
                rubric);
    }
}
