package com.gradeflow.grading;

import com.gradeflow.models.RubricDefinition;
import com.gradeflow.models.ScoreResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Scores one submission's text against the rubric through the external provider.
 * Only the job's {@link RetryState} is mutated, indirectly, through the {@link RetryController}.
 */
public class GradingAgent {
    private static final Logger logger = LoggerFactory.getLogger(GradingAgent.class);

    public static final int DEFAULT_MAX_REFORMULATIONS = 2;

    private final GradingProvider provider;
    private final RetryController retryController;
    private final ScoreResultParser parser;
    private final int maxReformulations;

    public GradingAgent(GradingProvider provider, RetryController retryController) {
        this(provider, retryController, new ScoreResultParser(), DEFAULT_MAX_REFORMULATIONS);
    }

    public GradingAgent(GradingProvider provider, RetryController retryController,
                        ScoreResultParser parser, int maxReformulations) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.retryController = Objects.requireNonNull(retryController, "retryController");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.maxReformulations = Math.max(0, maxReformulations);
    }

    public GradingOutcome grade(String text, RubricDefinition rubric, double strictness) {
        GradingRequest request = new GradingRequest(text, rubric, strictness, 0);
        int providerCalls = 0;

        while (true) {
            final GradingRequest current = request;
            CallOutcome<ScoreResult> outcome = retryController.call(
                    () -> parser.parse(provider.requestGrading(current), rubric));
            providerCalls += outcome.getAttempts();

            if (outcome.isSuccess()) {
                if (current.isReformulated()) {
                    logger.info("Provider answered with a valid result after {} reformulation(s)", current.reformulation());
                }
                return GradingOutcome.graded(outcome.getValue(), providerCalls);
            }

            ClassifiedError error = outcome.getError();
            if (error.getKind() != ErrorKind.MALFORMED) {
                return GradingOutcome.failed(error.withAttempts(providerCalls), providerCalls);
            }
            if (current.reformulation() >= maxReformulations) {
                logger.warn("Provider response still malformed after {} reformulation(s): {}",
                        current.reformulation(), error.getMessage());
                return GradingOutcome.failed(
                        error.withKind(ErrorKind.INVALID_RESPONSE).withAttempts(providerCalls), providerCalls);
            }
            logger.warn("Malformed provider response ({}), reformulating request", error.getMessage());
            request = current.reformulated();
        }
    }

    public GradingProvider getProvider() {
        return provider;
    }
}
