package com.gradeflow.grading;

import com.gradeflow.models.Criterion;
import com.gradeflow.models.RubricDefinition;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class GradingAgentTest {

    private static final RubricDefinition RUBRIC = RubricDefinition.of(
            new Criterion("Thesis", 10),
            new Criterion("Evidence", 10));

    private GradingAgent agent(GradingProvider provider) {
        RetryController controller = new RetryController(RetryPolicy.defaults(), new RetryState(),
                new RecordingSleeper(), () -> 0.0, Clock.systemUTC());
        return new GradingAgent(provider, controller);
    }

    @Test
    void gradesWithValidResponse() {
        FakeGradingProvider provider = FakeGradingProvider.scoring(0.8);
        GradingOutcome outcome = agent(provider).grade("An essay", RUBRIC, 0.5);

        assertTrue(outcome.isGraded());
        assertEquals(16.0, outcome.getRawResult().getTotalScore(), 0.001);
        assertEquals(1, outcome.getProviderCalls());
        assertEquals("An essay", provider.getRequests().get(0).text());
    }

    @Test
    void reformulatesAfterMalformedResponse() {
        FakeGradingProvider provider = new FakeGradingProvider((request, call) ->
                call == 1 ? "Sorry, I cannot produce JSON today." : FakeGradingProvider.validJson(request.rubric(), 0.5));
        GradingOutcome outcome = agent(provider).grade("text", RUBRIC, 0.5);

        assertTrue(outcome.isGraded());
        assertEquals(2, outcome.getProviderCalls());
        assertFalse(provider.getRequests().get(0).isReformulated());
        assertEquals(1, provider.getRequests().get(1).reformulation());
        assertTrue(GradingPromptBuilder.buildPrompt(provider.getRequests().get(1)).contains("could not be parsed"));
    }

    @Test
    void persistentMalformedResponseBecomesInvalidResponse() {
        FakeGradingProvider provider = new FakeGradingProvider((request, call) -> "not json at all");
        GradingOutcome outcome = agent(provider).grade("text", RUBRIC, 0.5);

        assertFalse(outcome.isGraded());
        assertEquals(ErrorKind.INVALID_RESPONSE, outcome.getError().getKind());
        assertEquals(GradingAgent.DEFAULT_MAX_REFORMULATIONS + 1, provider.getCalls());
    }

    @Test
    void transientFailuresExhaustBudget() {
        FakeGradingProvider provider = new FakeGradingProvider((request, call) -> {
            throw new ProviderException(500, "Internal Server Error");
        });
        GradingOutcome outcome = agent(provider).grade("text", RUBRIC, 0.5);

        assertFalse(outcome.isGraded());
        assertEquals(ErrorKind.TRANSIENT, outcome.getError().getKind());
        assertEquals(4, provider.getCalls());
        assertTrue(outcome.getError().describe().contains("after 4 attempts"));
    }

    @Test
    void agentsSharingStateTripTogether() {
        RetryState shared = new RetryState();
        RetryPolicy policy = new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(120), 2, Duration.ZERO);
        FakeGradingProvider provider = new FakeGradingProvider((request, call) -> {
            throw new ProviderException(429, "Too Many Requests");
        });
        GradingAgent first = new GradingAgent(provider,
                new RetryController(policy, shared, new RecordingSleeper(), () -> 0.0, Clock.systemUTC()));
        GradingAgent second = new GradingAgent(provider,
                new RetryController(policy, shared, new RecordingSleeper(), () -> 0.0, Clock.systemUTC()));

        assertEquals(ErrorKind.PROVIDER_EXHAUSTED, first.grade("a", RUBRIC, 0.5).getError().getKind());
        int callsAfterFirst = provider.getCalls();
        assertEquals(ErrorKind.PROVIDER_EXHAUSTED, second.grade("b", RUBRIC, 0.5).getError().getKind());
        assertEquals(callsAfterFirst, provider.getCalls());
    }
}
