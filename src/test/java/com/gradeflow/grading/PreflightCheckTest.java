package com.gradeflow.grading;

import com.gradeflow.models.Criterion;
import com.gradeflow.models.RubricDefinition;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PreflightCheckTest {

    private static final RubricDefinition RUBRIC = RubricDefinition.of(new Criterion("Content", 10));

    @Test
    void acceptsValidJob() throws Exception {
        FakeGradingProvider provider = FakeGradingProvider.scoring(1.0);
        assertSame(provider, new PreflightCheck(true, Duration.ofSeconds(1), false).verify(RUBRIC, 0.5, provider));
    }

    @Test
    void rejectsBadRubricAndStrictness() {
        PreflightCheck check = PreflightCheck.disabled();
        FakeGradingProvider provider = FakeGradingProvider.scoring(1.0);

        assertThrows(FatalConfigurationException.class, () -> check.verify(new RubricDefinition(List.of()), 0.5, provider));
        assertThrows(FatalConfigurationException.class,
                () -> check.verify(RubricDefinition.of(new Criterion("Zero", 0)), 0.5, provider));
        assertThrows(FatalConfigurationException.class, () -> check.verify(RUBRIC, 1.2, provider));
        assertThrows(FatalConfigurationException.class, () -> check.verify(RUBRIC, Double.NaN, provider));
    }

    @Test
    void missingCredentialsAreFatalEvenWithFallback() {
        FakeGradingProvider provider = new FakeGradingProvider((request, call) -> "{}", false);
        PreflightCheck check = new PreflightCheck(true, Duration.ofSeconds(1), true);

        FatalConfigurationException e = assertThrows(FatalConfigurationException.class,
                () -> check.verify(RUBRIC, 0.5, provider));
        assertTrue(e.getMessage().contains("credentials"));
    }

    @Test
    void unreachableProviderIsFatalWithoutFallback() {
        FakeGradingProvider provider = FakeGradingProvider.scoring(1.0);
        provider.failPingWith(new ProviderException(503, "down"));

        assertThrows(FatalConfigurationException.class,
                () -> new PreflightCheck(true, Duration.ofSeconds(1), false).verify(RUBRIC, 0.5, provider));
    }

    @Test
    void unreachableProviderFallsBackToHeuristic() throws Exception {
        FakeGradingProvider provider = FakeGradingProvider.scoring(1.0);
        provider.failPingWith(new ProviderException(503, "down"));

        GradingProvider chosen = new PreflightCheck(true, Duration.ofSeconds(1), true).verify(RUBRIC, 0.5, provider);
        assertTrue(chosen instanceof HeuristicGradingProvider);
    }

    @Test
    void readinessProbeSkippedWhenDisabled() throws Exception {
        FakeGradingProvider provider = FakeGradingProvider.scoring(1.0);
        provider.failPingWith(new ProviderException(503, "down"));

        assertSame(provider, PreflightCheck.disabled().verify(RUBRIC, 0.5, provider));
    }
}
