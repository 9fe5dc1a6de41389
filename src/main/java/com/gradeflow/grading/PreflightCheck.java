package com.gradeflow.grading;

import com.gradeflow.models.Criterion;
import com.gradeflow.models.RubricDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Checks a job's inputs and provider before any submission is dispatched.
 * Any failure here fails the job as a whole.
 */
public class PreflightCheck {
    private static final Logger logger = LoggerFactory.getLogger(PreflightCheck.class);

    private final boolean readinessCheck;
    private final Duration readinessTimeout;
    private final boolean fallbackToHeuristic;

    public PreflightCheck(boolean readinessCheck, Duration readinessTimeout, boolean fallbackToHeuristic) {
        this.readinessCheck = readinessCheck;
        this.readinessTimeout = readinessTimeout;
        this.fallbackToHeuristic = fallbackToHeuristic;
    }

    public static PreflightCheck disabled() {
        return new PreflightCheck(false, Duration.ofSeconds(5), false);
    }

    /**
     * @return the provider the job should grade with: the given one, or the heuristic fallback
     *         when the given one is unreachable and fallback is enabled
     */
    public GradingProvider verify(RubricDefinition rubric, double strictness, GradingProvider provider)
            throws FatalConfigurationException {
        if (rubric == null || rubric.isEmpty()) {
            throw new FatalConfigurationException("Rubric has no criteria");
        }
        for (Criterion criterion : rubric.getCriteria()) {
            if (!(criterion.getMaxPoints() > 0)) {
                throw new FatalConfigurationException("Criterion '" + criterion.getName()
                        + "' has non-positive max points: " + criterion.getMaxPoints());
            }
        }
        if (Double.isNaN(strictness) || strictness < 0.0 || strictness > 1.0) {
            throw new FatalConfigurationException("Strictness must be within [0,1], got " + strictness);
        }
        if (!provider.isConfigured()) {
            throw new FatalConfigurationException("Provider " + provider.getName() + " is missing credentials");
        }
        if (readinessCheck) {
            try {
                provider.ping(readinessTimeout);
            } catch (ProviderException e) {
                if (fallbackToHeuristic) {
                    logger.warn("Provider {} not ready ({}), grading with heuristic fallback",
                            provider.getName(), e.getMessage());
                    return new HeuristicGradingProvider();
                }
                throw new FatalConfigurationException("Provider " + provider.getName() + " not ready: " + e.getMessage(), e);
            }
        }
        return provider;
    }
}
