package com.gradeflow.grading;

import java.time.Duration;

/**
 * External AI grading provider. Implementations perform exactly one request per call and do not retry.
 */
public interface GradingProvider {

    /**
     * @return the provider's raw answer, expected to contain a score-result JSON object
     */
    String requestGrading(GradingRequest request) throws ProviderException;

    /**
     * Whether credentials and endpoint are present; checked before a job starts
     */
    boolean isConfigured();

    /**
     * Readiness probe with a bounded wait
     */
    void ping(Duration timeout) throws ProviderException;

    String getName();
}
