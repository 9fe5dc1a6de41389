package com.gradeflow;

import com.gradeflow.extraction.FileAccessPolicy;
import com.gradeflow.grading.PreflightCheck;
import com.gradeflow.grading.RetryPolicy;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Typed view of the {@code gradeflow} configuration block
 */
public final class GradingSettings {
    private final int concurrency;
    private final double passingThreshold;
    private final double defaultStrictness;
    private final RetryPolicy retryPolicy;
    private final int maxReformulations;
    private final String providerBaseUrl;
    private final String providerModel;
    private final String configuredApiKey;
    private final Duration requestTimeout;
    private final boolean readinessCheck;
    private final Duration readinessTimeout;
    private final boolean fallbackToHeuristic;
    private final FileAccessPolicy fileAccessPolicy;
    private final long maxFileBytes;
    private final String httpHost;
    private final int httpPort;

    public GradingSettings(Config root) {
        Config config = root.getConfig("gradeflow");
        this.concurrency = config.getInt("concurrency");
        this.passingThreshold = config.getDouble("passing-threshold");
        this.defaultStrictness = config.getDouble("default-strictness");
        this.retryPolicy = new RetryPolicy(
                config.getInt("retry.max-retries"),
                config.getDuration("retry.base-delay"),
                config.getDuration("retry.max-delay"),
                config.getInt("retry.circuit-breaker-threshold"),
                config.getDuration("retry.min-request-interval"));
        this.maxReformulations = config.getInt("agent.max-reformulations");
        this.providerBaseUrl = config.getString("provider.base-url");
        this.providerModel = config.getString("provider.model");
        this.configuredApiKey = config.hasPath("provider.api-key") ? config.getString("provider.api-key") : null;
        this.requestTimeout = config.getDuration("provider.request-timeout");
        this.readinessCheck = config.getBoolean("provider.readiness-check");
        this.readinessTimeout = config.getDuration("provider.readiness-timeout");
        this.fallbackToHeuristic = config.getBoolean("provider.fallback-to-heuristic");
        String allowedRoot = config.getString("extraction.allowed-root");
        Path allowedRootPath = allowedRoot.isBlank() ? null : Paths.get(allowedRoot);
        this.fileAccessPolicy = new FileAccessPolicy(allowedRootPath, config.getStringList("extraction.allowed-hosts"));
        this.maxFileBytes = config.getBytes("extraction.max-file-size");
        this.httpHost = config.getString("http.host");
        this.httpPort = config.getInt("http.port");

        if (concurrency < 1) {
            throw new IllegalArgumentException("gradeflow.concurrency must be >= 1, got " + concurrency);
        }
        if (maxFileBytes < 1) {
            throw new IllegalArgumentException("gradeflow.extraction.max-file-size must be positive, got " + maxFileBytes);
        }
    }

    public static GradingSettings load() {
        return new GradingSettings(ConfigFactory.load());
    }

    public PreflightCheck preflightCheck() {
        return new PreflightCheck(readinessCheck, readinessTimeout, fallbackToHeuristic);
    }

    public int getConcurrency() { return concurrency; }
    public double getPassingThreshold() { return passingThreshold; }
    public double getDefaultStrictness() { return defaultStrictness; }
    public RetryPolicy getRetryPolicy() { return retryPolicy; }
    public int getMaxReformulations() { return maxReformulations; }
    public String getProviderBaseUrl() { return providerBaseUrl; }
    public String getProviderModel() { return providerModel; }
    public String getConfiguredApiKey() { return configuredApiKey; }
    public Duration getRequestTimeout() { return requestTimeout; }
    public boolean isReadinessCheck() { return readinessCheck; }
    public Duration getReadinessTimeout() { return readinessTimeout; }
    public boolean isFallbackToHeuristic() { return fallbackToHeuristic; }
    public FileAccessPolicy getFileAccessPolicy() { return fileAccessPolicy; }
    public long getMaxFileBytes() { return maxFileBytes; }
    public String getHttpHost() { return httpHost; }
    public int getHttpPort() { return httpPort; }
}
