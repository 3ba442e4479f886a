package io.isoflow.core;

import io.isoflow.core.detect.WorkflowBoundaryDetector;
import io.isoflow.core.job.RenderJobManager;
import io.isoflow.core.pipeline.BatchProcessor;
import io.isoflow.core.render.FallbackPolicy;
import io.isoflow.core.render.OutputFormat;
import io.isoflow.core.render.QualityMode;
import io.isoflow.core.render.RenderDispatcher;
import io.isoflow.core.render.SystemCapabilityDetector;
import io.isoflow.core.render.backend.EngineLocations;
import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import java.util.Properties;

/// Configuration options for the isoflow environment.
///
/// Use the {@link Builder} for fluent configuration, {@link #fromProperties(Properties)}
/// for `isoflow.*` keys, or the setters directly.
///
/// ### Properties
/// | Key                                | Default                  |
/// |------------------------------------|--------------------------|
/// | `isoflow.threadPoolSize`           | `4`                      |
/// | `isoflow.render.concurrency`       | `3`                      |
/// | `isoflow.render.timeoutSeconds`    | `60`                     |
/// | `isoflow.render.strictArtifactChecks` | `true`                |
/// | `isoflow.render.qualityMode`       | `draft_allowed`          |
/// | `isoflow.render.fallbackPolicy`    | `graphviz,d2,mermaid,kroki,html` |
/// | `isoflow.render.format`            | `svg`                    |
/// | `isoflow.capability.ttlSeconds`    | `300`                    |
/// | `isoflow.detect.minConfidence`     | `0.3`                    |
/// | `isoflow.batch.timeoutSeconds`     | `300`                    |
/// | `isoflow.jobs.ttlSeconds`          | `3600`                   |
/// | `isoflow.jobs.maxConcurrent`       | `3`                      |
/// | `isoflow.engine.dot`               | `dot`                    |
/// | `isoflow.engine.d2`                | `d2`                     |
/// | `isoflow.engine.mmdc`              | `mmdc`                   |
/// | `isoflow.engine.krokiUrl`          | `https://kroki.io`       |
///
/// @implNote **Not thread-safe**. Configure before passing to {@link IsoflowFactory} and
/// do not modify afterwards.
public class IsoflowConfig {

    static final String PREFIX = "isoflow.";

    private int threadPoolSize = 4;
    private int renderConcurrency = BatchProcessor.DEFAULT_RENDER_CONCURRENCY;
    private Duration renderTimeout = RenderDispatcher.DEFAULT_TIMEOUT;
    private boolean strictArtifactChecks = true;
    private QualityMode qualityMode = QualityMode.DRAFT_ALLOWED;
    private FallbackPolicy fallbackPolicy = FallbackPolicy.defaults();
    private OutputFormat outputFormat = OutputFormat.SVG;
    private Duration capabilityTtl = SystemCapabilityDetector.DEFAULT_TTL;
    private double minCandidateConfidence = WorkflowBoundaryDetector.DEFAULT_MIN_CONFIDENCE;
    private Duration candidateTimeout = BatchProcessor.DEFAULT_CANDIDATE_TIMEOUT;
    private Duration jobTtl = RenderJobManager.DEFAULT_TTL;
    private int maxConcurrentJobs = RenderJobManager.DEFAULT_MAX_CONCURRENT;
    private EngineLocations engines = EngineLocations.defaults();

    public IsoflowConfig() {}

    /// Reads `isoflow.*` keys; missing keys keep their defaults.
    ///
    /// @param properties source properties, not null
    /// @return a new config, never null
    /// @throws IllegalArgumentException if a value cannot be parsed
    public static IsoflowConfig fromProperties(Properties properties) {
        IsoflowConfig config = new IsoflowConfig();
        config.threadPoolSize = intValue(properties, "threadPoolSize", config.threadPoolSize);
        config.renderConcurrency =
                intValue(properties, "render.concurrency", config.renderConcurrency);
        config.renderTimeout = seconds(properties, "render.timeoutSeconds", config.renderTimeout);
        config.strictArtifactChecks =
                Boolean.parseBoolean(
                        value(
                                properties,
                                "render.strictArtifactChecks",
                                String.valueOf(config.strictArtifactChecks)));
        config.qualityMode =
                QualityMode.valueOf(
                        value(properties, "render.qualityMode", config.qualityMode.name())
                                .toUpperCase(Locale.ROOT));
        String policy = properties.getProperty(PREFIX + "render.fallbackPolicy");
        if (policy != null && !policy.isBlank()) {
            config.fallbackPolicy = FallbackPolicy.parse(policy);
        }
        config.outputFormat =
                OutputFormat.valueOf(
                        value(properties, "render.format", config.outputFormat.name())
                                .toUpperCase(Locale.ROOT));
        config.capabilityTtl = seconds(properties, "capability.ttlSeconds", config.capabilityTtl);
        config.minCandidateConfidence =
                doubleValue(properties, "detect.minConfidence", config.minCandidateConfidence);
        config.candidateTimeout =
                seconds(properties, "batch.timeoutSeconds", config.candidateTimeout);
        config.jobTtl = seconds(properties, "jobs.ttlSeconds", config.jobTtl);
        config.maxConcurrentJobs =
                intValue(properties, "jobs.maxConcurrent", config.maxConcurrentJobs);

        EngineLocations defaults = config.engines;
        config.engines =
                new EngineLocations(
                        value(properties, "engine.dot", defaults.dot()),
                        value(properties, "engine.d2", defaults.d2()),
                        value(properties, "engine.mmdc", defaults.mmdc()),
                        URI.create(
                                value(properties, "engine.krokiUrl", defaults.kroki().toString())));
        return config;
    }

    private static String value(Properties properties, String key, String fallback) {
        String value = properties.getProperty(PREFIX + key);
        return value == null || value.isBlank() ? fallback : value.strip();
    }

    private static int intValue(Properties properties, String key, int fallback) {
        String value = value(properties, key, null);
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Invalid integer for " + PREFIX + key + ": " + value, e);
        }
    }

    private static double doubleValue(Properties properties, String key, double fallback) {
        String value = value(properties, key, null);
        if (value == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Invalid number for " + PREFIX + key + ": " + value, e);
        }
    }

    private static Duration seconds(Properties properties, String key, Duration fallback) {
        String value = value(properties, key, null);
        return value == null ? fallback : Duration.ofSeconds(intValue(properties, key, 0));
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    public void setThreadPoolSize(int threadPoolSize) {
        this.threadPoolSize = threadPoolSize;
    }

    /// Returns how many renders may run at once in a batch.
    public int getRenderConcurrency() {
        return renderConcurrency;
    }

    public void setRenderConcurrency(int renderConcurrency) {
        this.renderConcurrency = renderConcurrency;
    }

    /// Returns the hard timeout of one backend attempt.
    public Duration getRenderTimeout() {
        return renderTimeout;
    }

    public void setRenderTimeout(Duration renderTimeout) {
        this.renderTimeout = renderTimeout;
    }

    public boolean isStrictArtifactChecks() {
        return strictArtifactChecks;
    }

    public void setStrictArtifactChecks(boolean strictArtifactChecks) {
        this.strictArtifactChecks = strictArtifactChecks;
    }

    public QualityMode getQualityMode() {
        return qualityMode;
    }

    public void setQualityMode(QualityMode qualityMode) {
        this.qualityMode = qualityMode;
    }

    public FallbackPolicy getFallbackPolicy() {
        return fallbackPolicy;
    }

    public void setFallbackPolicy(FallbackPolicy fallbackPolicy) {
        this.fallbackPolicy = fallbackPolicy;
    }

    public OutputFormat getOutputFormat() {
        return outputFormat;
    }

    public void setOutputFormat(OutputFormat outputFormat) {
        this.outputFormat = outputFormat;
    }

    /// Returns how long backend availability is cached.
    public Duration getCapabilityTtl() {
        return capabilityTtl;
    }

    public void setCapabilityTtl(Duration capabilityTtl) {
        this.capabilityTtl = capabilityTtl;
    }

    public double getMinCandidateConfidence() {
        return minCandidateConfidence;
    }

    public void setMinCandidateConfidence(double minCandidateConfidence) {
        this.minCandidateConfidence = minCandidateConfidence;
    }

    /// Returns the per-workflow timeout of batch processing.
    public Duration getCandidateTimeout() {
        return candidateTimeout;
    }

    public void setCandidateTimeout(Duration candidateTimeout) {
        this.candidateTimeout = candidateTimeout;
    }

    /// Returns how long a finished render job stays queryable.
    public Duration getJobTtl() {
        return jobTtl;
    }

    public void setJobTtl(Duration jobTtl) {
        this.jobTtl = jobTtl;
    }

    public int getMaxConcurrentJobs() {
        return maxConcurrentJobs;
    }

    public void setMaxConcurrentJobs(int maxConcurrentJobs) {
        this.maxConcurrentJobs = maxConcurrentJobs;
    }

    public EngineLocations getEngines() {
        return engines;
    }

    public void setEngines(EngineLocations engines) {
        this.engines = engines;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link IsoflowConfig}.
    ///
    /// @implNote Mutates a single config instance and returns it on {@link #build()}.
    public static class Builder {
        private final IsoflowConfig config = new IsoflowConfig();

        public Builder threadPoolSize(int threadPoolSize) {
            config.threadPoolSize = threadPoolSize;
            return this;
        }

        public Builder renderConcurrency(int renderConcurrency) {
            config.renderConcurrency = renderConcurrency;
            return this;
        }

        public Builder renderTimeout(Duration renderTimeout) {
            config.renderTimeout = renderTimeout;
            return this;
        }

        public Builder strictArtifactChecks(boolean strictArtifactChecks) {
            config.strictArtifactChecks = strictArtifactChecks;
            return this;
        }

        public Builder qualityMode(QualityMode qualityMode) {
            config.qualityMode = qualityMode;
            return this;
        }

        public Builder fallbackPolicy(FallbackPolicy fallbackPolicy) {
            config.fallbackPolicy = fallbackPolicy;
            return this;
        }

        public Builder outputFormat(OutputFormat outputFormat) {
            config.outputFormat = outputFormat;
            return this;
        }

        public Builder capabilityTtl(Duration capabilityTtl) {
            config.capabilityTtl = capabilityTtl;
            return this;
        }

        public Builder minCandidateConfidence(double minCandidateConfidence) {
            config.minCandidateConfidence = minCandidateConfidence;
            return this;
        }

        public Builder candidateTimeout(Duration candidateTimeout) {
            config.candidateTimeout = candidateTimeout;
            return this;
        }

        public Builder jobTtl(Duration jobTtl) {
            config.jobTtl = jobTtl;
            return this;
        }

        public Builder maxConcurrentJobs(int maxConcurrentJobs) {
            config.maxConcurrentJobs = maxConcurrentJobs;
            return this;
        }

        public Builder engines(EngineLocations engines) {
            config.engines = engines;
            return this;
        }

        public IsoflowConfig build() {
            return config;
        }
    }
}
