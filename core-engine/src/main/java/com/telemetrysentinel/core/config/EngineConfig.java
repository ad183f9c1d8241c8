package com.telemetrysentinel.core.config;

import com.telemetrysentinel.core.model.WebVital;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Typed, immutable configuration of the telemetry engine.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults so
 * that a deployment can tune the engine without code changes.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class EngineConfig {

    // ---------------------------------------------------------------
    // Storage
    // ---------------------------------------------------------------
    private final String keyPrefix;

    // ---------------------------------------------------------------
    // Export sink
    // ---------------------------------------------------------------
    private final String environment;
    private final String release;
    private final double exportSampleRate;

    // ---------------------------------------------------------------
    // Classification
    // ---------------------------------------------------------------
    private final boolean autoClassify;
    private final double confidenceThreshold;

    // ---------------------------------------------------------------
    // Anomaly detection
    // ---------------------------------------------------------------
    private final boolean anomalyEnabled;
    private final double sensitivity;
    private final int windowSize;

    // ---------------------------------------------------------------
    // Sweeps
    // ---------------------------------------------------------------
    private final Duration patternSweepInterval;
    private final Duration analysisWindow;
    private final Duration regressionSweepInterval;
    private final List<String> regressionMetrics;

    // ---------------------------------------------------------------
    // Background dispatch
    // ---------------------------------------------------------------
    private final int dispatchAttempts;
    private final Duration dispatchBackoff;
    private final int dispatchThreads;

    private EngineConfig(Builder b) {
        this.keyPrefix = b.keyPrefix;
        this.environment = b.environment;
        this.release = b.release;
        this.exportSampleRate = b.exportSampleRate;
        this.autoClassify = b.autoClassify;
        this.confidenceThreshold = b.confidenceThreshold;
        this.anomalyEnabled = b.anomalyEnabled;
        this.sensitivity = b.sensitivity;
        this.windowSize = b.windowSize;
        this.patternSweepInterval = b.patternSweepInterval;
        this.analysisWindow = b.analysisWindow;
        this.regressionSweepInterval = b.regressionSweepInterval;
        this.regressionMetrics = List.copyOf(b.regressionMetrics);
        this.dispatchAttempts = b.dispatchAttempts;
        this.dispatchBackoff = b.dispatchBackoff;
        this.dispatchThreads = b.dispatchThreads;
    }

    /**
     * @return configuration with every value at its default
     */
    public static EngineConfig defaults() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build an {@link EngineConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static EngineConfig fromEnvironment() {
        try {
            return new Builder()
                    .keyPrefix(env("TELEMETRY_KEY_PREFIX", "telemetry"))
                    .environment(env("TELEMETRY_ENVIRONMENT", "production"))
                    .release(env("TELEMETRY_RELEASE", null))
                    .exportSampleRate(Double.parseDouble(env("EXPORT_SAMPLE_RATE", "1.0")))
                    .autoClassify(Boolean.parseBoolean(env("CLASSIFICATION_AUTO", "true")))
                    .confidenceThreshold(Double.parseDouble(env("CLASSIFICATION_CONFIDENCE_THRESHOLD", "0.5")))
                    .anomalyEnabled(Boolean.parseBoolean(env("ANOMALY_ENABLED", "true")))
                    .sensitivity(Double.parseDouble(env("ANOMALY_SENSITIVITY", "2.0")))
                    .windowSize(Integer.parseInt(env("ANOMALY_WINDOW_SIZE", "100")))
                    .patternSweepInterval(Duration.ofMillis(
                            Long.parseLong(env("PATTERN_SWEEP_INTERVAL_MS", "300000"))))
                    .analysisWindow(Duration.ofMillis(
                            Long.parseLong(env("PATTERN_ANALYSIS_WINDOW_MS", "3600000"))))
                    .regressionSweepInterval(Duration.ofMillis(
                            Long.parseLong(env("REGRESSION_SWEEP_INTERVAL_MS", "600000"))))
                    .regressionMetrics(parseList(env("REGRESSION_METRICS", "FCP,LCP,FID,CLS,TTFB,TTI")))
                    .dispatchAttempts(Integer.parseInt(env("DISPATCH_ATTEMPTS", "3")))
                    .dispatchBackoff(Duration.ofMillis(Long.parseLong(env("DISPATCH_BACKOFF_MS", "100"))))
                    .dispatchThreads(Integer.parseInt(env("DISPATCH_THREADS", "2")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Derived values
    // ---------------------------------------------------------------

    /**
     * @return z-score above which a measurement is anomalous
     */
    public double anomalyThreshold() {
        return 2 + sensitivity / 10;
    }

    /**
     * @return how long a pattern may stay idle before a sweep evicts it
     */
    public Duration patternIdleTimeout() {
        return analysisWindow.multipliedBy(24);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getKeyPrefix() {
        return keyPrefix;
    }

    public String getEnvironment() {
        return environment;
    }

    public String getRelease() {
        return release;
    }

    public double getExportSampleRate() {
        return exportSampleRate;
    }

    public boolean isAutoClassify() {
        return autoClassify;
    }

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public boolean isAnomalyEnabled() {
        return anomalyEnabled;
    }

    public double getSensitivity() {
        return sensitivity;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public Duration getPatternSweepInterval() {
        return patternSweepInterval;
    }

    public Duration getAnalysisWindow() {
        return analysisWindow;
    }

    public Duration getRegressionSweepInterval() {
        return regressionSweepInterval;
    }

    public List<String> getRegressionMetrics() {
        return regressionMetrics;
    }

    public int getDispatchAttempts() {
        return dispatchAttempts;
    }

    public Duration getDispatchBackoff() {
        return dispatchBackoff;
    }

    public int getDispatchThreads() {
        return dispatchThreads;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link EngineConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (sample rate and confidence threshold in [0, 1], sensitivity
     * &gt;= 0, window size &gt;= 10, positive intervals, at least one
     * dispatch attempt).
     * </p>
     */
    public static class Builder {
        private String keyPrefix = "telemetry";
        private String environment = "production";
        private String release;
        private double exportSampleRate = 1.0;
        private boolean autoClassify = true;
        private double confidenceThreshold = 0.5;
        private boolean anomalyEnabled = true;
        private double sensitivity = 2.0;
        private int windowSize = 100;
        private Duration patternSweepInterval = Duration.ofMinutes(5);
        private Duration analysisWindow = Duration.ofHours(1);
        private Duration regressionSweepInterval = Duration.ofMinutes(10);
        private List<String> regressionMetrics = new ArrayList<>(
                Arrays.stream(WebVital.values()).map(Enum::name).toList());
        private int dispatchAttempts = 3;
        private Duration dispatchBackoff = Duration.ofMillis(100);
        private int dispatchThreads = 2;

        public Builder keyPrefix(String v) {
            this.keyPrefix = v;
            return this;
        }

        public Builder environment(String v) {
            this.environment = v;
            return this;
        }

        public Builder release(String v) {
            this.release = v;
            return this;
        }

        public Builder exportSampleRate(double v) {
            this.exportSampleRate = v;
            return this;
        }

        public Builder autoClassify(boolean v) {
            this.autoClassify = v;
            return this;
        }

        public Builder confidenceThreshold(double v) {
            this.confidenceThreshold = v;
            return this;
        }

        public Builder anomalyEnabled(boolean v) {
            this.anomalyEnabled = v;
            return this;
        }

        public Builder sensitivity(double v) {
            this.sensitivity = v;
            return this;
        }

        public Builder windowSize(int v) {
            this.windowSize = v;
            return this;
        }

        public Builder patternSweepInterval(Duration v) {
            this.patternSweepInterval = v;
            return this;
        }

        public Builder analysisWindow(Duration v) {
            this.analysisWindow = v;
            return this;
        }

        public Builder regressionSweepInterval(Duration v) {
            this.regressionSweepInterval = v;
            return this;
        }

        public Builder regressionMetrics(List<String> v) {
            this.regressionMetrics = v != null ? new ArrayList<>(v) : new ArrayList<>();
            return this;
        }

        public Builder dispatchAttempts(int v) {
            this.dispatchAttempts = v;
            return this;
        }

        public Builder dispatchBackoff(Duration v) {
            this.dispatchBackoff = v;
            return this;
        }

        public Builder dispatchThreads(int v) {
            this.dispatchThreads = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link EngineConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public EngineConfig build() {
            requireNonBlank(keyPrefix, "keyPrefix");
            requireNonBlank(environment, "environment");
            requireUnitInterval(exportSampleRate, "exportSampleRate");
            requireUnitInterval(confidenceThreshold, "confidenceThreshold");
            if (sensitivity < 0 || Double.isNaN(sensitivity)) {
                throw new IllegalArgumentException("sensitivity must be >= 0, got: " + sensitivity);
            }
            if (windowSize < 10) {
                throw new IllegalArgumentException(
                        "windowSize must be >= 10 (the cold-start minimum), got: " + windowSize);
            }
            requirePositive(patternSweepInterval, "patternSweepInterval");
            requirePositive(analysisWindow, "analysisWindow");
            requirePositive(regressionSweepInterval, "regressionSweepInterval");
            Objects.requireNonNull(dispatchBackoff, "dispatchBackoff required");
            if (dispatchBackoff.isNegative()) {
                throw new IllegalArgumentException("dispatchBackoff must not be negative");
            }
            if (dispatchAttempts < 1) {
                throw new IllegalArgumentException(
                        "dispatchAttempts must be >= 1, got: " + dispatchAttempts);
            }
            if (dispatchThreads < 1) {
                throw new IllegalArgumentException(
                        "dispatchThreads must be >= 1, got: " + dispatchThreads);
            }
            regressionMetrics.forEach(m -> requireNonBlank(m, "regressionMetrics entry"));

            return new EngineConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }

        private static void requireUnitInterval(double value, String name) {
            if (!(value >= 0 && value <= 1)) {
                throw new IllegalArgumentException(name + " must be in [0, 1], got: " + value);
            }
        }

        private static void requirePositive(Duration value, String name) {
            if (value == null || value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be a positive duration, got: " + value);
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static List<String> parseList(String csv) {
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "keyPrefix='" + keyPrefix + '\'' +
                ", environment='" + environment + '\'' +
                ", release='" + release + '\'' +
                ", exportSampleRate=" + exportSampleRate +
                ", autoClassify=" + autoClassify +
                ", confidenceThreshold=" + confidenceThreshold +
                ", anomalyEnabled=" + anomalyEnabled +
                ", sensitivity=" + sensitivity +
                ", windowSize=" + windowSize +
                ", patternSweepInterval=" + patternSweepInterval +
                ", analysisWindow=" + analysisWindow +
                ", regressionSweepInterval=" + regressionSweepInterval +
                ", regressionMetrics=" + regressionMetrics +
                '}';
    }
}
