package com.telemetrysentinel.core.trend;

import com.telemetrysentinel.core.storage.TelemetryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Detects slow drifts in a metric that per-sample anomaly detection misses.
 *
 * <p>
 * Reads the metric's minute-bucket time series for the last
 * {@link #HISTORY} and compares the mean of the first {@value #WINDOW}
 * samples against the mean of the last {@value #WINDOW}. With fewer than
 * {@link #WINDOW} samples the two windows overlap. A recent mean more than
 * {@value #REGRESSION_RATIO} times the baseline mean is a regression.
 * </p>
 *
 * <p>
 * Higher values are treated as worse for every metric, which holds for the
 * web vitals this is swept over.
 * </p>
 *
 * @since 1.0.0
 */
public class TrendAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(TrendAnalyzer.class);

    public static final Duration HISTORY = Duration.ofDays(7);
    static final int MIN_SAMPLES = 10;
    static final int WINDOW = 24;
    static final double REGRESSION_RATIO = 1.2;

    private final TelemetryRepository repository;
    private final Clock clock;

    public TrendAnalyzer(TelemetryRepository repository, Clock clock) {
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @param metric metric name as recorded; must not be blank
     * @return the comparison, or {@link RegressionResult.Status#INSUFFICIENT_DATA}
     */
    public RegressionResult checkRegression(String metric) {
        if (metric == null || metric.isBlank()) {
            throw new IllegalArgumentException("metric must not be blank");
        }
        Instant now = clock.instant();
        List<Double> history = repository.metricHistory(metric, now.minus(HISTORY), now);
        if (history.size() < MIN_SAMPLES) {
            LOG.debug("Not enough samples for {} trend: {}", metric, history.size());
            return RegressionResult.insufficientData(metric, history.size());
        }

        double baselineAvg = mean(history.subList(0, Math.min(WINDOW, history.size())));
        double recentAvg = mean(history.subList(Math.max(0, history.size() - WINDOW), history.size()));
        boolean regression = recentAvg > baselineAvg * REGRESSION_RATIO;

        RegressionResult result = RegressionResult.compared(metric, regression, recentAvg, baselineAvg, history.size());
        if (regression) {
            LOG.info("Performance regression in {}: {}", metric, result);
        }
        return result;
    }

    private static double mean(List<Double> values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }
}
