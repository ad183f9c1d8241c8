package com.telemetrysentinel.core.detection;

import com.telemetrysentinel.core.model.AnomalyDetection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rolling z-score anomaly detector.
 *
 * <p>
 * Keeps one bounded {@link Baseline} per {@code (metric, service)} key. Each
 * call appends the value to its key's window and then tests
 * {@code |value - mean| / stdDev} against {@code 2 + sensitivity / 10}.
 * </p>
 *
 * <h3>Cold start</h3>
 * <p>
 * Nothing is reported until a key holds {@value Baseline#MIN_SAMPLES}
 * samples, so a fresh key never flags its first nine values.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * This is a <strong>stateful</strong> detector. Baselines live in memory
 * only and start from scratch after a restart.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyDetector.class);

    private final int windowSize;
    private final double threshold;
    private final Map<String, Baseline> baselines = new ConcurrentHashMap<>();

    /**
     * @param sensitivity added (divided by ten) to the base threshold of 2
     *                    sigma; must be &gt;= 0
     * @param windowSize  samples kept per key; must be &gt;=
     *                    {@value Baseline#MIN_SAMPLES}
     * @throws IllegalArgumentException if either argument is out of range
     */
    public AnomalyDetector(double sensitivity, int windowSize) {
        if (sensitivity < 0 || Double.isNaN(sensitivity)) {
            throw new IllegalArgumentException("sensitivity must be >= 0, got: " + sensitivity);
        }
        if (windowSize < Baseline.MIN_SAMPLES) {
            throw new IllegalArgumentException(
                    "windowSize must be >= " + Baseline.MIN_SAMPLES + ", got: " + windowSize);
        }
        this.windowSize = windowSize;
        this.threshold = 2 + sensitivity / 10;
    }

    /**
     * Record a measurement and decide whether it is anomalous.
     *
     * @param metric  metric name; must not be {@code null}
     * @param service service name; must not be {@code null}
     * @param value   the measurement
     * @return the verdict
     */
    public AnomalyDetection evaluate(String metric, String service, double value) {
        Objects.requireNonNull(metric, "metric must not be null");
        Objects.requireNonNull(service, "service must not be null");

        Baseline baseline = baselines.computeIfAbsent(key(metric, service), k -> new Baseline(windowSize));
        AnomalyDetection result = baseline.appendAndEvaluate(value, threshold);

        if (result.isDetected()) {
            LOG.debug("Anomaly on [{}:{}]: value={} baseline={} deviation={}",
                    metric, service, value, result.getBaseline(), result.getDeviation());
        }
        return result;
    }

    /**
     * @return z-score threshold in use
     */
    public double threshold() {
        return threshold;
    }

    /**
     * @return number of keys with a baseline
     */
    public int baselineCount() {
        return baselines.size();
    }

    /**
     * @param metric  metric name
     * @param service service name
     * @return copy of the key's window, oldest first; empty if unknown
     */
    public List<Double> baselineValues(String metric, String service) {
        Baseline baseline = baselines.get(key(metric, service));
        return baseline == null ? List.of() : baseline.snapshot();
    }

    private static String key(String metric, String service) {
        return metric + ':' + service;
    }
}
