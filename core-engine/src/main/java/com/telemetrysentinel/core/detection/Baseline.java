package com.telemetrysentinel.core.detection;

import com.telemetrysentinel.core.model.AnomalyDetection;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Rolling window of recent values for one (metric, service) pair.
 *
 * <h3>Window</h3>
 * <p>
 * Holds at most {@code capacity} values; the oldest value is evicted first.
 * The value under test is appended <em>before</em> the statistics are
 * computed, so it takes part in its own baseline.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Append-and-evaluate is a single synchronized step, so concurrent
 * measurements for the same key never lose a sample or see a window that is
 * half updated.
 * </p>
 *
 * @since 1.0.0
 */
final class Baseline {

    /** Minimum number of samples before any anomaly can be reported. */
    static final int MIN_SAMPLES = 10;

    static final String INSUFFICIENT_DATA = "insufficient baseline data";
    static final String WITHIN_RANGE = "Within normal range";

    private final int capacity;
    private final Deque<Double> window = new ArrayDeque<>();

    Baseline(int capacity) {
        if (capacity < MIN_SAMPLES) {
            throw new IllegalArgumentException(
                    "capacity must be >= " + MIN_SAMPLES + ", got: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Append {@code value} and test it against the updated window.
     *
     * @param value     the new measurement
     * @param threshold z-score above which the value is anomalous
     * @return the verdict
     */
    synchronized AnomalyDetection appendAndEvaluate(double value, double threshold) {
        window.addLast(value);
        while (window.size() > capacity) {
            window.pollFirst();
        }

        if (window.size() < MIN_SAMPLES) {
            return AnomalyDetection.notDetected(INSUFFICIENT_DATA);
        }

        double mean = computeMean();
        double stdDev = computeStdDev(mean);
        double deviation = value - mean;

        if (stdDev == 0) {
            // constant history: any difference is infinitely many sigmas away
            return deviation == 0
                    ? new AnomalyDetection(false, 0, mean, 0, WITHIN_RANGE)
                    : new AnomalyDetection(true, 1, mean, deviation,
                            "Value differs from a constant baseline of " + mean);
        }

        double zScore = Math.abs(deviation) / stdDev;
        boolean detected = zScore > threshold;
        double confidence = Math.min(zScore / threshold, 1);

        return new AnomalyDetection(detected, confidence, mean, deviation, detected
                ? String.format("Value deviates %.2f standard deviations from baseline", zScore)
                : WITHIN_RANGE);
    }

    synchronized int size() {
        return window.size();
    }

    synchronized List<Double> snapshot() {
        return List.copyOf(window);
    }

    // ---------------------------------------------------------------
    // Statistics helpers
    // ---------------------------------------------------------------

    private double computeMean() {
        double sum = 0;
        for (double v : window) {
            sum += v;
        }
        return sum / window.size();
    }

    /** Population standard deviation. */
    private double computeStdDev(double mean) {
        double sumSquaredDiff = 0;
        for (double v : window) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / window.size());
    }
}
