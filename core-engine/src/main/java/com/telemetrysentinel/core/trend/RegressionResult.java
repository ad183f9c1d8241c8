package com.telemetrysentinel.core.trend;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome of comparing a metric's recent samples with its earliest ones.
 *
 * @since 1.0.0
 */
public final class RegressionResult {

    /** Why a result does or does not flag a regression. */
    public enum Status {
        INSUFFICIENT_DATA,
        REGRESSION,
        NO_REGRESSION;

        @JsonValue
        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final String metric;
    private final Status status;
    private final double recentAvg;
    private final double baselineAvg;
    private final double changePct;
    private final int sampleCount;

    private RegressionResult(String metric, Status status, double recentAvg,
            double baselineAvg, double changePct, int sampleCount) {
        this.metric = metric;
        this.status = status;
        this.recentAvg = recentAvg;
        this.baselineAvg = baselineAvg;
        this.changePct = changePct;
        this.sampleCount = sampleCount;
    }

    static RegressionResult insufficientData(String metric, int sampleCount) {
        return new RegressionResult(metric, Status.INSUFFICIENT_DATA, 0, 0, 0, sampleCount);
    }

    static RegressionResult compared(String metric, boolean regression, double recentAvg,
            double baselineAvg, int sampleCount) {
        double changePct = baselineAvg == 0 ? 0 : (recentAvg - baselineAvg) / baselineAvg * 100;
        return new RegressionResult(metric,
                regression ? Status.REGRESSION : Status.NO_REGRESSION,
                recentAvg, baselineAvg, changePct, sampleCount);
    }

    public boolean isRegression() {
        return status == Status.REGRESSION;
    }

    public String getMetric() {
        return metric;
    }

    public Status getStatus() {
        return status;
    }

    public double getRecentAvg() {
        return recentAvg;
    }

    public double getBaselineAvg() {
        return baselineAvg;
    }

    /** Percentage change of the recent average over the baseline; 0 when the baseline is 0. */
    public double getChangePct() {
        return changePct;
    }

    public int getSampleCount() {
        return sampleCount;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT,
                "RegressionResult{metric='%s', status=%s, recentAvg=%.3f, baselineAvg=%.3f, changePct=%.1f, samples=%d}",
                metric, status, recentAvg, baselineAvg, changePct, sampleCount);
    }
}
