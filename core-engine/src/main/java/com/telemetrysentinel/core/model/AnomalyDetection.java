package com.telemetrysentinel.core.model;

/**
 * Outcome of testing one measurement against its rolling baseline.
 *
 * @since 1.0.0
 */
public final class AnomalyDetection {

    private final boolean detected;
    private final double confidence;
    private final double baseline;
    private final double deviation;
    private final String reason;

    /**
     * @param detected   whether the value is anomalous
     * @param confidence confidence in [0, 1]
     * @param baseline   baseline mean the value was compared to
     * @param deviation  signed difference {@code value - baseline}
     * @param reason     human-readable explanation
     */
    public AnomalyDetection(boolean detected, double confidence, double baseline,
            double deviation, String reason) {
        this.detected = detected;
        this.confidence = confidence;
        this.baseline = baseline;
        this.deviation = deviation;
        this.reason = reason;
    }

    /**
     * @param reason why nothing was detected
     * @return a not-detected result with zero confidence, baseline and deviation
     */
    public static AnomalyDetection notDetected(String reason) {
        return new AnomalyDetection(false, 0, 0, 0, reason);
    }

    public boolean isDetected() {
        return detected;
    }

    public double getConfidence() {
        return confidence;
    }

    public double getBaseline() {
        return baseline;
    }

    public double getDeviation() {
        return deviation;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return "AnomalyDetection{" +
                "detected=" + detected +
                ", confidence=" + confidence +
                ", baseline=" + baseline +
                ", deviation=" + deviation +
                ", reason='" + reason + '\'' +
                '}';
    }
}
