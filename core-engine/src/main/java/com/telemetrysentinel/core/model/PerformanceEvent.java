package com.telemetrysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Objects;

/**
 * One accepted performance measurement, with its anomaly verdict attached.
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PerformanceEvent {

    private final String id;
    private final Instant timestamp;
    private final String correlationId;
    private final PerformanceType type;
    private final String metric;
    private final double value;
    private final String unit;
    private final PerformanceContext context;
    private final PerformanceThreshold thresholds;
    private final AnomalyDetection anomaly;

    /**
     * @param id          event id
     * @param timestamp   when the event was accepted
     * @param measurement the caller's measurement
     * @param anomaly     anomaly verdict, or {@code null} when detection is off
     */
    public PerformanceEvent(String id, Instant timestamp, PerformanceMeasurement measurement,
            AnomalyDetection anomaly) {
        Objects.requireNonNull(measurement, "measurement must not be null");
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.correlationId = measurement.getCorrelationId();
        this.type = measurement.getType();
        this.metric = measurement.getMetric();
        this.value = measurement.getValue();
        this.unit = measurement.getUnit();
        this.context = measurement.getContext();
        this.thresholds = measurement.getThresholds();
        this.anomaly = anomaly;
    }

    public String getId() {
        return id;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public PerformanceType getType() {
        return type;
    }

    public String getMetric() {
        return metric;
    }

    public double getValue() {
        return value;
    }

    public String getUnit() {
        return unit;
    }

    public PerformanceContext getContext() {
        return context;
    }

    public PerformanceThreshold getThresholds() {
        return thresholds;
    }

    public AnomalyDetection getAnomaly() {
        return anomaly;
    }

    @Override
    public String toString() {
        return "PerformanceEvent{" +
                "id='" + id + '\'' +
                ", metric='" + metric + '\'' +
                ", value=" + value + unit +
                ", anomaly=" + anomaly +
                '}';
    }
}
