package com.telemetrysentinel.core.model;

import java.util.Objects;

/**
 * A performance measurement as submitted by a caller, before the engine has
 * assigned an id and timestamp.
 *
 * <p>
 * {@code metric} is required and {@code value} must be finite. Missing
 * optional parts are replaced with safe defaults at build time: an empty
 * context, unbounded thresholds, type {@code api_call} and an empty unit.
 * </p>
 *
 * @since 1.0.0
 */
public final class PerformanceMeasurement {

    private final String correlationId;
    private final PerformanceType type;
    private final String metric;
    private final double value;
    private final String unit;
    private final PerformanceContext context;
    private final PerformanceThreshold thresholds;

    private PerformanceMeasurement(Builder b) {
        if (b.metric == null || b.metric.isBlank()) {
            throw new IllegalArgumentException("metric must not be blank");
        }
        if (!Double.isFinite(b.value)) {
            throw new IllegalArgumentException("value must be finite, got: " + b.value);
        }
        this.correlationId = b.correlationId;
        this.type = b.type != null ? b.type : PerformanceType.API_CALL;
        this.metric = b.metric;
        this.value = b.value;
        this.unit = b.unit != null ? b.unit : "";
        this.context = b.context != null ? b.context : PerformanceContext.builder().build();
        this.thresholds = b.thresholds != null ? b.thresholds : PerformanceThreshold.unbounded();
    }

    public static Builder builder() {
        return new Builder();
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

    /**
     * Return a copy carrying the given correlation id.
     *
     * @param correlationId correlation id; must not be {@code null}
     * @return measurement with the correlation id set
     */
    public PerformanceMeasurement withCorrelationId(String correlationId) {
        Objects.requireNonNull(correlationId, "correlationId must not be null");
        return new Builder()
                .correlationId(correlationId)
                .type(type)
                .metric(metric)
                .value(value)
                .unit(unit)
                .context(context)
                .thresholds(thresholds)
                .build();
    }

    public static class Builder {
        private String correlationId;
        private PerformanceType type;
        private String metric;
        private double value = Double.NaN;
        private String unit;
        private PerformanceContext context;
        private PerformanceThreshold thresholds;

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder type(PerformanceType type) {
            this.type = type;
            return this;
        }

        public Builder metric(String metric) {
            this.metric = metric;
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder unit(String unit) {
            this.unit = unit;
            return this;
        }

        public Builder context(PerformanceContext context) {
            this.context = context;
            return this;
        }

        public Builder thresholds(PerformanceThreshold thresholds) {
            this.thresholds = thresholds;
            return this;
        }

        /**
         * @return the measurement
         * @throws IllegalArgumentException if the metric is blank or the value
         *                                  is not finite
         */
        public PerformanceMeasurement build() {
            return new PerformanceMeasurement(this);
        }
    }
}
