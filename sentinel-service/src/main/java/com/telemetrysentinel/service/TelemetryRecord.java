package com.telemetrysentinel.service;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One telemetry record as read from the ingest topic.
 *
 * <p>
 * Records arrive as free-form JSON and are kept as a {@link Map} so that
 * producers can add fields without breaking the service. The {@code kind}
 * field selects the engine operation:
 * </p>
 *
 * <pre>
 * {"kind":"error", "message":"...", "stack":"...", "level":"error",
 *  "correlationId":"...", "userId":"...",
 *  "context":{"service":"api","module":"orders","function":"...","file":"...","line":1,"column":1,"component":"..."},
 *  "tags":{"k":"v"}, "extra":{"k":1}}
 *
 * {"kind":"performance", "type":"api_call", "metric":"api.latency", "value":120.5, "unit":"ms",
 *  "correlationId":"...", "context":{"service":"api","endpoint":"/orders","method":"GET", ...},
 *  "thresholds":{"target":100,"warning":500,"critical":1000}}
 *
 * {"kind":"web_vital", "name":"LCP", "value":2300, "context":{"sessionId":"...", ...}}
 * </pre>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe. Each record is handled by the single ingest thread.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TelemetryRecord {

    public static final String KIND_ERROR = "error";
    public static final String KIND_PERFORMANCE = "performance";
    public static final String KIND_WEB_VITAL = "web_vital";

    private final Map<String, Object> fields = new LinkedHashMap<>();

    /** Set by the deserializer. */
    private Instant ingestionTime;

    // ---------------------------------------------------------------
    // Jackson dynamic-property support
    // ---------------------------------------------------------------

    @JsonAnySetter
    public void setField(String key, Object value) {
        Objects.requireNonNull(key, "Field key must not be null");
        fields.put(key, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    // ---------------------------------------------------------------
    // Field accessors
    // ---------------------------------------------------------------

    /**
     * @return the record kind, or empty if the producer did not set one
     */
    @JsonIgnore
    public Optional<String> getKind() {
        return getStringField("kind");
    }

    public Optional<Object> getField(String fieldName) {
        return Optional.ofNullable(fields.get(fieldName));
    }

    /**
     * Retrieve a numeric field value, coercing string-encoded numbers.
     *
     * @param fieldName the JSON key
     * @return optional containing the value as a {@code double}
     */
    public Optional<Double> getNumericField(String fieldName) {
        return numeric(fields.get(fieldName));
    }

    public Optional<String> getStringField(String fieldName) {
        Object raw = fields.get(fieldName);
        return raw == null ? Optional.empty() : Optional.of(raw.toString());
    }

    /**
     * Retrieve a nested JSON object, such as {@code context} or {@code tags}.
     *
     * @param fieldName the JSON key
     * @return the nested object, or an empty map if absent or not an object
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> getObjectField(String fieldName) {
        Object raw = fields.get(fieldName);
        if (raw instanceof Map<?, ?> map) {
            return Collections.unmodifiableMap((Map<String, Object>) map);
        }
        return Map.of();
    }

    /**
     * @return optional containing the value as a {@code double}, for a raw
     *         value taken from a nested object
     */
    static Optional<Double> numeric(Object raw) {
        if (raw instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        if (raw instanceof String s) {
            try {
                return Optional.of(Double.parseDouble(s));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    // ---------------------------------------------------------------
    // Ingestion time
    // ---------------------------------------------------------------

    @JsonIgnore
    public Instant getIngestionTime() {
        return ingestionTime;
    }

    public void setIngestionTime(Instant ingestionTime) {
        this.ingestionTime = ingestionTime;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TelemetryRecord that))
            return false;
        return Objects.equals(fields, that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "TelemetryRecord" + fields;
    }
}
