package com.telemetrysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of performance measurement.
 *
 * @since 1.0.0
 */
public enum PerformanceType {

    WEB_VITAL,
    API_CALL,
    DATABASE_QUERY,
    EXTERNAL_CALL;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a type label such as {@code "api_call"} or {@code "api-call"}.
     *
     * @param label type label
     * @return the matching type
     * @throws IllegalArgumentException if the label is blank or unknown
     */
    @JsonCreator
    public static PerformanceType fromLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Performance type must not be blank");
        }
        String normalised = label.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return valueOf(normalised);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown performance type: '" + label + "'", e);
        }
    }
}
