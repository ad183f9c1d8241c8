package com.telemetrysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Fault severity, ordered from least to most severe.
 *
 * @since 1.0.0
 */
public enum Severity {

    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a severity label, ignoring case.
     *
     * @param label severity label such as {@code "high"}
     * @return the matching severity
     * @throws IllegalArgumentException if the label is unknown
     */
    @JsonCreator
    public static Severity fromLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Severity must not be blank");
        }
        try {
            return valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown severity: '" + label + "'", e);
        }
    }
}
