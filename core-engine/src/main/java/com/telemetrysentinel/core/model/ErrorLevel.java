package com.telemetrysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Reporting level of an error event, and the level handed to the export sink.
 *
 * @since 1.0.0
 */
public enum ErrorLevel {

    INFO,
    WARNING,
    ERROR,
    FATAL;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a level label; {@code null} or blank input yields {@link #ERROR}.
     *
     * @param label level label
     * @return the matching level
     * @throws IllegalArgumentException if the label is unknown
     */
    @JsonCreator
    public static ErrorLevel fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return ERROR;
        }
        try {
            return valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown error level: '" + label + "'", e);
        }
    }

    /**
     * Map a classification severity to the level used by the export sink.
     *
     * @param severity classification severity; may be {@code null}
     * @return sink level
     */
    public static ErrorLevel forSeverity(Severity severity) {
        if (severity == null) {
            return ERROR;
        }
        return switch (severity) {
            case CRITICAL -> FATAL;
            case HIGH -> ERROR;
            case MEDIUM -> WARNING;
            case LOW -> INFO;
        };
    }
}
