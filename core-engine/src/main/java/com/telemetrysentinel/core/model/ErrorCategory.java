package com.telemetrysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Broad fault category assigned by the classifier.
 *
 * @since 1.0.0
 */
public enum ErrorCategory {

    APPLICATION,
    SYSTEM,
    NETWORK,
    DATABASE,
    EXTERNAL,
    USER;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a category label, ignoring case.
     *
     * @param label category label such as {@code "database"}
     * @return the matching category
     * @throws IllegalArgumentException if the label is unknown
     */
    @JsonCreator
    public static ErrorCategory fromLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Error category must not be blank");
        }
        try {
            return valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown error category: '" + label + "'", e);
        }
    }
}
