package com.telemetrysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Direction of an error pattern's frequency between two sweeps.
 *
 * @since 1.0.0
 */
public enum PatternTrend {

    INCREASING,
    DECREASING,
    STABLE;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
