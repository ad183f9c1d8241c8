package com.telemetrysentinel.core.signal;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Every notification the engine can emit.
 *
 * @since 1.0.0
 */
public enum SignalType {

    ERROR_RECORDED("error-recorded"),
    CRITICAL_ERROR("critical-error"),
    PERFORMANCE_RECORDED("performance-recorded"),
    PERFORMANCE_WARNING("performance-warning"),
    PERFORMANCE_CRITICAL("performance-critical"),
    ANOMALY_DETECTED("anomaly-detected"),
    PATTERN_ALERT("pattern-alert"),
    PERFORMANCE_REGRESSION("performance-regression");

    private final String wireName;

    SignalType(String wireName) {
        this.wireName = wireName;
    }

    /**
     * @return the kebab-case name used on the wire and in metrics
     */
    @JsonValue
    public String wireName() {
        return wireName;
    }
}
