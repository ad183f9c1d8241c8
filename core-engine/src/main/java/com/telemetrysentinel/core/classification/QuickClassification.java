package com.telemetrysentinel.core.classification;

import com.telemetrysentinel.core.model.Severity;

import java.util.Map;

/**
 * Coarse classification attached to faults on their way to the export sink.
 *
 * <p>
 * Categories here are plain labels ({@code database}, {@code network},
 * {@code auth}, {@code application}) and intentionally differ from
 * {@link com.telemetrysentinel.core.model.ErrorCategory}.
 * </p>
 *
 * @since 1.0.0
 */
public final class QuickClassification {

    private final String category;
    private final String type;
    private final Severity severity;

    QuickClassification(String category, String type, Severity severity) {
        this.category = category;
        this.type = type;
        this.severity = severity;
    }

    public String getCategory() {
        return category;
    }

    public String getType() {
        return type;
    }

    public Severity getSeverity() {
        return severity;
    }

    /**
     * @return sink tags {@code error_category} and {@code error_type}
     */
    public Map<String, String> asTags() {
        return Map.of("error_category", category, "error_type", type);
    }

    @Override
    public String toString() {
        return category + "/" + type + "/" + severity.label();
    }
}
