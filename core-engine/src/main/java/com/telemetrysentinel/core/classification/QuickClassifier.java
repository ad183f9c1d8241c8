package com.telemetrysentinel.core.classification;

import com.telemetrysentinel.core.model.Severity;

import java.util.Locale;

/**
 * Substring-based pre-classification used only on the export path.
 *
 * <p>
 * Kept separate from {@link ErrorClassifier}: it trades precision for speed
 * and has its own category set, so the two must not share rules.
 * </p>
 *
 * @since 1.0.0
 */
public final class QuickClassifier {

    private static final QuickClassification DATABASE =
            new QuickClassification("database", "database_error", Severity.HIGH);
    private static final QuickClassification NETWORK =
            new QuickClassification("network", "network_error", Severity.MEDIUM);
    private static final QuickClassification AUTH =
            new QuickClassification("auth", "auth_error", Severity.HIGH);
    private static final QuickClassification FALLBACK =
            new QuickClassification("application", "unknown", Severity.MEDIUM);

    /**
     * @param errorValue raw error text; {@code null} is treated as empty
     * @return the first matching quick classification
     */
    public QuickClassification classify(String errorValue) {
        String lower = errorValue == null ? "" : errorValue.toLowerCase(Locale.ROOT);

        if (lower.contains("database") || lower.contains("sql")) {
            return DATABASE;
        }
        if (lower.contains("network") || lower.contains("timeout")) {
            return NETWORK;
        }
        if (lower.contains("unauthorized") || lower.contains("forbidden")) {
            return AUTH;
        }
        return FALLBACK;
    }
}
