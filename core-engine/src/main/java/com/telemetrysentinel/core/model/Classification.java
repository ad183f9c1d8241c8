package com.telemetrysentinel.core.model;

import java.util.Objects;

/**
 * Result of classifying an error message: what kind of fault it is and how
 * urgently it should be handled.
 *
 * <p>
 * Instances are immutable and produced once per event; they are never
 * recomputed after ingestion.
 * </p>
 *
 * @since 1.0.0
 */
public final class Classification {

    /** Type label used when no rule matched. */
    public static final String UNKNOWN_TYPE = "unknown";

    private final ErrorCategory category;
    private final String type;
    private final Severity severity;
    private final int priority;
    private final boolean automated;
    private final double confidence;

    /**
     * @param category   fault category; must not be {@code null}
     * @param type       type label (usually the name of the matching rule)
     * @param severity   severity; must not be {@code null}
     * @param priority   numeric priority, higher is more urgent
     * @param automated  whether a classifier produced this result
     * @param confidence confidence in [0, 1]
     * @throws IllegalArgumentException if {@code confidence} is outside [0, 1]
     */
    public Classification(ErrorCategory category, String type, Severity severity,
            int priority, boolean automated, double confidence) {
        this.category = Objects.requireNonNull(category, "category must not be null");
        this.type = type != null ? type : UNKNOWN_TYPE;
        this.severity = Objects.requireNonNull(severity, "severity must not be null");
        this.priority = priority;
        this.automated = automated;
        if (confidence < 0 || confidence > 1 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("confidence must be in [0, 1], got: " + confidence);
        }
        this.confidence = confidence;
    }

    /**
     * Placeholder assigned to every event before (or instead of) automatic
     * classification.
     *
     * @return application / unknown / medium / priority 5, zero confidence
     */
    public static Classification unclassified() {
        return new Classification(ErrorCategory.APPLICATION, UNKNOWN_TYPE, Severity.MEDIUM, 5, false, 0);
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public String getType() {
        return type;
    }

    public Severity getSeverity() {
        return severity;
    }

    public int getPriority() {
        return priority;
    }

    public boolean isAutomated() {
        return automated;
    }

    public double getConfidence() {
        return confidence;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Classification that))
            return false;
        return priority == that.priority
                && automated == that.automated
                && Double.compare(confidence, that.confidence) == 0
                && category == that.category
                && Objects.equals(type, that.type)
                && severity == that.severity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(category, type, severity, priority, automated, confidence);
    }

    @Override
    public String toString() {
        return "Classification{" +
                "category=" + category.label() +
                ", type='" + type + '\'' +
                ", severity=" + severity.label() +
                ", priority=" + priority +
                ", automated=" + automated +
                ", confidence=" + confidence +
                '}';
    }
}
