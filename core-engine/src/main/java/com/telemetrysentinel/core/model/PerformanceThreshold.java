package com.telemetrysentinel.core.model;

import java.util.Objects;

/**
 * Target, warning and critical levels for one metric. Values above
 * {@code critical} are critical; values above {@code warning} (but not
 * critical) are warnings.
 *
 * @since 1.0.0
 */
public final class PerformanceThreshold {

    private static final PerformanceThreshold UNBOUNDED =
            new PerformanceThreshold(Double.MAX_VALUE, Double.MAX_VALUE, Double.MAX_VALUE);

    private final double target;
    private final double warning;
    private final double critical;

    private PerformanceThreshold(double target, double warning, double critical) {
        this.target = target;
        this.warning = warning;
        this.critical = critical;
    }

    /**
     * @param target   desired value
     * @param warning  warning level
     * @param critical critical level
     * @return threshold set
     * @throws IllegalArgumentException if {@code warning > critical}
     */
    public static PerformanceThreshold of(double target, double warning, double critical) {
        if (warning > critical) {
            throw new IllegalArgumentException(
                    "warning (" + warning + ") must not exceed critical (" + critical + ")");
        }
        return new PerformanceThreshold(target, warning, critical);
    }

    /**
     * @return thresholds no finite measurement can exceed
     */
    public static PerformanceThreshold unbounded() {
        return UNBOUNDED;
    }

    public double getTarget() {
        return target;
    }

    public double getWarning() {
        return warning;
    }

    public double getCritical() {
        return critical;
    }

    public boolean isCritical(double value) {
        return value > critical;
    }

    public boolean isWarning(double value) {
        return value > warning;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PerformanceThreshold that))
            return false;
        return Double.compare(target, that.target) == 0
                && Double.compare(warning, that.warning) == 0
                && Double.compare(critical, that.critical) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(target, warning, critical);
    }

    @Override
    public String toString() {
        return "PerformanceThreshold{target=" + target + ", warning=" + warning + ", critical=" + critical + '}';
    }
}
