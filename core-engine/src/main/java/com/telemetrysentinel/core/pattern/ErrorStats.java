package com.telemetrysentinel.core.pattern;

/**
 * Error totals over a recent time window.
 *
 * @since 1.0.0
 */
public final class ErrorStats {

    private final long totalErrors;
    private final long criticalErrors;
    private final int affectedUsers;
    private final double errorRate;
    private final int patternCount;

    /**
     * @param totalErrors    occurrences counted by patterns active in the window
     * @param criticalErrors occurrences counted by high-frequency patterns
     * @param affectedUsers  distinct users across those patterns
     * @param errorRate      {@code totalErrors} per hour of window
     * @param patternCount   live patterns, active in the window or not
     */
    public ErrorStats(long totalErrors, long criticalErrors, int affectedUsers,
            double errorRate, int patternCount) {
        this.totalErrors = totalErrors;
        this.criticalErrors = criticalErrors;
        this.affectedUsers = affectedUsers;
        this.errorRate = errorRate;
        this.patternCount = patternCount;
    }

    public long getTotalErrors() {
        return totalErrors;
    }

    public long getCriticalErrors() {
        return criticalErrors;
    }

    public int getAffectedUsers() {
        return affectedUsers;
    }

    public double getErrorRate() {
        return errorRate;
    }

    public int getPatternCount() {
        return patternCount;
    }

    @Override
    public String toString() {
        return "ErrorStats{" +
                "totalErrors=" + totalErrors +
                ", criticalErrors=" + criticalErrors +
                ", affectedUsers=" + affectedUsers +
                ", errorRate=" + errorRate +
                ", patternCount=" + patternCount +
                '}';
    }
}
