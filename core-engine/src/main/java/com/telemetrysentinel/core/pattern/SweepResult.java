package com.telemetrysentinel.core.pattern;

import com.telemetrysentinel.core.model.ErrorPattern;

import java.util.List;

/**
 * What one pattern sweep did.
 *
 * @since 1.0.0
 */
public final class SweepResult {

    private final int evicted;
    private final int updated;
    private final List<ErrorPattern> alerts;

    SweepResult(int evicted, int updated, List<ErrorPattern> alerts) {
        this.evicted = evicted;
        this.updated = updated;
        this.alerts = List.copyOf(alerts);
    }

    /**
     * @return patterns removed for being idle
     */
    public int getEvicted() {
        return evicted;
    }

    /**
     * @return patterns whose frequency, trend and impact were recomputed
     */
    public int getUpdated() {
        return updated;
    }

    /**
     * @return snapshots of patterns that are increasing above the alert rate
     */
    public List<ErrorPattern> getAlerts() {
        return alerts;
    }

    @Override
    public String toString() {
        return "SweepResult{evicted=" + evicted + ", updated=" + updated + ", alerts=" + alerts.size() + '}';
    }
}
