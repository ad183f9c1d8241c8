package com.telemetrysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Human triage state of an error event.
 *
 * <p>
 * This is the only part of an {@link ErrorEvent} that may change after
 * ingestion; it is written by an external workflow, not by the engine.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Resolution {

    /** Triage status. */
    public enum Status {
        NEW,
        ACKNOWLEDGED,
        RESOLVED,
        IGNORED;

        @JsonValue
        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private Status status = Status.NEW;
    private String assignedTo;
    private String resolvedBy;
    private Instant resolvedAt;
    private String note;
    private Duration timeToResolve;

    public Status getStatus() {
        return status;
    }

    public void setStatus(Status status) {
        this.status = status != null ? status : Status.NEW;
    }

    public String getAssignedTo() {
        return assignedTo;
    }

    public void setAssignedTo(String assignedTo) {
        this.assignedTo = assignedTo;
    }

    public String getResolvedBy() {
        return resolvedBy;
    }

    public void setResolvedBy(String resolvedBy) {
        this.resolvedBy = resolvedBy;
    }

    public Instant getResolvedAt() {
        return resolvedAt;
    }

    public void setResolvedAt(Instant resolvedAt) {
        this.resolvedAt = resolvedAt;
    }

    public String getNote() {
        return note;
    }

    public void setNote(String note) {
        this.note = note;
    }

    public Duration getTimeToResolve() {
        return timeToResolve;
    }

    public void setTimeToResolve(Duration timeToResolve) {
        this.timeToResolve = timeToResolve;
    }

    /**
     * Mark the fault resolved and derive the time to resolve from the moment
     * the event was recorded.
     *
     * @param by         who resolved it
     * @param at         when it was resolved
     * @param recordedAt when the event was recorded
     */
    public void resolve(String by, Instant at, Instant recordedAt) {
        this.status = Status.RESOLVED;
        this.resolvedBy = by;
        this.resolvedAt = at;
        if (at != null && recordedAt != null) {
            this.timeToResolve = Duration.between(recordedAt, at);
        }
    }

    @Override
    public String toString() {
        return "Resolution{status=" + status.label() + ", assignedTo='" + assignedTo + "'}";
    }
}
