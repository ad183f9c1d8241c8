package com.telemetrysentinel.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Aggregate state for every error event sharing one fingerprint.
 *
 * <h3>Thread Safety</h3>
 * <p>
 * This class is <strong>not</strong> thread-safe. Live instances are only
 * touched inside the pattern tracker's per-key critical section; everything
 * handed out to callers is a {@link #copy()}.
 * </p>
 *
 * @since 1.0.0
 */
public class ErrorPattern {

    /** Upper bound on remembered related error ids; oldest are dropped first. */
    public static final int MAX_RELATED_ERRORS = 100;

    private final String id;
    private final String fingerprint;
    private long count;
    private final Instant firstSeen;
    private Instant lastSeen;
    private double frequency;
    private PatternTrend trend = PatternTrend.STABLE;
    private final ErrorImpact impact;
    private final LinkedHashSet<String> affectedUsers;
    private final LinkedHashSet<String> relatedErrors;

    /**
     * Create an empty pattern first seen at {@code firstSeen}.
     *
     * @param id          pattern id
     * @param fingerprint grouping key
     * @param firstSeen   timestamp of the first matching event
     */
    public ErrorPattern(String id, String fingerprint, Instant firstSeen) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.fingerprint = Objects.requireNonNull(fingerprint, "fingerprint must not be null");
        this.firstSeen = Objects.requireNonNull(firstSeen, "firstSeen must not be null");
        this.lastSeen = firstSeen;
        this.impact = new ErrorImpact();
        this.affectedUsers = new LinkedHashSet<>();
        this.relatedErrors = new LinkedHashSet<>();
    }

    private ErrorPattern(ErrorPattern other) {
        this.id = other.id;
        this.fingerprint = other.fingerprint;
        this.count = other.count;
        this.firstSeen = other.firstSeen;
        this.lastSeen = other.lastSeen;
        this.frequency = other.frequency;
        this.trend = other.trend;
        this.impact = new ErrorImpact(other.impact);
        this.affectedUsers = new LinkedHashSet<>(other.affectedUsers);
        this.relatedErrors = new LinkedHashSet<>(other.relatedErrors);
    }

    /**
     * @return a deep copy, safe to hand to other threads
     */
    public ErrorPattern copy() {
        return new ErrorPattern(this);
    }

    // ---------------------------------------------------------------
    // Mutation (called under the tracker's per-key lock)
    // ---------------------------------------------------------------

    /**
     * Count one more occurrence. {@code lastSeen} only moves forward, so an
     * occurrence stamped before the latest one seen does not rewind it.
     *
     * @param errorId   id of the occurring event
     * @param timestamp its timestamp
     * @param userId    affected user id, or {@code null}
     */
    public void recordOccurrence(String errorId, Instant timestamp, String userId) {
        count++;
        if (timestamp.isAfter(lastSeen)) {
            lastSeen = timestamp;
        }
        if (userId != null && affectedUsers.add(userId)) {
            impact.setUserCount(affectedUsers.size());
        }
        if (errorId != null && relatedErrors.add(errorId) && relatedErrors.size() > MAX_RELATED_ERRORS) {
            Iterator<String> oldest = relatedErrors.iterator();
            oldest.next();
            oldest.remove();
        }
    }

    public void setFrequency(double frequency) {
        this.frequency = frequency;
    }

    public void setTrend(PatternTrend trend) {
        this.trend = trend;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public long getCount() {
        return count;
    }

    public Instant getFirstSeen() {
        return firstSeen;
    }

    public Instant getLastSeen() {
        return lastSeen;
    }

    /**
     * @return events per hour since first seen, as of the last sweep
     */
    public double getFrequency() {
        return frequency;
    }

    public PatternTrend getTrend() {
        return trend;
    }

    public ErrorImpact getImpact() {
        return impact;
    }

    /**
     * @return affected user ids in first-seen order
     */
    public List<String> getAffectedUsers() {
        return List.copyOf(affectedUsers);
    }

    /**
     * @return live read-only view of affected user ids
     */
    public Set<String> affectedUserSet() {
        return Collections.unmodifiableSet(affectedUsers);
    }

    public List<String> getRelatedErrors() {
        return new ArrayList<>(relatedErrors);
    }

    @Override
    public String toString() {
        return "ErrorPattern{" +
                "fingerprint='" + fingerprint + '\'' +
                ", count=" + count +
                ", firstSeen=" + firstSeen +
                ", lastSeen=" + lastSeen +
                ", frequency=" + frequency +
                ", trend=" + trend.label() +
                ", impact=" + impact +
                '}';
    }
}
