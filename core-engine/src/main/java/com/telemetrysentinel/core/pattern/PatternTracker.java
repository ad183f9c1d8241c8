package com.telemetrysentinel.core.pattern;

import com.telemetrysentinel.core.model.ErrorEvent;
import com.telemetrysentinel.core.model.ErrorImpact;
import com.telemetrysentinel.core.model.ErrorPattern;
import com.telemetrysentinel.core.model.Ids;
import com.telemetrysentinel.core.model.PatternTrend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fingerprint-keyed aggregation of error events.
 *
 * <h3>Ingestion</h3>
 * <p>
 * {@link #observe(ErrorEvent)} creates the pattern on first sight of a
 * fingerprint, then increments its count, moves {@code lastSeen} and records
 * the affected user. It never touches frequency or trend.
 * </p>
 *
 * <h3>Sweep</h3>
 * <p>
 * {@link #sweep(Instant)} evicts patterns idle for longer than the idle
 * timeout and, for the rest, recomputes events-per-hour since first seen,
 * the trend against the previous sweep's frequency, and the impact estimate.
 * Patterns that are increasing at more than {@value #ALERT_FREQUENCY} events
 * per hour are returned as alerts.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Every read or write of a live pattern runs inside
 * {@link ConcurrentHashMap#compute} (or {@code computeIfPresent}) for its
 * fingerprint, so observations of the same fingerprint never lose updates
 * and a sweep never sees a half-applied observation. Callers only ever
 * receive copies.
 * </p>
 *
 * @since 1.0.0
 */
public class PatternTracker {

    private static final Logger LOG = LoggerFactory.getLogger(PatternTracker.class);

    static final double INCREASING_RATIO = 1.5;
    static final double DECREASING_RATIO = 0.5;
    static final double ALERT_FREQUENCY = 10;
    static final int REVENUE_USER_THRESHOLD = 100;
    static final double REVENUE_PER_USER = 10;
    static final double SESSIONS_PER_ERROR = 1.2;

    private static final double MILLIS_PER_HOUR = 3_600_000d;

    private final Duration idleTimeout;
    private final Map<String, ErrorPattern> patterns = new ConcurrentHashMap<>();

    /**
     * @param idleTimeout how long a pattern may go without events before a
     *                    sweep removes it; must be positive
     */
    public PatternTracker(Duration idleTimeout) {
        Objects.requireNonNull(idleTimeout, "idleTimeout must not be null");
        if (idleTimeout.isZero() || idleTimeout.isNegative()) {
            throw new IllegalArgumentException("idleTimeout must be positive, got: " + idleTimeout);
        }
        this.idleTimeout = idleTimeout;
    }

    // ---------------------------------------------------------------
    // Ingestion
    // ---------------------------------------------------------------

    /**
     * Fold one event into its pattern.
     *
     * @param event fingerprinted error event; must not be {@code null}
     * @return snapshot of the pattern after the update
     */
    public ErrorPattern observe(ErrorEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        String userId = event.getUser() != null ? event.getUser().getId() : null;
        AtomicReference<ErrorPattern> snapshot = new AtomicReference<>();

        patterns.compute(event.getFingerprint(), (fingerprint, existing) -> {
            ErrorPattern pattern = existing;
            if (pattern == null) {
                pattern = new ErrorPattern(Ids.pattern(event.getTimestamp()), fingerprint, event.getTimestamp());
                LOG.debug("New error pattern {} for message '{}'", fingerprint, event.getMessage());
            }
            pattern.recordOccurrence(event.getId(), event.getTimestamp(), userId);
            snapshot.set(pattern.copy());
            return pattern;
        });
        return snapshot.get();
    }

    // ---------------------------------------------------------------
    // Sweep
    // ---------------------------------------------------------------

    /**
     * Recompute trend and impact for every live pattern, evicting idle ones.
     *
     * @param now the sweep time
     * @return what the sweep did, including patterns to alert on
     */
    public SweepResult sweep(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        int[] evicted = {0};
        int[] updated = {0};
        List<ErrorPattern> alerts = new ArrayList<>();

        for (String fingerprint : patterns.keySet()) {
            patterns.computeIfPresent(fingerprint, (fp, pattern) -> {
                if (Duration.between(pattern.getLastSeen(), now).compareTo(idleTimeout) > 0) {
                    evicted[0]++;
                    return null;
                }
                if (recomputeTrend(pattern, now)) {
                    alerts.add(pattern.copy());
                }
                recomputeImpact(pattern);
                updated[0]++;
                return pattern;
            });
        }

        SweepResult result = new SweepResult(evicted[0], updated[0], alerts);
        LOG.debug("Pattern sweep at {}: {}", now, result);
        return result;
    }

    /**
     * @return {@code true} if the pattern should raise an alert
     */
    private static boolean recomputeTrend(ErrorPattern pattern, Instant now) {
        long elapsedMillis = Duration.between(pattern.getFirstSeen(), now).toMillis();
        if (elapsedMillis <= 0) {
            // first seen at (or after) the sweep instant; no rate yet
            return false;
        }
        double previous = pattern.getFrequency();
        double frequency = pattern.getCount() / (elapsedMillis / MILLIS_PER_HOUR);
        pattern.setFrequency(frequency);

        if (frequency > previous * INCREASING_RATIO) {
            pattern.setTrend(PatternTrend.INCREASING);
            return frequency > ALERT_FREQUENCY;
        }
        if (frequency < previous * DECREASING_RATIO) {
            pattern.setTrend(PatternTrend.DECREASING);
        } else {
            pattern.setTrend(PatternTrend.STABLE);
        }
        return false;
    }

    private static void recomputeImpact(ErrorPattern pattern) {
        ErrorImpact impact = pattern.getImpact();
        int users = pattern.affectedUserSet().size();
        if (users > REVENUE_USER_THRESHOLD) {
            impact.setRevenue(users * REVENUE_PER_USER);
        }
        impact.setSessionCount((long) Math.floor(pattern.getCount() * SESSIONS_PER_ERROR));
        impact.setRequestCount(pattern.getCount());
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    /**
     * @param limit maximum number of patterns to return; must be &gt;= 0
     * @return pattern snapshots, highest count first
     */
    public List<ErrorPattern> list(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0, got: " + limit);
        }
        return snapshots().stream()
                .sorted(Comparator.comparingLong(ErrorPattern::getCount).reversed())
                .limit(limit)
                .toList();
    }

    /**
     * Totals over patterns seen within {@code window} before {@code now}.
     *
     * @param window look-back window; must be positive
     * @param now    end of the window
     * @return error statistics
     */
    public ErrorStats stats(Duration window, Instant now) {
        Objects.requireNonNull(window, "window must not be null");
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive, got: " + window);
        }
        Instant cutoff = now.minus(window);
        long total = 0;
        long critical = 0;
        Set<String> users = new HashSet<>();

        for (ErrorPattern pattern : snapshots()) {
            if (pattern.getLastSeen().isAfter(cutoff)) {
                total += pattern.getCount();
                users.addAll(pattern.affectedUserSet());
                if (pattern.getFrequency() > ALERT_FREQUENCY) {
                    critical += pattern.getCount();
                }
            }
        }
        double hours = window.toMillis() / MILLIS_PER_HOUR;
        return new ErrorStats(total, critical, users.size(), total / hours, patterns.size());
    }

    /**
     * @param fingerprint fingerprint to look up
     * @return snapshot of the pattern, or {@code null} if not live
     */
    public ErrorPattern get(String fingerprint) {
        AtomicReference<ErrorPattern> snapshot = new AtomicReference<>();
        patterns.computeIfPresent(fingerprint, (fp, pattern) -> {
            snapshot.set(pattern.copy());
            return pattern;
        });
        return snapshot.get();
    }

    public int size() {
        return patterns.size();
    }

    private List<ErrorPattern> snapshots() {
        List<ErrorPattern> copies = new ArrayList<>(patterns.size());
        for (String fingerprint : patterns.keySet()) {
            ErrorPattern copy = get(fingerprint);
            if (copy != null) {
                copies.add(copy);
            }
        }
        return copies;
    }
}
