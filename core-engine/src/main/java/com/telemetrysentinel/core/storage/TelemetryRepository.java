package com.telemetrysentinel.core.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.telemetrysentinel.core.model.ErrorEvent;
import com.telemetrysentinel.core.model.ErrorPattern;
import com.telemetrysentinel.core.model.PerformanceEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Durable copies of telemetry in a {@link KeyValueStore}.
 *
 * <h3>Key layout</h3>
 * <table>
 * <caption>Keys written, with their retention</caption>
 * <tr><td>{@code <prefix>:errors:<id>}</td><td>error event JSON</td><td>7 days</td></tr>
 * <tr><td>{@code <prefix>:performance:<id>}</td><td>performance event JSON</td><td>30 days</td></tr>
 * <tr><td>{@code <prefix>:metrics:<metric>:<minute>}</td><td>numeric value</td><td>30 days</td></tr>
 * <tr><td>{@code <prefix>:patterns:<fingerprint>}</td><td>pattern snapshot JSON</td><td>30 days</td></tr>
 * </table>
 *
 * <p>
 * {@code <minute>} is the event's epoch milliseconds divided by 60 000. A
 * second measurement of the same metric within the same minute replaces the
 * first in the time series.
 * </p>
 *
 * <p>
 * Stored copies are snapshots; the engine's in-memory state stays the source
 * of truth while the process is running.
 * </p>
 *
 * @since 1.0.0
 */
public class TelemetryRepository {

    private static final Logger LOG = LoggerFactory.getLogger(TelemetryRepository.class);

    public static final Duration ERROR_RETENTION = Duration.ofDays(7);
    public static final Duration PERFORMANCE_RETENTION = Duration.ofDays(30);
    public static final Duration METRIC_RETENTION = Duration.ofDays(30);
    public static final Duration PATTERN_RETENTION = Duration.ofDays(30);

    private static final long MILLIS_PER_MINUTE = 60_000L;

    private final KeyValueStore store;
    private final String prefix;
    private final ObjectMapper mapper;

    /**
     * @param store     backing store; must not be {@code null}
     * @param keyPrefix prefix of every key; must not be blank
     */
    public TelemetryRepository(KeyValueStore store, String keyPrefix) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        if (keyPrefix == null || keyPrefix.isBlank()) {
            throw new IllegalArgumentException("keyPrefix must not be blank");
        }
        this.prefix = keyPrefix;
        this.mapper = JsonMappers.create();
    }

    // ---------------------------------------------------------------
    // Writes
    // ---------------------------------------------------------------

    public void saveError(ErrorEvent event) {
        store.setex(errorKey(event.getId()), ERROR_RETENTION, toJson(event));
    }

    /**
     * Store the event and its time-series sample.
     *
     * @param event the performance event
     */
    public void savePerformance(PerformanceEvent event) {
        store.setex(performanceKey(event.getId()), PERFORMANCE_RETENTION, toJson(event));
        store.setex(metricKey(event.getMetric(), minuteBucket(event.getTimestamp())),
                METRIC_RETENTION, Double.toString(event.getValue()));
    }

    public void savePattern(ErrorPattern pattern) {
        store.setex(patternKey(pattern.getFingerprint()), PATTERN_RETENTION, toJson(pattern));
    }

    // ---------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------

    /**
     * Read the time series of a metric between two instants, oldest first.
     *
     * @param metric metric name
     * @param from   inclusive start
     * @param to     inclusive end
     * @return sample values ordered by minute bucket
     */
    public List<Double> metricHistory(String metric, Instant from, Instant to) {
        String seriesPrefix = prefix + ":metrics:" + metric + ':';
        long fromBucket = minuteBucket(from);
        long toBucket = minuteBucket(to);

        NavigableMap<Long, String> keysByBucket = new TreeMap<>();
        for (String key : store.keys(seriesPrefix)) {
            String suffix = key.substring(seriesPrefix.length());
            long bucket;
            try {
                bucket = Long.parseLong(suffix);
            } catch (NumberFormatException e) {
                // a longer metric name sharing this prefix
                continue;
            }
            if (bucket >= fromBucket && bucket <= toBucket) {
                keysByBucket.put(bucket, key);
            }
        }

        List<String> orderedKeys = new ArrayList<>(keysByBucket.values());
        List<String> raw = orderedKeys.isEmpty() ? List.of() : store.mget(orderedKeys);

        List<Double> values = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            String v = raw.get(i);
            if (v == null) {
                continue;
            }
            try {
                values.add(Double.parseDouble(v));
            } catch (NumberFormatException e) {
                LOG.warn("Skipping non-numeric sample at {}: '{}'", orderedKeys.get(i), v);
            }
        }
        return values;
    }

    /**
     * @param id error event id
     * @return stored JSON, if still retained
     */
    public Optional<String> findErrorJson(String id) {
        return store.get(errorKey(id));
    }

    // ---------------------------------------------------------------
    // Keys
    // ---------------------------------------------------------------

    public String errorKey(String id) {
        return prefix + ":errors:" + id;
    }

    public String performanceKey(String id) {
        return prefix + ":performance:" + id;
    }

    public String metricKey(String metric, long minuteBucket) {
        return prefix + ":metrics:" + metric + ':' + minuteBucket;
    }

    public String patternKey(String fingerprint) {
        return prefix + ":patterns:" + fingerprint;
    }

    public static long minuteBucket(Instant instant) {
        return Math.floorDiv(instant.toEpochMilli(), MILLIS_PER_MINUTE);
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
