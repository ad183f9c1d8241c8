package com.telemetrysentinel.core.storage;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local {@link KeyValueStore} backed by a concurrent map.
 *
 * <h3>Expiry</h3>
 * <p>
 * Expired entries are hidden from reads at once and removed by
 * {@link #purgeExpired()}. That purge runs on every {@link #keys(String)}
 * scan and after every {@value #PURGE_EVERY_WRITES} writes, so a write-only
 * workload (error and performance events are never read back) still gives
 * memory back once retention runs out.
 * </p>
 *
 * <p>
 * Suitable for tests and for running the engine without an external store;
 * contents are lost with the process.
 * </p>
 *
 * @since 1.0.0
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    /** Writes between two full expiry purges. */
    public static final int PURGE_EVERY_WRITES = 1024;

    private final Clock clock;
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final AtomicLong writes = new AtomicLong();

    public InMemoryKeyValueStore() {
        this(Clock.systemUTC());
    }

    /**
     * @param clock clock used to evaluate expiry; must not be {@code null}
     */
    public InMemoryKeyValueStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public void setex(String key, Duration ttl, String value) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(ttl, "ttl must not be null");
        Objects.requireNonNull(value, "value must not be null");
        entries.put(key, new Entry(value, clock.instant().plus(ttl)));
        if (writes.incrementAndGet() % PURGE_EVERY_WRITES == 0) {
            purgeExpired();
        }
    }

    @Override
    public Optional<String> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value);
    }

    @Override
    public List<String> keys(String prefix) {
        Instant now = clock.instant();
        List<String> result = new ArrayList<>();
        entries.forEach((key, entry) -> {
            if (entry.isExpired(now)) {
                entries.remove(key, entry);
            } else if (key.startsWith(prefix)) {
                result.add(key);
            }
        });
        return result;
    }

    @Override
    public List<String> mget(List<String> keys) {
        List<String> values = new ArrayList<>(keys.size());
        for (String key : keys) {
            values.add(get(key).orElse(null));
        }
        return values;
    }

    /**
     * Drop every expired entry.
     *
     * @return number of entries removed
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<String, Entry> e : entries.entrySet()) {
            if (e.getValue().isExpired(now) && entries.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    /**
     * @return number of stored entries, expired ones included until the next purge
     */
    public int size() {
        return entries.size();
    }

    /**
     * @param key the key
     * @return remaining time to live, or empty if absent or expired
     */
    public Optional<Duration> ttl(String key) {
        Entry entry = entries.get(key);
        Instant now = clock.instant();
        if (entry == null || entry.isExpired(now)) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(now, entry.expiresAt));
    }

    private static final class Entry {
        private final String value;
        private final Instant expiresAt;

        private Entry(String value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }

        private boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
