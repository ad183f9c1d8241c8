package com.telemetrysentinel.core.storage;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Minimal key-value store with per-key expiry, used for durable copies of
 * events and for the metric time series.
 *
 * <p>
 * Implementations throw {@link StoreException} on failure. They must be safe
 * for concurrent use.
 * </p>
 */
public interface KeyValueStore extends AutoCloseable {

    /**
     * Store {@code value} under {@code key}, replacing any previous value, and
     * expire it after {@code ttl}.
     */
    void setex(String key, Duration ttl, String value);

    /**
     * @return the live value for {@code key}, or empty if absent or expired
     */
    Optional<String> get(String key);

    /**
     * @return every live key starting with {@code prefix}, in no particular order
     */
    List<String> keys(String prefix);

    /**
     * @return values for {@code keys} in the same order; {@code null} where a
     *         key is absent or expired
     */
    List<String> mget(List<String> keys);

    @Override
    default void close() {
    }
}
