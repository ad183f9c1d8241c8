package com.telemetrysentinel.core.storage;

import com.telemetrysentinel.core.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link InMemoryKeyValueStore}.
 */
class InMemoryKeyValueStoreTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");
    private static final Duration WEEK = Duration.ofDays(7);

    private MutableClock clock;
    private InMemoryKeyValueStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        store = new InMemoryKeyValueStore(clock);
    }

    @Test
    @DisplayName("Entries vanish from reads once their TTL has passed")
    void shouldHideExpiredEntries() {
        store.setex("telemetry:errors:1", Duration.ofMinutes(5), "{}");

        assertThat(store.get("telemetry:errors:1")).contains("{}");
        assertThat(store.ttl("telemetry:errors:1")).contains(Duration.ofMinutes(5));

        clock.advance(Duration.ofMinutes(5));

        assertThat(store.get("telemetry:errors:1")).isEmpty();
        assertThat(store.mget(List.of("telemetry:errors:1"))).containsExactly((String) null);
    }

    @Test
    @DisplayName("A key scan frees every expired entry, not only those under its prefix")
    void shouldFreeExpiredEntriesOnScan() {
        for (int i = 0; i < 1000; i++) {
            store.setex("telemetry:errors:" + i, WEEK, "{}");
        }
        clock.advance(Duration.ofDays(8));

        assertThat(store.keys("telemetry:metrics:LCP:")).isEmpty();

        for (int i = 0; i < 10; i++) {
            store.setex("telemetry:errors:new-" + i, WEEK, "{}");
        }
        assertThat(store.size()).isEqualTo(10);
        assertThat(store.keys("telemetry:errors:")).hasSize(10);
    }

    @Test
    @DisplayName("A write-only workload still frees expired entries")
    void shouldPurgeDuringWrites() {
        for (int i = 0; i < 100; i++) {
            store.setex("telemetry:performance:" + i, WEEK, "{}");
        }
        clock.advance(Duration.ofDays(8));

        for (int i = 0; i < InMemoryKeyValueStore.PURGE_EVERY_WRITES - 100; i++) {
            store.setex("telemetry:performance:fresh-" + i, WEEK, "{}");
        }

        assertThat(store.size()).isEqualTo(InMemoryKeyValueStore.PURGE_EVERY_WRITES - 100);
    }

    @Test
    @DisplayName("purgeExpired removes only entries whose TTL has passed")
    void shouldPurgeOnlyExpired() {
        store.setex("short", Duration.ofHours(1), "a");
        store.setex("long", Duration.ofDays(30), "b");
        clock.advance(Duration.ofHours(2));

        assertThat(store.purgeExpired()).isEqualTo(1);
        assertThat(store.size()).isEqualTo(1);
        assertThat(store.get("long")).contains("b");
    }
}
