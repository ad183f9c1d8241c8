package com.telemetrysentinel.core.storage;

import com.telemetrysentinel.core.MutableClock;
import com.telemetrysentinel.core.model.Classification;
import com.telemetrysentinel.core.model.ErrorContext;
import com.telemetrysentinel.core.model.ErrorEvent;
import com.telemetrysentinel.core.model.ErrorPattern;
import com.telemetrysentinel.core.model.PerformanceEvent;
import com.telemetrysentinel.core.model.PerformanceMeasurement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TelemetryRepository} over the in-memory store.
 */
class TelemetryRepositoryTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");

    private MutableClock clock;
    private InMemoryKeyValueStore store;
    private TelemetryRepository repository;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        store = new InMemoryKeyValueStore(clock);
        repository = new TelemetryRepository(store, "telemetry");
    }

    @Test
    @DisplayName("Error events are stored as JSON under prefix:errors:id for seven days")
    void shouldStoreErrorEvent() {
        repository.saveError(errorEvent("err_1"));

        assertThat(store.ttl("telemetry:errors:err_1")).contains(Duration.ofDays(7));
        assertThat(repository.findErrorJson("err_1")).hasValueSatisfying(json -> {
            assertThat(json).contains("\"id\":\"err_1\"");
            assertThat(json).contains("\"timestamp\":\"2026-03-01T10:15:30Z\"");
            assertThat(json).contains("\"level\":\"error\"");
            assertThat(json).contains("\"category\":\"application\"");
        });
    }

    @Test
    @DisplayName("Stored errors disappear after their retention")
    void shouldExpireErrorEvent() {
        repository.saveError(errorEvent("err_2"));

        clock.advance(Duration.ofDays(7).plusSeconds(1));

        assertThat(repository.findErrorJson("err_2")).isEmpty();
    }

    @Test
    @DisplayName("Performance events also write a plain numeric minute-bucket sample")
    void shouldStorePerformanceEventAndSample() {
        PerformanceEvent event = new PerformanceEvent("perf_1", NOW,
                PerformanceMeasurement.builder().metric("LCP").value(2400.5).build(), null);

        repository.savePerformance(event);

        long bucket = NOW.toEpochMilli() / 60_000;
        assertThat(store.get("telemetry:performance:perf_1")).isPresent();
        assertThat(store.ttl("telemetry:performance:perf_1")).contains(Duration.ofDays(30));
        assertThat(store.get("telemetry:metrics:LCP:" + bucket)).contains("2400.5");
        assertThat(store.ttl("telemetry:metrics:LCP:" + bucket)).contains(Duration.ofDays(30));
    }

    @Test
    @DisplayName("Pattern snapshots are stored by fingerprint for thirty days")
    void shouldStorePattern() {
        ErrorPattern pattern = new ErrorPattern("pattern_1", "abc123", NOW);
        pattern.recordOccurrence("err_1", NOW, "alice");

        repository.savePattern(pattern);

        assertThat(store.get("telemetry:patterns:abc123")).hasValueSatisfying(json -> {
            assertThat(json).contains("\"fingerprint\":\"abc123\"");
            assertThat(json).contains("\"trend\":\"stable\"");
            assertThat(json).contains("\"alice\"");
        });
        assertThat(store.ttl("telemetry:patterns:abc123")).contains(Duration.ofDays(30));
    }

    @Test
    @DisplayName("Metric history is ordered by bucket and bounded by the range")
    void shouldReadMetricHistoryInOrder() {
        long base = TelemetryRepository.minuteBucket(NOW);
        store.setex(repository.metricKey("FID", base + 2), Duration.ofDays(1), "30");
        store.setex(repository.metricKey("FID", base), Duration.ofDays(1), "10");
        store.setex(repository.metricKey("FID", base + 1), Duration.ofDays(1), "20");
        store.setex(repository.metricKey("FID", base + 10), Duration.ofDays(1), "99");
        store.setex("telemetry:metrics:FID:not-a-bucket", Duration.ofDays(1), "5");

        assertThat(repository.metricHistory("FID", NOW, NOW.plus(Duration.ofMinutes(5))))
                .containsExactly(10.0, 20.0, 30.0);
    }

    @Test
    @DisplayName("Non-numeric samples are skipped")
    void shouldSkipCorruptSamples() {
        long base = TelemetryRepository.minuteBucket(NOW);
        store.setex(repository.metricKey("CLS", base), Duration.ofDays(1), "0.1");
        store.setex(repository.metricKey("CLS", base + 1), Duration.ofDays(1), "garbage");

        assertThat(repository.metricHistory("CLS", NOW, NOW.plus(Duration.ofMinutes(2))))
                .containsExactly(0.1);
    }

    @Test
    @DisplayName("Should reject a blank key prefix")
    void shouldRejectBlankPrefix() {
        assertThatThrownBy(() -> new TelemetryRepository(store, ""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static ErrorEvent errorEvent(String id) {
        return ErrorEvent.builder()
                .id(id)
                .timestamp(NOW)
                .message("Deadlock detected")
                .context(ErrorContext.unknown())
                .classification(Classification.unclassified())
                .fingerprint("fp")
                .build();
    }
}
