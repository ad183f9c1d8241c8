package com.telemetrysentinel.service;

import com.telemetrysentinel.core.config.EngineConfig;
import com.telemetrysentinel.core.engine.TelemetryEngine;
import com.telemetrysentinel.core.model.ErrorEvent;
import com.telemetrysentinel.core.model.ErrorLevel;
import com.telemetrysentinel.core.model.PerformanceEvent;
import com.telemetrysentinel.core.model.PerformanceType;
import com.telemetrysentinel.core.signal.Signal;
import com.telemetrysentinel.core.signal.SignalType;
import com.telemetrysentinel.core.storage.InMemoryKeyValueStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link RecordHandler} against a synchronous engine.
 */
class RecordHandlerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

    private final TelemetryRecordDeserializer deserializer = new TelemetryRecordDeserializer(CLOCK);
    private List<Signal> signals;
    private TelemetryEngine engine;
    private RecordHandler handler;

    @BeforeEach
    void setUp() {
        signals = new CopyOnWriteArrayList<>();
        engine = TelemetryEngine.builder()
                .config(EngineConfig.builder().environment("test").build())
                .store(new InMemoryKeyValueStore(CLOCK))
                .clock(CLOCK)
                .dispatchExecutor(Runnable::run)
                .build();
        engine.getSignalBus().subscribe(signals::add);
        handler = new RecordHandler(engine);
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    @DisplayName("An error record carries its context, tags, stack and user into the engine")
    void shouldRecordError() {
        String id = handler.handle(record("{\"kind\":\"error\",\"message\":\"Deadlock detected\","
                + "\"stack\":\"at Orders.save(Orders.java:42)\",\"level\":\"fatal\",\"correlationId\":\"req-1\","
                + "\"userId\":\"alice\",\"context\":{\"service\":\"checkout\",\"module\":\"orders\",\"line\":42},"
                + "\"tags\":{\"region\":\"eu\"},\"extra\":{\"attempt\":2}}"));

        assertThat(id).startsWith("err_");
        ErrorEvent event = signals.get(0).payloadAs(ErrorEvent.class);
        assertThat(event.getMessage()).isEqualTo("Deadlock detected");
        assertThat(event.getStack()).isEqualTo("at Orders.save(Orders.java:42)");
        assertThat(event.getLevel()).isEqualTo(ErrorLevel.FATAL);
        assertThat(event.getCorrelationId()).isEqualTo("req-1");
        assertThat(event.getUser().getId()).isEqualTo("alice");
        assertThat(event.getContext().getService()).isEqualTo("checkout");
        assertThat(event.getContext().getModule()).isEqualTo("orders");
        assertThat(event.getContext().getLine()).isEqualTo(42);
        assertThat(event.getTags()).containsEntry("region", "eu");
        assertThat(event.getExtra()).containsEntry("attempt", 2);
    }

    @Test
    @DisplayName("An error record without context falls back to unknown service and module")
    void shouldDefaultErrorContext() {
        handler.handle(record("{\"kind\":\"error\",\"message\":\"oops\"}"));

        ErrorEvent event = signals.get(0).payloadAs(ErrorEvent.class);
        assertThat(event.getContext().getService()).isEqualTo("unknown");
        assertThat(event.getContext().getModule()).isEqualTo("unknown");
    }

    @Test
    @DisplayName("A performance record over its warning threshold signals performance-warning")
    void shouldRecordPerformance() {
        String id = handler.handle(record("{\"kind\":\"performance\",\"type\":\"database_query\","
                + "\"metric\":\"db.orders.select\",\"value\":300,\"unit\":\"ms\","
                + "\"context\":{\"service\":\"checkout\"},\"thresholds\":{\"warning\":200,\"critical\":500}}"));

        assertThat(id).startsWith("perf_");
        assertThat(signals).extracting(Signal::getType)
                .containsExactly(SignalType.PERFORMANCE_WARNING, SignalType.PERFORMANCE_RECORDED);
        PerformanceEvent event = signals.get(1).payloadAs(PerformanceEvent.class);
        assertThat(event.getType()).isEqualTo(PerformanceType.DATABASE_QUERY);
        assertThat(event.getThresholds().getTarget()).isEqualTo(200.0);
        assertThat(event.getCorrelationId()).isNotBlank();
    }

    @Test
    @DisplayName("A performance record without thresholds never warns")
    void shouldTreatMissingThresholdsAsUnbounded() {
        handler.handle(record("{\"kind\":\"performance\",\"metric\":\"api.latency\",\"value\":99999}"));

        assertThat(signals).extracting(Signal::getType).containsExactly(SignalType.PERFORMANCE_RECORDED);
    }

    @Test
    @DisplayName("A web vital record uses the vital's thresholds and the session as correlation id")
    void shouldRecordWebVital() {
        handler.handle(record("{\"kind\":\"web_vital\",\"name\":\"lcp\",\"value\":6000,"
                + "\"context\":{\"service\":\"storefront\",\"sessionId\":\"sess-9\"}}"));

        assertThat(signals).extracting(Signal::getType)
                .containsExactly(SignalType.PERFORMANCE_CRITICAL, SignalType.PERFORMANCE_RECORDED);
        PerformanceEvent event = signals.get(1).payloadAs(PerformanceEvent.class);
        assertThat(event.getMetric()).isEqualTo("LCP");
        assertThat(event.getType()).isEqualTo(PerformanceType.WEB_VITAL);
        assertThat(event.getCorrelationId()).isEqualTo("sess-9");
    }

    @Test
    @DisplayName("Records the engine cannot accept are rejected with IllegalArgumentException")
    void shouldRejectInvalidRecords() {
        assertThatThrownBy(() -> handler.handle(record("{\"message\":\"no kind\"}")))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("kind");
        assertThatThrownBy(() -> handler.handle(record("{\"kind\":\"trace\"}")))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("trace");
        assertThatThrownBy(() -> handler.handle(record("{\"kind\":\"error\"}")))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("message");
        assertThatThrownBy(() -> handler.handle(record("{\"kind\":\"performance\",\"value\":1}")))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("metric");
        assertThatThrownBy(() -> handler.handle(record("{\"kind\":\"performance\",\"metric\":\"m\",\"value\":\"fast\"}")))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("value");
        assertThatThrownBy(() -> handler.handle(record("{\"kind\":\"web_vital\",\"name\":\"INP\",\"value\":1}")))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("INP");

        assertThat(signals).isEmpty();
    }

    private TelemetryRecord record(String json) {
        return deserializer.deserialize("telemetry-events", json.getBytes(StandardCharsets.UTF_8));
    }
}
