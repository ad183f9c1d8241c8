package com.telemetrysentinel.service;

import com.telemetrysentinel.core.config.EngineConfig;
import com.telemetrysentinel.core.engine.TelemetryEngine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link IngestConsumer} with a {@link MockConsumer}.
 */
class IngestConsumerTest {

    private static final String TOPIC = "telemetry-events";
    private static final TopicPartition PARTITION = new TopicPartition(TOPIC, 0);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

    private final TelemetryRecordDeserializer deserializer = new TelemetryRecordDeserializer(CLOCK);
    private MockConsumer<String, TelemetryRecord> consumer;
    private SimpleMeterRegistry registry;
    private TelemetryEngine engine;
    private IngestConsumer ingest;

    @BeforeEach
    void setUp() {
        consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
        registry = new SimpleMeterRegistry();
        engine = TelemetryEngine.builder()
                .config(EngineConfig.defaults())
                .clock(CLOCK)
                .dispatchExecutor(Runnable::run)
                .build();
        ingest = new IngestConsumer(consumer, TOPIC, Duration.ofMillis(10),
                new RecordHandler(engine), new SentinelMetrics(registry), CLOCK);
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    @DisplayName("Good records reach the engine; undecodable and refused records are counted as rejected")
    void shouldHandleBatch() {
        consumer.assign(List.of(PARTITION));
        consumer.updateBeginningOffsets(Map.of(PARTITION, 0L));
        addRecord(0, "{\"kind\":\"error\",\"message\":\"Deadlock detected\"}");
        addRecord(1, "{broken");
        addRecord(2, "{\"kind\":\"performance\",\"metric\":\"api.latency\",\"value\":120}");
        addRecord(3, "{\"kind\":\"unknown\"}");

        int accepted = ingest.pollOnce();

        assertThat(accepted).isEqualTo(2);
        assertThat(engine.patternCount()).isEqualTo(1);
        assertThat(registry.get("telemetry.records.ingested").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("telemetry.records.rejected").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("telemetry.ingest.latency").timer().count()).isEqualTo(2);
    }

    @Test
    @DisplayName("run() consumes until close() wakes it, then closes the consumer")
    void shouldRunUntilClosed() throws Exception {
        consumer.schedulePollTask(() -> {
            consumer.rebalance(List.of(PARTITION));
            consumer.updateBeginningOffsets(Map.of(PARTITION, 0L));
            consumer.seek(PARTITION, 0L);
            addRecord(0, "{\"kind\":\"error\",\"message\":\"Deadlock detected\"}");
        });

        Thread thread = new Thread(ingest, "ingest-test");
        thread.start();
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (engine.patternCount() == 0 && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        assertThat(ingest.isRunning()).isTrue();

        ingest.close();
        thread.join(5_000);

        assertThat(thread.isAlive()).isFalse();
        assertThat(ingest.isRunning()).isFalse();
        assertThat(consumer.closed()).isTrue();
        assertThat(engine.patternCount()).isEqualTo(1);
    }

    private void addRecord(long offset, String json) {
        consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, offset, null,
                deserializer.deserialize(TOPIC, json.getBytes(StandardCharsets.UTF_8))));
    }
}
