package com.telemetrysentinel.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.telemetrysentinel.core.signal.Signal;
import com.telemetrysentinel.core.signal.SignalType;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

/**
 * Tests for {@link KafkaSignalPublisher} with a {@link MockProducer}.
 */
class KafkaSignalPublisherTest {

    private static final Signal SIGNAL = Signal.builder()
            .type(SignalType.PATTERN_ALERT)
            .timestamp(Instant.parse("2026-03-01T10:00:00Z"))
            .key("0f343b0931126a20f133d67c2b018a3b")
            .details("Error frequency increasing rapidly")
            .payload(Map.of("count", 42))
            .build();

    @Test
    @DisplayName("Signals are sent to the signal topic keyed by signal key")
    void shouldPublishSignal() throws Exception {
        MockProducer<String, Signal> producer =
                new MockProducer<>(true, new StringSerializer(), new JsonSerializer<>());
        KafkaSignalPublisher publisher = new KafkaSignalPublisher(producer, "telemetry-signals");

        publisher.onSignal(SIGNAL);

        assertThat(producer.history()).hasSize(1);
        ProducerRecord<String, Signal> sent = producer.history().get(0);
        assertThat(sent.topic()).isEqualTo("telemetry-signals");
        assertThat(sent.key()).isEqualTo(SIGNAL.getKey());
        assertThat(sent.value()).isSameAs(SIGNAL);

        JsonNode json = new ObjectMapper().readTree(new JsonSerializer<Signal>().serialize("t", SIGNAL));
        assertThat(json.get("type").asText()).isEqualTo("pattern-alert");
        assertThat(json.get("timestamp").asText()).isEqualTo("2026-03-01T10:00:00Z");
        assertThat(json.get("payload").get("count").asInt()).isEqualTo(42);
    }

    @Test
    @DisplayName("A failed send is logged, not thrown at the emitter")
    void shouldLogSendFailure() {
        MockProducer<String, Signal> producer =
                new MockProducer<>(false, new StringSerializer(), new JsonSerializer<>());
        KafkaSignalPublisher publisher = new KafkaSignalPublisher(producer, "telemetry-signals");

        publisher.onSignal(SIGNAL);

        assertThatCode(() -> producer.errorNext(new RuntimeException("broker down"))).doesNotThrowAnyException();
        assertThat(producer.history()).hasSize(1);
    }

    @Test
    @DisplayName("close() closes the producer")
    void shouldCloseProducer() {
        MockProducer<String, Signal> producer =
                new MockProducer<>(true, new StringSerializer(), new JsonSerializer<>());

        new KafkaSignalPublisher(producer, "telemetry-signals").close();

        assertThat(producer.closed()).isTrue();
    }
}
