package com.telemetrysentinel.service;

import com.telemetrysentinel.core.signal.Signal;
import com.telemetrysentinel.core.signal.SignalListener;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Publishes every engine {@link Signal} as JSON to the signal topic, keyed by
 * the signal key (fingerprint or metric) so related signals share a partition.
 *
 * <p>
 * Sends are asynchronous; a failed send is logged from the producer callback
 * and never reaches the emitting thread.
 * </p>
 *
 * @since 1.0.0
 */
public class KafkaSignalPublisher implements SignalListener, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(KafkaSignalPublisher.class);

    private final Producer<String, Signal> producer;
    private final String topic;

    public KafkaSignalPublisher(Producer<String, Signal> producer, String topic) {
        this.producer = Objects.requireNonNull(producer, "producer must not be null");
        this.topic = Objects.requireNonNull(topic, "topic must not be null");
    }

    @Override
    public void onSignal(Signal signal) {
        producer.send(new ProducerRecord<>(topic, signal.getKey(), signal), (metadata, exception) -> {
            if (exception != null) {
                LOG.error("Failed to publish {} signal for key '{}': {}",
                        signal.getType().wireName(), signal.getKey(), exception.getMessage(), exception);
            }
        });
    }

    @Override
    public void close() {
        producer.close();
    }
}
