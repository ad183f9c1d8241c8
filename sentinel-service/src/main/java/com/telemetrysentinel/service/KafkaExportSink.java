package com.telemetrysentinel.service;

import com.telemetrysentinel.core.export.ExportException;
import com.telemetrysentinel.core.export.ExportSink;
import com.telemetrysentinel.core.export.ExportedFault;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link ExportSink} that writes classified faults to a Kafka topic, keyed by
 * fingerprint.
 *
 * <p>
 * {@link #send(ExportedFault)} waits for the broker acknowledgement so that
 * the engine's background dispatcher can retry a failed delivery.
 * </p>
 *
 * @since 1.0.0
 */
public class KafkaExportSink implements ExportSink {

    private final Producer<String, ExportedFault> producer;
    private final String topic;
    private final Duration sendTimeout;

    public KafkaExportSink(Producer<String, ExportedFault> producer, String topic, Duration sendTimeout) {
        this.producer = Objects.requireNonNull(producer, "producer must not be null");
        this.topic = Objects.requireNonNull(topic, "topic must not be null");
        this.sendTimeout = Objects.requireNonNull(sendTimeout, "sendTimeout must not be null");
    }

    @Override
    public void send(ExportedFault fault) {
        try {
            producer.send(new ProducerRecord<>(topic, fault.getFingerprint(), fault))
                    .get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExportException("Interrupted while exporting " + fault.getEventId(), e);
        } catch (ExecutionException e) {
            throw new ExportException("Export of " + fault.getEventId() + " failed", e.getCause());
        } catch (TimeoutException e) {
            throw new ExportException("Export of " + fault.getEventId() + " timed out after " + sendTimeout, e);
        }
    }

    @Override
    public void close() {
        producer.close();
    }
}
