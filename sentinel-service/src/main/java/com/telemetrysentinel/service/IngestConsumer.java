package com.telemetrysentinel.service;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.common.errors.WakeupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Poll loop that reads {@link TelemetryRecord}s from the ingest topic and
 * hands each one to the {@link RecordHandler}.
 *
 * <h3>Failure handling</h3>
 * <ul>
 * <li>Undecodable records arrive as {@code null} values and are counted as
 * rejected.</li>
 * <li>Records the engine refuses ({@link IllegalArgumentException}) are
 * logged and counted as rejected; the loop continues.</li>
 * </ul>
 *
 * <h3>Lifecycle</h3>
 * <p>
 * {@link #run()} blocks on the calling thread until {@link #close()} wakes the
 * consumer from another thread. The consumer itself is closed by the polling
 * thread on the way out.
 * </p>
 *
 * @since 1.0.0
 */
public class IngestConsumer implements Runnable, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(IngestConsumer.class);

    private final Consumer<String, TelemetryRecord> consumer;
    private final String topic;
    private final Duration pollTimeout;
    private final RecordHandler handler;
    private final SentinelMetrics metrics;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean();
    private final CountDownLatch stopped = new CountDownLatch(1);

    public IngestConsumer(Consumer<String, TelemetryRecord> consumer, String topic, Duration pollTimeout,
            RecordHandler handler, SentinelMetrics metrics, Clock clock) {
        this.consumer = Objects.requireNonNull(consumer, "consumer must not be null");
        this.topic = Objects.requireNonNull(topic, "topic must not be null");
        this.pollTimeout = Objects.requireNonNull(pollTimeout, "pollTimeout must not be null");
        this.handler = Objects.requireNonNull(handler, "handler must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public void run() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Ingest consumer already running");
        }
        try {
            consumer.subscribe(List.of(topic));
            LOG.info("Consuming telemetry from topic '{}'", topic);
            while (running.get()) {
                pollOnce();
            }
        } catch (WakeupException e) {
            if (running.get()) {
                throw e;
            }
        } finally {
            consumer.close();
            running.set(false);
            stopped.countDown();
            LOG.info("Ingest consumer stopped");
        }
    }

    /**
     * Poll once and handle whatever arrived.
     *
     * @return number of records handed to the engine
     */
    int pollOnce() {
        ConsumerRecords<String, TelemetryRecord> records = consumer.poll(pollTimeout);
        int accepted = 0;
        for (ConsumerRecord<String, TelemetryRecord> record : records) {
            if (handle(record)) {
                accepted++;
            }
        }
        return accepted;
    }

    private boolean handle(ConsumerRecord<String, TelemetryRecord> record) {
        TelemetryRecord value = record.value();
        if (value == null) {
            metrics.incrementRejected();
            return false;
        }
        try {
            String id = handler.handle(value);
            metrics.incrementIngested();
            Instant received = value.getIngestionTime();
            if (received != null) {
                metrics.recordLatency(Duration.between(received, clock.instant()));
            }
            LOG.debug("Record at {}-{}@{} recorded as {}", record.topic(), record.partition(), record.offset(), id);
            return true;
        } catch (IllegalArgumentException e) {
            metrics.incrementRejected();
            LOG.warn("Rejected record at {}-{}@{}: {}", record.topic(), record.partition(), record.offset(),
                    e.getMessage());
            return false;
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Stop polling and wait up to ten seconds for the loop to exit.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            consumer.wakeup();
            try {
                if (!stopped.await(10, TimeUnit.SECONDS)) {
                    LOG.warn("Ingest consumer did not stop within 10s");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
