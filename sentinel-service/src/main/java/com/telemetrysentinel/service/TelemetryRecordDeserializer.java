package com.telemetrysentinel.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.telemetrysentinel.core.storage.JsonMappers;
import org.apache.kafka.common.serialization.Deserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * Kafka {@link Deserializer} that converts raw record bytes into a
 * {@link TelemetryRecord}.
 * <p>
 * Malformed messages are logged and dropped (returns {@code null}), so one bad
 * record never stops the ingest loop.
 * </p>
 */
public class TelemetryRecordDeserializer implements Deserializer<TelemetryRecord> {

    private static final Logger LOG = LoggerFactory.getLogger(TelemetryRecordDeserializer.class);

    private final ObjectMapper mapper = JsonMappers.create();
    private final Clock clock;

    public TelemetryRecordDeserializer() {
        this(Clock.systemUTC());
    }

    public TelemetryRecordDeserializer(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public TelemetryRecord deserialize(String topic, byte[] data) {
        if (data == null || data.length == 0) {
            return null;
        }
        try {
            TelemetryRecord record = mapper.readValue(data, TelemetryRecord.class);
            record.setIngestionTime(clock.instant());
            return record;
        } catch (Exception e) {
            LOG.warn("Failed to deserialize record from {}, skipping: {}", topic, e.getMessage());
            return null;
        }
    }
}
