package com.telemetrysentinel.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.telemetrysentinel.core.storage.JsonMappers;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.serialization.Serializer;

/**
 * Kafka {@link Serializer} writing any value as JSON with ISO-8601 timestamps.
 * Used for published signals and exported faults.
 *
 * @param <T> value type
 */
public class JsonSerializer<T> implements Serializer<T> {

    private final ObjectMapper mapper = JsonMappers.create();

    @Override
    public byte[] serialize(String topic, T data) {
        if (data == null) {
            return null;
        }
        try {
            return mapper.writeValueAsBytes(data);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to serialize "
                    + data.getClass().getSimpleName() + " for topic " + topic, e);
        }
    }
}
