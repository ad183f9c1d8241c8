package com.telemetrysentinel.core.signal;

import java.time.Instant;
import java.util.Objects;

/**
 * Notification emitted by the engine.
 *
 * <p>
 * The {@code payload} is the domain object the signal is about (an error
 * event, a performance event, a pattern snapshot or a regression result) and
 * is serialized as-is by publishers.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code type} and {@code timestamp} are required;
 * omitting either throws {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public final class Signal {

    private final SignalType type;
    private final Instant timestamp;
    private final String key;
    private final String details;
    private final Object payload;

    private Signal(Builder builder) {
        this.type = Objects.requireNonNull(builder.type, "type must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.key = builder.key;
        this.details = builder.details;
        this.payload = builder.payload;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Signal} instances.
     */
    public static class Builder {
        private SignalType type;
        private Instant timestamp;
        private String key;
        private String details;
        private Object payload;

        public Builder type(SignalType type) {
            this.type = type;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        /** Identifier of what the signal is about (event id, fingerprint, metric). */
        public Builder key(String key) {
            this.key = key;
            return this;
        }

        public Builder details(String details) {
            this.details = details;
            return this;
        }

        public Builder payload(Object payload) {
            this.payload = payload;
            return this;
        }

        /**
         * @return a new {@link Signal}
         * @throws NullPointerException if {@code type} or {@code timestamp} is
         *                              {@code null}
         */
        public Signal build() {
            return new Signal(this);
        }
    }

    public SignalType getType() {
        return type;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getKey() {
        return key;
    }

    public String getDetails() {
        return details;
    }

    public Object getPayload() {
        return payload;
    }

    /**
     * Return the payload cast to the expected type.
     *
     * @param type expected payload class
     * @param <T>  payload type
     * @return the payload
     * @throws ClassCastException if the payload is of another type
     */
    public <T> T payloadAs(Class<T> type) {
        return type.cast(payload);
    }

    @Override
    public String toString() {
        return "Signal{" +
                "type=" + type.wireName() +
                ", key='" + key + '\'' +
                ", timestamp=" + timestamp +
                ", details='" + details + '\'' +
                '}';
    }
}
