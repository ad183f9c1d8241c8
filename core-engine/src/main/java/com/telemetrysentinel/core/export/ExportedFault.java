package com.telemetrysentinel.core.export;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.telemetrysentinel.core.model.ErrorContext;
import com.telemetrysentinel.core.model.ErrorLevel;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The shape of a fault as handed to an {@link ExportSink}.
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ExportedFault {

    private final String eventId;
    private final Instant timestamp;
    private final ErrorLevel level;
    private final String message;
    private final String stack;
    private final String fingerprint;
    private final String environment;
    private final String release;
    private final ErrorContext context;
    private final Map<String, String> tags;
    private final Map<String, Object> extra;

    ExportedFault(String eventId, Instant timestamp, ErrorLevel level, String message, String stack,
            String fingerprint, String environment, String release, ErrorContext context,
            Map<String, String> tags, Map<String, Object> extra) {
        this.eventId = Objects.requireNonNull(eventId, "eventId must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.level = Objects.requireNonNull(level, "level must not be null");
        this.message = message;
        this.stack = stack;
        this.fingerprint = fingerprint;
        this.environment = environment;
        this.release = release;
        this.context = context;
        this.tags = Collections.unmodifiableMap(new LinkedHashMap<>(tags));
        this.extra = Collections.unmodifiableMap(new LinkedHashMap<>(extra));
    }

    public String getEventId() {
        return eventId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public ErrorLevel getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    public String getStack() {
        return stack;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public String getEnvironment() {
        return environment;
    }

    public String getRelease() {
        return release;
    }

    public ErrorContext getContext() {
        return context;
    }

    public Map<String, String> getTags() {
        return tags;
    }

    public Map<String, Object> getExtra() {
        return extra;
    }

    @Override
    public String toString() {
        return "ExportedFault{eventId='" + eventId + "', level=" + level
                + ", fingerprint='" + fingerprint + "', tags=" + tags + '}';
    }
}
