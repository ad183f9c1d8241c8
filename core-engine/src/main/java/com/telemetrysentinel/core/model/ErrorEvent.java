package com.telemetrysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One recorded occurrence of a fault.
 *
 * <p>
 * Built by the engine at ingestion time and immutable afterwards, with the
 * exception of {@link #getResolution() resolution} which belongs to the
 * human triage workflow.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code id}, {@code timestamp}, {@code message},
 * {@code context}, {@code classification} and {@code fingerprint} are
 * required; omitting any of them throws {@link NullPointerException} at
 * build time.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ErrorEvent {

    private final String id;
    private final Instant timestamp;
    private final ErrorLevel level;
    private final String message;
    private final String stack;
    private final String correlationId;
    private final ErrorContext context;
    private final Map<String, String> tags;
    private final Map<String, Object> extra;
    private final UserContext user;
    private final RequestContext request;
    private final String environment;
    private final String release;
    private final Classification classification;
    private final String fingerprint;

    private volatile Resolution resolution;

    private ErrorEvent(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id must not be null");
        this.timestamp = Objects.requireNonNull(b.timestamp, "timestamp must not be null");
        this.level = b.level != null ? b.level : ErrorLevel.ERROR;
        this.message = Objects.requireNonNull(b.message, "message must not be null");
        this.stack = b.stack;
        this.correlationId = b.correlationId;
        this.context = Objects.requireNonNull(b.context, "context must not be null");
        this.tags = new LinkedHashMap<>(b.tags);
        this.extra = new LinkedHashMap<>(b.extra);
        this.user = b.user;
        this.request = b.request;
        this.environment = b.environment;
        this.release = b.release;
        this.classification = Objects.requireNonNull(b.classification, "classification must not be null");
        this.fingerprint = Objects.requireNonNull(b.fingerprint, "fingerprint must not be null");
        this.resolution = b.resolution;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getId() {
        return id;
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

    public String getCorrelationId() {
        return correlationId;
    }

    public ErrorContext getContext() {
        return context;
    }

    public Map<String, String> getTags() {
        return Collections.unmodifiableMap(tags);
    }

    public Map<String, Object> getExtra() {
        return Collections.unmodifiableMap(extra);
    }

    public UserContext getUser() {
        return user;
    }

    public RequestContext getRequest() {
        return request;
    }

    public String getEnvironment() {
        return environment;
    }

    public String getRelease() {
        return release;
    }

    public Classification getClassification() {
        return classification;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public Resolution getResolution() {
        return resolution;
    }

    public void setResolution(Resolution resolution) {
        this.resolution = resolution;
    }

    /**
     * Fluent builder for {@link ErrorEvent}.
     */
    public static class Builder {
        private String id;
        private Instant timestamp;
        private ErrorLevel level;
        private String message;
        private String stack;
        private String correlationId;
        private ErrorContext context;
        private final Map<String, String> tags = new LinkedHashMap<>();
        private final Map<String, Object> extra = new LinkedHashMap<>();
        private UserContext user;
        private RequestContext request;
        private String environment;
        private String release;
        private Classification classification;
        private String fingerprint;
        private Resolution resolution;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder level(ErrorLevel level) {
            this.level = level;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder stack(String stack) {
            this.stack = stack;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder context(ErrorContext context) {
            this.context = context;
            return this;
        }

        public Builder tags(Map<String, String> tags) {
            if (tags != null) {
                this.tags.putAll(tags);
            }
            return this;
        }

        public Builder tag(String key, String value) {
            this.tags.put(key, value);
            return this;
        }

        public Builder extra(Map<String, Object> extra) {
            if (extra != null) {
                this.extra.putAll(extra);
            }
            return this;
        }

        public Builder user(UserContext user) {
            this.user = user;
            return this;
        }

        public Builder request(RequestContext request) {
            this.request = request;
            return this;
        }

        public Builder environment(String environment) {
            this.environment = environment;
            return this;
        }

        public Builder release(String release) {
            this.release = release;
            return this;
        }

        public Builder classification(Classification classification) {
            this.classification = classification;
            return this;
        }

        public Builder fingerprint(String fingerprint) {
            this.fingerprint = fingerprint;
            return this;
        }

        public Builder resolution(Resolution resolution) {
            this.resolution = resolution;
            return this;
        }

        public ErrorEvent build() {
            return new ErrorEvent(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ErrorEvent that))
            return false;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "ErrorEvent{" +
                "id='" + id + '\'' +
                ", timestamp=" + timestamp +
                ", message='" + message + '\'' +
                ", fingerprint='" + fingerprint + '\'' +
                ", classification=" + classification +
                '}';
    }
}
