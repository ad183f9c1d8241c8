package com.telemetrysentinel.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A fault as submitted by a caller: either a {@link Throwable} or a plain
 * message, plus whatever context the caller has.
 *
 * <p>
 * Everything except the message or throwable is optional. Missing parts are
 * defaulted by the engine rather than rejected.
 * </p>
 *
 * @since 1.0.0
 */
public final class ErrorReport {

    private final String message;
    private final Throwable throwable;
    private final String stack;
    private final ErrorLevel level;
    private final ErrorContext context;
    private final UserContext user;
    private final RequestContext request;
    private final String correlationId;
    private final Map<String, String> tags;
    private final Map<String, Object> extra;

    private ErrorReport(Builder b) {
        if (b.throwable == null && b.message == null) {
            throw new IllegalArgumentException("Either a message or a throwable is required");
        }
        this.throwable = b.throwable;
        this.message = b.message != null ? b.message : messageOf(b.throwable);
        this.stack = b.stack;
        this.level = b.level != null ? b.level : ErrorLevel.ERROR;
        this.context = b.context;
        this.user = b.user;
        this.request = b.request;
        this.correlationId = b.correlationId;
        this.tags = new LinkedHashMap<>(b.tags);
        this.extra = new LinkedHashMap<>(b.extra);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ErrorReport of(String message, ErrorContext context) {
        return new Builder().message(message).context(context).build();
    }

    public static ErrorReport of(Throwable throwable, ErrorContext context) {
        return new Builder().throwable(throwable).context(context).build();
    }

    private static String messageOf(Throwable t) {
        String m = t.getMessage();
        return m != null ? m : t.getClass().getName();
    }

    public String getMessage() {
        return message;
    }

    public Throwable getThrowable() {
        return throwable;
    }

    /**
     * @return a stack trace already rendered by the reporter, or {@code null}
     *         when it should be taken from {@link #getThrowable()}
     */
    public String getStack() {
        return stack;
    }

    public ErrorLevel getLevel() {
        return level;
    }

    public ErrorContext getContext() {
        return context;
    }

    public UserContext getUser() {
        return user;
    }

    public RequestContext getRequest() {
        return request;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public Map<String, String> getTags() {
        return Collections.unmodifiableMap(tags);
    }

    public Map<String, Object> getExtra() {
        return Collections.unmodifiableMap(extra);
    }

    public static class Builder {
        private String message;
        private Throwable throwable;
        private String stack;
        private ErrorLevel level;
        private ErrorContext context;
        private UserContext user;
        private RequestContext request;
        private String correlationId;
        private final Map<String, String> tags = new LinkedHashMap<>();
        private final Map<String, Object> extra = new LinkedHashMap<>();

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder throwable(Throwable throwable) {
            this.throwable = throwable;
            return this;
        }

        public Builder stack(String stack) {
            this.stack = stack;
            return this;
        }

        public Builder level(ErrorLevel level) {
            this.level = level;
            return this;
        }

        public Builder context(ErrorContext context) {
            this.context = context;
            return this;
        }

        public Builder user(UserContext user) {
            this.user = user;
            return this;
        }

        public Builder userId(String userId) {
            this.user = userId != null ? UserContext.of(userId) : null;
            return this;
        }

        public Builder request(RequestContext request) {
            this.request = request;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder tag(String key, String value) {
            this.tags.put(key, value);
            return this;
        }

        public Builder tags(Map<String, String> tags) {
            if (tags != null) {
                this.tags.putAll(tags);
            }
            return this;
        }

        public Builder extra(String key, Object value) {
            this.extra.put(key, value);
            return this;
        }

        public Builder extra(Map<String, Object> extra) {
            if (extra != null) {
                this.extra.putAll(extra);
            }
            return this;
        }

        /**
         * @return the report
         * @throws IllegalArgumentException if neither message nor throwable is set
         */
        public ErrorReport build() {
            return new ErrorReport(this);
        }
    }
}
