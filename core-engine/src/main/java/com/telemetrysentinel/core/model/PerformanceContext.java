package com.telemetrysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Where and for whom a performance measurement was taken.
 *
 * <p>
 * {@code service} is part of the anomaly baseline key; a missing service is
 * treated as {@value ErrorContext#UNKNOWN}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PerformanceContext {

    private final String service;
    private final String endpoint;
    private final String method;
    private final String userId;
    private final String sessionId;
    private final String browser;
    private final String device;
    private final String connection;
    private final String region;

    private PerformanceContext(Builder b) {
        this.service = b.service;
        this.endpoint = b.endpoint;
        this.method = b.method;
        this.userId = b.userId;
        this.sessionId = b.sessionId;
        this.browser = b.browser;
        this.device = b.device;
        this.connection = b.connection;
        this.region = b.region;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static PerformanceContext forService(String service) {
        return new Builder().service(service).build();
    }

    /**
     * @return the service, or {@value ErrorContext#UNKNOWN} when blank
     */
    public String serviceOrUnknown() {
        return service == null || service.isBlank() ? ErrorContext.UNKNOWN : service;
    }

    public String getService() {
        return service;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public String getMethod() {
        return method;
    }

    public String getUserId() {
        return userId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getBrowser() {
        return browser;
    }

    public String getDevice() {
        return device;
    }

    public String getConnection() {
        return connection;
    }

    public String getRegion() {
        return region;
    }

    public static class Builder {
        private String service;
        private String endpoint;
        private String method;
        private String userId;
        private String sessionId;
        private String browser;
        private String device;
        private String connection;
        private String region;

        public Builder service(String service) {
            this.service = service;
            return this;
        }

        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder browser(String browser) {
            this.browser = browser;
            return this;
        }

        public Builder device(String device) {
            this.device = device;
            return this;
        }

        public Builder connection(String connection) {
            this.connection = connection;
            return this;
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public PerformanceContext build() {
            return new PerformanceContext(this);
        }
    }

    @Override
    public String toString() {
        return "PerformanceContext{service='" + service + "', endpoint='" + endpoint + "'}";
    }
}
