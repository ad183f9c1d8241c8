package com.telemetrysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * The user affected by an error. Only {@code id} is used for impact counting.
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class UserContext {

    private final String id;
    private final String email;
    private final String username;
    private final String ipAddress;
    private final String userAgent;
    private final String sessionId;

    private UserContext(Builder b) {
        this.id = Objects.requireNonNull(b.id, "user id must not be null");
        this.email = b.email;
        this.username = b.username;
        this.ipAddress = b.ipAddress;
        this.userAgent = b.userAgent;
        this.sessionId = b.sessionId;
    }

    public static UserContext of(String id) {
        return new Builder().id(id).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getId() {
        return id;
    }

    public String getEmail() {
        return email;
    }

    public String getUsername() {
        return username;
    }

    public String getIpAddress() {
        return ipAddress;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public String getSessionId() {
        return sessionId;
    }

    public static class Builder {
        private String id;
        private String email;
        private String username;
        private String ipAddress;
        private String userAgent;
        private String sessionId;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder email(String email) {
            this.email = email;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder ipAddress(String ipAddress) {
            this.ipAddress = ipAddress;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        /**
         * @return the user context
         * @throws NullPointerException if {@code id} is {@code null}
         */
        public UserContext build() {
            return new UserContext(this);
        }
    }

    @Override
    public String toString() {
        return "UserContext{id='" + id + "'}";
    }
}
