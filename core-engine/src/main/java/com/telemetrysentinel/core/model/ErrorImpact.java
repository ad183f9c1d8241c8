package com.telemetrysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Estimated business impact of an error pattern.
 *
 * <p>
 * Mutable; owned by the {@link ErrorPattern} it belongs to and only changed
 * while the pattern's entry is locked.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorImpact {

    private int userCount;
    private long sessionCount;
    private long requestCount;
    private Double revenue;

    public ErrorImpact() {
    }

    ErrorImpact(ErrorImpact other) {
        this.userCount = other.userCount;
        this.sessionCount = other.sessionCount;
        this.requestCount = other.requestCount;
        this.revenue = other.revenue;
    }

    public int getUserCount() {
        return userCount;
    }

    public void setUserCount(int userCount) {
        this.userCount = userCount;
    }

    public long getSessionCount() {
        return sessionCount;
    }

    public void setSessionCount(long sessionCount) {
        this.sessionCount = sessionCount;
    }

    public long getRequestCount() {
        return requestCount;
    }

    public void setRequestCount(long requestCount) {
        this.requestCount = requestCount;
    }

    /**
     * @return estimated revenue at risk, or {@code null} if not estimated
     */
    public Double getRevenue() {
        return revenue;
    }

    public void setRevenue(Double revenue) {
        this.revenue = revenue;
    }

    @Override
    public String toString() {
        return "ErrorImpact{" +
                "userCount=" + userCount +
                ", sessionCount=" + sessionCount +
                ", requestCount=" + requestCount +
                ", revenue=" + revenue +
                '}';
    }
}
