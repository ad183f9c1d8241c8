package com.telemetrysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The inbound request during which an error occurred.
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class RequestContext {

    private final String method;
    private final String url;
    private final Map<String, String> headers;
    private final Map<String, Object> query;
    private final Integer statusCode;
    private final Long responseTimeMs;

    public RequestContext(String method, String url, Map<String, String> headers,
            Map<String, Object> query, Integer statusCode, Long responseTimeMs) {
        this.method = method;
        this.url = url;
        this.headers = headers != null ? new LinkedHashMap<>(headers) : new LinkedHashMap<>();
        this.query = query != null ? new LinkedHashMap<>(query) : new LinkedHashMap<>();
        this.statusCode = statusCode;
        this.responseTimeMs = responseTimeMs;
    }

    public String getMethod() {
        return method;
    }

    public String getUrl() {
        return url;
    }

    public Map<String, String> getHeaders() {
        return Collections.unmodifiableMap(headers);
    }

    public Map<String, Object> getQuery() {
        return Collections.unmodifiableMap(query);
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    public Long getResponseTimeMs() {
        return responseTimeMs;
    }

    @Override
    public String toString() {
        return "RequestContext{" + method + " " + url + " -> " + statusCode + '}';
    }
}
