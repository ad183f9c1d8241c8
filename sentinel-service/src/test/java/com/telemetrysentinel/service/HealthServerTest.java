package com.telemetrysentinel.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.telemetrysentinel.core.config.EngineConfig;
import com.telemetrysentinel.core.engine.TelemetryEngine;
import com.telemetrysentinel.core.model.ErrorContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link HealthServer} on an ephemeral port.
 */
class HealthServerTest {

    private static final ErrorContext CHECKOUT = ErrorContext.builder().service("checkout").module("orders").build();

    private final HttpClient client = HttpClient.newHttpClient();
    private final ObjectMapper mapper = new ObjectMapper();
    private final AtomicBoolean ready = new AtomicBoolean(false);
    private TelemetryEngine engine;
    private HealthServer server;

    @BeforeEach
    void setUp() {
        engine = TelemetryEngine.builder()
                .config(EngineConfig.defaults())
                .dispatchExecutor(Runnable::run)
                .build();
        server = new HealthServer(engine, ready::get);
        server.start(0);
    }

    @AfterEach
    void tearDown() {
        server.stop();
        engine.close();
    }

    @Test
    @DisplayName("/health reports UP")
    void shouldReportHealth() throws Exception {
        HttpResponse<String> response = get("/health");

        assertThat(server.isRunning()).isTrue();
        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).isEqualTo("{\"status\":\"UP\"}");
    }

    @Test
    @DisplayName("/readiness follows the readiness check")
    void shouldReportReadiness() throws Exception {
        assertThat(get("/readiness").statusCode()).isEqualTo(503);

        ready.set(true);

        assertThat(get("/readiness").statusCode()).isEqualTo(200);
    }

    @Test
    @DisplayName("/patterns lists patterns by count, honouring the limit")
    void shouldListPatterns() throws Exception {
        for (int i = 0; i < 3; i++) {
            engine.recordError("Deadlock detected", CHECKOUT);
        }
        engine.recordError("Connection refused", CHECKOUT);

        JsonNode all = mapper.readTree(get("/patterns").body());
        JsonNode top = mapper.readTree(get("/patterns?limit=1").body());

        assertThat(all).hasSize(2);
        assertThat(all.get(0).get("count").asLong()).isEqualTo(3);
        assertThat(top).hasSize(1);
    }

    @Test
    @DisplayName("/stats reports totals over the requested window")
    void shouldReportStats() throws Exception {
        engine.recordError("Deadlock detected", CHECKOUT);
        engine.recordError("Deadlock detected", CHECKOUT);

        HttpResponse<String> response = get("/stats?windowMs=60000");
        JsonNode stats = mapper.readTree(response.body());

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(stats.get("totalErrors").asLong()).isEqualTo(2);
        assertThat(stats.get("patternCount").asInt()).isEqualTo(1);
    }

    @Test
    @DisplayName("Bad query parameters answer 400, other methods 405")
    void shouldRejectBadRequests() throws Exception {
        assertThat(get("/patterns?limit=abc").statusCode()).isEqualTo(400);
        assertThat(get("/stats?windowMs=0").statusCode()).isEqualTo(400);

        HttpResponse<String> post = client.send(HttpRequest.newBuilder(uri("/health"))
                .POST(HttpRequest.BodyPublishers.noBody()).build(), HttpResponse.BodyHandlers.ofString());
        assertThat(post.statusCode()).isEqualTo(405);
    }

    @Test
    @DisplayName("Query strings are split and URL-decoded")
    void shouldParseQuery() {
        assertThat(HealthServer.queryParams("limit=5&name=a%20b&flag"))
                .containsEntry("limit", "5")
                .containsEntry("name", "a b")
                .containsEntry("flag", "");
        assertThat(HealthServer.queryParams(null)).isEmpty();
    }

    @Test
    @DisplayName("Ports outside [0, 65535] are rejected")
    void shouldRejectBadPort() {
        assertThatThrownBy(() -> new HealthServer(engine, () -> true).start(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private HttpResponse<String> get(String path) throws Exception {
        return client.send(HttpRequest.newBuilder(uri(path)).GET().build(), HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://localhost:" + server.getPort() + path);
    }
}
