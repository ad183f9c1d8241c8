package com.telemetrysentinel.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import com.telemetrysentinel.core.engine.TelemetryEngine;
import com.telemetrysentinel.core.storage.JsonMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * Lightweight HTTP server exposing health checks and the engine's query surface.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health} - {@code 200} with {@code {"status":"UP"}}</li>
 * <li>{@code GET /readiness} - {@code 200} once the ingest loop is running,
 * {@code 503} otherwise</li>
 * <li>{@code GET /patterns?limit=N} - the N most frequent error patterns
 * (default 20)</li>
 * <li>{@code GET /stats?windowMs=N} - error statistics over the last N
 * milliseconds (default one hour)</li>
 * </ul>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer}; no servlet container is needed.
 * </p>
 *
 * @since 1.0.0
 */
public class HealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);

    static final int DEFAULT_PATTERN_LIMIT = 20;
    static final long DEFAULT_STATS_WINDOW_MS = Duration.ofHours(1).toMillis();

    private static final byte[] UP = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);
    private static final byte[] DOWN = "{\"status\":\"DOWN\"}".getBytes(StandardCharsets.UTF_8);

    private final TelemetryEngine engine;
    private final BooleanSupplier ready;
    private final ObjectMapper mapper = JsonMappers.create();

    private HttpServer server;
    private ExecutorService executor;
    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * @param engine engine answering {@code /patterns} and {@code /stats}
     * @param ready  readiness check for {@code /readiness}
     */
    public HealthServer(TelemetryEngine engine, BooleanSupplier ready) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.ready = Objects.requireNonNull(ready, "ready must not be null");
    }

    /**
     * Start the server on the given port.
     *
     * @param port TCP port to bind to; {@code 0} picks any free port
     * @throws IllegalArgumentException if port is out of range
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Health port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/health", get(exchange -> respond(exchange, 200, UP)));
            server.createContext("/readiness", get(this::handleReadiness));
            server.createContext("/patterns", get(this::handlePatterns));
            server.createContext("/stats", get(this::handleStats));

            executor = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "health-server");
                t.setDaemon(true);
                return t;
            });
            server.setExecutor(executor);

            server.start();
            running.set(true);
            LOG.info("Health server started on port {}", getPort());
        } catch (IOException e) {
            LOG.error("Failed to start health server on port {}: {}", port, e.getMessage(), e);
        }
    }

    /**
     * Stop the server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            executor.shutdown();
            LOG.info("Health server stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port, or {@code -1} when not running
     */
    public int getPort() {
        return running.get() ? server.getAddress().getPort() : -1;
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private void handleReadiness(HttpExchange exchange) throws IOException {
        if (ready.getAsBoolean()) {
            respond(exchange, 200, UP);
        } else {
            respond(exchange, 503, DOWN);
        }
    }

    private void handlePatterns(HttpExchange exchange) throws IOException {
        long limit = longParam(exchange, "limit", DEFAULT_PATTERN_LIMIT);
        if (limit < 0 || limit > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("limit must be a non-negative int, got: " + limit);
        }
        respondJson(exchange, engine.listPatterns((int) limit));
    }

    private void handleStats(HttpExchange exchange) throws IOException {
        long windowMs = longParam(exchange, "windowMs", DEFAULT_STATS_WINDOW_MS);
        if (windowMs <= 0) {
            throw new IllegalArgumentException("windowMs must be positive, got: " + windowMs);
        }
        respondJson(exchange, engine.errorStats(Duration.ofMillis(windowMs)));
    }

    /**
     * Restrict a handler to GET and turn bad query parameters into {@code 400}.
     */
    private HttpHandler get(HttpHandler handler) {
        return exchange -> {
            try {
                if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                    respond(exchange, 405, error("Method not allowed"));
                    return;
                }
                try {
                    handler.handle(exchange);
                } catch (IllegalArgumentException e) {
                    respond(exchange, 400, error(e.getMessage()));
                } catch (RuntimeException e) {
                    LOG.error("Request {} failed: {}", exchange.getRequestURI(), e.getMessage(), e);
                    respond(exchange, 500, error("Internal error"));
                }
            } finally {
                exchange.close();
            }
        };
    }

    private void respondJson(HttpExchange exchange, Object body) throws IOException {
        respond(exchange, 200, mapper.writeValueAsBytes(body));
    }

    private byte[] error(String message) throws IOException {
        return mapper.writeValueAsBytes(Map.of("error", String.valueOf(message)));
    }

    private static void respond(HttpExchange exchange, int status, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    // ---------------------------------------------------------------
    // Query parsing
    // ---------------------------------------------------------------

    static Map<String, String> queryParams(String rawQuery) {
        Map<String, String> params = new HashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return params;
        }
        for (String pair : rawQuery.split("&")) {
            int eq = pair.indexOf('=');
            String name = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            params.put(URLDecoder.decode(name, StandardCharsets.UTF_8),
                    URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return params;
    }

    private static long longParam(HttpExchange exchange, String name, long defaultValue) {
        String raw = queryParams(exchange.getRequestURI().getRawQuery()).get(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be a number, got: '" + raw + "'", e);
        }
    }
}
