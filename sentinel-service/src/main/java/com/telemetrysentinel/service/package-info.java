/**
 * Standalone service hosting the telemetry engine.
 *
 * <p>
 * Consumes telemetry records from Kafka, stores events and metric series in
 * Redis, publishes signals and exported faults back to Kafka and serves
 * health checks and queries over HTTP.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.telemetrysentinel.service.TelemetrySentinelService}: main
 * entry point</li>
 * <li>{@link com.telemetrysentinel.service.IngestConsumer}: Kafka poll
 * loop</li>
 * <li>{@link com.telemetrysentinel.service.ServiceConfig}: environment-driven
 * configuration</li>
 * <li>{@link com.telemetrysentinel.service.HealthServer}: HTTP health checks and
 * queries</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.telemetrysentinel.service;
