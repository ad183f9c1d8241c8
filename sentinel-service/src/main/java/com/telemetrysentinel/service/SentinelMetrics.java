package com.telemetrysentinel.service;

import com.telemetrysentinel.core.engine.TelemetryEngine;
import com.telemetrysentinel.core.signal.Signal;
import com.telemetrysentinel.core.signal.SignalListener;
import com.telemetrysentinel.core.signal.SignalType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Micrometer metric definitions for the service.
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code telemetry.records.ingested} - records handed to the engine</li>
 *   <li>{@code telemetry.records.rejected} - malformed or unacceptable records</li>
 *   <li>{@code telemetry.signals} - signals emitted, tagged by {@code type}</li>
 *   <li>{@code telemetry.ingest.latency} - time from deserialization to the
 *       engine returning an id</li>
 *   <li>{@code telemetry.patterns.live} - live error patterns (gauge)</li>
 * </ul>
 *
 * <p>
 * The registry decides where these go; the service only defines them.
 * </p>
 */
public class SentinelMetrics implements SignalListener {

    private final MeterRegistry registry;
    private final Counter recordsIngested;
    private final Counter recordsRejected;
    private final Timer ingestLatency;
    private final Map<SignalType, Counter> signals = new EnumMap<>(SignalType.class);

    public SentinelMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.recordsIngested = Counter.builder("telemetry.records.ingested")
                .description("Records handed to the engine")
                .register(registry);
        this.recordsRejected = Counter.builder("telemetry.records.rejected")
                .description("Malformed or unacceptable records")
                .register(registry);
        this.ingestLatency = Timer.builder("telemetry.ingest.latency")
                .description("Time from deserialization to the engine returning an id")
                .register(registry);
        for (SignalType type : SignalType.values()) {
            signals.put(type, Counter.builder("telemetry.signals")
                    .description("Signals emitted by the engine")
                    .tag("type", type.wireName())
                    .register(registry));
        }
    }

    /**
     * Expose the engine's live pattern count as a gauge.
     */
    public void bindPatternGauge(TelemetryEngine engine) {
        Gauge.builder("telemetry.patterns.live", engine, TelemetryEngine::patternCount)
                .description("Live error patterns")
                .register(registry);
    }

    public void incrementIngested() {
        recordsIngested.increment();
    }

    public void incrementRejected() {
        recordsRejected.increment();
    }

    public void recordLatency(Duration latency) {
        ingestLatency.record(latency);
    }

    @Override
    public void onSignal(Signal signal) {
        signals.get(signal.getType()).increment();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
