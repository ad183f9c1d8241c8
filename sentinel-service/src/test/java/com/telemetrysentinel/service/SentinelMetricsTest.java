package com.telemetrysentinel.service;

import com.telemetrysentinel.core.config.EngineConfig;
import com.telemetrysentinel.core.engine.TelemetryEngine;
import com.telemetrysentinel.core.model.ErrorContext;
import com.telemetrysentinel.core.signal.SignalType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SentinelMetrics}.
 */
class SentinelMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final SentinelMetrics metrics = new SentinelMetrics(registry);

    @Test
    @DisplayName("Engine signals are counted per signal type")
    void shouldCountSignalsByType() {
        try (TelemetryEngine engine = TelemetryEngine.builder()
                .config(EngineConfig.defaults())
                .dispatchExecutor(Runnable::run)
                .build()) {
            engine.getSignalBus().subscribe(metrics);
            metrics.bindPatternGauge(engine);

            engine.recordError(new OutOfMemoryError("Java heap space"), ErrorContext.unknown());
            engine.recordError("Deadlock detected", ErrorContext.unknown());

            assertThat(signalCount(SignalType.ERROR_RECORDED)).isEqualTo(2.0);
            assertThat(signalCount(SignalType.CRITICAL_ERROR)).isEqualTo(1.0);
            assertThat(signalCount(SignalType.PATTERN_ALERT)).isZero();
            assertThat(registry.get("telemetry.patterns.live").gauge().value()).isEqualTo(2.0);
        }
    }

    @Test
    @DisplayName("Ingest counters and latency timer accumulate")
    void shouldRecordIngest() {
        metrics.incrementIngested();
        metrics.incrementIngested();
        metrics.incrementRejected();
        metrics.recordLatency(Duration.ofMillis(40));

        assertThat(registry.get("telemetry.records.ingested").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("telemetry.records.rejected").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("telemetry.ingest.latency").timer().totalTime(TimeUnit.MILLISECONDS))
                .isEqualTo(40.0);
    }

    private double signalCount(SignalType type) {
        return registry.get("telemetry.signals").tag("type", type.wireName()).counter().count();
    }
}
