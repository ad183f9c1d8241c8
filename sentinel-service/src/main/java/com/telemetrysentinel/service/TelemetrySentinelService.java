package com.telemetrysentinel.service;

import com.telemetrysentinel.core.classification.ErrorClassifier;
import com.telemetrysentinel.core.config.ClassificationRulesLoader;
import com.telemetrysentinel.core.config.EngineConfig;
import com.telemetrysentinel.core.engine.TelemetryEngine;
import com.telemetrysentinel.core.export.ExportedFault;
import com.telemetrysentinel.core.signal.Signal;
import com.telemetrysentinel.core.signal.SignalBus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Main entry point for the Telemetry Sentinel service.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (telemetry-events)
 *     → Deserialize JSON → TelemetryRecord
 *     → RecordHandler → TelemetryEngine (classify, fingerprint, detect)
 *         → Redis (events, patterns, metric series)
 *         → Kafka (telemetry-faults) via the export sink
 *     → Signals → Kafka (telemetry-signals) + Micrometer counters
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Host settings come from {@link ServiceConfig#fromEnvironment()}, engine
 * tuning from {@link EngineConfig#fromEnvironment()} and classification rules
 * from {@link ClassificationRulesLoader#load()}.
 * </p>
 *
 * @since 1.0.0
 */
public final class TelemetrySentinelService {

    private static final Logger LOG = LoggerFactory.getLogger(TelemetrySentinelService.class);

    private TelemetrySentinelService() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) throws InterruptedException {
        // 1. Load configuration
        ServiceConfig config = ServiceConfig.fromEnvironment();
        EngineConfig engineConfig = EngineConfig.fromEnvironment();
        LOG.info("Starting Telemetry Sentinel with {} and {}", config, engineConfig);

        // 2. Outbound: Redis store, signal and export producers
        RedisKeyValueStore store = new RedisKeyValueStore(
                config.getRedisHost(), config.getRedisPort(), config.getRedisTimeout());
        KafkaSignalPublisher signalPublisher = new KafkaSignalPublisher(
                new KafkaProducer<String, Signal>(config.kafkaProducerProperties(),
                        new StringSerializer(), new JsonSerializer<>()),
                config.getSignalTopic());
        KafkaExportSink exportSink = new KafkaExportSink(
                new KafkaProducer<String, ExportedFault>(config.kafkaProducerProperties(),
                        new StringSerializer(), new JsonSerializer<>()),
                config.getExportTopic(), config.getSendTimeout());

        // 3. Engine with signal fan-out
        SentinelMetrics metrics = new SentinelMetrics(new SimpleMeterRegistry());
        SignalBus signalBus = new SignalBus();
        signalBus.subscribe(signalPublisher);
        signalBus.subscribe(metrics);

        TelemetryEngine engine = TelemetryEngine.builder()
                .config(engineConfig)
                .store(store)
                .classifier(new ErrorClassifier(ClassificationRulesLoader.load()))
                .exportSink(exportSink)
                .signalBus(signalBus)
                .build();
        metrics.bindPatternGauge(engine);
        engine.start();

        // 4. Ingest loop
        IngestConsumer ingest = new IngestConsumer(
                new KafkaConsumer<>(config.kafkaConsumerProperties(),
                        new StringDeserializer(), new TelemetryRecordDeserializer()),
                config.getIngestTopic(), config.getPollTimeout(),
                new RecordHandler(engine), metrics, Clock.systemUTC());

        // 5. Health checks and queries
        HealthServer healthServer = new HealthServer(engine, ingest::isRunning);
        healthServer.start(config.getHealthPort());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutting down Telemetry Sentinel");
            healthServer.stop();
            ingest.close();
            engine.close();
            signalPublisher.close();
            exportSink.close();
            store.close();
        }, "sentinel-shutdown"));

        Thread ingestThread = new Thread(ingest, "telemetry-ingest");
        ingestThread.start();
        ingestThread.join();
    }
}
