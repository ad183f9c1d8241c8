package com.telemetrysentinel.service;

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Typed, immutable configuration for the Telemetry Sentinel service host.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the service can be configured entirely from a container definition or a shell.
 * Engine tuning lives separately in
 * {@link com.telemetrysentinel.core.config.EngineConfig}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class ServiceConfig {

    // ---------------------------------------------------------------
    // Kafka
    // ---------------------------------------------------------------
    private final String kafkaBootstrapServers;
    private final String ingestTopic;
    private final String signalTopic;
    private final String exportTopic;
    private final String kafkaGroupId;
    private final Duration pollTimeout;
    private final Duration sendTimeout;

    // ---------------------------------------------------------------
    // Redis
    // ---------------------------------------------------------------
    private final String redisHost;
    private final int redisPort;
    private final Duration redisTimeout;

    // ---------------------------------------------------------------
    // Health / query endpoints
    // ---------------------------------------------------------------
    private final int healthPort;

    private ServiceConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.ingestTopic = b.ingestTopic;
        this.signalTopic = b.signalTopic;
        this.exportTopic = b.exportTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.pollTimeout = b.pollTimeout;
        this.sendTimeout = b.sendTimeout;
        this.redisHost = b.redisHost;
        this.redisPort = b.redisPort;
        this.redisTimeout = b.redisTimeout;
        this.healthPort = b.healthPort;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link ServiceConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static ServiceConfig fromEnvironment() {
        try {
            return new Builder()
                    .kafkaBootstrapServers(env("KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .ingestTopic(env("KAFKA_INGEST_TOPIC", "telemetry-events"))
                    .signalTopic(env("KAFKA_SIGNAL_TOPIC", "telemetry-signals"))
                    .exportTopic(env("KAFKA_EXPORT_TOPIC", "telemetry-faults"))
                    .kafkaGroupId(env("KAFKA_GROUP_ID", "telemetry-sentinel"))
                    .pollTimeout(Duration.ofMillis(parseLongEnv("KAFKA_POLL_TIMEOUT_MS", "500")))
                    .sendTimeout(Duration.ofMillis(parseLongEnv("KAFKA_SEND_TIMEOUT_MS", "5000")))
                    .redisHost(env("REDIS_HOST", "localhost"))
                    .redisPort(parseIntEnv("REDIS_PORT", "6379"))
                    .redisTimeout(Duration.ofMillis(parseLongEnv("REDIS_TIMEOUT_MS", "2000")))
                    .healthPort(parseIntEnv("HEALTH_PORT", "8080"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Kafka properties helpers
    // ---------------------------------------------------------------

    /**
     * Build Kafka consumer {@link Properties} for the ingest topic. Values
     * stay raw bytes; {@link TelemetryRecordDeserializer} is passed to the
     * consumer separately.
     *
     * @return new Properties instance configured for consumption
     */
    public Properties kafkaConsumerProperties() {
        Properties props = new Properties();
        props.setProperty(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafkaBootstrapServers);
        props.setProperty(ConsumerConfig.GROUP_ID_CONFIG, kafkaGroupId);
        props.setProperty(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.setProperty(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "true");
        props.setProperty(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        return props;
    }

    /**
     * Build Kafka producer {@link Properties} shared by the signal and export
     * publishers.
     *
     * @return new Properties instance configured for production
     */
    public Properties kafkaProducerProperties() {
        Properties props = new Properties();
        props.setProperty(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, kafkaBootstrapServers);
        props.setProperty(ProducerConfig.ACKS_CONFIG, "all");
        props.setProperty(ProducerConfig.LINGER_MS_CONFIG, "5");
        props.setProperty(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        return props;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getIngestTopic() {
        return ingestTopic;
    }

    public String getSignalTopic() {
        return signalTopic;
    }

    public String getExportTopic() {
        return exportTopic;
    }

    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    public Duration getPollTimeout() {
        return pollTimeout;
    }

    public Duration getSendTimeout() {
        return sendTimeout;
    }

    public String getRedisHost() {
        return redisHost;
    }

    public int getRedisPort() {
        return redisPort;
    }

    public Duration getRedisTimeout() {
        return redisTimeout;
    }

    public int getHealthPort() {
        return healthPort;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ServiceConfig}.
     *
     * <p>
     * The {@link #build()} method validates that topic names are non-blank,
     * timeouts are positive and ports are in range. A health port of
     * {@code 0} asks the OS for any free port.
     * </p>
     */
    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String ingestTopic = "telemetry-events";
        private String signalTopic = "telemetry-signals";
        private String exportTopic = "telemetry-faults";
        private String kafkaGroupId = "telemetry-sentinel";
        private Duration pollTimeout = Duration.ofMillis(500);
        private Duration sendTimeout = Duration.ofSeconds(5);
        private String redisHost = "localhost";
        private int redisPort = 6379;
        private Duration redisTimeout = Duration.ofSeconds(2);
        private int healthPort = 8080;

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder ingestTopic(String v) {
            this.ingestTopic = v;
            return this;
        }

        public Builder signalTopic(String v) {
            this.signalTopic = v;
            return this;
        }

        public Builder exportTopic(String v) {
            this.exportTopic = v;
            return this;
        }

        public Builder kafkaGroupId(String v) {
            this.kafkaGroupId = v;
            return this;
        }

        public Builder pollTimeout(Duration v) {
            this.pollTimeout = v;
            return this;
        }

        public Builder sendTimeout(Duration v) {
            this.sendTimeout = v;
            return this;
        }

        public Builder redisHost(String v) {
            this.redisHost = v;
            return this;
        }

        public Builder redisPort(int v) {
            this.redisPort = v;
            return this;
        }

        public Builder redisTimeout(Duration v) {
            this.redisTimeout = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link ServiceConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public ServiceConfig build() {
            Objects.requireNonNull(kafkaBootstrapServers, "kafkaBootstrapServers required");
            requireNonBlank(ingestTopic, "ingestTopic");
            requireNonBlank(signalTopic, "signalTopic");
            requireNonBlank(exportTopic, "exportTopic");
            requireNonBlank(kafkaGroupId, "kafkaGroupId");
            requireNonBlank(redisHost, "redisHost");
            requirePositive(pollTimeout, "pollTimeout");
            requirePositive(sendTimeout, "sendTimeout");
            requirePositive(redisTimeout, "redisTimeout");

            if (redisPort < 1 || redisPort > 65_535) {
                throw new IllegalArgumentException(
                        "redisPort must be in [1, 65535], got: " + redisPort);
            }
            if (healthPort < 0 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [0, 65535], got: " + healthPort);
            }

            return new ServiceConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }

        private static void requirePositive(Duration value, String name) {
            if (value == null || value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be positive, got: " + value);
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue));
    }

    private static long parseLongEnv(String name, String defaultValue) {
        return Long.parseLong(env(name, defaultValue));
    }

    @Override
    public String toString() {
        return "ServiceConfig{" +
                "kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", ingestTopic='" + ingestTopic + '\'' +
                ", signalTopic='" + signalTopic + '\'' +
                ", exportTopic='" + exportTopic + '\'' +
                ", kafkaGroupId='" + kafkaGroupId + '\'' +
                ", pollTimeout=" + pollTimeout +
                ", redisHost='" + redisHost + '\'' +
                ", redisPort=" + redisPort +
                ", healthPort=" + healthPort +
                '}';
    }
}
