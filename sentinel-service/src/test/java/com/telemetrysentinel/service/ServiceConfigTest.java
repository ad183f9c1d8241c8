package com.telemetrysentinel.service;

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ServiceConfig}.
 */
class ServiceConfigTest {

    @Test
    @DisplayName("Builder defaults point at local Kafka and Redis")
    void shouldApplyDefaults() {
        ServiceConfig config = ServiceConfig.builder().build();

        assertThat(config.getKafkaBootstrapServers()).isEqualTo("localhost:9092");
        assertThat(config.getIngestTopic()).isEqualTo("telemetry-events");
        assertThat(config.getSignalTopic()).isEqualTo("telemetry-signals");
        assertThat(config.getExportTopic()).isEqualTo("telemetry-faults");
        assertThat(config.getKafkaGroupId()).isEqualTo("telemetry-sentinel");
        assertThat(config.getPollTimeout()).isEqualTo(Duration.ofMillis(500));
        assertThat(config.getRedisHost()).isEqualTo("localhost");
        assertThat(config.getRedisPort()).isEqualTo(6379);
        assertThat(config.getHealthPort()).isEqualTo(8080);
    }

    @Test
    @DisplayName("Consumer properties carry bootstrap servers, group id and earliest reset")
    void shouldBuildConsumerProperties() {
        Properties props = ServiceConfig.builder()
                .kafkaBootstrapServers("broker:29092")
                .kafkaGroupId("sentinel-test")
                .build()
                .kafkaConsumerProperties();

        assertThat(props.getProperty(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG)).isEqualTo("broker:29092");
        assertThat(props.getProperty(ConsumerConfig.GROUP_ID_CONFIG)).isEqualTo("sentinel-test");
        assertThat(props.getProperty(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG)).isEqualTo("earliest");
    }

    @Test
    @DisplayName("Producer properties wait for all in-sync replicas")
    void shouldBuildProducerProperties() {
        Properties props = ServiceConfig.builder().build().kafkaProducerProperties();

        assertThat(props.getProperty(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG)).isEqualTo("localhost:9092");
        assertThat(props.getProperty(ProducerConfig.ACKS_CONFIG)).isEqualTo("all");
    }

    @Test
    @DisplayName("Blank topics are rejected")
    void shouldRejectBlankTopic() {
        assertThatThrownBy(() -> ServiceConfig.builder().signalTopic(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("signalTopic");
    }

    @Test
    @DisplayName("Ports out of range are rejected; health port 0 is allowed")
    void shouldValidatePorts() {
        assertThatThrownBy(() -> ServiceConfig.builder().redisPort(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("redisPort");
        assertThatThrownBy(() -> ServiceConfig.builder().healthPort(70_000).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("healthPort");
        assertThat(ServiceConfig.builder().healthPort(0).build().getHealthPort()).isZero();
    }

    @Test
    @DisplayName("Non-positive timeouts are rejected")
    void shouldRejectZeroTimeout() {
        assertThatThrownBy(() -> ServiceConfig.builder().pollTimeout(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("pollTimeout");
    }
}
