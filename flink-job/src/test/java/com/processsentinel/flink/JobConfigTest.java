package com.processsentinel.flink;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig}.
 */
class JobConfigTest {

    @Test
    @DisplayName("Builder defaults should target a local broker")
    void shouldUseDefaults() {
        JobConfig config = new JobConfig.Builder().build();

        assertThat(config.getKafkaBootstrapServers()).isEqualTo("localhost:9092");
        assertThat(config.getKafkaSamplesTopic()).isEqualTo("process-samples");
        assertThat(config.getKafkaAlertTopic()).isEqualTo("alerts");
        assertThat(config.getKafkaMetricsTopic()).isEqualTo("process-metrics");
        assertThat(config.getKafkaGroupId()).isEqualTo("process-sentinel");
        assertThat(config.getParallelism()).isEqualTo(1);
        assertThat(config.getProcessIdleTimeoutMs()).isEqualTo(600_000L);
        assertThat(config.getMonitorConfigPath()).isEmpty();
        assertThat(config.getHealthPort()).isEqualTo(8080);
    }

    @Test
    @DisplayName("Should reject blank topic names")
    void shouldRejectBlankTopic() {
        assertThatThrownBy(() -> new JobConfig.Builder().kafkaMetricsTopic(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("kafkaMetricsTopic");
    }

    @Test
    @DisplayName("Should reject out-of-range numeric values")
    void shouldRejectInvalidNumbers() {
        assertThatThrownBy(() -> new JobConfig.Builder().parallelism(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parallelism");
        assertThatThrownBy(() -> new JobConfig.Builder().processIdleTimeoutMs(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("processIdleTimeoutMs");
        assertThatThrownBy(() -> new JobConfig.Builder().healthPort(70_000).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("healthPort");
    }

    @Test
    @DisplayName("Producer properties should carry the bootstrap servers")
    void shouldBuildProducerProperties() {
        JobConfig config = new JobConfig.Builder().kafkaBootstrapServers("kafka:29092").build();

        Properties props = config.kafkaProducerProperties();

        assertThat(props.getProperty("bootstrap.servers")).isEqualTo("kafka:29092");
        assertThat(props.getProperty("transaction.timeout.ms")).isEqualTo("900000");
    }

    @Test
    @DisplayName("toString should not leak the builder")
    void shouldDescribeConfig() {
        JobConfig config = new JobConfig.Builder().kafkaSamplesTopic("samples").build();

        assertThat(config.toString())
                .startsWith("JobConfig{")
                .contains("kafkaSamplesTopic='samples'");
    }
}
