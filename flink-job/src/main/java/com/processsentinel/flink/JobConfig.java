package com.processsentinel.flink;

import java.io.Serializable;
import java.util.Objects;
import java.util.Properties;

/**
 * Typed, immutable configuration of the Process Sentinel Flink job.
 *
 * <p>
 * Values are resolved from environment variables, falling back to defaults
 * suitable for a single local broker. Detection behaviour itself (thresholds,
 * model sizes, cooldowns) lives in the monitor YAML referenced by
 * {@link #getMonitorConfigPath()}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} when deployed, or the {@link Builder} in
 * tests. The builder validates every value at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    // ---------------------------------------------------------------
    // Kafka
    // ---------------------------------------------------------------
    private final String kafkaBootstrapServers;
    private final String kafkaSamplesTopic;
    private final String kafkaAlertTopic;
    private final String kafkaMetricsTopic;
    private final String kafkaGroupId;

    // ---------------------------------------------------------------
    // Flink
    // ---------------------------------------------------------------
    private final int parallelism;
    private final long checkpointIntervalMs;
    private final long processIdleTimeoutMs;

    // ---------------------------------------------------------------
    // Monitor
    // ---------------------------------------------------------------
    private final String monitorConfigPath;
    private final int healthPort;

    private JobConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaSamplesTopic = b.kafkaSamplesTopic;
        this.kafkaAlertTopic = b.kafkaAlertTopic;
        this.kafkaMetricsTopic = b.kafkaMetricsTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.parallelism = b.parallelism;
        this.checkpointIntervalMs = b.checkpointIntervalMs;
        this.processIdleTimeoutMs = b.processIdleTimeoutMs;
        this.monitorConfigPath = b.monitorConfigPath;
        this.healthPort = b.healthPort;
    }

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if a numeric variable cannot be parsed
     * @throws IllegalArgumentException if a value is out of range
     */
    public static JobConfig fromEnvironment() {
        try {
            return new Builder()
                    .kafkaBootstrapServers(env("KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .kafkaSamplesTopic(env("KAFKA_SAMPLES_TOPIC", "process-samples"))
                    .kafkaAlertTopic(env("KAFKA_ALERT_TOPIC", "alerts"))
                    .kafkaMetricsTopic(env("KAFKA_METRICS_TOPIC", "process-metrics"))
                    .kafkaGroupId(env("KAFKA_GROUP_ID", "process-sentinel"))
                    .parallelism(parseIntEnv("FLINK_PARALLELISM", "1"))
                    .checkpointIntervalMs(parseLongEnv("FLINK_CHECKPOINT_INTERVAL_MS", "60000"))
                    .processIdleTimeoutMs(parseLongEnv("PROCESS_IDLE_TIMEOUT_MS", "600000"))
                    .monitorConfigPath(env("MONITOR_CONFIG_PATH", ""))
                    .healthPort(parseIntEnv("HEALTH_PORT", "8080"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    /**
     * Kafka producer properties shared by the alert and metric sinks.
     */
    public Properties kafkaProducerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("transaction.timeout.ms", "900000");
        return props;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaSamplesTopic() {
        return kafkaSamplesTopic;
    }

    public String getKafkaAlertTopic() {
        return kafkaAlertTopic;
    }

    public String getKafkaMetricsTopic() {
        return kafkaMetricsTopic;
    }

    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    public int getParallelism() {
        return parallelism;
    }

    public long getCheckpointIntervalMs() {
        return checkpointIntervalMs;
    }

    /** Processing-time delay after which an idle process's history is dropped. */
    public long getProcessIdleTimeoutMs() {
        return processIdleTimeoutMs;
    }

    /** Path of the monitor YAML; blank means the classpath default. */
    public String getMonitorConfigPath() {
        return monitorConfigPath;
    }

    public int getHealthPort() {
        return healthPort;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * {@link #build()} rejects blank topic names, a parallelism below 1,
     * non-positive intervals and ports outside [1, 65535].
     * </p>
     */
    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaSamplesTopic = "process-samples";
        private String kafkaAlertTopic = "alerts";
        private String kafkaMetricsTopic = "process-metrics";
        private String kafkaGroupId = "process-sentinel";
        private int parallelism = 1;
        private long checkpointIntervalMs = 60_000;
        private long processIdleTimeoutMs = 600_000;
        private String monitorConfigPath = "";
        private int healthPort = 8080;

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaSamplesTopic(String v) {
            this.kafkaSamplesTopic = v;
            return this;
        }

        public Builder kafkaAlertTopic(String v) {
            this.kafkaAlertTopic = v;
            return this;
        }

        public Builder kafkaMetricsTopic(String v) {
            this.kafkaMetricsTopic = v;
            return this;
        }

        public Builder kafkaGroupId(String v) {
            this.kafkaGroupId = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder checkpointIntervalMs(long v) {
            this.checkpointIntervalMs = v;
            return this;
        }

        public Builder processIdleTimeoutMs(long v) {
            this.processIdleTimeoutMs = v;
            return this;
        }

        public Builder monitorConfigPath(String v) {
            this.monitorConfigPath = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        /**
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            Objects.requireNonNull(kafkaBootstrapServers, "kafkaBootstrapServers required");
            requireNonBlank(kafkaSamplesTopic, "kafkaSamplesTopic");
            requireNonBlank(kafkaAlertTopic, "kafkaAlertTopic");
            requireNonBlank(kafkaMetricsTopic, "kafkaMetricsTopic");
            requireNonBlank(kafkaGroupId, "kafkaGroupId");

            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (checkpointIntervalMs < 1) {
                throw new IllegalArgumentException(
                        "checkpointIntervalMs must be >= 1, got: " + checkpointIntervalMs);
            }
            if (processIdleTimeoutMs < 1) {
                throw new IllegalArgumentException(
                        "processIdleTimeoutMs must be >= 1, got: " + processIdleTimeoutMs);
            }
            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }
            if (monitorConfigPath == null) {
                monitorConfigPath = "";
            }
            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
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
        return "JobConfig{" +
                "kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", kafkaSamplesTopic='" + kafkaSamplesTopic + '\'' +
                ", kafkaAlertTopic='" + kafkaAlertTopic + '\'' +
                ", kafkaMetricsTopic='" + kafkaMetricsTopic + '\'' +
                ", kafkaGroupId='" + kafkaGroupId + '\'' +
                ", parallelism=" + parallelism +
                ", checkpointIntervalMs=" + checkpointIntervalMs +
                ", processIdleTimeoutMs=" + processIdleTimeoutMs +
                ", monitorConfigPath='" + monitorConfigPath + '\'' +
                ", healthPort=" + healthPort +
                '}';
    }
}
