package com.processsentinel.flink;

import com.processsentinel.core.config.MonitorConfig;
import com.processsentinel.core.config.MonitorConfigLoader;
import com.processsentinel.core.model.Alert;
import com.processsentinel.core.model.MetricSnapshot;
import com.processsentinel.core.model.Sample;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.connector.base.DeliveryGuarantee;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.datastream.SingleOutputStreamOperator;
import org.apache.flink.streaming.api.environment.CheckpointConfig;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Main entry point of the Process Sentinel Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (process-samples topic)
 *     → Deserialize JSON → Sample
 *     → Key by processId
 *     → ProcessAnalysisFunction (anomaly, classification, forecast, alerts)
 *         ├─ Alert          → JSON → Kafka (alerts topic)
 *         └─ MetricSnapshot → JSON → Kafka (process-metrics topic)
 * </pre>
 *
 * <p>
 * Job settings come from the environment via {@link JobConfig}; detection
 * settings from the monitor YAML via {@link MonitorConfigLoader}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ProcessMonitorJob {

        private static final Logger LOG = LoggerFactory.getLogger(ProcessMonitorJob.class);

        private ProcessMonitorJob() {
                // entry-point class - not instantiable
        }

        public static void main(String[] args) throws Exception {
                JobConfig config = JobConfig.fromEnvironment();
                LOG.info("Starting Process Sentinel with config: {}", config);

                MonitorConfig monitorConfig = loadMonitorConfig(config);

                HealthServer healthServer = new HealthServer(() -> healthDetails(config));
                healthServer.start(config.getHealthPort());
                Runtime.getRuntime().addShutdownHook(new Thread(healthServer::stop, "health-shutdown"));

                StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
                env.setParallelism(config.getParallelism());
                configureCheckpointing(env, config);

                buildPipeline(env, config, monitorConfig);

                env.execute("Process Sentinel – Process Monitoring");
        }

        // ---------------------------------------------------------------
        // Pipeline assembly
        // ---------------------------------------------------------------

        /**
         * Build the Kafka → Flink → Kafka pipeline.
         */
        static void buildPipeline(StreamExecutionEnvironment env,
                        JobConfig config,
                        MonitorConfig monitorConfig) {
                KafkaSource<Sample> kafkaSource = KafkaSource.<Sample>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setTopics(config.getKafkaSamplesTopic())
                                .setGroupId(config.getKafkaGroupId())
                                .setStartingOffsets(OffsetsInitializer.earliest())
                                .setValueOnlyDeserializer(new SampleDeserializationSchema())
                                .build();

                DataStream<Sample> samples = env.fromSource(
                                kafkaSource,
                                WatermarkStrategy.<Sample>forBoundedOutOfOrderness(Duration.ofSeconds(5))
                                                .withIdleness(Duration.ofMinutes(1)),
                                "kafka-samples-source");

                SingleOutputStreamOperator<Alert> alerts = samples
                                .filter(Objects::nonNull) // drop deserialization failures
                                .keyBy(Sample::getProcessId)
                                .process(new ProcessAnalysisFunction(monitorConfig,
                                                config.getProcessIdleTimeoutMs()))
                                .name("process-analysis");

                alerts.sinkTo(kafkaSink(config, config.getKafkaAlertTopic(),
                                new JacksonSerializationSchema<Alert>()))
                                .name("kafka-alerts-sink");

                DataStream<MetricSnapshot> snapshots =
                                alerts.getSideOutput(ProcessAnalysisFunction.METRIC_SNAPSHOTS);
                snapshots.sinkTo(kafkaSink(config, config.getKafkaMetricsTopic(),
                                new JacksonSerializationSchema<MetricSnapshot>()))
                                .name("kafka-metrics-sink");
        }

        // ---------------------------------------------------------------
        // Helpers
        // ---------------------------------------------------------------

        private static <T> KafkaSink<T> kafkaSink(JobConfig config, String topic,
                        JacksonSerializationSchema<T> schema) {
                return KafkaSink.<T>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setKafkaProducerConfig(config.kafkaProducerProperties())
                                .setDeliveryGuarantee(DeliveryGuarantee.AT_LEAST_ONCE)
                                .setRecordSerializer(
                                                KafkaRecordSerializationSchema.<T>builder()
                                                                .setTopic(topic)
                                                                .setValueSerializationSchema(schema)
                                                                .build())
                                .build();
        }

        static MonitorConfig loadMonitorConfig(JobConfig config) {
                String path = config.getMonitorConfigPath();
                if (path != null && !path.isBlank()) {
                        return MonitorConfigLoader.fromFile(path);
                }
                return MonitorConfigLoader.load();
        }

        private static Map<String, Object> healthDetails(JobConfig config) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("job", "process-sentinel");
                details.put("samplesTopic", config.getKafkaSamplesTopic());
                details.put("alertTopic", config.getKafkaAlertTopic());
                details.put("metricsTopic", config.getKafkaMetricsTopic());
                return details;
        }

        private static void configureCheckpointing(StreamExecutionEnvironment env, JobConfig config) {
                long interval = config.getCheckpointIntervalMs();
                env.enableCheckpointing(interval, CheckpointingMode.EXACTLY_ONCE);

                CheckpointConfig cpConfig = env.getCheckpointConfig();
                cpConfig.setMinPauseBetweenCheckpoints(interval / 2);
                cpConfig.setCheckpointTimeout(interval * 2);
                cpConfig.setMaxConcurrentCheckpoints(1);
                cpConfig.setExternalizedCheckpointCleanup(
                                CheckpointConfig.ExternalizedCheckpointCleanup.RETAIN_ON_CANCELLATION);
        }
}
