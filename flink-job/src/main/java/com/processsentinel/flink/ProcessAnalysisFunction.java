package com.processsentinel.flink;

import com.processsentinel.core.alert.InMemoryAlertStore;
import com.processsentinel.core.config.MonitorConfig;
import com.processsentinel.core.engine.MonitoringEngine;
import com.processsentinel.core.model.Alert;
import com.processsentinel.core.model.AnalysisResult;
import com.processsentinel.core.model.MetricSnapshot;
import com.processsentinel.core.model.Sample;
import com.processsentinel.core.model.SystemStats;
import org.apache.flink.api.common.state.ValueState;
import org.apache.flink.api.common.state.ValueStateDescriptor;
import org.apache.flink.api.common.typeinfo.Types;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.apache.flink.util.OutputTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Flink {@link KeyedProcessFunction} that runs every sample of a process
 * through the {@link MonitoringEngine}.
 *
 * <p>
 * The stream is keyed by {@code processId}. One engine is built per subtask
 * in {@link #open(Configuration)}; its models are shared by every key the
 * subtask owns, while its history store keeps one window per process.
 * </p>
 *
 * <h3>Outputs</h3>
 * <ul>
 * <li>Main output: alerts raised by the alert engine.</li>
 * <li>{@link #METRIC_SNAPSHOTS}: one {@link MetricSnapshot} per analyzed
 * process sample.</li>
 * </ul>
 *
 * <h3>Idle eviction</h3>
 * <p>
 * Each key stores the deadline of its idle timer in {@code ValueState}. Every
 * sample pushes the deadline forward; when a timer fires at the current
 * deadline the engine forgets the process: its history and cooldowns are
 * dropped and its open alerts resolved. Alert maintenance runs after samples
 * at the configured interval so expired cooldowns and alerts do not
 * accumulate.
 * </p>
 *
 * @since 1.0.0
 */
public class ProcessAnalysisFunction extends KeyedProcessFunction<String, Sample, Alert> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(ProcessAnalysisFunction.class);

    /** Side output carrying metric snapshots for persistence. */
    public static final OutputTag<MetricSnapshot> METRIC_SNAPSHOTS =
            new OutputTag<MetricSnapshot>("metric-snapshots") {
                private static final long serialVersionUID = 1L;
            };

    private final MonitorConfig monitorConfig;
    private final long idleTimeoutMs;

    private transient MonitoringEngine engine;
    private transient ExecutorService trainingExecutor;
    private transient ValueState<Long> idleDeadline;
    private transient MonitorMetrics metrics;

    /**
     * @param monitorConfig validated monitor configuration
     * @param idleTimeoutMs processing-time delay before an idle process's
     *                      history is evicted; must be positive
     */
    public ProcessAnalysisFunction(MonitorConfig monitorConfig, long idleTimeoutMs) {
        this.monitorConfig = Objects.requireNonNull(monitorConfig, "monitorConfig must not be null");
        if (idleTimeoutMs < 1) {
            throw new IllegalArgumentException("idleTimeoutMs must be >= 1, got: " + idleTimeoutMs);
        }
        this.idleTimeoutMs = idleTimeoutMs;
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void open(Configuration parameters) {
        idleDeadline = getRuntimeContext().getState(
                new ValueStateDescriptor<>("idle-deadline", Types.LONG));
        metrics = new MonitorMetrics(getRuntimeContext().getMetricGroup());

        trainingExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "model-trainer");
            t.setDaemon(true);
            return t;
        });
        InMemoryAlertStore store = new InMemoryAlertStore(
                Duration.ofDays(monitorConfig.getAlertRetentionDays()));
        engine = new MonitoringEngine(monitorConfig, store, Clock.systemUTC(), trainingExecutor);
        engine.getTrainer().bootstrapClassifier();

        LOG.info("ProcessAnalysisFunction opened (subtask {})",
                getRuntimeContext().getIndexOfThisSubtask());
    }

    @Override
    public void close() throws Exception {
        LOG.info("ProcessAnalysisFunction closing");
        if (trainingExecutor != null) {
            trainingExecutor.shutdownNow();
            if (!trainingExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("Model training did not stop within 5s");
            }
        }
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    @Override
    public void processElement(Sample sample,
            KeyedProcessFunction<String, Sample, Alert>.Context ctx,
            Collector<Alert> out) throws Exception {
        long startNanos = System.nanoTime();
        rescheduleIdleTimer(ctx);

        List<Alert> alerts;
        try {
            alerts = sample.isSystem() ? analyzeSystem(sample) : analyzeProcess(sample, ctx);
        } catch (RuntimeException e) {
            LOG.error("Analysis of sample for process [{}] failed – skipping",
                    sample.getProcessId(), e);
            return;
        }

        for (Alert alert : alerts) {
            out.collect(alert);
            LOG.info("Alert emitted: type={} process={} metric={}",
                    alert.getType(), alert.getProcessId(), alert.getMetric());
        }
        metrics.incrementAlertsEmitted(alerts.size());
        metrics.incrementSamplesAnalyzed();
        metrics.recordLatency((System.nanoTime() - startNanos) / 1_000_000);

        engine.getTrainer().maybeRetrain();
        engine.maybeRunMaintenance();
    }

    @Override
    public void onTimer(long timestamp,
            KeyedProcessFunction<String, Sample, Alert>.OnTimerContext ctx,
            Collector<Alert> out) throws Exception {
        Long deadline = idleDeadline.value();
        if (deadline == null || deadline != timestamp) {
            return;
        }
        String processId = ctx.getCurrentKey();
        if (engine.forgetProcess(processId)) {
            LOG.debug("Evicted idle process {}", processId);
        }
        idleDeadline.clear();
    }

    MonitoringEngine getEngine() {
        return engine;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private List<Alert> analyzeSystem(Sample sample) {
        return engine.checkThresholds(SystemStats.fromSample(sample));
    }

    private List<Alert> analyzeProcess(Sample sample,
            KeyedProcessFunction<String, Sample, Alert>.Context ctx) {
        AnalysisResult analysis = engine.analyze(sample);
        if (analysis.getAnomaly().isAnomaly()) {
            metrics.incrementAnomaliesDetected();
        }
        ctx.output(METRIC_SNAPSHOTS, MetricSnapshot.of(sample, analysis));
        return engine.checkProcessThresholds(sample, analysis);
    }

    private void rescheduleIdleTimer(KeyedProcessFunction<String, Sample, Alert>.Context ctx)
            throws Exception {
        Long previous = idleDeadline.value();
        if (previous != null) {
            ctx.timerService().deleteProcessingTimeTimer(previous);
        }
        long deadline = ctx.timerService().currentProcessingTime() + idleTimeoutMs;
        ctx.timerService().registerProcessingTimeTimer(deadline);
        idleDeadline.update(deadline);
    }
}
