package com.processsentinel.flink;

import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Histogram;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.runtime.metrics.DescriptiveStatisticsHistogram;

/**
 * Flink metrics published by {@link ProcessAnalysisFunction}.
 *
 * <ul>
 *   <li>{@code samples_analyzed_total}: samples run through the engine</li>
 *   <li>{@code anomalies_detected_total}: samples judged anomalous</li>
 *   <li>{@code alerts_emitted_total}: alerts sent downstream</li>
 *   <li>{@code analysis_latency_ms}: per-sample analysis latency</li>
 * </ul>
 */
public class MonitorMetrics {

    private final Counter samplesAnalyzed;
    private final Counter anomaliesDetected;
    private final Counter alertsEmitted;
    private final Histogram analysisLatency;

    public MonitorMetrics(MetricGroup metricGroup) {
        MetricGroup group = metricGroup.addGroup("process_sentinel");

        this.samplesAnalyzed = group.counter("samples_analyzed_total");
        this.anomaliesDetected = group.counter("anomalies_detected_total");
        this.alertsEmitted = group.counter("alerts_emitted_total");
        this.analysisLatency = group
                .histogram("analysis_latency_ms", new DescriptiveStatisticsHistogram(350));
    }

    public void incrementSamplesAnalyzed() {
        samplesAnalyzed.inc();
    }

    public void incrementAnomaliesDetected() {
        anomaliesDetected.inc();
    }

    public void incrementAlertsEmitted(int count) {
        alertsEmitted.inc(count);
    }

    public void recordLatency(long milliseconds) {
        analysisLatency.update(milliseconds);
    }
}
