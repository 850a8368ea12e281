package com.processsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-tick record handed to the metrics persistence collaborator: the raw
 * sample metrics plus a summary of the analysis.
 *
 * @since 1.0.0
 */
public class MetricSnapshot implements Serializable {

    private static final long serialVersionUID = 1L;

    private String processId;
    private String processName;
    private Long pid;
    private Instant timestamp;
    private Map<String, Double> metrics = new LinkedHashMap<>();
    private MlAnalysis mlAnalysis;

    /** No-arg constructor required by Jackson. */
    public MetricSnapshot() {
    }

    /**
     * Build a snapshot from a sample and its analysis.
     *
     * @param sample   the analyzed sample
     * @param analysis the analysis of {@code sample}
     * @return a new snapshot
     */
    public static MetricSnapshot of(Sample sample, AnalysisResult analysis) {
        Objects.requireNonNull(sample, "sample must not be null");
        Objects.requireNonNull(analysis, "analysis must not be null");

        MetricSnapshot snapshot = new MetricSnapshot();
        snapshot.processId = sample.getProcessId();
        snapshot.processName = sample.getProcessName();
        snapshot.pid = sample.getPid();
        snapshot.timestamp = sample.getTimestamp();
        snapshot.metrics = new LinkedHashMap<>(sample.getMetrics());

        MlAnalysis ml = new MlAnalysis();
        ml.anomalyScore = analysis.getAnomaly().getScore();
        ml.anomaly = analysis.getAnomaly().isAnomaly();
        ml.classification = analysis.getClassification().getLabel();
        ml.confidence = analysis.getClassification().getConfidence();
        ml.predictions = new ArrayList<>(analysis.getPredictions());
        snapshot.mlAnalysis = ml;
        return snapshot;
    }

    public String getProcessId() {
        return processId;
    }

    public void setProcessId(String processId) {
        this.processId = processId;
    }

    public String getProcessName() {
        return processName;
    }

    public void setProcessName(String processName) {
        this.processName = processName;
    }

    public Long getPid() {
        return pid;
    }

    public void setPid(Long pid) {
        this.pid = pid;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public Map<String, Double> getMetrics() {
        return Collections.unmodifiableMap(metrics);
    }

    public void setMetrics(Map<String, Double> metrics) {
        this.metrics = metrics != null ? new LinkedHashMap<>(metrics) : new LinkedHashMap<>();
    }

    public MlAnalysis getMlAnalysis() {
        return mlAnalysis;
    }

    public void setMlAnalysis(MlAnalysis mlAnalysis) {
        this.mlAnalysis = mlAnalysis;
    }

    /**
     * Analysis summary stored alongside the metrics.
     */
    public static class MlAnalysis implements Serializable {

        private static final long serialVersionUID = 1L;

        private double anomalyScore;
        private boolean anomaly;
        private String classification;
        private double confidence;
        private List<Double> predictions = new ArrayList<>();

        public double getAnomalyScore() {
            return anomalyScore;
        }

        public void setAnomalyScore(double anomalyScore) {
            this.anomalyScore = anomalyScore;
        }

        @JsonProperty("isAnomaly")
        public boolean isAnomaly() {
            return anomaly;
        }

        @JsonProperty("isAnomaly")
        public void setAnomaly(boolean anomaly) {
            this.anomaly = anomaly;
        }

        public String getClassification() {
            return classification;
        }

        public void setClassification(String classification) {
            this.classification = classification;
        }

        public double getConfidence() {
            return confidence;
        }

        public void setConfidence(double confidence) {
            this.confidence = confidence;
        }

        public List<Double> getPredictions() {
            return Collections.unmodifiableList(predictions);
        }

        public void setPredictions(List<Double> predictions) {
            this.predictions = predictions != null ? new ArrayList<>(predictions) : new ArrayList<>();
        }
    }

    @Override
    public String toString() {
        return "MetricSnapshot{processId='" + processId + "', timestamp=" + timestamp + '}';
    }
}
