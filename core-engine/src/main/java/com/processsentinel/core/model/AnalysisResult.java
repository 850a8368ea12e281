package com.processsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Everything the engine learned about one sample in one evaluation tick.
 *
 * @since 1.0.0
 */
public final class AnalysisResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final AnomalyAssessment anomaly;
    private final Classification classification;
    private final List<Double> predictions;
    private final Instant timestamp;

    public AnalysisResult(AnomalyAssessment anomaly, Classification classification,
            List<Double> predictions, Instant timestamp) {
        this.anomaly = Objects.requireNonNull(anomaly, "anomaly must not be null");
        this.classification = Objects.requireNonNull(classification, "classification must not be null");
        this.predictions = predictions != null
                ? Collections.unmodifiableList(List.copyOf(predictions))
                : Collections.emptyList();
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public AnomalyAssessment getAnomaly() {
        return anomaly;
    }

    public Classification getClassification() {
        return classification;
    }

    /**
     * @return forecast values in order; empty when no forecast was available
     */
    public List<Double> getPredictions() {
        return predictions;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "AnalysisResult{" +
                "anomaly=" + anomaly +
                ", classification=" + classification +
                ", predictions=" + predictions +
                ", timestamp=" + timestamp +
                '}';
    }
}
