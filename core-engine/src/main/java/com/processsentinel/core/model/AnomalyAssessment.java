package com.processsentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Anomaly score of one sample together with its derived flag and tier.
 *
 * <p>
 * {@link #isAnomaly()} is {@code true} exactly when the score exceeds the
 * warning threshold it was assessed against.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyAssessment implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double score;
    private final boolean anomaly;
    private final AnomalySeverity severity;

    private AnomalyAssessment(double score, boolean anomaly, AnomalySeverity severity) {
        this.score = score;
        this.anomaly = anomaly;
        this.severity = severity;
    }

    /**
     * Grade a score against warning and critical cutoffs.
     *
     * @param score    anomaly score in [0, 1]
     * @param warning  warning cutoff (exclusive)
     * @param critical critical cutoff (exclusive)
     * @return the assessment
     */
    public static AnomalyAssessment of(double score, double warning, double critical) {
        AnomalySeverity severity;
        if (score > critical) {
            severity = AnomalySeverity.CRITICAL;
        } else if (score > warning) {
            severity = AnomalySeverity.WARNING;
        } else {
            severity = AnomalySeverity.NORMAL;
        }
        return new AnomalyAssessment(score, score > warning, severity);
    }

    public static AnomalyAssessment normal() {
        return new AnomalyAssessment(0.0, false, AnomalySeverity.NORMAL);
    }

    public double getScore() {
        return score;
    }

    public boolean isAnomaly() {
        return anomaly;
    }

    public AnomalySeverity getSeverity() {
        return severity;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyAssessment that))
            return false;
        return Double.compare(score, that.score) == 0 && anomaly == that.anomaly
                && severity == that.severity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(score, anomaly, severity);
    }

    @Override
    public String toString() {
        return "AnomalyAssessment{score=" + score + ", anomaly=" + anomaly + ", severity=" + severity + '}';
    }
}
