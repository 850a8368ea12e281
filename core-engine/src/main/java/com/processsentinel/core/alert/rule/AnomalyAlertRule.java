package com.processsentinel.core.alert.rule;

import com.processsentinel.core.alert.AlertRequest;
import com.processsentinel.core.model.AlertSource;
import com.processsentinel.core.model.AlertType;
import com.processsentinel.core.model.AnalysisResult;
import com.processsentinel.core.model.AnomalyAssessment;
import com.processsentinel.core.model.AnomalySeverity;
import com.processsentinel.core.model.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;

/**
 * Raises an ML alert when the anomaly detector flags a sample. Escalates to
 * critical when the anomaly score crosses the critical cutoff.
 */
public class AnomalyAlertRule implements ProcessAlertRule {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyAlertRule.class);

    static final String ALGORITHM = "Isolation Forest";
    static final String KIND = "anomaly";

    private final double warningThreshold;

    /**
     * @param warningThreshold anomaly-score cutoff reported in the alert details
     */
    public AnomalyAlertRule(double warningThreshold) {
        this.warningThreshold = warningThreshold;
    }

    @Override
    public Optional<AlertRequest> evaluate(Sample sample, AnalysisResult analysis) {
        if (analysis == null || analysis.getAnomaly() == null || !analysis.getAnomaly().isAnomaly()) {
            return Optional.empty();
        }
        AnomalyAssessment anomaly = analysis.getAnomaly();
        AlertType type = anomaly.getSeverity() == AnomalySeverity.CRITICAL ? AlertType.CRITICAL : AlertType.WARNING;
        LOG.debug("Rule [{}] fired: process {} score={} ({})", getName(), sample.getProcessId(),
                anomaly.getScore(), anomaly.getSeverity().label());

        return Optional.of(AlertRequest.builder(type, AlertSource.ANOMALY)
                .processId(sample.getProcessId())
                .processName(sample.getDisplayName())
                .metric(KIND)
                .message(String.format(Locale.ROOT, "Anomaly detected in %s (score: %.2f)",
                        sample.getDisplayName(), anomaly.getScore()))
                .detail("anomalyScore", anomaly.getScore())
                .detail("threshold", warningThreshold)
                .mlDetected(true)
                .algorithm(ALGORITHM)
                .cooldownKey(ProcessAlertRule.cooldownKey(sample.getProcessId(), KIND))
                .build());
    }

    @Override
    public String getName() {
        return "process-anomaly";
    }
}
