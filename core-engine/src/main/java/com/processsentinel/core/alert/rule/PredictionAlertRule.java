package com.processsentinel.core.alert.rule;

import com.processsentinel.core.alert.AlertRequest;
import com.processsentinel.core.model.AlertSource;
import com.processsentinel.core.model.AlertType;
import com.processsentinel.core.model.AnalysisResult;
import com.processsentinel.core.model.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Warns ahead of time when the mean forecast CPU usage of a process exceeds
 * {@code limit} percent.
 */
public class PredictionAlertRule implements ProcessAlertRule {

    private static final Logger LOG = LoggerFactory.getLogger(PredictionAlertRule.class);

    static final String ALGORITHM = "Multilayer Perceptron";
    static final String KIND = "prediction";

    private final double limit;

    public PredictionAlertRule(double limit) {
        this.limit = limit;
    }

    @Override
    public Optional<AlertRequest> evaluate(Sample sample, AnalysisResult analysis) {
        if (analysis == null) {
            return Optional.empty();
        }
        List<Double> predictions = analysis.getPredictions();
        if (predictions == null || predictions.isEmpty()) {
            LOG.trace("Rule [{}]: no forecast for process {} – skipping", getName(), sample.getProcessId());
            return Optional.empty();
        }
        double mean = predictions.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        if (!(mean > limit)) {
            return Optional.empty();
        }
        double current = sample.metric(Sample.CPU);
        LOG.debug("Rule [{}] fired: process {} forecast mean={} > {}", getName(), sample.getProcessId(), mean, limit);

        return Optional.of(AlertRequest.builder(AlertType.WARNING, AlertSource.PREDICTION)
                .processId(sample.getProcessId())
                .processName(sample.getDisplayName())
                .metric(Sample.CPU)
                .message(String.format(Locale.ROOT, "Forecast: %s will reach %.1f%% CPU",
                        sample.getDisplayName(), mean))
                .detail("prediction", mean)
                .detail("currentValue", current)
                .mlDetected(true)
                .algorithm(ALGORITHM)
                .cooldownKey(ProcessAlertRule.cooldownKey(sample.getProcessId(), KIND))
                .build());
    }

    @Override
    public String getName() {
        return "process-prediction";
    }
}
