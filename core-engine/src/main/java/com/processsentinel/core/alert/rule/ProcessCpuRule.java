package com.processsentinel.core.alert.rule;

import com.processsentinel.core.alert.AlertRequest;
import com.processsentinel.core.model.AlertSource;
import com.processsentinel.core.model.AlertType;
import com.processsentinel.core.model.AnalysisResult;
import com.processsentinel.core.model.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Warns when a single process uses more CPU than {@code limit} percent.
 */
public class ProcessCpuRule implements ProcessAlertRule {

    private static final Logger LOG = LoggerFactory.getLogger(ProcessCpuRule.class);

    private final double limit;

    public ProcessCpuRule(double limit) {
        this.limit = limit;
    }

    @Override
    public Optional<AlertRequest> evaluate(Sample sample, AnalysisResult analysis) {
        Objects.requireNonNull(sample, "sample must not be null");
        double cpu = sample.metric(Sample.CPU);
        if (!(cpu > limit)) {
            return Optional.empty();
        }
        LOG.debug("Rule [{}] fired: process {} cpu={} > {}", getName(), sample.getProcessId(), cpu, limit);
        return Optional.of(AlertRequest.builder(AlertType.WARNING, AlertSource.THRESHOLD)
                .processId(sample.getProcessId())
                .processName(sample.getDisplayName())
                .metric(Sample.CPU)
                .message(String.format(Locale.ROOT, "Process %s using %.1f%% CPU", sample.getDisplayName(), cpu))
                .detail("currentValue", cpu)
                .detail("threshold", limit)
                .cooldownKey(ProcessAlertRule.cooldownKey(sample.getProcessId(), Sample.CPU))
                .build());
    }

    @Override
    public String getName() {
        return "process-cpu";
    }

    public double getLimit() {
        return limit;
    }
}
