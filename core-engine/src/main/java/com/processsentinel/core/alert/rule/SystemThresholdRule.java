package com.processsentinel.core.alert.rule;

import com.processsentinel.core.alert.AlertRequest;
import com.processsentinel.core.config.ThresholdLevels;
import com.processsentinel.core.model.AlertSource;
import com.processsentinel.core.model.AlertType;
import com.processsentinel.core.model.SystemStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Two-tier threshold on one host-wide metric.
 *
 * <p>
 * The critical tier is checked first; a value above the critical cutoff never
 * also produces a warning. Each tier has its own cooldown key
 * {@code system:<metric>:<tier>}.
 * </p>
 *
 * @since 1.0.0
 */
public class SystemThresholdRule {

    private static final Logger LOG = LoggerFactory.getLogger(SystemThresholdRule.class);

    private final String metric;
    private final ThresholdLevels levels;

    public SystemThresholdRule(String metric, ThresholdLevels levels) {
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        this.levels = Objects.requireNonNull(levels, "levels must not be null for metric '" + metric + "'");
    }

    /**
     * @param stats current host usage
     * @return an alert request for the highest tier crossed, if any
     */
    public Optional<AlertRequest> evaluate(SystemStats stats) {
        Optional<Double> usage = stats.usage(metric);
        if (usage.isEmpty()) {
            LOG.trace("Rule [system:{}]: no reading – skipping", metric);
            return Optional.empty();
        }
        double value = usage.get();

        if (value > levels.getCritical()) {
            return Optional.of(request(AlertType.CRITICAL, "critical", value, levels.getCritical()));
        }
        if (value > levels.getWarning()) {
            return Optional.of(request(AlertType.WARNING, "elevated", value, levels.getWarning()));
        }
        return Optional.empty();
    }

    private AlertRequest request(AlertType type, String wording, double value, double threshold) {
        String tier = type.label();
        LOG.debug("Rule [system:{}] fired: {}={} > {} threshold {}", metric, metric, value, tier, threshold);
        return AlertRequest.builder(type, AlertSource.THRESHOLD)
                .metric(metric)
                .message(String.format(Locale.ROOT, "System %s usage %s at %.1f%%", displayName(), wording, value))
                .detail("currentValue", value)
                .detail("threshold", threshold)
                .cooldownKey("system:" + metric + ":" + tier)
                .build();
    }

    private String displayName() {
        return SystemStats.CPU.equals(metric) ? "CPU" : metric;
    }

    public String getMetric() {
        return metric;
    }

    public ThresholdLevels getLevels() {
        return levels;
    }
}
