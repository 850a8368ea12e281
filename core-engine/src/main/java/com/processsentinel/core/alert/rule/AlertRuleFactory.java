package com.processsentinel.core.alert.rule;

import com.processsentinel.core.config.MonitorConfig;
import com.processsentinel.core.config.ThresholdLevels;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Creates the alert rules described by a {@link MonitorConfig}.
 *
 * <p>
 * Every threshold entry except {@link MonitorConfig#ANOMALY_SCORE} becomes a
 * {@link SystemThresholdRule}. The anomaly-score levels are consumed by the
 * analysis step and by {@link AnomalyAlertRule}.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertRuleFactory {

    private static final Logger LOG = LoggerFactory.getLogger(AlertRuleFactory.class);

    private AlertRuleFactory() {
        // utility class - not instantiable
    }

    /**
     * @param config validated monitor configuration
     * @return unmodifiable list: cpu, anomaly and prediction rules
     */
    public static List<ProcessAlertRule> processRules(MonitorConfig config) {
        Objects.requireNonNull(config, "MonitorConfig must not be null");
        List<ProcessAlertRule> rules = List.of(
                new ProcessCpuRule(config.getProcessCpuLimit()),
                new AnomalyAlertRule(config.threshold(MonitorConfig.ANOMALY_SCORE).getWarning()),
                new PredictionAlertRule(config.getPredictionLimit()));
        LOG.info("Created {} process alert rule(s)", rules.size());
        return rules;
    }

    /**
     * @param config validated monitor configuration
     * @return unmodifiable list of one rule per system metric
     */
    public static List<SystemThresholdRule> systemRules(MonitorConfig config) {
        Objects.requireNonNull(config, "MonitorConfig must not be null");
        List<SystemThresholdRule> rules = new ArrayList<>();
        for (Map.Entry<String, ThresholdLevels> entry : config.getThresholds().entrySet()) {
            if (!MonitorConfig.ANOMALY_SCORE.equals(entry.getKey())) {
                rules.add(new SystemThresholdRule(entry.getKey(), entry.getValue()));
            }
        }
        LOG.info("Created {} system threshold rule(s)", rules.size());
        return Collections.unmodifiableList(rules);
    }
}
