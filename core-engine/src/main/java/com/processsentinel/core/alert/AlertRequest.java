package com.processsentinel.core.alert;

import com.processsentinel.core.model.AlertSource;
import com.processsentinel.core.model.AlertType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Everything needed to raise an alert, before an id and timestamp are
 * assigned by {@link AlertEngine#createAlert(AlertRequest)}.
 *
 * <p>
 * A non-null {@code cooldownKey} subjects the request to deduplication: the
 * engine drops it while another alert with the same key is inside its
 * cooldown window.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertRequest {

    private final AlertType type;
    private final AlertSource source;
    private final String processId;
    private final String processName;
    private final String metric;
    private final String message;
    private final Map<String, Double> details;
    private final boolean mlDetected;
    private final String algorithm;
    private final Integer severity;
    private final String cooldownKey;

    private AlertRequest(Builder builder) {
        this.type = Objects.requireNonNull(builder.type, "type must not be null");
        this.source = Objects.requireNonNull(builder.source, "source must not be null");
        this.message = Objects.requireNonNull(builder.message, "message must not be null");
        this.processId = builder.processId;
        this.processName = builder.processName;
        this.metric = builder.metric;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(builder.details));
        this.mlDetected = builder.mlDetected;
        this.algorithm = builder.algorithm;
        this.severity = builder.severity;
        this.cooldownKey = builder.cooldownKey;
    }

    public static Builder builder(AlertType type, AlertSource source) {
        return new Builder().type(type).source(source);
    }

    public AlertType getType() {
        return type;
    }

    public AlertSource getSource() {
        return source;
    }

    public String getProcessId() {
        return processId;
    }

    public String getProcessName() {
        return processName;
    }

    public String getMetric() {
        return metric;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, Double> getDetails() {
        return details;
    }

    public boolean isMlDetected() {
        return mlDetected;
    }

    public String getAlgorithm() {
        return algorithm;
    }

    /** @return explicit severity override, or {@code null} to derive it from the type */
    public Integer getSeverity() {
        return severity;
    }

    public String getCooldownKey() {
        return cooldownKey;
    }

    @Override
    public String toString() {
        return "AlertRequest{type=" + type + ", source=" + source + ", cooldownKey='" + cooldownKey
                + "', message='" + message + "'}";
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private AlertType type;
        private AlertSource source;
        private String processId;
        private String processName;
        private String metric;
        private String message;
        private final Map<String, Double> details = new LinkedHashMap<>();
        private boolean mlDetected;
        private String algorithm;
        private Integer severity;
        private String cooldownKey;

        public Builder type(AlertType type) {
            this.type = type;
            return this;
        }

        public Builder source(AlertSource source) {
            this.source = source;
            return this;
        }

        public Builder processId(String processId) {
            this.processId = processId;
            return this;
        }

        public Builder processName(String processName) {
            this.processName = processName;
            return this;
        }

        public Builder metric(String metric) {
            this.metric = metric;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder detail(String name, double value) {
            this.details.put(name, value);
            return this;
        }

        public Builder mlDetected(boolean mlDetected) {
            this.mlDetected = mlDetected;
            return this;
        }

        public Builder algorithm(String algorithm) {
            this.algorithm = algorithm;
            return this;
        }

        public Builder severity(Integer severity) {
            this.severity = severity;
            return this;
        }

        public Builder cooldownKey(String cooldownKey) {
            this.cooldownKey = cooldownKey;
            return this;
        }

        public AlertRequest build() {
            return new AlertRequest(this);
        }
    }
}
