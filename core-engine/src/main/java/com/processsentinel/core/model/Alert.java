package com.processsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Alert raised by the alert engine.
 *
 * <p>
 * Serialized to JSON and handed to the persistence collaborator and the
 * alerts topic.
 * </p>
 *
 * <h3>Lifecycle</h3>
 * <p>
 * An alert is created open, may be acknowledged, and may be resolved.
 * Resolution is terminal: a resolved alert never becomes open again and is
 * not acknowledged afterwards.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. The builder enforces that {@code id},
 * {@code type}, {@code source}, {@code message} and {@code createdAt} are
 * present; omitting any of them throws a {@link NullPointerException} at
 * build time.
 * </p>
 *
 * @since 1.0.0
 */
public class Alert implements Serializable {

    private static final long serialVersionUID = 1L;

    private String id;
    private AlertType type;

    /** Numeric severity in [1, 10]. */
    private int severity;

    private AlertSource source;
    private String processId;
    private String processName;
    private String metric;
    private String message;

    /** Numeric payload such as currentValue, threshold or anomalyScore. */
    private Map<String, Double> details = new LinkedHashMap<>();

    private boolean mlDetected;
    private String algorithm;

    private boolean acknowledged;
    private Instant acknowledgedAt;
    private String acknowledgedBy;
    private boolean resolved;
    private Instant resolvedAt;

    private Instant createdAt;
    private Instant updatedAt;

    // ---------------------------------------------------------------
    // Constructors
    // ---------------------------------------------------------------

    /** No-arg constructor required by Jackson. */
    public Alert() {
    }

    private Alert(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.type = Objects.requireNonNull(builder.type, "type must not be null");
        this.source = Objects.requireNonNull(builder.source, "source must not be null");
        this.message = Objects.requireNonNull(builder.message, "message must not be null");
        this.createdAt = Objects.requireNonNull(builder.createdAt, "createdAt must not be null");
        this.severity = builder.severity != null ? builder.severity : AlertType.severityOf(builder.type);
        if (severity < 1 || severity > 10) {
            throw new IllegalArgumentException("severity must be in [1, 10], got: " + severity);
        }
        this.processId = builder.processId;
        this.processName = builder.processName;
        this.metric = builder.metric;
        this.details = builder.details != null
                ? new LinkedHashMap<>(builder.details)
                : new LinkedHashMap<>();
        this.mlDetected = builder.mlDetected;
        this.algorithm = builder.algorithm;
        this.updatedAt = createdAt;
    }

    /**
     * Copy every field of another alert.
     *
     * @param other alert to copy; must not be {@code null}
     * @return an independent copy
     */
    public static Alert copyOf(Alert other) {
        Objects.requireNonNull(other, "alert must not be null");
        Alert copy = new Alert();
        copy.id = other.id;
        copy.type = other.type;
        copy.severity = other.severity;
        copy.source = other.source;
        copy.processId = other.processId;
        copy.processName = other.processName;
        copy.metric = other.metric;
        copy.message = other.message;
        copy.setDetails(other.details);
        copy.mlDetected = other.mlDetected;
        copy.algorithm = other.algorithm;
        copy.acknowledged = other.acknowledged;
        copy.acknowledgedAt = other.acknowledgedAt;
        copy.acknowledgedBy = other.acknowledgedBy;
        copy.resolved = other.resolved;
        copy.resolvedAt = other.resolvedAt;
        copy.createdAt = other.createdAt;
        copy.updatedAt = other.updatedAt;
        return copy;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Alert} instances.
     *
     * <p>
     * When no explicit severity is given, the type's default severity is used
     * (critical=9, warning=6, info=3).
     * </p>
     */
    public static class Builder {
        private String id;
        private AlertType type;
        private Integer severity;
        private AlertSource source;
        private String processId;
        private String processName;
        private String metric;
        private String message;
        private Map<String, Double> details;
        private boolean mlDetected;
        private String algorithm;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(AlertType type) {
            this.type = type;
            return this;
        }

        public Builder severity(Integer severity) {
            this.severity = severity;
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

        public Builder details(Map<String, Double> details) {
            this.details = details;
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

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        /**
         * Build the alert.
         *
         * @return a new open {@link Alert}
         * @throws NullPointerException     if a required field is missing
         * @throws IllegalArgumentException if the severity is outside [1, 10]
         */
        public Alert build() {
            return new Alert(this);
        }
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Mark the alert acknowledged. No-op when already acknowledged or resolved.
     *
     * @param actor who acknowledged it
     * @param at    when
     * @return {@code true} if the alert changed
     */
    public boolean acknowledge(String actor, Instant at) {
        if (acknowledged || resolved) {
            return false;
        }
        this.acknowledged = true;
        this.acknowledgedBy = actor;
        this.acknowledgedAt = at;
        this.updatedAt = at;
        return true;
    }

    /**
     * Mark the alert resolved. No-op when already resolved.
     *
     * @param at when
     * @return {@code true} if the alert changed
     */
    public boolean resolve(Instant at) {
        if (resolved) {
            return false;
        }
        this.resolved = true;
        this.resolvedAt = at;
        this.updatedAt = at;
        return true;
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public AlertType getType() {
        return type;
    }

    public void setType(AlertType type) {
        this.type = type;
    }

    public int getSeverity() {
        return severity;
    }

    public void setSeverity(int severity) {
        this.severity = severity;
    }

    public AlertSource getSource() {
        return source;
    }

    public void setSource(AlertSource source) {
        this.source = source;
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

    public String getMetric() {
        return metric;
    }

    public void setMetric(String metric) {
        this.metric = metric;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    /**
     * @return unmodifiable view of the numeric details
     */
    public Map<String, Double> getDetails() {
        return Collections.unmodifiableMap(details);
    }

    public void setDetails(Map<String, Double> details) {
        this.details = details != null ? new LinkedHashMap<>(details) : new LinkedHashMap<>();
    }

    public boolean isMlDetected() {
        return mlDetected;
    }

    public void setMlDetected(boolean mlDetected) {
        this.mlDetected = mlDetected;
    }

    public String getAlgorithm() {
        return algorithm;
    }

    public void setAlgorithm(String algorithm) {
        this.algorithm = algorithm;
    }

    public boolean isAcknowledged() {
        return acknowledged;
    }

    public void setAcknowledged(boolean acknowledged) {
        this.acknowledged = acknowledged;
    }

    public Instant getAcknowledgedAt() {
        return acknowledgedAt;
    }

    public void setAcknowledgedAt(Instant acknowledgedAt) {
        this.acknowledgedAt = acknowledgedAt;
    }

    public String getAcknowledgedBy() {
        return acknowledgedBy;
    }

    public void setAcknowledgedBy(String acknowledgedBy) {
        this.acknowledgedBy = acknowledgedBy;
    }

    public boolean isResolved() {
        return resolved;
    }

    public void setResolved(boolean resolved) {
        this.resolved = resolved;
    }

    public Instant getResolvedAt() {
        return resolvedAt;
    }

    public void setResolvedAt(Instant resolvedAt) {
        this.resolvedAt = resolvedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert alert))
            return false;
        return Objects.equals(id, alert.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return "Alert{" +
                "id='" + id + '\'' +
                ", type=" + type +
                ", source=" + source +
                ", processId='" + processId + '\'' +
                ", metric='" + metric + '\'' +
                ", message='" + message + '\'' +
                ", acknowledged=" + acknowledged +
                ", resolved=" + resolved +
                '}';
    }
}
