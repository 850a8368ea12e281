package com.processsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single resource-usage reading for one process.
 *
 * <p>
 * Samples are produced by the telemetry collaborator and are immutable once
 * built. Metric values are keyed by the constants declared on this class;
 * missing metrics read as {@code 0}, except {@link #THREADS} which reads as
 * {@code 1}.
 * </p>
 *
 * <p>
 * A sample whose {@code processId} equals {@link #SYSTEM_PROCESS_ID} carries
 * host-wide usage rather than a single process.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Sample implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String CPU = "cpu";
    public static final String MEMORY = "memory";
    public static final String THREADS = "threads";
    public static final String IO_READ = "ioRead";
    public static final String IO_WRITE = "ioWrite";
    public static final String NETWORK_SENT = "networkSent";
    public static final String NETWORK_RECEIVED = "networkReceived";

    /** Process id used by the telemetry source for host-wide readings. */
    public static final String SYSTEM_PROCESS_ID = "system";

    private final String processId;
    private final String processName;
    private final Long pid;
    private final int priority;
    private final Instant timestamp;
    private final Map<String, Double> metrics;

    @JsonCreator
    Sample(@JsonProperty("processId") String processId,
            @JsonProperty("processName") String processName,
            @JsonProperty("pid") Long pid,
            @JsonProperty("priority") int priority,
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("metrics") Map<String, Double> metrics) {
        this.processId = Objects.requireNonNull(processId, "processId must not be null");
        this.processName = processName;
        this.pid = pid;
        this.priority = priority;
        this.timestamp = timestamp != null ? timestamp : Instant.now();
        this.metrics = metrics != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metrics))
                : Collections.emptyMap();
    }

    public static Builder builder(String processId) {
        return new Builder(processId);
    }

    /**
     * Fluent builder for {@link Sample}. {@code processId} is required.
     */
    public static class Builder {
        private final String processId;
        private String processName;
        private Long pid;
        private int priority;
        private Instant timestamp;
        private final Map<String, Double> metrics = new LinkedHashMap<>();

        private Builder(String processId) {
            this.processId = processId;
        }

        public Builder processName(String processName) {
            this.processName = processName;
            return this;
        }

        public Builder pid(long pid) {
            this.pid = pid;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder metric(String name, double value) {
            metrics.put(Objects.requireNonNull(name, "metric name must not be null"), value);
            return this;
        }

        public Builder cpu(double value) {
            return metric(CPU, value);
        }

        public Builder memory(double value) {
            return metric(MEMORY, value);
        }

        public Builder threads(double value) {
            return metric(THREADS, value);
        }

        public Sample build() {
            return new Sample(processId, processName, pid, priority, timestamp, metrics);
        }
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public String getProcessId() {
        return processId;
    }

    public String getProcessName() {
        return processName;
    }

    public Long getPid() {
        return pid;
    }

    public int getPriority() {
        return priority;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Map<String, Double> getMetrics() {
        return metrics;
    }

    /**
     * Read a metric, substituting the default for missing or non-finite values.
     *
     * @param name metric key
     * @return the metric value, {@code 1} for missing {@link #THREADS}, otherwise
     *         {@code 0}
     */
    public double metric(String name) {
        Double value = metrics.get(name);
        if (value == null || !Double.isFinite(value)) {
            return THREADS.equals(name) ? 1.0 : 0.0;
        }
        return value;
    }

    /**
     * @return the process name, falling back to the process id
     */
    @JsonIgnore
    public String getDisplayName() {
        return processName != null && !processName.isBlank() ? processName : processId;
    }

    @JsonIgnore
    public boolean isSystem() {
        return SYSTEM_PROCESS_ID.equals(processId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Sample that))
            return false;
        return Objects.equals(processId, that.processId)
                && Objects.equals(timestamp, that.timestamp)
                && Objects.equals(metrics, that.metrics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(processId, timestamp, metrics);
    }

    @Override
    public String toString() {
        return "Sample{" +
                "processId='" + processId + '\'' +
                ", processName='" + processName + '\'' +
                ", timestamp=" + timestamp +
                ", metrics=" + metrics +
                '}';
    }
}
