package com.processsentinel.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Host-wide usage percentages keyed by metric ({@code cpu}, {@code memory},
 * {@code disk}).
 *
 * @since 1.0.0
 */
public final class SystemStats implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String CPU = "cpu";
    public static final String MEMORY = "memory";
    public static final String DISK = "disk";

    private final Map<String, Double> usage;

    private SystemStats(Map<String, Double> usage) {
        this.usage = Collections.unmodifiableMap(new LinkedHashMap<>(usage));
    }

    public static SystemStats of(Map<String, Double> usage) {
        Objects.requireNonNull(usage, "usage must not be null");
        return new SystemStats(usage);
    }

    public static SystemStats of(double cpu, double memory, double disk) {
        Map<String, Double> usage = new LinkedHashMap<>();
        usage.put(CPU, cpu);
        usage.put(MEMORY, memory);
        usage.put(DISK, disk);
        return new SystemStats(usage);
    }

    /**
     * Build host-wide stats from a {@link Sample#SYSTEM_PROCESS_ID system}
     * sample. Metrics that are absent from the sample are absent here too.
     *
     * @param sample the system sample
     * @return stats carrying the sample's cpu, memory and disk metrics
     */
    public static SystemStats fromSample(Sample sample) {
        Objects.requireNonNull(sample, "sample must not be null");
        Map<String, Double> usage = new LinkedHashMap<>();
        for (String metric : new String[] { CPU, MEMORY, DISK }) {
            Double value = sample.getMetrics().get(metric);
            if (value != null) {
                usage.put(metric, value);
            }
        }
        return new SystemStats(usage);
    }

    public Optional<Double> usage(String metric) {
        Double value = usage.get(metric);
        return value != null && Double.isFinite(value) ? Optional.of(value) : Optional.empty();
    }

    public Map<String, Double> getUsage() {
        return usage;
    }

    @Override
    public String toString() {
        return "SystemStats" + usage;
    }
}
