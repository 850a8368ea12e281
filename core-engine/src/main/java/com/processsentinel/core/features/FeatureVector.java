package com.processsentinel.core.features;

import java.io.Serializable;
import java.util.Arrays;
import java.util.List;

/**
 * Fixed-order numeric features of one sample and its recent history.
 *
 * <p>
 * The order of {@link #toArray()} matches {@link #NAMES} and must not change,
 * because trained anomaly models are bound to it.
 * </p>
 *
 * @since 1.0.0
 */
public final class FeatureVector implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final List<String> NAMES = List.of(
            "cpu", "memory", "threads",
            "cpuPerThread", "memoryPerThread",
            "cpuMean", "cpuStd", "cpuTrend",
            "memoryMean", "memoryStd", "memoryTrend");

    public static final int DIMENSION = NAMES.size();

    private final double[] values;

    FeatureVector(double[] values) {
        if (values.length != DIMENSION) {
            throw new IllegalArgumentException(
                    "Expected " + DIMENSION + " features, got: " + values.length);
        }
        this.values = values.clone();
    }

    public double get(String name) {
        int index = NAMES.indexOf(name);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown feature: " + name);
        }
        return values[index];
    }

    public double getCpu() {
        return values[0];
    }

    public double getMemory() {
        return values[1];
    }

    public double getThreads() {
        return values[2];
    }

    public double getCpuMean() {
        return values[5];
    }

    public double getCpuStd() {
        return values[6];
    }

    public double getCpuTrend() {
        return values[7];
    }

    public double getMemoryTrend() {
        return values[10];
    }

    /**
     * @return a copy of the features in {@link #NAMES} order
     */
    public double[] toArray() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FeatureVector that))
            return false;
        return Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "FeatureVector" + Arrays.toString(values);
    }
}
