package com.processsentinel.core.features;

import java.io.Serializable;

/**
 * Min-max scaling parameters remembered for one feature.
 *
 * @since 1.0.0
 */
public final class ScalerParams implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double min;
    private final double max;
    private final double range;

    public ScalerParams(double min, double max) {
        this.min = min;
        this.max = max;
        double span = max - min;
        this.range = span == 0 ? 1.0 : span;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    /**
     * @return {@code max - min}, or {@code 1} when the two are equal
     */
    public double getRange() {
        return range;
    }

    public double scale(double value) {
        return (value - min) / range;
    }

    public double unscale(double value) {
        return value * range + min;
    }

    @Override
    public String toString() {
        return "ScalerParams{min=" + min + ", max=" + max + ", range=" + range + '}';
    }
}
