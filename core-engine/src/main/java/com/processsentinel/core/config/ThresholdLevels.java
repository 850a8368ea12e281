package com.processsentinel.core.config;

import java.io.Serializable;

/**
 * Warning and critical cutoffs for one metric. A reading fires a tier when it
 * is strictly greater than the cutoff.
 *
 * @since 1.0.0
 */
public class ThresholdLevels implements Serializable {

    private static final long serialVersionUID = 1L;

    private double warning;
    private double critical;

    /** No-arg constructor required by SnakeYAML. */
    public ThresholdLevels() {
    }

    public ThresholdLevels(double warning, double critical) {
        this.warning = warning;
        this.critical = critical;
    }

    public double getWarning() {
        return warning;
    }

    public void setWarning(double warning) {
        this.warning = warning;
    }

    public double getCritical() {
        return critical;
    }

    public void setCritical(double critical) {
        this.critical = critical;
    }

    @Override
    public String toString() {
        return "{warning=" + warning + ", critical=" + critical + '}';
    }
}
