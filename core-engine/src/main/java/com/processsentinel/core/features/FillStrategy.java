package com.processsentinel.core.features;

/**
 * How {@link FeatureEngineer#fillMissing} replaces missing entries.
 */
public enum FillStrategy {
    /** Arithmetic mean of the valid entries. */
    MEAN,
    /** Upper median of the valid entries. */
    MEDIAN,
    ZERO
}
