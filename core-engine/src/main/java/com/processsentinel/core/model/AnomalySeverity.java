package com.processsentinel.core.model;

import java.util.Locale;

/**
 * Severity tier of an anomaly score.
 */
public enum AnomalySeverity {
    NORMAL,
    WARNING,
    CRITICAL;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
