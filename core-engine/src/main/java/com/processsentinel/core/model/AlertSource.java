package com.processsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What raised an alert.
 */
public enum AlertSource {
    THRESHOLD,
    ML,
    ANOMALY,
    PREDICTION,
    SYSTEM;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
