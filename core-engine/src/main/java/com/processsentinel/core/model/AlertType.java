package com.processsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity tier of an alert; each tier maps to a default numeric severity.
 */
public enum AlertType {
    INFO(3),
    WARNING(6),
    CRITICAL(9);

    /** Numeric severity used when a type is not known. */
    public static final int DEFAULT_SEVERITY = 5;

    private final int severity;

    AlertType(int severity) {
        this.severity = severity;
    }

    public int defaultSeverity() {
        return severity;
    }

    /**
     * @param type alert type, possibly {@code null}
     * @return the type's default severity, or {@value #DEFAULT_SEVERITY}
     */
    public static int severityOf(AlertType type) {
        return type != null ? type.severity : DEFAULT_SEVERITY;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
