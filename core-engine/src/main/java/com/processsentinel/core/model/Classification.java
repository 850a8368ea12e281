package com.processsentinel.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Workload label predicted for a process.
 *
 * @since 1.0.0
 */
public final class Classification implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Label reported when no trained model is available. */
    public static final String UNKNOWN = "unknown";

    private static final Classification UNKNOWN_RESULT =
            new Classification(UNKNOWN, 0.0, Collections.emptyMap());

    private final String label;
    private final double confidence;
    private final Map<String, Double> probabilities;

    public Classification(String label, double confidence, Map<String, Double> probabilities) {
        this.label = Objects.requireNonNull(label, "label must not be null");
        this.confidence = confidence;
        this.probabilities = probabilities != null && !probabilities.isEmpty()
                ? Collections.unmodifiableMap(new LinkedHashMap<>(probabilities))
                : Collections.emptyMap();
    }

    public static Classification unknown() {
        return UNKNOWN_RESULT;
    }

    public String getLabel() {
        return label;
    }

    public double getConfidence() {
        return confidence;
    }

    public Map<String, Double> getProbabilities() {
        return probabilities;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Classification that))
            return false;
        return Double.compare(confidence, that.confidence) == 0
                && label.equals(that.label)
                && probabilities.equals(that.probabilities);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, confidence, probabilities);
    }

    @Override
    public String toString() {
        return "Classification{label='" + label + "', confidence=" + confidence + '}';
    }
}
