package com.processsentinel.core.classification;

import com.processsentinel.core.model.Sample;

import java.util.Objects;

/**
 * A process sample paired with its known workload label, used for training.
 */
public final class LabeledSample {

    private final Sample sample;
    private final String label;

    public LabeledSample(Sample sample, String label) {
        this.sample = Objects.requireNonNull(sample, "sample must not be null");
        this.label = Objects.requireNonNull(label, "label must not be null");
    }

    public Sample getSample() {
        return sample;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return "LabeledSample{label='" + label + "', processId='" + sample.getProcessId() + "'}";
    }
}
