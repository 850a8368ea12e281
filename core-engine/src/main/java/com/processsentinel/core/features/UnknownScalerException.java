package com.processsentinel.core.features;

/**
 * Thrown when values are denormalized under a feature name that was never
 * normalized.
 */
public class UnknownScalerException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public UnknownScalerException(String featureName) {
        super("No scaler found for feature: " + featureName);
    }
}
