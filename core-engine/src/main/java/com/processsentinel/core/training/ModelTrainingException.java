package com.processsentinel.core.training;

/**
 * Thrown when a model cannot be trained on the data it was given.
 *
 * <p>
 * A failed training run never replaces the model's previous state.
 * </p>
 */
public class ModelTrainingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ModelTrainingException(String message) {
        super(message);
    }

    public ModelTrainingException(String message, Throwable cause) {
        super(message, cause);
    }
}
