package com.processsentinel.core.alert;

/**
 * Raised by an {@link AlertStore} when the backing storage fails.
 */
public class AlertStoreException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public AlertStoreException(String message) {
        super(message);
    }

    public AlertStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
