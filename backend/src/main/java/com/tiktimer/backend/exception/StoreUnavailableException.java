package com.tiktimer.backend.exception;

/**
 * The user store could not be reached. Retryable; never reported as a credential failure.
 */
public class StoreUnavailableException extends RuntimeException {
    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
