package com.tiktimer.backend.exception;

/**
 * The external publishing platform rejected a call or could not be reached.
 */
public class ExternalPlatformException extends RuntimeException {
    public ExternalPlatformException(String message) {
        super(message);
    }

    public ExternalPlatformException(String message, Throwable cause) {
        super(message, cause);
    }
}
