package com.tiktimer.backend.exception;

/**
 * Uniform rejection for every credential failure: bad password, unknown user, bad signature,
 * expired, stale or replayed token. The client always sees {@link #PUBLIC_MESSAGE}; the
 * constructor message is for server logs only.
 */
public class InvalidCredentialsException extends RuntimeException {

    public static final String PUBLIC_MESSAGE = "Could not validate credentials";

    public InvalidCredentialsException(String reason) {
        super(reason);
    }

    public InvalidCredentialsException(String reason, Throwable cause) {
        super(reason, cause);
    }
}
