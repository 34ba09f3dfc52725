package com.tiktimer.backend.exception;

public class DuplicateIdentityException extends RuntimeException {

    public static final String PUBLIC_MESSAGE = "User with this email or username already exists";

    public DuplicateIdentityException() {
        super(PUBLIC_MESSAGE);
    }

    public DuplicateIdentityException(Throwable cause) {
        super(PUBLIC_MESSAGE, cause);
    }
}
