package com.tiktimer.backend.exception;

public class InactiveAccountException extends RuntimeException {

    public static final String PUBLIC_MESSAGE = "Inactive user";

    public InactiveAccountException() {
        super(PUBLIC_MESSAGE);
    }
}
