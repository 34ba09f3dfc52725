package com.tiktimer.backend.exception;

public class ForbiddenRoleException extends RuntimeException {

    public static final String PUBLIC_MESSAGE = "Admin privileges required";

    public ForbiddenRoleException() {
        super(PUBLIC_MESSAGE);
    }
}
