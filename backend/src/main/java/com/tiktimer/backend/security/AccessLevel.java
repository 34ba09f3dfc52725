package com.tiktimer.backend.security;

public enum AccessLevel {
    /** Valid, current token for an existing user. */
    AUTHENTICATED,
    /** AUTHENTICATED and the account is active. */
    ACTIVE,
    /** ACTIVE and the account has the admin role. */
    ADMIN
}
