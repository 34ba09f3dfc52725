package com.tiktimer.backend.security;

import java.time.Instant;

/**
 * What a successfully decoded access token proves: it was issued for {@code username} at
 * revocation epoch {@code version} and has not yet expired. Whether that epoch is still current
 * is decided by {@link AuthenticationGate}.
 */
public record AccessTokenClaims(String username, long version, Instant expiresAt) {
}
