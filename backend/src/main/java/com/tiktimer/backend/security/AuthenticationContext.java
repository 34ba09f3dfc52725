package com.tiktimer.backend.security;

import com.tiktimer.backend.model.User;
import lombok.Builder;
import lombok.Value;

/**
 * Value threaded through the {@link AuthenticationGate} steps. Each step returns an enriched copy;
 * fields stay null until the step that resolves them has run.
 */
@Value
@Builder(toBuilder = true)
public class AuthenticationContext {

    String authorizationHeader;
    String bearerToken;
    AccessTokenClaims claims;
    User user;

    public static AuthenticationContext fromHeader(String authorizationHeader) {
        return AuthenticationContext.builder()
                .authorizationHeader(authorizationHeader)
                .build();
    }
}
