package com.tiktimer.backend.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Signing secret, algorithm and lifetimes for the credentials minted by the backend.
 * Bound once at startup; components receive it by constructor injection.
 */
@Validated
@ConfigurationProperties(prefix = "jwt")
@Data
public class JwtProperties {

    /**
     * HMAC secret. No default: startup fails when JWT_SECRET is not provided.
     */
    @NotBlank
    private String secret;

    /**
     * HS256, HS384 or HS512.
     */
    @NotBlank
    private String algorithm = "HS256";

    @NotBlank
    private String issuer = "tiktimer";

    @NotNull
    private Duration accessTokenExpiration = Duration.ofMinutes(30);

    @NotNull
    private Duration refreshTokenExpiration = Duration.ofDays(7);
}
