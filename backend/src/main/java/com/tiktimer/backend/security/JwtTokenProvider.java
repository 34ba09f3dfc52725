package com.tiktimer.backend.security;

import com.tiktimer.backend.config.JwtProperties;
import com.tiktimer.backend.exception.InvalidCredentialsException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.MacAlgorithm;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Map;
import java.util.UUID;

/**
 * Mints and decodes the short-lived bearer tokens.
 * <p>
 * A decoded token only proves that this process signed it for a given username and epoch and that it
 * has not expired. Stale epochs are rejected by {@link AuthenticationGate}.
 */
@Slf4j
@Component
public class JwtTokenProvider {

    public static final String VERSION_CLAIM = "ver";

    private static final Map<String, MacAlgorithm> ALGORITHMS = Map.of(
            "HS256", Jwts.SIG.HS256,
            "HS384", Jwts.SIG.HS384,
            "HS512", Jwts.SIG.HS512
    );

    private final JwtProperties properties;
    private final Clock clock;

    private MacAlgorithm algorithm;
    private SecretKey signingKey;

    public JwtTokenProvider(JwtProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void validateSecret() {
        String secret = properties.getSecret();
        if (secret == null || secret.isBlank()) {
            String reason = "Missing JWT secret. Set the JWT_SECRET environment variable.";
            log.error(reason);
            throw new IllegalStateException(reason);
        }
        String algorithmName = properties.getAlgorithm() == null ? "" : properties.getAlgorithm().trim().toUpperCase();
        MacAlgorithm selected = ALGORITHMS.get(algorithmName);
        if (selected == null) {
            String reason = "Unsupported JWT algorithm '" + properties.getAlgorithm() + "'. Use HS256, HS384 or HS512.";
            log.error(reason);
            throw new IllegalStateException(reason);
        }
        byte[] keyBytes = secret.getBytes(StandardCharsets.UTF_8);
        int minimumBytes = selected.getKeyBitLength() / Byte.SIZE;
        if (keyBytes.length < minimumBytes) {
            String reason = "JWT secret must be at least " + minimumBytes + " bytes for " + algorithmName + ".";
            log.error(reason);
            throw new IllegalStateException(reason);
        }
        this.algorithm = selected;
        this.signingKey = Keys.hmacShaKeyFor(keyBytes);
        log.info("Access tokens signed with {}, lifetime {}", algorithmName, properties.getAccessTokenExpiration());
    }

    public String generateToken(String username, long tokenVersion) {
        return generateToken(username, tokenVersion, properties.getAccessTokenExpiration());
    }

    public String generateToken(String username, long tokenVersion, Duration lifetime) {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("Username is required");
        }
        if (tokenVersion < 0) {
            throw new IllegalArgumentException("Token version must not be negative");
        }
        Instant now = clock.instant();
        Instant expiry = now.plus(lifetime);

        return Jwts.builder()
                .id(UUID.randomUUID().toString())
                .issuer(properties.getIssuer())
                .subject(username)
                .claim(VERSION_CLAIM, tokenVersion)
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiry))
                .signWith(signingKey, algorithm)
                .compact();
    }

    /**
     * Verifies signature, algorithm, issuer and expiry and extracts subject and epoch.
     *
     * @throws InvalidCredentialsException on any failure; the cause is only logged
     */
    public AccessTokenClaims parse(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidCredentialsException("Access token missing");
        }
        Jws<Claims> jws;
        try {
            jws = Jwts.parser()
                    .verifyWith(signingKey)
                    .requireIssuer(properties.getIssuer())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token);
        } catch (JwtException | IllegalArgumentException ex) {
            throw new InvalidCredentialsException("JWT validation error: " + ex.getMessage(), ex);
        }

        if (!algorithm.getId().equals(jws.getHeader().getAlgorithm())) {
            throw new InvalidCredentialsException("Unexpected signing algorithm " + jws.getHeader().getAlgorithm());
        }
        Claims claims = jws.getPayload();
        String username = claims.getSubject();
        if (username == null || username.isBlank()) {
            throw new InvalidCredentialsException("Token has no subject");
        }
        Date expiration = claims.getExpiration();
        if (expiration == null) {
            throw new InvalidCredentialsException("Token has no expiry");
        }
        Object rawVersion = claims.get(VERSION_CLAIM);
        if (!(rawVersion instanceof Integer) && !(rawVersion instanceof Long)) {
            throw new InvalidCredentialsException("Token has no usable version claim");
        }
        long version = ((Number) rawVersion).longValue();
        if (version < 0) {
            throw new InvalidCredentialsException("Token version is negative");
        }
        return new AccessTokenClaims(username, version, expiration.toInstant());
    }
}
