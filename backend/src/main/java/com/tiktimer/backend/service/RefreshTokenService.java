package com.tiktimer.backend.service;

import com.tiktimer.backend.config.JwtProperties;
import com.tiktimer.backend.exception.InactiveAccountException;
import com.tiktimer.backend.exception.InvalidCredentialsException;
import com.tiktimer.backend.model.User;
import com.tiktimer.backend.repository.UserRepository;
import com.tiktimer.backend.security.CredentialHasher;
import com.tiktimer.backend.security.JwtTokenProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;

/**
 * Issues and rotates the long-lived refresh tokens.
 * <p>
 * A raw token is {@code <userId>.<secret>}: the user id only selects the row, the 256-bit secret is what
 * makes it unguessable. Only a BCrypt digest of the whole string is stored, together with its expiry.
 * There is at most one live refresh token per user; issuing replaces it.
 * <p>
 * Concurrency: every read-validate-write runs on a row locked with {@code SELECT ... FOR UPDATE}, so two
 * presentations of the same token serialize and the second one sees the replacement digest.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RefreshTokenService {

    static final int SECRET_BYTES = 32;
    static final int MAX_TOKEN_LENGTH = 72;
    private static final char SELECTOR_SEPARATOR = '.';
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final UserRepository userRepository;
    private final CredentialHasher credentialHasher;
    private final JwtTokenProvider jwtTokenProvider;
    private final JwtProperties jwtProperties;
    private final Clock clock;

    /**
     * Installs a new refresh token on {@code user} and returns its raw value. The caller must hold the
     * user's row lock in the current transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public String issue(User user) {
        if (user.getId() == null) {
            throw new IllegalArgumentException("User must be persisted before a refresh token is issued");
        }
        String raw = user.getId() + String.valueOf(SELECTOR_SEPARATOR) + generateSecret();
        Instant expiresAt = clock.instant().plus(jwtProperties.getRefreshTokenExpiration());
        user.replaceRefreshToken(credentialHasher.hash(raw), expiresAt);
        userRepository.save(user);
        return raw;
    }

    /**
     * Exchanges a refresh token for a new access/refresh pair. The presented token is consumed: a second
     * presentation fails with {@link InvalidCredentialsException}.
     */
    @Transactional
    public TokenPair rotate(String rawToken) {
        Long userId = parseSelector(rawToken);
        User user = userRepository.findByIdForUpdate(userId)
                .orElseThrow(() -> new InvalidCredentialsException("Refresh token selector matches no user"));

        validate(user, rawToken);
        if (!user.isActive()) {
            throw new InactiveAccountException();
        }

        String newRefreshToken = issue(user);
        String accessToken = jwtTokenProvider.generateToken(user.getUsername(), user.getTokenVersion());
        log.info("Rotated refresh token for {}", user.getUsername());
        return new TokenPair(accessToken, newRefreshToken);
    }

    /**
     * Checks, cheapest first: a digest is stored, it has not expired, the presented token matches it.
     */
    void validate(User user, String rawToken) {
        if (!user.hasRefreshToken()) {
            throw new InvalidCredentialsException("No outstanding refresh token for " + user.getUsername());
        }
        Instant expiresAt = user.getRefreshTokenExpiresAt();
        if (expiresAt == null || !expiresAt.isAfter(clock.instant())) {
            throw new InvalidCredentialsException("Refresh token expired for " + user.getUsername());
        }
        if (!credentialHasher.verify(rawToken, user.getRefreshTokenHash())) {
            throw new InvalidCredentialsException("Refresh token mismatch for " + user.getUsername());
        }
    }

    Long parseSelector(String rawToken) {
        if (rawToken == null || rawToken.isBlank() || rawToken.length() > MAX_TOKEN_LENGTH) {
            throw new InvalidCredentialsException("Malformed refresh token");
        }
        int separator = rawToken.indexOf(SELECTOR_SEPARATOR);
        if (separator <= 0 || separator == rawToken.length() - 1) {
            throw new InvalidCredentialsException("Malformed refresh token");
        }
        try {
            return Long.parseLong(rawToken.substring(0, separator));
        } catch (NumberFormatException ex) {
            throw new InvalidCredentialsException("Malformed refresh token selector", ex);
        }
    }

    private String generateSecret() {
        byte[] bytes = new byte[SECRET_BYTES];
        SECURE_RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
