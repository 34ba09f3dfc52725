package com.tiktimer.backend.service;

import com.tiktimer.backend.dto.RegisterRequest;
import com.tiktimer.backend.exception.BadRequestException;
import com.tiktimer.backend.exception.DuplicateIdentityException;
import com.tiktimer.backend.exception.InactiveAccountException;
import com.tiktimer.backend.exception.InvalidCredentialsException;
import com.tiktimer.backend.model.User;
import com.tiktimer.backend.model.UserRole;
import com.tiktimer.backend.repository.UserRepository;
import com.tiktimer.backend.security.CredentialHasher;
import com.tiktimer.backend.security.JwtTokenProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Locale;
import java.util.Optional;

/**
 * Registration, login, refresh and logout.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountService {

    private final UserRepository userRepository;
    private final CredentialHasher credentialHasher;
    private final JwtTokenProvider jwtTokenProvider;
    private final RefreshTokenService refreshTokenService;
    private final RevocationService revocationService;
    private final Clock clock;

    // Compared against for unknown usernames so both failure paths cost one BCrypt check.
    private volatile String timingDigest;

    @Transactional
    public User register(RegisterRequest request) {
        String email = request.getEmail().trim().toLowerCase(Locale.ROOT);
        String username = request.getUsername().trim();
        if (!credentialHasher.accepts(request.getPassword())) {
            throw new BadRequestException("Password must be at most 72 bytes when UTF-8 encoded");
        }
        if (userRepository.existsByUsernameOrEmail(username, email)) {
            throw new DuplicateIdentityException();
        }
        User user = User.builder()
                .username(username)
                .email(email)
                .passwordHash(credentialHasher.hash(request.getPassword()))
                .role(UserRole.USER)
                .active(true)
                .tokenVersion(0L)
                .createdAt(clock.instant())
                .build();
        try {
            user = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            // lost a race against a concurrent registration with the same identity
            throw new DuplicateIdentityException(ex);
        }
        log.info("Registered new user: {}", user.getUsername());
        return user;
    }

    /**
     * Verifies the password and mints a new access/refresh pair at the user's current token version.
     * Replaces any refresh token issued by an earlier login.
     */
    @Transactional
    public TokenPair login(String username, String password) {
        Optional<User> candidate = username == null
                ? Optional.empty()
                : userRepository.findByUsernameForUpdate(username.trim());
        if (candidate.isEmpty()) {
            credentialHasher.verify(password == null ? "" : password, timingDigest());
            throw new InvalidCredentialsException("Login failed: unknown user");
        }
        User user = candidate.get();
        if (!credentialHasher.verify(password, user.getPasswordHash())) {
            throw new InvalidCredentialsException("Login failed: bad password for " + user.getUsername());
        }
        if (!user.isActive()) {
            throw new InactiveAccountException();
        }

        String refreshToken = refreshTokenService.issue(user);
        String accessToken = jwtTokenProvider.generateToken(user.getUsername(), user.getTokenVersion());
        log.info("User logged in: {}", user.getUsername());
        return new TokenPair(accessToken, refreshToken);
    }

    public TokenPair refresh(String rawRefreshToken) {
        return refreshTokenService.rotate(rawRefreshToken);
    }

    public void logout(Long userId) {
        User user = revocationService.revokeAll(userId);
        log.info("User logged out: {}", user.getUsername());
    }

    private String timingDigest() {
        String digest = timingDigest;
        if (digest == null) {
            digest = credentialHasher.hash("timing-equalizer");
            timingDigest = digest;
        }
        return digest;
    }
}
