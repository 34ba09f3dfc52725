package com.tiktimer.backend.service;

import com.tiktimer.backend.exception.NotFoundException;
import com.tiktimer.backend.model.User;
import com.tiktimer.backend.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Revokes every credential a user holds by moving the account to the next token version and dropping
 * the stored refresh token. There is no per-token denylist: revoking one session revokes them all.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RevocationService {

    private final UserRepository userRepository;

    @Transactional
    public User revokeAll(Long userId) {
        User user = userRepository.findByIdForUpdate(userId)
                .orElseThrow(() -> new NotFoundException("User not found"));
        return revokeLocked(user);
    }

    /**
     * Same as {@link #revokeAll(Long)} for a user already locked by the caller's transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public User revokeLocked(User user) {
        long previousVersion = user.getTokenVersion();
        user.revokeAllCredentials();
        User saved = userRepository.save(user);
        log.info("Revoked all sessions for {} (token version {} -> {})",
                saved.getUsername(), previousVersion, saved.getTokenVersion());
        return saved;
    }
}
