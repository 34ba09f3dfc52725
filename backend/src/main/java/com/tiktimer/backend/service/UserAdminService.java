package com.tiktimer.backend.service;

import com.tiktimer.backend.exception.NotFoundException;
import com.tiktimer.backend.model.User;
import com.tiktimer.backend.model.UserRole;
import com.tiktimer.backend.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserAdminService {

    private final UserRepository userRepository;
    private final RevocationService revocationService;

    @Transactional(readOnly = true)
    public List<User> listUsers() {
        return userRepository.findAllByOrderByIdAsc();
    }

    /**
     * The gate reads the role from the store on every request, so a change applies without revoking tokens.
     */
    @Transactional
    public User changeRole(String username, UserRole role, String actor) {
        User user = lockUser(username);
        UserRole previous = user.getRole();
        user.setRole(role);
        User saved = userRepository.save(user);
        log.info("{} changed role of {} from {} to {}", actor, username, previous, role);
        return saved;
    }

    /**
     * Deactivation also revokes every outstanding credential of the account.
     */
    @Transactional
    public User changeStatus(String username, boolean active, String actor) {
        User user = lockUser(username);
        user.setActive(active);
        User saved = active ? userRepository.save(user) : revocationService.revokeLocked(user);
        log.info("{} set {} active={}", actor, username, active);
        return saved;
    }

    @Transactional
    public void revokeSessions(String username, String actor) {
        User user = lockUser(username);
        revocationService.revokeLocked(user);
        log.info("{} revoked all sessions of {}", actor, username);
    }

    private User lockUser(String username) {
        return userRepository.findByUsernameForUpdate(username)
                .orElseThrow(() -> new NotFoundException("User not found"));
    }
}
