package com.tiktimer.backend.security;

import com.tiktimer.backend.exception.ForbiddenRoleException;
import com.tiktimer.backend.exception.InactiveAccountException;
import com.tiktimer.backend.exception.InvalidCredentialsException;
import com.tiktimer.backend.exception.StoreUnavailableException;
import com.tiktimer.backend.model.User;
import com.tiktimer.backend.repository.UserRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

import java.util.Optional;

/**
 * Per-request authentication pipeline.
 * <p>
 * Steps run in a fixed order: extract the bearer token, decode it, load the subject, compare the
 * token's epoch with the stored {@code token_version}, then optionally require an active account
 * and the admin role. Every level is the previous level plus one step, so an admin check can never
 * run on an identity that has not passed the earlier ones.
 * <p>
 * A store failure while loading the subject surfaces as {@link StoreUnavailableException}, never as a
 * credential rejection.
 */
@Component
public class AuthenticationGate {

    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtTokenProvider jwtTokenProvider;
    private final UserRepository userRepository;

    private final GateStep identityChain;
    private final GateStep activeChain;
    private final GateStep adminChain;

    public AuthenticationGate(JwtTokenProvider jwtTokenProvider, UserRepository userRepository) {
        this.jwtTokenProvider = jwtTokenProvider;
        this.userRepository = userRepository;
        this.identityChain = extractBearer()
                .then(decodeToken())
                .then(loadUser())
                .then(matchEpoch());
        this.activeChain = identityChain.then(requireActive());
        this.adminChain = activeChain.then(requireAdmin());
    }

    /**
     * Runs the identity chain on a raw {@code Authorization} header value.
     */
    public AuthenticationContext authenticate(String authorizationHeader) {
        return identityChain.apply(AuthenticationContext.fromHeader(authorizationHeader));
    }

    /**
     * Runs the full chain for {@code level} on a raw {@code Authorization} header value.
     */
    public AuthenticationContext authenticate(String authorizationHeader, AccessLevel level) {
        AuthenticationContext context = AuthenticationContext.fromHeader(authorizationHeader);
        return switch (level) {
            case AUTHENTICATED -> identityChain.apply(context);
            case ACTIVE -> activeChain.apply(context);
            case ADMIN -> adminChain.apply(context);
        };
    }

    /**
     * Continues from an identity already resolved by {@link #authenticate(String)}.
     */
    public AuthenticationContext authorize(AuthenticationContext identity, AccessLevel level) {
        return switch (level) {
            case AUTHENTICATED -> identity;
            case ACTIVE -> requireActive().apply(identity);
            case ADMIN -> requireActive().then(requireAdmin()).apply(identity);
        };
    }

    GateStep extractBearer() {
        return context -> {
            String header = context.getAuthorizationHeader();
            if (header == null || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
                throw new InvalidCredentialsException("Bearer token missing");
            }
            String token = header.substring(BEARER_PREFIX.length()).trim();
            if (token.isEmpty()) {
                throw new InvalidCredentialsException("Bearer token empty");
            }
            return context.toBuilder().bearerToken(token).build();
        };
    }

    GateStep decodeToken() {
        return context -> context.toBuilder()
                .claims(jwtTokenProvider.parse(context.getBearerToken()))
                .build();
    }

    GateStep loadUser() {
        return context -> {
            Optional<User> user;
            try {
                user = userRepository.findByUsername(context.getClaims().username());
            } catch (DataAccessException | TransactionException ex) {
                throw new StoreUnavailableException("User store unavailable", ex);
            }
            return context.toBuilder()
                    .user(user.orElseThrow(() -> new InvalidCredentialsException("Token subject no longer exists")))
                    .build();
        };
    }

    GateStep matchEpoch() {
        return context -> {
            if (context.getClaims().version() != context.getUser().getTokenVersion()) {
                throw new InvalidCredentialsException("Token version " + context.getClaims().version()
                        + " is stale for " + context.getUser().getUsername());
            }
            return context;
        };
    }

    GateStep requireActive() {
        return context -> {
            if (context.getUser() == null) {
                throw new InvalidCredentialsException("No resolved identity");
            }
            if (!context.getUser().isActive()) {
                throw new InactiveAccountException();
            }
            return context;
        };
    }

    GateStep requireAdmin() {
        return context -> {
            if (!context.getUser().isAdmin()) {
                throw new ForbiddenRoleException();
            }
            return context;
        };
    }
}
