package com.tiktimer.backend.security;

import com.tiktimer.backend.exception.ForbiddenRoleException;
import com.tiktimer.backend.exception.InactiveAccountException;
import com.tiktimer.backend.exception.InvalidCredentialsException;
import com.tiktimer.backend.exception.StoreUnavailableException;
import com.tiktimer.backend.model.User;
import com.tiktimer.backend.model.UserRole;
import com.tiktimer.backend.repository.UserRepository;
import com.tiktimer.backend.util.TestAuthFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.Optional;

import static com.tiktimer.backend.util.TestAuthFactory.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AuthenticationGateTest {

    private UserRepository userRepository;
    private JwtTokenProvider jwtTokenProvider;
    private AuthenticationGate gate;
    private User alice;

    @BeforeEach
    void setUp() {
        userRepository = mock(UserRepository.class);
        jwtTokenProvider = TestAuthFactory.tokenProvider(TestAuthFactory.clockAt(NOW));
        gate = new AuthenticationGate(jwtTokenProvider, userRepository);
        alice = TestAuthFactory.user(1L, "alice");
        when(userRepository.findByUsername("alice")).thenReturn(Optional.of(alice));
    }

    @Test
    void resolvesUserForCurrentEpoch() {
        String header = "Bearer " + jwtTokenProvider.generateToken("alice", 0L);

        AuthenticationContext context = gate.authenticate(header);

        assertThat(context.getUser()).isSameAs(alice);
        assertThat(context.getClaims().version()).isZero();
        assertThat(context.getBearerToken()).isEqualTo(header.substring(7));
    }

    @Test
    void schemeIsCaseInsensitive() {
        String header = "bearer " + jwtTokenProvider.generateToken("alice", 0L);

        assertThat(gate.authenticate(header).getUser()).isSameAs(alice);
    }

    @Test
    void missingOrForeignSchemeNeverReachesTheStore() {
        assertThatThrownBy(() -> gate.authenticate(null))
                .isInstanceOf(InvalidCredentialsException.class);
        assertThatThrownBy(() -> gate.authenticate("Basic YWxpY2U6c2VjcmV0"))
                .isInstanceOf(InvalidCredentialsException.class);
        assertThatThrownBy(() -> gate.authenticate("Bearer    "))
                .isInstanceOf(InvalidCredentialsException.class);

        verify(userRepository, never()).findByUsername(anyString());
    }

    @Test
    void undecodableTokenNeverReachesTheStore() {
        assertThatThrownBy(() -> gate.authenticate("Bearer garbage"))
                .isInstanceOf(InvalidCredentialsException.class);

        verify(userRepository, never()).findByUsername(anyString());
    }

    @Test
    void staleEpochIsRejected() {
        String header = "Bearer " + jwtTokenProvider.generateToken("alice", 0L);
        alice.revokeAllCredentials();

        assertThatThrownBy(() -> gate.authenticate(header))
                .isInstanceOf(InvalidCredentialsException.class)
                .hasMessageContaining("stale");
    }

    @Test
    void tokenFromAFutureEpochIsRejected() {
        String header = "Bearer " + jwtTokenProvider.generateToken("alice", 5L);

        assertThatThrownBy(() -> gate.authenticate(header))
                .isInstanceOf(InvalidCredentialsException.class);
    }

    @Test
    void deletedSubjectIsRejected() {
        when(userRepository.findByUsername("ghost")).thenReturn(Optional.empty());
        String header = "Bearer " + jwtTokenProvider.generateToken("ghost", 0L);

        assertThatThrownBy(() -> gate.authenticate(header))
                .isInstanceOf(InvalidCredentialsException.class);
    }

    @Test
    void inactiveUserPassesIdentityButNotActiveLevel() {
        alice.setActive(false);
        String header = "Bearer " + jwtTokenProvider.generateToken("alice", 0L);

        assertThat(gate.authenticate(header, AccessLevel.AUTHENTICATED).getUser()).isSameAs(alice);
        assertThatThrownBy(() -> gate.authenticate(header, AccessLevel.ACTIVE))
                .isInstanceOf(InactiveAccountException.class);
        assertThatThrownBy(() -> gate.authenticate(header, AccessLevel.ADMIN))
                .isInstanceOf(InactiveAccountException.class);
    }

    @Test
    void adminLevelRequiresAdminRole() {
        String header = "Bearer " + jwtTokenProvider.generateToken("alice", 0L);

        assertThatThrownBy(() -> gate.authenticate(header, AccessLevel.ADMIN))
                .isInstanceOf(ForbiddenRoleException.class);

        alice.setRole(UserRole.ADMIN);
        assertThat(gate.authenticate(header, AccessLevel.ADMIN).getUser().isAdmin()).isTrue();
    }

    @Test
    void authorizeContinuesFromResolvedIdentity() {
        String header = "Bearer " + jwtTokenProvider.generateToken("alice", 0L);
        AuthenticationContext identity = gate.authenticate(header);

        assertThat(gate.authorize(identity, AccessLevel.ACTIVE)).isSameAs(identity);
        assertThatThrownBy(() -> gate.authorize(identity, AccessLevel.ADMIN))
                .isInstanceOf(ForbiddenRoleException.class);
    }

    @Test
    void authorizeWithoutIdentityIsRejected() {
        AuthenticationContext empty = AuthenticationContext.fromHeader(null);

        assertThatThrownBy(() -> gate.authorize(empty, AccessLevel.ACTIVE))
                .isInstanceOf(InvalidCredentialsException.class);
    }

    @Test
    void storeOutageIsNotACredentialFailure() {
        when(userRepository.findByUsername("alice"))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));
        String header = "Bearer " + jwtTokenProvider.generateToken("alice", 0L);

        assertThatThrownBy(() -> gate.authenticate(header))
                .isInstanceOf(StoreUnavailableException.class)
                .hasCauseInstanceOf(DataAccessResourceFailureException.class);
    }

    @Test
    void stepsComposeInOrder() {
        GateStep identity = gate.extractBearer().then(gate.decodeToken());
        String token = jwtTokenProvider.generateToken("alice", 0L);

        AuthenticationContext context = identity.apply(AuthenticationContext.fromHeader("Bearer " + token));

        assertThat(context.getClaims().username()).isEqualTo("alice");
        assertThat(context.getUser()).isNull();
    }
}
