package com.tiktimer.backend.service;

import com.tiktimer.backend.config.JwtProperties;
import com.tiktimer.backend.exception.InactiveAccountException;
import com.tiktimer.backend.exception.InvalidCredentialsException;
import com.tiktimer.backend.model.User;
import com.tiktimer.backend.repository.UserRepository;
import com.tiktimer.backend.security.BCryptCredentialHasher;
import com.tiktimer.backend.security.JwtTokenProvider;
import com.tiktimer.backend.util.TestAuthFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

import static com.tiktimer.backend.util.TestAuthFactory.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RefreshTokenServiceTest {

    private UserRepository userRepository;
    private BCryptCredentialHasher hasher;
    private JwtProperties jwtProperties;
    private JwtTokenProvider jwtTokenProvider;
    private RefreshTokenService service;
    private User alice;

    @BeforeEach
    void setUp() {
        userRepository = mock(UserRepository.class);
        hasher = TestAuthFactory.fastHasher();
        jwtProperties = TestAuthFactory.jwtProperties(TestAuthFactory.SECRET, "HS256");
        jwtTokenProvider = TestAuthFactory.tokenProvider(jwtProperties, TestAuthFactory.clockAt(NOW));
        service = serviceAt(TestAuthFactory.clockAt(NOW));
        alice = TestAuthFactory.user(7L, "alice");
        when(userRepository.findByIdForUpdate(7L)).thenReturn(Optional.of(alice));
        when(userRepository.save(any(User.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    private RefreshTokenService serviceAt(Clock clock) {
        return new RefreshTokenService(userRepository, hasher, jwtTokenProvider, jwtProperties, clock);
    }

    @Test
    void issueStoresOnlyDigestAndExpiry() {
        String raw = service.issue(alice);

        assertThat(raw).startsWith("7.");
        assertThat(raw.substring(2)).hasSize(43).matches("[A-Za-z0-9_-]+");
        assertThat(alice.getRefreshTokenHash()).isNotEqualTo(raw);
        assertThat(hasher.verify(raw, alice.getRefreshTokenHash())).isTrue();
        assertThat(alice.getRefreshTokenExpiresAt()).isEqualTo(NOW.plus(Duration.ofDays(7)));
        verify(userRepository).save(alice);
    }

    @Test
    void issueReplacesPreviousToken() {
        String first = service.issue(alice);
        String second = service.issue(alice);

        assertThat(second).isNotEqualTo(first);
        assertThat(hasher.verify(first, alice.getRefreshTokenHash())).isFalse();
        assertThat(hasher.verify(second, alice.getRefreshTokenHash())).isTrue();
    }

    @Test
    void issueRequiresPersistedUser() {
        User transientUser = TestAuthFactory.user(null, "bob");

        assertThatThrownBy(() -> service.issue(transientUser))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rotateReturnsNewPairAtCurrentVersion() {
        alice.setTokenVersion(2L);
        String raw = service.issue(alice);

        TokenPair pair = service.rotate(raw);

        assertThat(pair.refreshToken()).isNotEqualTo(raw).startsWith("7.");
        assertThat(jwtTokenProvider.parse(pair.accessToken()).version()).isEqualTo(2L);
        assertThat(jwtTokenProvider.parse(pair.accessToken()).username()).isEqualTo("alice");
    }

    @Test
    void rotatedTokenCannotBeReplayed() {
        String raw = service.issue(alice);
        TokenPair pair = service.rotate(raw);

        assertThatThrownBy(() -> service.rotate(raw))
                .isInstanceOf(InvalidCredentialsException.class);
        assertThat(service.rotate(pair.refreshToken()).refreshToken()).isNotBlank();
    }

    @Test
    void expiredTokenIsRejected() {
        String raw = service.issue(alice);
        RefreshTokenService later = serviceAt(TestAuthFactory.clockAt(NOW.plus(Duration.ofDays(7))));

        assertThatThrownBy(() -> later.rotate(raw))
                .isInstanceOf(InvalidCredentialsException.class)
                .hasMessageContaining("expired");
    }

    @Test
    void revokedTokenIsRejected() {
        String raw = service.issue(alice);
        alice.revokeAllCredentials();

        assertThatThrownBy(() -> service.rotate(raw))
                .isInstanceOf(InvalidCredentialsException.class);
    }

    @Test
    void tokenForAnotherUserIsRejected() {
        User bob = TestAuthFactory.user(8L, "bob");
        when(userRepository.findByIdForUpdate(8L)).thenReturn(Optional.of(bob));
        String alicesToken = service.issue(alice);
        service.issue(bob);

        String retargeted = "8" + alicesToken.substring(1);

        assertThatThrownBy(() -> service.rotate(retargeted))
                .isInstanceOf(InvalidCredentialsException.class);
    }

    @Test
    void unknownSelectorIsRejected() {
        when(userRepository.findByIdForUpdate(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.rotate("99.AAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAA"))
                .isInstanceOf(InvalidCredentialsException.class);
    }

    @Test
    void malformedTokensNeverReachTheStore() {
        for (String malformed : new String[]{null, "", "  ", "no-separator", ".secret", "7.", "abc.secret",
                "7." + "x".repeat(80)}) {
            assertThatThrownBy(() -> service.rotate(malformed))
                    .as("token %s", malformed)
                    .isInstanceOf(InvalidCredentialsException.class);
        }
        verify(userRepository, never()).findByIdForUpdate(anyLong());
    }

    @Test
    void inactiveUserCannotRotate() {
        String raw = service.issue(alice);
        alice.setActive(false);

        assertThatThrownBy(() -> service.rotate(raw))
                .isInstanceOf(InactiveAccountException.class);
    }

    @Test
    void userWithoutOutstandingTokenIsRejected() {
        assertThatThrownBy(() -> service.rotate("7.AAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAA"))
                .isInstanceOf(InvalidCredentialsException.class)
                .hasMessageContaining("No outstanding");
    }
}
