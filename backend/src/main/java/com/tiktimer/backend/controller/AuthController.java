package com.tiktimer.backend.controller;

import com.tiktimer.backend.dto.RefreshRequest;
import com.tiktimer.backend.dto.RegisterRequest;
import com.tiktimer.backend.dto.TokenResponse;
import com.tiktimer.backend.dto.UserResponse;
import com.tiktimer.backend.model.User;
import com.tiktimer.backend.security.AccessLevel;
import com.tiktimer.backend.security.CurrentUser;
import com.tiktimer.backend.security.UserPrincipal;
import com.tiktimer.backend.service.AccountService;
import com.tiktimer.backend.service.TokenPair;
import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Authentication Controller
 * Registration, password login, refresh token rotation and logout
 */
@RestController
@RequiredArgsConstructor
public class AuthController {

    private final AccountService accountService;

    @PostMapping("/register")
    @Operation(summary = "Register a new user")
    public ResponseEntity<UserResponse> register(@Valid @RequestBody RegisterRequest request) {
        User user = accountService.register(request);
        return ResponseEntity.ok(UserResponse.from(user));
    }

    /**
     * Password login; form-encoded like an OAuth2 password grant.
     */
    @PostMapping(value = "/token", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    @Operation(summary = "Log in and receive an access/refresh token pair")
    public ResponseEntity<TokenResponse> login(@RequestParam("username") String username,
                                               @RequestParam("password") String password) {
        TokenPair pair = accountService.login(username, password);
        return ResponseEntity.ok(TokenResponse.bearer(pair.accessToken(), pair.refreshToken()));
    }

    @PostMapping("/auth/refresh")
    @Operation(summary = "Exchange a refresh token for a new token pair")
    public ResponseEntity<TokenResponse> refresh(@Valid @RequestBody RefreshRequest request) {
        TokenPair pair = accountService.refresh(request.getRefreshToken());
        return ResponseEntity.ok(TokenResponse.bearer(pair.accessToken(), pair.refreshToken()));
    }

    /**
     * Revokes every session of the caller, not only the presented token.
     */
    @PostMapping("/auth/logout")
    @Operation(summary = "Revoke all access and refresh tokens of the caller")
    public ResponseEntity<Void> logout(@CurrentUser(AccessLevel.AUTHENTICATED) UserPrincipal principal) {
        accountService.logout(principal.getUserId());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/users/me")
    @Operation(summary = "Current user profile")
    public ResponseEntity<UserResponse> me(@CurrentUser User user) {
        return ResponseEntity.ok(UserResponse.from(user));
    }
}
