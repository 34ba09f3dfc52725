package com.tiktimer.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * User Entity for authentication and external platform linkage
 */
@Entity
@Table(name = "users")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, updatable = false, length = 50)
    private String username;

    @Column(nullable = false, unique = true, updatable = false, length = 255)
    private String email;

    @ToString.Exclude
    @Column(nullable = false)
    private String passwordHash;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private UserRole role = UserRole.USER;

    // Refresh token state: both set or both null.
    @ToString.Exclude
    @Column
    private String refreshTokenHash;

    @Column
    @Convert(converter = UtcInstantConverter.class)
    private Instant refreshTokenExpiresAt;

    @Column(nullable = false)
    @Builder.Default
    private long tokenVersion = 0L;

    @Column(nullable = false, updatable = false)
    @Convert(converter = UtcInstantConverter.class)
    private Instant createdAt;

    // TikTok OAuth fields
    @ToString.Exclude
    @Column(length = 1500)
    private String tiktokAccessToken;

    @ToString.Exclude
    @Column(length = 1500)
    private String tiktokRefreshToken;

    @Column(length = 128)
    private String tiktokOpenId;

    @Column
    @Convert(converter = UtcInstantConverter.class)
    private Instant tiktokTokenExpiresAt;

    public boolean hasRefreshToken() {
        return refreshTokenHash != null;
    }

    public boolean isAdmin() {
        return role == UserRole.ADMIN;
    }

    public boolean isTiktokConnected() {
        return tiktokAccessToken != null;
    }

    /**
     * Installs a new refresh token digest, replacing any previous one.
     */
    public void replaceRefreshToken(String digest, Instant expiresAt) {
        if (digest == null || expiresAt == null) {
            throw new IllegalArgumentException("Refresh token digest and expiry must be set together");
        }
        this.refreshTokenHash = digest;
        this.refreshTokenExpiresAt = expiresAt;
    }

    public void clearRefreshToken() {
        this.refreshTokenHash = null;
        this.refreshTokenExpiresAt = null;
    }

    /**
     * Moves the account to the next revocation epoch and drops the outstanding refresh token.
     */
    public void revokeAllCredentials() {
        this.tokenVersion = this.tokenVersion + 1;
        clearRefreshToken();
    }

    public void clearTiktokConnection() {
        this.tiktokAccessToken = null;
        this.tiktokRefreshToken = null;
        this.tiktokOpenId = null;
        this.tiktokTokenExpiresAt = null;
    }
}
