package com.tiktimer.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tiktimer.backend.model.User;
import com.tiktimer.backend.model.UserRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Public view of a user record. Never carries password, refresh token or platform token fields.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserResponse {
    private Long id;
    private String username;
    private String email;
    @JsonProperty("is_active")
    private boolean active;
    private UserRole role;
    @JsonProperty("tiktok_connected")
    private boolean tiktokConnected;
    @JsonProperty("created_at")
    private Instant createdAt;

    public static UserResponse from(User user) {
        return UserResponse.builder()
                .id(user.getId())
                .username(user.getUsername())
                .email(user.getEmail())
                .active(user.isActive())
                .role(user.getRole())
                .tiktokConnected(user.isTiktokConnected())
                .createdAt(user.getCreatedAt())
                .build();
    }
}
