package com.tiktimer.backend.security;

import com.tiktimer.backend.model.UserRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserPrincipal {
    private Long userId;
    private String username;
    private UserRole role;
    private long tokenVersion;

    @ToString.Exclude
    private AuthenticationContext context;

    public static UserPrincipal from(AuthenticationContext context) {
        return UserPrincipal.builder()
                .userId(context.getUser().getId())
                .username(context.getUser().getUsername())
                .role(context.getUser().getRole())
                .tokenVersion(context.getUser().getTokenVersion())
                .context(context)
                .build();
    }
}
