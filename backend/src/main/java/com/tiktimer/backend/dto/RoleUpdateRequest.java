package com.tiktimer.backend.dto;

import com.tiktimer.backend.model.UserRole;
import jakarta.validation.constraints.NotNull;

public record RoleUpdateRequest(@NotNull UserRole role) {
}
