package com.tiktimer.backend.controller;

import com.tiktimer.backend.dto.RoleUpdateRequest;
import com.tiktimer.backend.dto.StatusUpdateRequest;
import com.tiktimer.backend.dto.UserResponse;
import com.tiktimer.backend.security.AccessLevel;
import com.tiktimer.backend.security.CurrentUser;
import com.tiktimer.backend.security.UserPrincipal;
import com.tiktimer.backend.service.UserAdminService;
import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/admin/users")
@RequiredArgsConstructor
public class AdminController {

    private final UserAdminService userAdminService;

    @GetMapping
    @Operation(summary = "List all users")
    public ResponseEntity<List<UserResponse>> listUsers(@CurrentUser(AccessLevel.ADMIN) UserPrincipal admin) {
        List<UserResponse> users = userAdminService.listUsers().stream()
                .map(UserResponse::from)
                .toList();
        return ResponseEntity.ok(users);
    }

    @PutMapping("/{username}/role")
    @Operation(summary = "Change a user's role")
    public ResponseEntity<UserResponse> changeRole(@CurrentUser(AccessLevel.ADMIN) UserPrincipal admin,
                                                   @PathVariable String username,
                                                   @Valid @RequestBody RoleUpdateRequest request) {
        return ResponseEntity.ok(UserResponse.from(
                userAdminService.changeRole(username, request.role(), admin.getUsername())));
    }

    @PutMapping("/{username}/status")
    @Operation(summary = "Activate or deactivate a user")
    public ResponseEntity<UserResponse> changeStatus(@CurrentUser(AccessLevel.ADMIN) UserPrincipal admin,
                                                     @PathVariable String username,
                                                     @Valid @RequestBody StatusUpdateRequest request) {
        return ResponseEntity.ok(UserResponse.from(
                userAdminService.changeStatus(username, request.active(), admin.getUsername())));
    }

    @PostMapping("/{username}/revoke")
    @Operation(summary = "Revoke all sessions of a user")
    public ResponseEntity<Void> revokeSessions(@CurrentUser(AccessLevel.ADMIN) UserPrincipal admin,
                                               @PathVariable String username) {
        userAdminService.revokeSessions(username, admin.getUsername());
        return ResponseEntity.noContent().build();
    }
}
