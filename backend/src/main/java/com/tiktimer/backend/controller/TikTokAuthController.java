package com.tiktimer.backend.controller;

import com.tiktimer.backend.dto.MessageResponse;
import com.tiktimer.backend.dto.TikTokAuthorizationResponse;
import com.tiktimer.backend.security.CurrentUser;
import com.tiktimer.backend.security.UserPrincipal;
import com.tiktimer.backend.service.TikTokAuthService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/auth/tiktok")
@RequiredArgsConstructor
public class TikTokAuthController {

    private final TikTokAuthService tikTokAuthService;

    @GetMapping("/authorize")
    public ResponseEntity<TikTokAuthorizationResponse> authorize() {
        String state = tikTokAuthService.newState();
        return ResponseEntity.ok(new TikTokAuthorizationResponse(tikTokAuthService.buildAuthorizationUrl(state), state));
    }

    @GetMapping("/callback")
    public ResponseEntity<MessageResponse> callback(@CurrentUser UserPrincipal principal,
                                                    @RequestParam("code") String code,
                                                    @RequestParam("state") String state) {
        tikTokAuthService.connect(principal.getUserId(), code);
        return ResponseEntity.ok(new MessageResponse("TikTok account connected successfully"));
    }

    @DeleteMapping("/disconnect")
    public ResponseEntity<MessageResponse> disconnect(@CurrentUser UserPrincipal principal) {
        tikTokAuthService.disconnect(principal.getUserId());
        return ResponseEntity.ok(new MessageResponse("TikTok account disconnected successfully"));
    }
}
