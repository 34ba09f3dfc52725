package com.tiktimer.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TikTokAuthorizationResponse(
        @JsonProperty("authorization_url") String authorizationUrl,
        String state
) {
}
