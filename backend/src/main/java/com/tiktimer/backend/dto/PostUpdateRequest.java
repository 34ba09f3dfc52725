package com.tiktimer.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Partial update; null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PostUpdateRequest {

    @Size(min = 1, max = 2200)
    private String content;

    @JsonProperty("scheduled_time")
    private Instant scheduledTime;

    @Size(min = 1, max = 32)
    private String platform;
}
