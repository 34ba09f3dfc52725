package com.tiktimer.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tiktimer.backend.model.Post;
import com.tiktimer.backend.model.PostStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PostResponse {
    private Long id;
    private String content;
    @JsonProperty("scheduled_time")
    private Instant scheduledTime;
    private String platform;
    private PostStatus status;
    @JsonProperty("created_at")
    private Instant createdAt;
    @JsonProperty("updated_at")
    private Instant updatedAt;

    public static PostResponse from(Post post) {
        return PostResponse.builder()
                .id(post.getId())
                .content(post.getContent())
                .scheduledTime(post.getScheduledTime())
                .platform(post.getPlatform())
                .status(post.getStatus())
                .createdAt(post.getCreatedAt())
                .updatedAt(post.getUpdatedAt())
                .build();
    }
}
