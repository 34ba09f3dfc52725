package com.tiktimer.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "posts")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Post {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long userId;

    @Column(nullable = false, length = 2200)
    private String content;

    @Column(nullable = false)
    @Convert(converter = UtcInstantConverter.class)
    private Instant scheduledTime;

    @Column(nullable = false, length = 32)
    @Builder.Default
    private String platform = "tiktok";

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private PostStatus status = PostStatus.SCHEDULED;

    @Column(nullable = false, updatable = false)
    @Convert(converter = UtcInstantConverter.class)
    private Instant createdAt;

    @Column(nullable = false)
    @Convert(converter = UtcInstantConverter.class)
    private Instant updatedAt;
}
