package com.tiktimer.backend.service;

import com.tiktimer.backend.dto.PostCreateRequest;
import com.tiktimer.backend.dto.PostUpdateRequest;
import com.tiktimer.backend.exception.BadRequestException;
import com.tiktimer.backend.exception.NotFoundException;
import com.tiktimer.backend.model.Post;
import com.tiktimer.backend.model.PostStatus;
import com.tiktimer.backend.repository.PostRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

@Slf4j
@Service
@RequiredArgsConstructor
public class PostService {

    static final String DEFAULT_PLATFORM = "tiktok";

    private final PostRepository postRepository;
    private final Clock clock;

    @Transactional
    public Post create(Long userId, PostCreateRequest request) {
        Instant now = clock.instant();
        if (!request.getScheduledTime().isAfter(now)) {
            throw new BadRequestException("Scheduled time must be in the future");
        }
        Post post = Post.builder()
                .userId(userId)
                .content(request.getContent())
                .scheduledTime(request.getScheduledTime())
                .platform(normalizePlatform(request.getPlatform()))
                .status(PostStatus.SCHEDULED)
                .createdAt(now)
                .updatedAt(now)
                .build();
        Post saved = postRepository.save(post);
        log.info("Created post {} for user {}", saved.getId(), userId);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<Post> list(Long userId) {
        return postRepository.findByUserIdOrderByScheduledTimeAsc(userId);
    }

    @Transactional(readOnly = true)
    public Post get(Long userId, Long postId) {
        return postRepository.findByIdAndUserId(postId, userId)
                .orElseThrow(() -> new NotFoundException("Post not found"));
    }

    @Transactional
    public Post update(Long userId, Long postId, PostUpdateRequest request) {
        Post post = get(userId, postId);
        if (post.getStatus() != PostStatus.SCHEDULED) {
            throw new BadRequestException("Only scheduled posts can be edited");
        }
        if (request.getContent() != null) {
            post.setContent(request.getContent());
        }
        if (request.getScheduledTime() != null) {
            if (!request.getScheduledTime().isAfter(clock.instant())) {
                throw new BadRequestException("Scheduled time must be in the future");
            }
            post.setScheduledTime(request.getScheduledTime());
        }
        if (request.getPlatform() != null) {
            post.setPlatform(normalizePlatform(request.getPlatform()));
        }
        post.setUpdatedAt(clock.instant());
        Post saved = postRepository.save(post);
        log.info("Updated post {} for user {}", postId, userId);
        return saved;
    }

    @Transactional
    public void delete(Long userId, Long postId) {
        Post post = get(userId, postId);
        postRepository.delete(post);
        log.info("Deleted post {} for user {}", postId, userId);
    }

    private String normalizePlatform(String platform) {
        if (platform == null || platform.isBlank()) {
            return DEFAULT_PLATFORM;
        }
        return platform.trim().toLowerCase(Locale.ROOT);
    }
}
