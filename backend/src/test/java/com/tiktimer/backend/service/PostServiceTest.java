package com.tiktimer.backend.service;

import com.tiktimer.backend.dto.PostCreateRequest;
import com.tiktimer.backend.dto.PostUpdateRequest;
import com.tiktimer.backend.exception.BadRequestException;
import com.tiktimer.backend.exception.NotFoundException;
import com.tiktimer.backend.model.Post;
import com.tiktimer.backend.model.PostStatus;
import com.tiktimer.backend.repository.PostRepository;
import com.tiktimer.backend.util.TestAuthFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static com.tiktimer.backend.util.TestAuthFactory.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PostServiceTest {

    private PostRepository postRepository;
    private PostService postService;

    @BeforeEach
    void setUp() {
        postRepository = mock(PostRepository.class);
        postService = new PostService(postRepository, TestAuthFactory.clockAt(NOW));
        when(postRepository.save(any(Post.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    private Post scheduledPost() {
        return Post.builder()
                .id(5L)
                .userId(1L)
                .content("hello")
                .scheduledTime(NOW.plus(Duration.ofHours(2)))
                .platform("tiktok")
                .status(PostStatus.SCHEDULED)
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }

    @Test
    void createSchedulesPostForOwner() {
        Post post = postService.create(1L, PostCreateRequest.builder()
                .content("first clip")
                .scheduledTime(NOW.plus(Duration.ofHours(1)))
                .build());

        assertThat(post.getUserId()).isEqualTo(1L);
        assertThat(post.getStatus()).isEqualTo(PostStatus.SCHEDULED);
        assertThat(post.getPlatform()).isEqualTo("tiktok");
        assertThat(post.getCreatedAt()).isEqualTo(NOW);
    }

    @Test
    void createRejectsPastOrPresentTime() {
        assertThatThrownBy(() -> postService.create(1L, PostCreateRequest.builder()
                .content("late")
                .scheduledTime(NOW)
                .build()))
                .isInstanceOf(BadRequestException.class)
                .hasMessage("Scheduled time must be in the future");
    }

    @Test
    void otherUsersPostIsNotFound() {
        when(postRepository.findByIdAndUserId(5L, 2L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> postService.get(2L, 5L))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void updateAppliesOnlyProvidedFields() {
        Post post = scheduledPost();
        when(postRepository.findByIdAndUserId(5L, 1L)).thenReturn(Optional.of(post));

        Post updated = postService.update(1L, 5L, PostUpdateRequest.builder().content("edited").build());

        assertThat(updated.getContent()).isEqualTo("edited");
        assertThat(updated.getScheduledTime()).isEqualTo(NOW.plus(Duration.ofHours(2)));
        assertThat(updated.getPlatform()).isEqualTo("tiktok");
    }

    @Test
    void publishedPostCannotBeEdited() {
        Post post = scheduledPost();
        post.setStatus(PostStatus.PUBLISHED);
        when(postRepository.findByIdAndUserId(5L, 1L)).thenReturn(Optional.of(post));

        assertThatThrownBy(() -> postService.update(1L, 5L, PostUpdateRequest.builder().content("x").build()))
                .isInstanceOf(BadRequestException.class);
    }

    @Test
    void deleteRemovesOwnedPost() {
        Post post = scheduledPost();
        when(postRepository.findByIdAndUserId(5L, 1L)).thenReturn(Optional.of(post));

        postService.delete(1L, 5L);

        verify(postRepository).delete(post);
    }
}
