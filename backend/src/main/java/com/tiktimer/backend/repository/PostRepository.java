package com.tiktimer.backend.repository;

import com.tiktimer.backend.model.Post;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface PostRepository extends JpaRepository<Post, Long> {
    List<Post> findByUserIdOrderByScheduledTimeAsc(Long userId);
    Optional<Post> findByIdAndUserId(Long id, Long userId);
}
