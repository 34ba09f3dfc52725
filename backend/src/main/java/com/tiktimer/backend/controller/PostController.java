package com.tiktimer.backend.controller;

import com.tiktimer.backend.dto.PostCreateRequest;
import com.tiktimer.backend.dto.PostResponse;
import com.tiktimer.backend.dto.PostUpdateRequest;
import com.tiktimer.backend.security.CurrentUser;
import com.tiktimer.backend.security.UserPrincipal;
import com.tiktimer.backend.service.PostService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/posts")
@RequiredArgsConstructor
public class PostController {

    private final PostService postService;

    @PostMapping
    public ResponseEntity<PostResponse> create(@CurrentUser UserPrincipal principal,
                                               @Valid @RequestBody PostCreateRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(PostResponse.from(postService.create(principal.getUserId(), request)));
    }

    @GetMapping
    public ResponseEntity<List<PostResponse>> list(@CurrentUser UserPrincipal principal) {
        return ResponseEntity.ok(postService.list(principal.getUserId()).stream()
                .map(PostResponse::from)
                .toList());
    }

    @GetMapping("/{postId}")
    public ResponseEntity<PostResponse> get(@CurrentUser UserPrincipal principal, @PathVariable Long postId) {
        return ResponseEntity.ok(PostResponse.from(postService.get(principal.getUserId(), postId)));
    }

    @PatchMapping("/{postId}")
    public ResponseEntity<PostResponse> update(@CurrentUser UserPrincipal principal,
                                               @PathVariable Long postId,
                                               @Valid @RequestBody PostUpdateRequest request) {
        return ResponseEntity.ok(PostResponse.from(postService.update(principal.getUserId(), postId, request)));
    }

    @DeleteMapping("/{postId}")
    public ResponseEntity<Void> delete(@CurrentUser UserPrincipal principal, @PathVariable Long postId) {
        postService.delete(principal.getUserId(), postId);
        return ResponseEntity.noContent().build();
    }
}
