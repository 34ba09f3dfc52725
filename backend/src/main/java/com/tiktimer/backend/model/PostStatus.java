package com.tiktimer.backend.model;

public enum PostStatus {
    SCHEDULED,
    PUBLISHED,
    FAILED
}
