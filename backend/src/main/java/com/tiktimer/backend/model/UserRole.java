package com.tiktimer.backend.model;

public enum UserRole {
    USER,
    ADMIN
}
