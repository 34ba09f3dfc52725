package com.tiktimer.backend.dto;

public record MessageResponse(String message) {
}
