package com.tiktimer.backend.service;

/**
 * Freshly minted credentials. The raw refresh token exists only here; the store keeps its digest.
 */
public record TokenPair(String accessToken, String refreshToken) {

    @Override
    public String toString() {
        return "TokenPair[redacted]";
    }
}
