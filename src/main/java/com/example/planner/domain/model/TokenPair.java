package com.example.planner.domain.model;

public record TokenPair(String sessionId, String accessToken, String refreshToken, long expiresInSeconds) {
}
