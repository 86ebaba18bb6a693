package com.example.planner.web.rest.dto;

public record RevocationResponse(String principalId, int revokedSessions) {
}
