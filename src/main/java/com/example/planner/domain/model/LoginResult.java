package com.example.planner.domain.model;

import com.example.planner.domain.entity.AuthenticatedPrincipal;

public record LoginResult(IssuedSession session, AuthenticatedPrincipal principal) {
}
