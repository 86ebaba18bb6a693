package com.example.planner.web.rest.dto;

import com.example.planner.domain.model.LoginResult;
import com.example.planner.domain.model.TokenPair;

public record LoginResponse(
    String sessionId,
    String accessToken,
    String refreshToken,
    long expiresIn,
    PrincipalSummary principal
) {
  public static LoginResponse from(LoginResult result) {
    TokenPair tokens = result.session().tokens();
    return new LoginResponse(
        tokens.sessionId(),
        tokens.accessToken(),
        tokens.refreshToken(),
        tokens.expiresInSeconds(),
        PrincipalSummary.from(result.principal()));
  }
}
