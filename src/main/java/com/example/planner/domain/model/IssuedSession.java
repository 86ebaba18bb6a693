package com.example.planner.domain.model;

import com.example.planner.domain.entity.SessionRecord;

/**
 * A freshly created session with the only plaintext copies of its tokens.
 */
public record IssuedSession(SessionRecord session, String accessToken, String refreshToken) {

  public TokenPair tokens() {
    return new TokenPair(session.getId(), accessToken, refreshToken, session.getIdleTimeoutSeconds());
  }
}
