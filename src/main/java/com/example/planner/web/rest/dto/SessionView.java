package com.example.planner.web.rest.dto;

import com.example.planner.domain.entity.PrincipalRole;
import com.example.planner.domain.entity.SessionRecord;
import com.example.planner.domain.entity.SessionStatus;
import com.example.planner.domain.entity.TerminationReason;
import com.example.planner.util.TokenUtils;
import java.time.Instant;

/**
 * Session as shown to its owner or the owner's guardian. Never carries token material.
 */
public record SessionView(
    String sessionId,
    String principalId,
    PrincipalRole role,
    Instant issuedAt,
    Instant lastActivityAt,
    Instant idleExpiresAt,
    Instant absoluteExpiresAt,
    String device,
    String sourceAddress,
    SessionStatus status,
    TerminationReason terminationReason,
    Instant terminatedAt
) {
  public static SessionView from(SessionRecord session, String deviceDescription) {
    return new SessionView(
        session.getId(),
        session.getPrincipalId(),
        session.getRole(),
        session.getIssuedAt(),
        session.getLastActivityAt(),
        session.isActive() ? session.idleExpiry() : null,
        session.absoluteExpiry(),
        deviceDescription,
        TokenUtils.maskAddress(session.getSourceAddress()),
        session.getStatus(),
        session.getTerminationReason(),
        session.getTerminatedAt());
  }
}
