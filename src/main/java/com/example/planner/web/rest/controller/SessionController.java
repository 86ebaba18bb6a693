package com.example.planner.web.rest.controller;

import com.example.planner.domain.entity.AuthenticatedPrincipal;
import com.example.planner.domain.entity.SessionRecord;
import com.example.planner.domain.entity.TerminationReason;
import com.example.planner.properties.ApplicationProperties;
import com.example.planner.service.DeviceFingerprintValidator;
import com.example.planner.service.PrincipalDirectory;
import com.example.planner.service.SessionService;
import com.example.planner.web.rest.CurrentSession;
import com.example.planner.web.rest.dto.RevocationResponse;
import com.example.planner.web.rest.dto.SessionView;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequiredArgsConstructor
public class SessionController implements SessionAPI {

  private final SessionService sessionService;
  private final PrincipalDirectory principalDirectory;
  private final DeviceFingerprintValidator fingerprintValidator;
  private final ApplicationProperties properties;

  @Override
  public ResponseEntity<List<SessionView>> listActiveSessions(String principalId) {
    String target = resolveTarget(principalId);
    return ResponseEntity.ok(toViews(sessionService.listActiveSessions(target)));
  }

  @Override
  public ResponseEntity<List<SessionView>> getSessionHistory(String principalId, Integer days, Integer limit) {
    String target = resolveTarget(principalId);
    ApplicationProperties.SecurityProperties.SessionProperties sessionProps = properties.security().session();
    Duration window = days != null ? Duration.ofDays(days) : sessionProps.historyRetention();
    int effectiveLimit = limit != null ? limit : sessionProps.historyLimit();
    return ResponseEntity.ok(toViews(sessionService.getSessionHistory(target, window, effectiveLimit)));
  }

  @Override
  public ResponseEntity<Void> revokeSession(String sessionId) {
    Optional<SessionRecord> session = sessionService.findSession(sessionId);
    if (session.isEmpty()) {
      return ResponseEntity.notFound().build();
    }
    AuthenticatedPrincipal caller = CurrentSession.require().getPrincipal();
    principalDirectory.assertCanOversee(caller, session.get().getPrincipalId());

    sessionService.revokeSessionById(sessionId, TerminationReason.REVOKED);
    log.info("Principal {} revoked session {}", caller.id(), sessionId);
    return ResponseEntity.noContent().build();
  }

  @Override
  public ResponseEntity<RevocationResponse> revokeAllSessions(String principalId) {
    String target = resolveTarget(principalId);
    int revoked = sessionService.revokeAllSessions(target, TerminationReason.REVOKED);
    return ResponseEntity.ok(new RevocationResponse(target, revoked));
  }

  private String resolveTarget(String principalId) {
    AuthenticatedPrincipal caller = CurrentSession.require().getPrincipal();
    String target = principalId != null && !principalId.isBlank() ? principalId : caller.id();
    principalDirectory.assertCanOversee(caller, target);
    return target;
  }

  private List<SessionView> toViews(List<SessionRecord> sessions) {
    return sessions.stream()
        .map(s -> SessionView.from(s, s.getFingerprint() != null ? fingerprintValidator.describe(s.getFingerprint()) : null))
        .toList();
  }
}
