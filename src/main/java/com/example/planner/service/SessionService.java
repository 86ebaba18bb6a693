package com.example.planner.service;

import com.example.planner.domain.entity.DeviceFingerprint;
import com.example.planner.domain.entity.Principal;
import com.example.planner.domain.entity.PrincipalRole;
import com.example.planner.domain.entity.RefreshToken;
import com.example.planner.domain.entity.SessionRecord;
import com.example.planner.domain.entity.SessionStatus;
import com.example.planner.domain.entity.TerminationReason;
import com.example.planner.domain.model.IssuedSession;
import com.example.planner.domain.model.SessionPolicy;
import com.example.planner.domain.model.TokenPair;
import com.example.planner.exception.InvalidCredentialsException;
import com.example.planner.exception.InvalidRefreshTokenException;
import com.example.planner.exception.SessionException;
import com.example.planner.exception.SessionExpiredException;
import com.example.planner.exception.SessionNotFoundException;
import com.example.planner.exception.SessionRevokedException;
import com.example.planner.properties.ApplicationProperties;
import com.example.planner.repository.RefreshTokenRepository;
import com.example.planner.repository.SessionRecordRepository;
import com.example.planner.util.TokenUtils;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Issues, validates, renews and terminates sessions.
 * <p>
 * The relational store is the single source of truth. Tokens are opaque 32-byte values and
 * only their SHA-256 hashes are persisted. Timeouts are evaluated lazily on every validation:
 * a request that arrives after the idle or absolute limit terminates the session and fails.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionService {

  private static final int CLEANUP_BATCH_SIZE = 500;
  private static final int MAX_HISTORY_LIMIT = 100;
  private static final Duration STALE_REFRESH_TOKEN_GRACE = Duration.ofDays(1);

  private final SessionRecordRepository sessionRepository;
  private final RefreshTokenRepository refreshTokenRepository;
  private final SessionPolicyProvider policyProvider;
  private final ApplicationProperties properties;
  private final Clock clock;

  /**
   * Creates a session for a principal that was verified upstream.
   */
  @Transactional
  public IssuedSession createSession(Principal principal, DeviceFingerprint fingerprint, String sourceAddress) {
    if (principal == null || !principal.isActive()) {
      throw new InvalidCredentialsException("Principal was not verified");
    }

    SessionPolicy policy = policyProvider.policyFor(principal.getRole());
    Instant now = clock.instant();
    String accessToken = TokenUtils.generateToken();

    SessionRecord session = SessionRecord.builder()
        .id(UUID.randomUUID().toString())
        .principalId(principal.getId())
        .role(principal.getRole())
        .accessTokenHash(TokenUtils.sha256Hex(accessToken))
        .issuedAt(now)
        .lastActivityAt(now)
        .policy(policy.role())
        .idleTimeoutSeconds(policy.idleTimeout().toSeconds())
        .absoluteTimeoutSeconds(policy.absoluteTimeout().toSeconds())
        .fingerprint(fingerprint)
        .sourceAddress(sourceAddress)
        .status(SessionStatus.ACTIVE)
        .build();
    sessionRepository.save(session);

    String refreshToken = issueRefreshToken(session, now);

    log.info("Created {} session {} for principal {} (idle {}, absolute {})",
        policy.role(), session.getId(), principal.getId(), policy.idleTimeout(), policy.absoluteTimeout());
    return new IssuedSession(session, accessToken, refreshToken);
  }

  /**
   * Validates an access token and bumps the last-activity timestamp.
   *
   * @throws SessionNotFoundException unknown token
   * @throws SessionExpiredException idle or absolute limit reached, now or earlier
   * @throws SessionRevokedException logged out, revoked or terminated by the anomaly detector
   */
  @Transactional(noRollbackFor = SessionException.class)
  public SessionRecord validateSession(String accessToken) {
    if (!TokenUtils.isWellFormed(accessToken)) {
      throw new SessionNotFoundException("Session not found");
    }

    SessionRecord session = sessionRepository.findByAccessTokenHash(TokenUtils.sha256Hex(accessToken))
        .orElseThrow(() -> new SessionNotFoundException("Session not found"));

    if (!session.isActive()) {
      throw terminatedSessionError(session);
    }

    Instant now = clock.instant();
    TerminationReason expiry = expiryReason(session, now);
    if (expiry != null) {
      sessionRepository.terminate(session.getId(), expiry, false, now);
      refreshTokenRepository.revokeBySessionId(session.getId());
      log.info("Session {} of principal {} expired ({})", session.getId(), session.getPrincipalId(), expiry);
      throw new SessionExpiredException("Session expired");
    }

    if (sessionRepository.touch(session.getId(), now) == 0) {
      // Either a concurrent request already bumped it to the same instant or it was terminated meanwhile.
      SessionRecord current = sessionRepository.findById(session.getId())
          .orElseThrow(() -> new SessionNotFoundException("Session not found"));
      if (!current.isActive()) {
        throw terminatedSessionError(current);
      }
      return current;
    }

    session.setLastActivityAt(now);
    return session;
  }

  /**
   * Consumes a refresh token and issues a new access/refresh pair in one transaction.
   * Concurrent calls with the same token race on a conditional update, so at most one succeeds.
   */
  @Transactional
  public TokenPair renewSession(String refreshToken) {
    if (!TokenUtils.isWellFormed(refreshToken)) {
      throw new InvalidRefreshTokenException("Refresh token is invalid");
    }

    Instant now = clock.instant();
    String tokenHash = TokenUtils.sha256Hex(refreshToken);

    if (refreshTokenRepository.consume(tokenHash, now) == 0) {
      log.warn("Rejected refresh token {}: unknown, already used, revoked or expired",
          TokenUtils.maskToken(refreshToken));
      throw new InvalidRefreshTokenException("Refresh token is invalid");
    }

    RefreshToken consumed = refreshTokenRepository.findByTokenHash(tokenHash)
        .orElseThrow(() -> new InvalidRefreshTokenException("Refresh token is invalid"));
    SessionRecord session = sessionRepository.findById(consumed.getSessionId())
        .orElseThrow(() -> new InvalidRefreshTokenException("Refresh token is invalid"));

    if (!session.isActive() || expiryReason(session, now) != null) {
      log.info("Refusing renewal for session {} that is no longer active", session.getId());
      throw new InvalidRefreshTokenException("Refresh token is invalid");
    }

    String accessToken = TokenUtils.generateToken();
    if (sessionRepository.rotateAccessToken(session.getId(), TokenUtils.sha256Hex(accessToken), now) == 0) {
      throw new InvalidRefreshTokenException("Refresh token is invalid");
    }
    String nextRefreshToken = issueRefreshToken(session, now);

    log.debug("Rotated tokens for session {}", session.getId());
    return new TokenPair(session.getId(), accessToken, nextRefreshToken, session.getIdleTimeoutSeconds());
  }

  /**
   * Revokes the session owning the token. Unknown or already terminated sessions are a no-op.
   */
  @Transactional
  public void revokeSession(String accessToken) {
    terminateByToken(accessToken, TerminationReason.REVOKED, true);
  }

  @Transactional
  public void logout(String accessToken) {
    terminateByToken(accessToken, TerminationReason.LOGOUT, false);
  }

  @Transactional
  public boolean revokeSessionById(String sessionId, TerminationReason reason) {
    int updated = sessionRepository.terminate(sessionId, reason, true, clock.instant());
    refreshTokenRepository.revokeBySessionId(sessionId);
    if (updated > 0) {
      log.info("Revoked session {} ({})", sessionId, reason);
    }
    return updated > 0;
  }

  /**
   * Terminates every active session of the principal and revokes their refresh tokens.
   *
   * @return number of sessions that were active
   */
  @Transactional
  public int revokeAllSessions(String principalId, TerminationReason reason) {
    int terminated = sessionRepository.terminateAllForPrincipal(principalId, reason, clock.instant());
    int tokens = refreshTokenRepository.revokeByPrincipalId(principalId);
    log.info("Revoked {} session(s) and {} refresh token(s) for principal {} ({})",
        terminated, tokens, principalId, reason);
    return terminated;
  }

  /**
   * Active sessions that are still inside both limits, newest first.
   */
  @Transactional(readOnly = true)
  public List<SessionRecord> listActiveSessions(String principalId) {
    Instant now = clock.instant();
    return sessionRepository.findByPrincipalIdAndStatusOrderByIssuedAtDesc(principalId, SessionStatus.ACTIVE)
        .stream()
        .filter(session -> expiryReason(session, now) == null)
        .toList();
  }

  @Transactional(readOnly = true)
  public List<SessionRecord> getSessionHistory(String principalId, Duration window, int limit) {
    Instant since = clock.instant().minus(window);
    int pageSize = Math.max(1, Math.min(limit, MAX_HISTORY_LIMIT));
    return sessionRepository.findByPrincipalIdAndIssuedAtAfterOrderByIssuedAtDesc(
        principalId, since, PageRequest.of(0, pageSize));
  }

  @Transactional(readOnly = true)
  public Optional<SessionRecord> findSession(String sessionId) {
    return sessionRepository.findById(sessionId);
  }

  /**
   * Most recent session of the principal, used to compare device fingerprints at login.
   */
  @Transactional(readOnly = true)
  public DeviceFingerprint lastKnownFingerprint(String principalId) {
    return sessionRepository.findFirstByPrincipalIdOrderByIssuedAtDesc(principalId)
        .map(SessionRecord::getFingerprint)
        .orElse(null);
  }

  @Transactional(readOnly = true)
  public long countSessionsIssuedSince(String principalId, Instant since) {
    return sessionRepository.countByPrincipalIdAndIssuedAtAfter(principalId, since);
  }

  /**
   * Terminates sessions whose limits have passed. Correctness does not depend on this sweep.
   */
  @Transactional
  public int terminateExpiredSessions() {
    Instant now = clock.instant();
    int terminated = 0;
    for (PrincipalRole role : PrincipalRole.values()) {
      terminated += terminateExpired(policyProvider.policyFor(role), now);
    }
    int deletedTokens = refreshTokenRepository.deleteStale(now.minus(STALE_REFRESH_TOKEN_GRACE));
    if (terminated > 0 || deletedTokens > 0) {
      log.info("Session cleanup terminated {} session(s) and deleted {} refresh token(s)", terminated, deletedTokens);
    }
    return terminated;
  }

  private int terminateExpired(SessionPolicy policy, Instant now) {
    Instant idleCutoff = now.minus(policy.idleTimeout());
    Instant absoluteCutoff = now.minus(policy.absoluteTimeout());

    int terminated = 0;
    for (SessionRecord session : sessionRepository.findExpiryCandidates(
        policy.role(), idleCutoff, absoluteCutoff, PageRequest.of(0, CLEANUP_BATCH_SIZE))) {
      TerminationReason reason = expiryReason(session, now);
      if (reason != null && sessionRepository.terminate(session.getId(), reason, false, now) > 0) {
        refreshTokenRepository.revokeBySessionId(session.getId());
        terminated++;
      }
    }
    return terminated;
  }

  /**
   * Absolute limit first: a session past its maximum duration is expired regardless of activity.
   */
  TerminationReason expiryReason(SessionRecord session, Instant now) {
    if (!now.isBefore(session.absoluteExpiry())) {
      return TerminationReason.ABSOLUTE_TIMEOUT;
    }
    if (!now.isBefore(session.idleExpiry())) {
      return TerminationReason.IDLE_TIMEOUT;
    }
    return null;
  }

  private void terminateByToken(String accessToken, TerminationReason reason, boolean revoked) {
    if (!TokenUtils.isWellFormed(accessToken)) {
      return;
    }
    sessionRepository.findByAccessTokenHash(TokenUtils.sha256Hex(accessToken)).ifPresentOrElse(session -> {
      if (sessionRepository.terminate(session.getId(), reason, revoked, clock.instant()) > 0) {
        log.info("Terminated session {} of principal {} ({})", session.getId(), session.getPrincipalId(), reason);
      }
      refreshTokenRepository.revokeBySessionId(session.getId());
    }, () -> log.debug("Termination requested for unknown token {}", TokenUtils.maskToken(accessToken)));
  }

  private String issueRefreshToken(SessionRecord session, Instant now) {
    String refreshToken = TokenUtils.generateToken();
    Instant expiresAt = now.plus(properties.security().session().refreshTokenTtl());
    if (expiresAt.isAfter(session.absoluteExpiry())) {
      expiresAt = session.absoluteExpiry();
    }
    refreshTokenRepository.save(RefreshToken.builder()
        .tokenHash(TokenUtils.sha256Hex(refreshToken))
        .sessionId(session.getId())
        .principalId(session.getPrincipalId())
        .issuedAt(now)
        .expiresAt(expiresAt)
        .build());
    return refreshToken;
  }

  private SessionException terminatedSessionError(SessionRecord session) {
    TerminationReason reason = session.getTerminationReason();
    if (reason != null && reason.isExpiry()) {
      return new SessionExpiredException("Session expired");
    }
    return new SessionRevokedException("Session revoked", session.getPrincipalId(), reason);
  }
}
