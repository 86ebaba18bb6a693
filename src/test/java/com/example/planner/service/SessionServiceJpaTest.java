package com.example.planner.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.planner.MutableClock;
import com.example.planner.TestProperties;
import com.example.planner.domain.entity.Principal;
import com.example.planner.domain.entity.PrincipalRole;
import com.example.planner.domain.entity.SessionRecord;
import com.example.planner.domain.entity.SessionStatus;
import com.example.planner.domain.entity.TerminationReason;
import com.example.planner.domain.model.IssuedSession;
import com.example.planner.domain.model.SessionPolicy;
import com.example.planner.domain.model.TokenPair;
import com.example.planner.exception.InvalidRefreshTokenException;
import com.example.planner.exception.SessionExpiredException;
import com.example.planner.exception.SessionNotFoundException;
import com.example.planner.exception.SessionRevokedException;
import com.example.planner.properties.ApplicationProperties;
import com.example.planner.repository.RefreshTokenRepository;
import com.example.planner.repository.SessionRecordRepository;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.data.domain.PageRequest;

/**
 * Runs the session lifecycle against the real repositories and their conditional updates.
 */
@DataJpaTest
@DisplayName("SessionService with JPA repositories")
class SessionServiceJpaTest {

  private static final Instant START = Instant.parse("2026-03-02T15:00:00Z");

  @Autowired
  private SessionRecordRepository sessionRepository;

  @Autowired
  private RefreshTokenRepository refreshTokenRepository;

  private MutableClock clock;
  private SessionService sessionService;

  @BeforeEach
  void setUp() {
    ApplicationProperties properties = TestProperties.defaults();
    clock = new MutableClock(START, ZoneOffset.UTC);
    sessionService = new SessionService(
        sessionRepository, refreshTokenRepository, new SessionPolicyProvider(properties), properties, clock);
  }

  private static Principal child(String id) {
    return Principal.builder()
        .id(id)
        .role(PrincipalRole.CHILD)
        .loginName("login-" + id)
        .credentialHash("hash")
        .guardianId("adult-1")
        .build();
  }

  private static Principal adult(String id) {
    return Principal.builder()
        .id(id)
        .role(PrincipalRole.ADULT)
        .loginName("login-" + id)
        .credentialHash("hash")
        .build();
  }

  private SessionRecord reload(IssuedSession issued) {
    return sessionService.findSession(issued.session().getId()).orElseThrow();
  }

  @Nested
  @DisplayName("renewSession")
  class RenewSession {

    @Test
    @DisplayName("accepts a refresh token once and retires the previous access token")
    void refreshTokenSingleUse() {
      // given
      IssuedSession issued = sessionService.createSession(child("child-1"), null, "203.0.113.9");

      // when
      TokenPair renewed = sessionService.renewSession(issued.refreshToken());

      // then
      assertThatThrownBy(() -> sessionService.renewSession(issued.refreshToken()))
          .isInstanceOf(InvalidRefreshTokenException.class);
      assertThatThrownBy(() -> sessionService.validateSession(issued.accessToken()))
          .isInstanceOf(SessionNotFoundException.class);
      assertThat(sessionService.validateSession(renewed.accessToken()).getId())
          .isEqualTo(issued.session().getId());
      assertThat(sessionService.renewSession(renewed.refreshToken()).sessionId())
          .isEqualTo(issued.session().getId());
    }

    @Test
    @DisplayName("rejects the refresh token of a revoked session")
    void revokedSession() {
      // given
      IssuedSession issued = sessionService.createSession(child("child-1"), null, null);
      sessionService.revokeSession(issued.accessToken());

      // when / then
      assertThatThrownBy(() -> sessionService.renewSession(issued.refreshToken()))
          .isInstanceOf(InvalidRefreshTokenException.class);
    }
  }

  @Nested
  @DisplayName("validateSession")
  class ValidateSession {

    @Test
    @DisplayName("activity inside the idle limit keeps a child session alive")
    void activityExtendsIdleWindow() {
      // given
      IssuedSession issued = sessionService.createSession(child("child-1"), null, null);
      clock.advance(Duration.ofMinutes(15));
      sessionService.validateSession(issued.accessToken());

      // when
      clock.advance(Duration.ofMinutes(15));
      SessionRecord session = sessionService.validateSession(issued.accessToken());

      // then
      assertThat(session.getLastActivityAt()).isEqualTo(START.plus(Duration.ofMinutes(30)));
      assertThat(reload(issued).getStatus()).isEqualTo(SessionStatus.ACTIVE);
    }

    @Test
    @DisplayName("an idle child session expires at 20 minutes and stays terminated")
    void childIdleExpiry() {
      // given
      IssuedSession issued = sessionService.createSession(child("child-1"), null, null);
      clock.advance(SessionPolicy.CHILD_IDLE_TIMEOUT);

      // when / then
      assertThatThrownBy(() -> sessionService.validateSession(issued.accessToken()))
          .isInstanceOf(SessionExpiredException.class);
      SessionRecord stored = reload(issued);
      assertThat(stored.getStatus()).isEqualTo(SessionStatus.TERMINATED);
      assertThat(stored.getTerminationReason()).isEqualTo(TerminationReason.IDLE_TIMEOUT);

      clock.set(START.plusSeconds(60));
      assertThatThrownBy(() -> sessionService.validateSession(issued.accessToken()))
          .isInstanceOf(SessionExpiredException.class);
      assertThatThrownBy(() -> sessionService.renewSession(issued.refreshToken()))
          .isInstanceOf(InvalidRefreshTokenException.class);
    }

    @Test
    @DisplayName("a revoked session is never brought back")
    void revokedTwice() {
      // given
      IssuedSession issued = sessionService.createSession(adult("adult-1"), null, null);
      sessionService.revokeSession(issued.accessToken());

      // when
      sessionService.revokeSession(issued.accessToken());

      // then
      assertThatThrownBy(() -> sessionService.validateSession(issued.accessToken()))
          .isInstanceOf(SessionRevokedException.class);
      SessionRecord stored = reload(issued);
      assertThat(stored.getStatus()).isEqualTo(SessionStatus.TERMINATED);
      assertThat(stored.isRevoked()).isTrue();
      assertThat(stored.getTerminationReason()).isEqualTo(TerminationReason.REVOKED);
    }
  }

  @Nested
  @DisplayName("terminateExpiredSessions")
  class TerminateExpiredSessions {

    @Test
    @DisplayName("expires idle child sessions and leaves adult sessions inside their own limits alone")
    void perPolicyCutoffs() {
      // given
      List<IssuedSession> adults = List.of(
          sessionService.createSession(adult("adult-1"), null, null),
          sessionService.createSession(adult("adult-2"), null, null),
          sessionService.createSession(adult("adult-3"), null, null));
      IssuedSession child = sessionService.createSession(child("child-1"), null, null);
      clock.advance(Duration.ofMinutes(30));
      Instant now = clock.instant();

      // when
      int terminated = sessionService.terminateExpiredSessions();

      // then
      assertThat(terminated).isEqualTo(1);
      assertThat(reload(child).getTerminationReason()).isEqualTo(TerminationReason.IDLE_TIMEOUT);
      adults.forEach(adult -> assertThat(reload(adult).getStatus()).isEqualTo(SessionStatus.ACTIVE));
      assertThat(sessionRepository.findExpiryCandidates(PrincipalRole.ADULT,
          now.minus(Duration.ofHours(2)), now.minus(Duration.ofHours(24)), PageRequest.of(0, 10))).isEmpty();
    }

    @Test
    @DisplayName("candidates come least recently used first")
    void oldestActivityFirst() {
      // given
      IssuedSession older = sessionService.createSession(child("child-1"), null, null);
      clock.advance(Duration.ofMinutes(5));
      sessionService.createSession(child("child-2"), null, null);
      clock.advance(Duration.ofMinutes(35));
      Instant now = clock.instant();

      // when
      List<SessionRecord> firstPage = sessionRepository.findExpiryCandidates(PrincipalRole.CHILD,
          now.minus(SessionPolicy.CHILD_IDLE_TIMEOUT), now.minus(SessionPolicy.CHILD_ABSOLUTE_TIMEOUT),
          PageRequest.of(0, 1));

      // then
      assertThat(firstPage).extracting(SessionRecord::getId).containsExactly(older.session().getId());
    }
  }
}
