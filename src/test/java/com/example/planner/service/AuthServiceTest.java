package com.example.planner.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.planner.TestProperties;
import com.example.planner.domain.entity.DeviceFingerprint;
import com.example.planner.domain.entity.Principal;
import com.example.planner.domain.entity.PrincipalRole;
import com.example.planner.domain.entity.SessionRecord;
import com.example.planner.domain.model.AnomalySignal;
import com.example.planner.domain.model.DeviceDescriptor;
import com.example.planner.domain.model.IssuedSession;
import com.example.planner.domain.model.LoginCommand;
import com.example.planner.domain.model.LoginResult;
import com.example.planner.exception.AnomalyThresholdExceededException;
import com.example.planner.exception.InvalidCredentialsException;
import com.example.planner.notification.GuardianNotificationPublisher;
import com.example.planner.notification.NotificationType;
import com.example.planner.security.AnomalyDetector;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("AuthService")
class AuthServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-02T15:00:00Z");
  private static final DeviceDescriptor IPAD = new DeviceDescriptor(
      "Mozilla/5.0 (iPad; CPU OS 17_0 like Mac OS X) Safari/604.1", "iPad", false, "1024x768", "en-US", "UTC");
  private static final DeviceDescriptor WINDOWS_LAPTOP = new DeviceDescriptor(
      "Mozilla/5.0 (Windows NT 10.0) Chrome/124.0", "Win32", false, "1920x1080", "en-US", "UTC");

  @Mock
  private CredentialVerifier credentialVerifier;

  @Mock
  private SessionService sessionService;

  @Mock
  private AnomalyDetector anomalyDetector;

  @Mock
  private GuardianNotificationPublisher notificationPublisher;

  private final DeviceFingerprintValidator fingerprintValidator = new DeviceFingerprintValidator();
  private AuthService authService;

  private final Principal tim = Principal.builder()
      .id("child-1")
      .role(PrincipalRole.CHILD)
      .loginName("tim")
      .credentialHash("hash")
      .guardianId("adult-1")
      .displayName("Tim")
      .build();

  @BeforeEach
  void setUp() {
    authService = new AuthService(
        credentialVerifier,
        fingerprintValidator,
        sessionService,
        anomalyDetector,
        notificationPublisher,
        TestProperties.defaults(),
        Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private IssuedSession issuedFor(Principal principal) {
    SessionRecord session = SessionRecord.builder()
        .id("session-1")
        .principalId(principal.getId())
        .role(principal.getRole())
        .idleTimeoutSeconds(1200)
        .absoluteTimeoutSeconds(7200)
        .issuedAt(NOW)
        .lastActivityAt(NOW)
        .build();
    return new IssuedSession(session, "access", "refresh");
  }

  private static LoginCommand childLogin(String pin, DeviceDescriptor device) {
    return new LoginCommand("tim", pin, null, null, device, "192.168.1.20");
  }

  @Nested
  @DisplayName("child login")
  class ChildLogin {

    @Test
    @DisplayName("tim with PIN 1234 on his usual device gets a session and the guardian is told")
    void successfulLoginOnKnownDevice() {
      // given
      DeviceFingerprint known = fingerprintValidator.fingerprint(IPAD);
      when(credentialVerifier.verifyChild("tim", "1234")).thenReturn(tim);
      when(sessionService.lastKnownFingerprint("child-1")).thenReturn(known);
      when(sessionService.createSession(eq(tim), any(DeviceFingerprint.class), eq("192.168.1.20")))
          .thenReturn(issuedFor(tim));

      // when
      LoginResult result = authService.login(childLogin("1234", IPAD));

      // then
      assertThat(result.session().tokens().expiresInSeconds()).isEqualTo(1200);
      assertThat(result.principal().id()).isEqualTo("child-1");
      assertThat(result.principal().isChild()).isTrue();
      verify(anomalyDetector, never()).recordSignal(anyString(), eq(AnomalySignal.NEW_DEVICE_LOGIN));
      verify(notificationPublisher).publish(eq(NotificationType.CHILD_LOGIN), eq("child-1"), anyString(), anyMap());
    }

    @Test
    @DisplayName("a login from a different device records a new-device signal but still succeeds")
    void newDeviceIsSignalled() {
      // given
      when(credentialVerifier.verifyChild("tim", "1234")).thenReturn(tim);
      when(sessionService.lastKnownFingerprint("child-1")).thenReturn(fingerprintValidator.fingerprint(IPAD));
      when(sessionService.createSession(eq(tim), any(DeviceFingerprint.class), anyString()))
          .thenReturn(issuedFor(tim));

      // when
      LoginResult result = authService.login(childLogin("1234", WINDOWS_LAPTOP));

      // then
      assertThat(result.session()).isNotNull();
      verify(anomalyDetector).recordSignal("child-1", AnomalySignal.NEW_DEVICE_LOGIN);
      verify(anomalyDetector).evaluate("child-1");
    }

    @Test
    @DisplayName("a third session inside the rapid window records a rapid-creation signal")
    void rapidSessionCreation() {
      // given
      when(credentialVerifier.verifyChild("tim", "1234")).thenReturn(tim);
      when(sessionService.countSessionsIssuedSince(eq("child-1"), any(Instant.class))).thenReturn(2L);
      when(sessionService.createSession(eq(tim), any(DeviceFingerprint.class), anyString()))
          .thenReturn(issuedFor(tim));

      // when
      authService.login(childLogin("1234", IPAD));

      // then
      verify(anomalyDetector).recordSignal("child-1", AnomalySignal.RAPID_SESSION_CREATION);
    }

    @Test
    @DisplayName("a wrong PIN fails and counts as a failed login signal")
    void wrongPin() {
      // given
      when(credentialVerifier.verifyChild("tim", "9999"))
          .thenThrow(new InvalidCredentialsException("Invalid credentials", "child-1"));

      // when / then
      assertThatThrownBy(() -> authService.login(childLogin("9999", IPAD)))
          .isInstanceOf(InvalidCredentialsException.class);
      verify(anomalyDetector).recordAndEvaluate("child-1", AnomalySignal.FAILED_LOGIN);
      verify(sessionService, never()).createSession(any(), any(), any());
    }

    @Test
    @DisplayName("a locked out child cannot log in even with the right PIN")
    void lockedOut() {
      // given
      when(credentialVerifier.verifyChild("tim", "1234")).thenReturn(tim);
      when(anomalyDetector.isLockedOut("child-1")).thenReturn(true);

      // when / then
      assertThatThrownBy(() -> authService.login(childLogin("1234", IPAD)))
          .isInstanceOf(AnomalyThresholdExceededException.class);
      verify(sessionService, never()).createSession(any(), any(), any());
    }
  }

  @Nested
  @DisplayName("adult login")
  class AdultLogin {

    @Test
    @DisplayName("adults are never scored and no guardian is notified")
    void adultLogin() {
      // given
      Principal adult = Principal.builder()
          .id("adult-1").role(PrincipalRole.ADULT).loginName("pat@example.com").credentialHash("hash").build();
      when(credentialVerifier.verifyAdult("pat@example.com", "s3cret-pass")).thenReturn(adult);
      when(sessionService.createSession(eq(adult), any(DeviceFingerprint.class), any())).thenReturn(issuedFor(adult));

      // when
      LoginResult result = authService.login(
          new LoginCommand(null, null, "pat@example.com", "s3cret-pass", WINDOWS_LAPTOP, null));

      // then
      assertThat(result.principal().role()).isEqualTo(PrincipalRole.ADULT);
      verify(anomalyDetector, never()).recordSignal(anyString(), any());
      verify(notificationPublisher, never()).publish(any(), anyString(), anyString(), anyMap());
    }

    @Test
    @DisplayName("a command without either credential pair is rejected")
    void missingCredentials() {
      assertThatThrownBy(() -> authService.login(new LoginCommand(null, null, null, null, null, null)))
          .isInstanceOf(InvalidCredentialsException.class);
    }
  }
}
