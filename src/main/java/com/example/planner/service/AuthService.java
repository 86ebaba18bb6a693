package com.example.planner.service;

import com.example.planner.domain.entity.AuthenticatedPrincipal;
import com.example.planner.domain.entity.DeviceFingerprint;
import com.example.planner.domain.entity.Principal;
import com.example.planner.domain.model.AnomalySignal;
import com.example.planner.domain.model.AnomalyVerdict;
import com.example.planner.domain.model.FingerprintMatch;
import com.example.planner.domain.model.IssuedSession;
import com.example.planner.domain.model.LoginCommand;
import com.example.planner.domain.model.LoginResult;
import com.example.planner.exception.AnomalyThresholdExceededException;
import com.example.planner.exception.InvalidCredentialsException;
import com.example.planner.notification.GuardianNotificationPublisher;
import com.example.planner.notification.NotificationType;
import com.example.planner.properties.ApplicationProperties;
import com.example.planner.security.AnomalyDetector;
import com.example.planner.util.TokenUtils;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Login orchestration: credentials, device fingerprint, session creation and anomaly signals.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

  private final CredentialVerifier credentialVerifier;
  private final DeviceFingerprintValidator fingerprintValidator;
  private final SessionService sessionService;
  private final AnomalyDetector anomalyDetector;
  private final GuardianNotificationPublisher notificationPublisher;
  private final ApplicationProperties properties;
  private final Clock clock;

  public LoginResult login(LoginCommand command) {
    Principal principal = verify(command);

    if (principal.isChild() && anomalyDetector.isLockedOut(principal.getId())) {
      log.warn("Rejected login for locked out principal {} from {}",
          principal.getId(), TokenUtils.maskAddress(command.sourceAddress()));
      throw new AnomalyThresholdExceededException(principal.getId());
    }

    DeviceFingerprint fingerprint = fingerprintValidator.fingerprint(command.device());
    DeviceFingerprint previous = sessionService.lastKnownFingerprint(principal.getId());
    FingerprintMatch match = previous == null ? null : fingerprintValidator.compare(previous, fingerprint);

    Instant now = clock.instant();
    ApplicationProperties.SecurityProperties.AnomalyProperties anomaly = properties.security().anomaly();
    long recentSessions = sessionService.countSessionsIssuedSince(
        principal.getId(), now.minus(anomaly.rapidSessionWindow()));

    IssuedSession issued = sessionService.createSession(principal, fingerprint, command.sourceAddress());
    AuthenticatedPrincipal authenticated = AuthenticatedPrincipal.from(principal);

    if (principal.isChild()) {
      boolean signalled = false;
      if (match == FingerprintMatch.MISMATCH) {
        anomalyDetector.recordSignal(principal.getId(), AnomalySignal.NEW_DEVICE_LOGIN);
        signalled = true;
      } else if (match == FingerprintMatch.PARTIAL_MATCH) {
        log.debug("Partial device match for principal {}", principal.getId());
      }
      if (recentSessions + 1 >= anomaly.rapidSessionCount()) {
        anomalyDetector.recordSignal(principal.getId(), AnomalySignal.RAPID_SESSION_CREATION);
        signalled = true;
      }
      signalled |= anomalyDetector.recordIfOffHours(principal.getId(), now, fingerprint.getTimezone());

      if (signalled && anomalyDetector.evaluate(principal.getId()) == AnomalyVerdict.SUSPICIOUS) {
        log.warn("Login of principal {} tripped the anomaly threshold; the new session is already revoked",
            principal.getId());
      }
      notifyGuardianOfLogin(principal, fingerprint, match, command.sourceAddress(), now);
    }

    log.info("{} principal {} logged in from {}", principal.getRole(), principal.getId(),
        TokenUtils.maskAddress(command.sourceAddress()));
    return new LoginResult(issued, authenticated);
  }

  private Principal verify(LoginCommand command) {
    try {
      if (command.isChildLogin()) {
        return credentialVerifier.verifyChild(command.username(), command.pin());
      }
      if (command.isAdultLogin()) {
        return credentialVerifier.verifyAdult(command.email(), command.password());
      }
      throw new InvalidCredentialsException("Neither username/PIN nor email/password supplied");
    } catch (InvalidCredentialsException e) {
      if (e.getPrincipalId() != null) {
        anomalyDetector.recordAndEvaluate(e.getPrincipalId(), AnomalySignal.FAILED_LOGIN);
      }
      throw e;
    }
  }

  private void notifyGuardianOfLogin(
      Principal child, DeviceFingerprint fingerprint, FingerprintMatch match, String sourceAddress, Instant at) {
    Map<String, Object> details = new HashMap<>();
    details.put("device", fingerprintValidator.describe(fingerprint));
    details.put("newDevice", match == FingerprintMatch.MISMATCH);
    details.put("sourceAddress", TokenUtils.maskAddress(sourceAddress));
    details.put("loginTime", at.toString());

    String name = child.getDisplayName() != null ? child.getDisplayName() : child.getLoginName();
    notificationPublisher.publish(
        NotificationType.CHILD_LOGIN,
        child.getId(),
        name + " signed in on " + details.get("device"),
        details);
  }
}
