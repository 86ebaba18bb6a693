package com.example.planner.exception;

import com.example.planner.domain.entity.TerminationReason;
import lombok.Getter;

/**
 * Raised when a session was terminated by logout, explicit revocation or the anomaly detector.
 */
@Getter
public class SessionRevokedException extends SessionException {

  private final String principalId;
  private final TerminationReason reason;

  public SessionRevokedException(String message, String principalId, TerminationReason reason) {
    super(message);
    this.principalId = principalId;
    this.reason = reason;
  }
}
