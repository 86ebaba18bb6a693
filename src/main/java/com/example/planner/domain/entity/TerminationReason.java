package com.example.planner.domain.entity;

/**
 * Why a session left the ACTIVE state. Timeouts map to SessionExpired, everything else to SessionRevoked.
 */
public enum TerminationReason {
  IDLE_TIMEOUT,
  ABSOLUTE_TIMEOUT,
  LOGOUT,
  REVOKED,
  ANOMALY;

  public boolean isExpiry() {
    return this == IDLE_TIMEOUT || this == ABSOLUTE_TIMEOUT;
  }
}
