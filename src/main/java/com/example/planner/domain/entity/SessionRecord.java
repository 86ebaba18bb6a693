package com.example.planner.domain.entity;

import jakarta.persistence.*;
import java.time.Duration;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A bounded-lifetime authorization grant for one principal and one device.
 * Status changes go through conditional updates in {@code SessionRecordRepository}.
 */
@Entity
@Table(name = "sessions", indexes = {
    @Index(name = "idx_sessions_access_token", columnList = "access_token_hash", unique = true),
    @Index(name = "idx_sessions_principal", columnList = "principal_id"),
    @Index(name = "idx_sessions_status", columnList = "status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SessionRecord {

  @Id
  @Column(name = "id", length = 36, updatable = false, nullable = false)
  private String id;

  @Column(name = "principal_id", length = 36, updatable = false, nullable = false)
  private String principalId;

  @Enumerated(EnumType.STRING)
  @Column(name = "role", length = 10, updatable = false, nullable = false)
  private PrincipalRole role;

  @Column(name = "access_token_hash", length = 64, nullable = false)
  private String accessTokenHash;

  @Column(name = "issued_at", updatable = false, nullable = false)
  private Instant issuedAt;

  @Column(name = "last_activity_at", nullable = false)
  private Instant lastActivityAt;

  /** Name of the policy the limits below were taken from. */
  @Enumerated(EnumType.STRING)
  @Column(name = "policy", length = 10, updatable = false, nullable = false)
  private PrincipalRole policy;

  @Column(name = "idle_timeout_seconds", updatable = false, nullable = false)
  private long idleTimeoutSeconds;

  @Column(name = "absolute_timeout_seconds", updatable = false, nullable = false)
  private long absoluteTimeoutSeconds;

  @Embedded
  private DeviceFingerprint fingerprint;

  @Column(name = "source_address", length = 45)
  private String sourceAddress;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", length = 12, nullable = false)
  @Builder.Default
  private SessionStatus status = SessionStatus.ACTIVE;

  @Column(name = "revoked", nullable = false)
  @Builder.Default
  private boolean revoked = false;

  @Column(name = "terminated_at")
  private Instant terminatedAt;

  @Enumerated(EnumType.STRING)
  @Column(name = "termination_reason", length = 20)
  private TerminationReason terminationReason;

  public boolean isActive() {
    return status == SessionStatus.ACTIVE;
  }

  public Instant absoluteExpiry() {
    return issuedAt.plusSeconds(absoluteTimeoutSeconds);
  }

  public Instant idleExpiry() {
    return lastActivityAt.plusSeconds(idleTimeoutSeconds);
  }

  public Duration idleTimeout() {
    return Duration.ofSeconds(idleTimeoutSeconds);
  }
}
