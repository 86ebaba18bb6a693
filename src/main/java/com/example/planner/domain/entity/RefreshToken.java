package com.example.planner.domain.entity;

import jakarta.persistence.*;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Single-use refresh token. Only the SHA-256 hash of the token is stored.
 * A token is consumed exactly once by {@code RefreshTokenRepository#consume}.
 */
@Entity
@Table(name = "refresh_tokens", indexes = {
    @Index(name = "idx_refresh_tokens_hash", columnList = "token_hash", unique = true),
    @Index(name = "idx_refresh_tokens_session", columnList = "session_id"),
    @Index(name = "idx_refresh_tokens_expires", columnList = "expires_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RefreshToken {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id", updatable = false, nullable = false)
  private Long id;

  @Column(name = "token_hash", length = 64, nullable = false, updatable = false)
  private String tokenHash;

  @Column(name = "session_id", length = 36, nullable = false, updatable = false)
  private String sessionId;

  @Column(name = "principal_id", length = 36, nullable = false, updatable = false)
  private String principalId;

  @Column(name = "issued_at", nullable = false, updatable = false)
  private Instant issuedAt;

  @Column(name = "expires_at", nullable = false, updatable = false)
  private Instant expiresAt;

  @Column(name = "consumed_at")
  private Instant consumedAt;

  @Column(name = "revoked", nullable = false)
  @Builder.Default
  private boolean revoked = false;
}
