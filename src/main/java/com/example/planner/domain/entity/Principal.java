package com.example.planner.domain.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * An adult or child user. Identity and role are immutable once created, so the entity
 * exposes no setters.
 */
@Entity
@Table(name = "principals", indexes = {
    @Index(name = "idx_principals_login_name", columnList = "login_name", unique = true),
    @Index(name = "idx_principals_guardian", columnList = "guardian_id")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class Principal {

  @Id
  @Column(name = "id", length = 36, updatable = false, nullable = false)
  private String id;

  @Enumerated(EnumType.STRING)
  @Column(name = "role", length = 10, updatable = false, nullable = false)
  private PrincipalRole role;

  /** Email for adults, username for children. */
  @Column(name = "login_name", length = 255, nullable = false)
  private String loginName;

  /** BCrypt hash of the password (adult) or PIN (child). */
  @Column(name = "credential_hash", length = 100, nullable = false)
  private String credentialHash;

  @Column(name = "guardian_id", length = 36, updatable = false)
  private String guardianId;

  @Column(name = "display_name", length = 255)
  private String displayName;

  @Column(name = "active", nullable = false)
  @Builder.Default
  private boolean active = true;

  public boolean isChild() {
    return role == PrincipalRole.CHILD;
  }
}
