package com.example.planner.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Normalized device descriptor attached to a session at creation. Compared, never mutated.
 */
@Embeddable
@Getter
@EqualsAndHashCode
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class DeviceFingerprint {

  @Column(name = "device_agent_class", length = 20)
  private String agentClass;

  @Column(name = "device_platform", length = 20)
  private String platform;

  @Column(name = "device_mobile")
  private boolean mobile;

  @Column(name = "device_screen_class", length = 20)
  private String screenClass;

  @Column(name = "device_locale", length = 35)
  private String locale;

  @Column(name = "device_timezone", length = 64)
  private String timezone;

  @Column(name = "device_hash", length = 64)
  private String hash;
}
