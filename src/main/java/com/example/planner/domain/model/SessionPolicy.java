package com.example.planner.domain.model;

import com.example.planner.domain.entity.PrincipalRole;
import java.time.Duration;

/**
 * Idle and absolute limits applied to a session. Child limits are fixed.
 */
public record SessionPolicy(PrincipalRole role, Duration idleTimeout, Duration absoluteTimeout) {

  public static final Duration CHILD_IDLE_TIMEOUT = Duration.ofMinutes(20);
  public static final Duration CHILD_ABSOLUTE_TIMEOUT = Duration.ofHours(2);

  public static SessionPolicy child() {
    return new SessionPolicy(PrincipalRole.CHILD, CHILD_IDLE_TIMEOUT, CHILD_ABSOLUTE_TIMEOUT);
  }

  public static SessionPolicy adult(Duration idleTimeout, Duration absoluteTimeout) {
    return new SessionPolicy(PrincipalRole.ADULT, idleTimeout, absoluteTimeout);
  }
}
