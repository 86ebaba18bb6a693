package com.example.planner.service;

import com.example.planner.domain.entity.PrincipalRole;
import com.example.planner.domain.model.SessionPolicy;
import com.example.planner.properties.ApplicationProperties;
import org.springframework.stereotype.Component;

/**
 * Resolves the session policy for a role. Adult limits come from configuration.
 */
@Component
public class SessionPolicyProvider {

  private final SessionPolicy adultPolicy;
  private final SessionPolicy childPolicy = SessionPolicy.child();

  public SessionPolicyProvider(ApplicationProperties properties) {
    ApplicationProperties.SecurityProperties.SessionProperties session = properties.security().session();
    this.adultPolicy = SessionPolicy.adult(session.adultIdleTimeout(), session.adultAbsoluteTimeout());
  }

  public SessionPolicy policyFor(PrincipalRole role) {
    return role == PrincipalRole.CHILD ? childPolicy : adultPolicy;
  }
}
