package com.example.planner.security;

import com.example.planner.domain.entity.AuthenticatedPrincipal;
import java.util.List;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

/**
 * Authentication established from a validated bearer access token.
 */
public class SessionAuthentication extends AbstractAuthenticationToken {

  private final AuthenticatedPrincipal principal;
  private final String sessionId;
  private final String timezone;

  public SessionAuthentication(AuthenticatedPrincipal principal, String sessionId, String timezone) {
    super(List.of(new SimpleGrantedAuthority("ROLE_" + principal.role().name())));
    this.principal = principal;
    this.sessionId = sessionId;
    this.timezone = timezone;
    setAuthenticated(true);
  }

  @Override
  public AuthenticatedPrincipal getPrincipal() {
    return principal;
  }

  @Override
  public Object getCredentials() {
    return null;
  }

  public String getSessionId() {
    return sessionId;
  }

  /**
   * Time zone reported by the device at login, may be null.
   */
  public String getTimezone() {
    return timezone;
  }
}
