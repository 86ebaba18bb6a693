package com.example.planner.web.rest;

import com.example.planner.security.SessionAuthentication;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Access to the session authentication of the current request.
 */
public final class CurrentSession {

  private CurrentSession() {}

  public static SessionAuthentication require() {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (authentication instanceof SessionAuthentication session) {
      return session;
    }
    throw new AuthenticationCredentialsNotFoundException("No authenticated session");
  }

  /**
   * Activity is only ever written by the child's own session.
   */
  public static SessionAuthentication requireChild() {
    SessionAuthentication session = require();
    if (!session.getPrincipal().isChild()) {
      throw new AccessDeniedException("Only child sessions can record activity");
    }
    return session;
  }
}
