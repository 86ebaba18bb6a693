package com.example.planner.security.filter;

import com.example.planner.domain.entity.AuthenticatedPrincipal;
import com.example.planner.domain.entity.SessionRecord;
import com.example.planner.domain.entity.TerminationReason;
import com.example.planner.domain.model.AnomalySignal;
import com.example.planner.exception.SessionException;
import com.example.planner.exception.SessionRevokedException;
import com.example.planner.security.AnomalyDetector;
import com.example.planner.security.SessionAuthentication;
import com.example.planner.service.PrincipalDirectory;
import com.example.planner.service.SessionService;
import com.example.planner.util.TokenUtils;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates {@code /api/**} requests from the bearer access token.
 * <p>
 * Validation is delegated to {@link SessionService}. An invalid token leaves the request
 * unauthenticated and the entry point answers 401. Presenting the token of a revoked
 * session counts as a FAILED_VALIDATION signal for the owning child.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionAuthenticationFilter extends OncePerRequestFilter {

  public static final String SESSION_ERROR_ATTRIBUTE = SessionAuthenticationFilter.class.getName() + ".error";
  private static final String BEARER_PREFIX = "Bearer ";

  private final SessionService sessionService;
  private final PrincipalDirectory principalDirectory;
  private final AnomalyDetector anomalyDetector;

  @Override
  protected void doFilterInternal(
      HttpServletRequest request,
      HttpServletResponse response,
      FilterChain filterChain) throws ServletException, IOException {

    Optional<String> token = bearerToken(request);
    if (token.isPresent()) {
      try {
        SessionRecord session = sessionService.validateSession(token.get());
        Optional<AuthenticatedPrincipal> principal = principalDirectory.find(session.getPrincipalId());
        if (principal.isPresent()) {
          SessionAuthentication authentication = new SessionAuthentication(
              principal.get(),
              session.getId(),
              session.getFingerprint() != null ? session.getFingerprint().getTimezone() : null);
          SecurityContextHolder.getContext().setAuthentication(authentication);
          log.trace("Authenticated session {} for principal {}", session.getId(), session.getPrincipalId());
        } else {
          log.warn("Session {} belongs to unknown principal {}", session.getId(), session.getPrincipalId());
        }
      } catch (SessionRevokedException e) {
        request.setAttribute(SESSION_ERROR_ATTRIBUTE, e);
        log.debug("Rejected revoked session token {}", TokenUtils.maskToken(token.get()));
        if (e.getReason() != TerminationReason.ANOMALY && e.getPrincipalId() != null) {
          anomalyDetector.recordAndEvaluate(e.getPrincipalId(), AnomalySignal.FAILED_VALIDATION);
        }
      } catch (SessionException e) {
        request.setAttribute(SESSION_ERROR_ATTRIBUTE, e);
        log.debug("Rejected session token {}: {}", TokenUtils.maskToken(token.get()), e.getMessage());
      }
    }

    filterChain.doFilter(request, response);
  }

  private Optional<String> bearerToken(HttpServletRequest request) {
    String header = request.getHeader(HttpHeaders.AUTHORIZATION);
    if (header == null || !header.startsWith(BEARER_PREFIX)) {
      return Optional.empty();
    }
    String token = header.substring(BEARER_PREFIX.length()).trim();
    return token.isEmpty() ? Optional.empty() : Optional.of(token);
  }
}
