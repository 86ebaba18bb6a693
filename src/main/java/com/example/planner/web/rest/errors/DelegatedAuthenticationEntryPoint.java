package com.example.planner.web.rest.errors;

import static com.example.planner.security.filter.SessionAuthenticationFilter.SESSION_ERROR_ATTRIBUTE;

import com.example.planner.exception.SessionExpiredException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

/**
 * Answers unauthenticated requests to protected endpoints with a JSON 401 instead of a redirect.
 * <p>
 * Triggered when no bearer token is sent, or when {@code SessionAuthenticationFilter}
 * rejected the token. The body never says why a token was rejected beyond "expired".
 */
@Component
@RequiredArgsConstructor
public class DelegatedAuthenticationEntryPoint implements AuthenticationEntryPoint {

  private final ObjectMapper objectMapper;
  private final Clock clock;

  @Override
  public void commence(HttpServletRequest request, HttpServletResponse response,
                       AuthenticationException authException) throws IOException {
    boolean expired = request.getAttribute(SESSION_ERROR_ATTRIBUTE) instanceof SessionExpiredException;

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("timestamp", clock.instant().toString());
    body.put("status", HttpServletResponse.SC_UNAUTHORIZED);
    body.put("error", expired ? "session_expired" : "not_authenticated");
    body.put("message", expired ? "Session has expired" : "Authentication required");
    body.put("path", request.getRequestURI());

    response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    objectMapper.writeValue(response.getWriter(), body);
  }
}
