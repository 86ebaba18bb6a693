package com.example.planner.web.rest.controller;

import com.example.planner.domain.model.LoginResult;
import com.example.planner.domain.model.TokenPair;
import com.example.planner.service.AuthService;
import com.example.planner.service.SessionService;
import com.example.planner.web.rest.ApiConstants.Headers;
import com.example.planner.web.rest.dto.LoginRequest;
import com.example.planner.web.rest.dto.LoginResponse;
import com.example.planner.web.rest.dto.RefreshRequest;
import jakarta.servlet.http.HttpServletRequest;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequiredArgsConstructor
public class AuthController implements AuthAPI {

  private static final Pattern IP_LITERAL = Pattern.compile("[0-9A-Fa-f.:]{2,45}");

  private final AuthService authService;
  private final SessionService sessionService;

  @Override
  public ResponseEntity<LoginResponse> login(LoginRequest loginRequest, HttpServletRequest request) {
    LoginResult result = authService.login(loginRequest.toCommand(clientAddress(request)));
    return ResponseEntity.ok(LoginResponse.from(result));
  }

  @Override
  public ResponseEntity<TokenPair> refresh(RefreshRequest refreshRequest) {
    return ResponseEntity.ok(sessionService.renewSession(refreshRequest.refreshToken()));
  }

  @Override
  public ResponseEntity<Void> logout(String authorization) {
    if (authorization != null && authorization.startsWith(Headers.BEARER_PREFIX)) {
      sessionService.logout(authorization.substring(Headers.BEARER_PREFIX.length()).trim());
    } else {
      log.debug("Logout without bearer token");
    }
    return ResponseEntity.noContent().build();
  }

  /**
   * First X-Forwarded-For hop when it looks like an IPv4 or IPv6 literal, otherwise the socket peer.
   */
  static String clientAddress(HttpServletRequest request) {
    String forwardedFor = request.getHeader(Headers.FORWARDED_FOR);
    if (forwardedFor != null && !forwardedFor.isBlank()) {
      String candidate = forwardedFor.split(",")[0].trim();
      if (IP_LITERAL.matcher(candidate).matches()) {
        return candidate;
      }
      log.debug("Ignoring malformed {} header", Headers.FORWARDED_FOR);
    }
    return request.getRemoteAddr();
  }
}
