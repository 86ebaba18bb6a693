package com.example.planner.web.rest.errors;

import com.example.planner.exception.AnalyticsUnavailableException;
import com.example.planner.exception.AnomalyThresholdExceededException;
import com.example.planner.exception.HelpRequestNotFoundException;
import com.example.planner.exception.InvalidCredentialsException;
import com.example.planner.exception.SessionException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Global Error Handler
 *
 * Provides consistent error responses without exposing sensitive information
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
@RequestMapping(produces = MediaType.APPLICATION_JSON_VALUE)
public class GlobalErrorHandler {

  private final Clock clock;

  @ExceptionHandler(InvalidCredentialsException.class)
  public ResponseEntity<Map<String, Object>> handleInvalidCredentials(
      InvalidCredentialsException ex, WebRequest request) {
    log.warn("Login rejected: {}", ex.getMessage());
    return respond(HttpStatus.UNAUTHORIZED, "invalid_credentials", "Invalid credentials", request);
  }

  @ExceptionHandler(SessionException.class)
  public ResponseEntity<Map<String, Object>> handleSessionException(
      SessionException ex, WebRequest request) {
    log.warn("Session error: {}", ex.getMessage());
    return respond(HttpStatus.UNAUTHORIZED, "invalid_session", "Session is invalid or expired", request);
  }

  @ExceptionHandler(AnomalyThresholdExceededException.class)
  public ResponseEntity<Map<String, Object>> handleLockout(
      AnomalyThresholdExceededException ex, WebRequest request) {
    log.warn("Locked out principal {} attempted to log in", ex.getPrincipalId());
    return respond(HttpStatus.LOCKED, "account_locked", "Account is temporarily locked", request);
  }

  @ExceptionHandler(AnalyticsUnavailableException.class)
  public ResponseEntity<Map<String, Object>> handleAnalyticsUnavailable(
      AnalyticsUnavailableException ex, WebRequest request) {
    log.error("Analytics unavailable", ex);
    return respond(HttpStatus.SERVICE_UNAVAILABLE, "service_unavailable",
        "Service temporarily unavailable", request);
  }

  @ExceptionHandler(HelpRequestNotFoundException.class)
  public ResponseEntity<Map<String, Object>> handleHelpRequestNotFound(
      HelpRequestNotFoundException ex, WebRequest request) {
    return respond(HttpStatus.NOT_FOUND, "not_found", "Help request not found", request);
  }

  @ExceptionHandler(AuthenticationException.class)
  public ResponseEntity<Map<String, Object>> handleAuthenticationException(
      AuthenticationException ex, WebRequest request) {
    log.warn("Authentication error: {}", ex.getMessage());
    return respond(HttpStatus.UNAUTHORIZED, "authentication_failed", "Authentication failed", request);
  }

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<Map<String, Object>> handleAccessDeniedException(
      AccessDeniedException ex, WebRequest request) {
    log.warn("Access denied: {}", ex.getMessage());
    return respond(HttpStatus.FORBIDDEN, "access_denied", "Access denied", request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<Map<String, Object>> handleValidationException(
      MethodArgumentNotValidException ex, WebRequest request) {
    String errors = ex.getBindingResult().getFieldErrors().stream()
        .map(error -> error.getField() + " " + error.getDefaultMessage())
        .collect(Collectors.joining(", "));
    return respond(HttpStatus.BAD_REQUEST, "validation_error", errors, request);
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<Map<String, Object>> handleConstraintViolation(
      ConstraintViolationException ex, WebRequest request) {
    String errors = ex.getConstraintViolations().stream()
        .map(ConstraintViolation::getMessage)
        .collect(Collectors.joining(", "));
    return respond(HttpStatus.BAD_REQUEST, "validation_error", errors, request);
  }

  @ExceptionHandler(HandlerMethodValidationException.class)
  public ResponseEntity<Map<String, Object>> handleMethodValidation(
      HandlerMethodValidationException ex, WebRequest request) {
    String errors = ex.getAllErrors().stream()
        .map(error -> error instanceof FieldError field
            ? field.getField() + " " + field.getDefaultMessage()
            : error.getDefaultMessage())
        .collect(Collectors.joining(", "));
    return respond(HttpStatus.BAD_REQUEST, "validation_error", errors, request);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, Object>> handleUnreadableBody(
      HttpMessageNotReadableException ex, WebRequest request) {
    return respond(HttpStatus.BAD_REQUEST, "malformed_request", "Request body could not be read", request);
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<Map<String, Object>> handleMissingParams(
      MissingServletRequestParameterException ex, WebRequest request) {
    return respond(HttpStatus.BAD_REQUEST, "missing_parameter",
        String.format("Missing required parameter: %s", ex.getParameterName()), request);
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<Map<String, Object>> handleTypeMismatch(
      MethodArgumentTypeMismatchException ex, WebRequest request) {
    return respond(HttpStatus.BAD_REQUEST, "invalid_parameter",
        String.format("Invalid value for parameter: %s", ex.getName()), request);
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<Map<String, Object>> handleMethodNotSupported(
      HttpRequestMethodNotSupportedException ex, WebRequest request) {
    return respond(HttpStatus.METHOD_NOT_ALLOWED, "method_not_allowed",
        String.format("Method %s not supported", ex.getMethod()), request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleGenericException(
      Exception ex, WebRequest request) {
    log.error("Unexpected error", ex);
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error",
        "An error occurred processing your request", request);
  }

  private ResponseEntity<Map<String, Object>> respond(
      HttpStatus status, String error, String message, WebRequest request) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("timestamp", clock.instant());
    body.put("status", status.value());
    body.put("error", error);
    body.put("message", message);
    body.put("path", extractPath(request));
    return new ResponseEntity<>(body, status);
  }

  private String extractPath(WebRequest request) {
    return request.getDescription(false).replace("uri=", "");
  }
}
