package com.example.planner.exception;

/**
 * Raised when a session passed its idle timeout or its absolute duration.
 */
public class SessionExpiredException extends SessionException {
  public SessionExpiredException(String message) {
    super(message);
  }
}
