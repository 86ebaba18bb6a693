package com.example.planner.exception;

/**
 * Base type for session lifecycle failures. Every subtype surfaces to the caller as 401.
 */
public class SessionException extends RuntimeException {
  public SessionException(String message) {
    super(message);
  }

  public SessionException(String message, Throwable cause) {
    super(message, cause);
  }
}
