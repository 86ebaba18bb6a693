package com.example.planner.exception;

/**
 * Unknown, consumed, revoked or expired refresh token.
 */
public class InvalidRefreshTokenException extends SessionException {
  public InvalidRefreshTokenException(String message) {
    super(message);
  }
}
