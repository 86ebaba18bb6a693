package com.example.planner.exception;

import lombok.Getter;

/**
 * Login failure. The message is for logs only and never reaches the client.
 * {@code principalId} is set when the login name matched a principal but the secret did not.
 */
@Getter
public class InvalidCredentialsException extends RuntimeException {

  private final String principalId;

  public InvalidCredentialsException(String message) {
    this(message, null);
  }

  public InvalidCredentialsException(String message, String principalId) {
    super(message);
    this.principalId = principalId;
  }
}
