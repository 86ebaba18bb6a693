package com.example.planner.exception;

/**
 * The help-request log or activity store could not be read. No partial result is returned.
 */
public class AnalyticsUnavailableException extends RuntimeException {
  public AnalyticsUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
