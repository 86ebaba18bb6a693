package com.example.planner.exception;

/**
 * Cache store failure. Recovered inside the progress cache by computing directly.
 */
public class CacheUnavailableException extends RuntimeException {
  public CacheUnavailableException(String message) {
    super(message);
  }

  public CacheUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
