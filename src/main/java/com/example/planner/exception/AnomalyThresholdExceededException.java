package com.example.planner.exception;

import lombok.Getter;

/**
 * Raised on login while a child principal is locked out after reaching the anomaly threshold.
 */
@Getter
public class AnomalyThresholdExceededException extends RuntimeException {

  private final String principalId;

  public AnomalyThresholdExceededException(String principalId) {
    super("Principal is locked out after suspicious activity");
    this.principalId = principalId;
  }
}
