package com.example.planner.domain.model;

/**
 * Discrete suspicious-activity indicators counted by the anomaly detector.
 */
public enum AnomalySignal {
  NEW_DEVICE_LOGIN,
  RAPID_SESSION_CREATION,
  OFF_HOURS_ACCESS,
  FAILED_VALIDATION,
  FAILED_LOGIN
}
