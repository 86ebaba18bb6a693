package com.example.planner.notification;

public enum NotificationType {
  CHILD_LOGIN,
  ANOMALY_DETECTED,
  FREQUENT_HELP_REQUESTS
}
