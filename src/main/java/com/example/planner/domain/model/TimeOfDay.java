package com.example.planner.domain.model;

public enum TimeOfDay {
  EARLY_MORNING,
  MORNING,
  AFTERNOON,
  EVENING,
  NIGHT;

  public static TimeOfDay ofHour(int hour) {
    if (hour < 6) return EARLY_MORNING;
    if (hour < 12) return MORNING;
    if (hour < 17) return AFTERNOON;
    if (hour < 21) return EVENING;
    return NIGHT;
  }
}
