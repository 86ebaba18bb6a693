package com.example.planner.domain.model;

import java.time.Duration;
import java.util.Locale;

/**
 * Trailing windows used by the pattern projection and windowed progress summaries.
 */
public enum AnalyticsWindow {
  DAY(Duration.ofDays(1)),
  WEEK(Duration.ofDays(7)),
  MONTH(Duration.ofDays(30));

  private final Duration duration;

  AnalyticsWindow(Duration duration) {
    this.duration = duration;
  }

  public Duration duration() {
    return duration;
  }

  public String keySuffix() {
    return name().toLowerCase(Locale.ROOT);
  }
}
