package com.example.planner.domain.entity;

public enum StreakKind {
  DAILY,
  WEEKLY,
  ACTIVITY_COMPLETION,
  PERFECT_SCORE,
  HELP_FREE
}
