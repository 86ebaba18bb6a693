package com.example.planner.domain.model;

public enum ProficiencyLevel {
  BEGINNER,
  DEVELOPING,
  PROFICIENT,
  MASTERED;

  public static ProficiencyLevel ofScore(double averageScore) {
    if (averageScore >= 95) return MASTERED;
    if (averageScore >= 80) return PROFICIENT;
    if (averageScore >= 60) return DEVELOPING;
    return BEGINNER;
  }
}
