package com.example.planner.domain.model;

public record SubjectProgress(
    String subject,
    int totalActivities,
    int completedActivities,
    double averageScore,
    long timeSpentSeconds,
    ProficiencyLevel proficiencyLevel
) {
}
