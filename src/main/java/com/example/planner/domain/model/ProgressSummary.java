package com.example.planner.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * Aggregated progress of one child. Cached as JSON, always recomputable from the store.
 */
public record ProgressSummary(
    String childId,
    AnalyticsWindow window,
    int totalActivities,
    int completedActivities,
    int inProgressActivities,
    long totalTimeSpentSeconds,
    double averageScore,
    int currentDailyStreak,
    int longestDailyStreak,
    List<StreakSnapshot> streaks,
    Instant lastActivityAt,
    int weeklyGoalProgress,
    int monthlyGoalProgress,
    List<SubjectProgress> subjectProgress,
    long helpRequestCount,
    Instant generatedAt
) {
}
