package com.example.planner.domain.model;

import com.example.planner.domain.entity.StreakKind;
import java.time.LocalDate;

public record StreakSnapshot(
    StreakKind kind,
    int currentCount,
    int longestCount,
    LocalDate lastQualifyingDate,
    LocalDate streakStartDate,
    boolean active
) {
}
