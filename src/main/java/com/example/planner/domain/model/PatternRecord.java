package com.example.planner.domain.model;

import java.time.Instant;

public record PatternRecord(
    Long helpRequestId,
    Instant createdAt,
    TimeOfDay timeOfDay,
    String subject,
    int difficulty,
    QuestionType questionType,
    boolean resolved
) {
}
