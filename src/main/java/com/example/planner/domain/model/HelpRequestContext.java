package com.example.planner.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import java.time.Instant;

/**
 * Contextual tags of a help request. Updates go through the {@code with*} methods, which
 * return a merged copy and keep every field that was already present.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HelpRequestContext(
    @Size(max = 64) String subject,
    @Min(1) @Max(5) Integer difficulty,
    @Size(max = 64) String activityId,
    Boolean wasHelpful,
    Instant resolvedAt,
    Boolean reported,
    @Size(max = 255) String reportReason,
    @Size(max = 2000) String reportDetails,
    Instant reportedAt
) {

  public static final String UNKNOWN_SUBJECT = "unknown";
  public static final int DEFAULT_DIFFICULTY = 1;

  public static HelpRequestContext of(String subject, Integer difficulty, String activityId) {
    return new HelpRequestContext(subject, difficulty, activityId, null, null, null, null, null, null);
  }

  public static HelpRequestContext empty() {
    return of(null, null, null);
  }

  public HelpRequestContext withResolution(boolean helpful, Instant at) {
    return new HelpRequestContext(subject, difficulty, activityId, helpful, at,
        reported, reportReason, reportDetails, reportedAt);
  }

  public HelpRequestContext withReport(String reason, String details, Instant at) {
    return new HelpRequestContext(subject, difficulty, activityId, wasHelpful, resolvedAt,
        Boolean.TRUE, reason, details, at);
  }

  public int difficultyOrDefault() {
    return difficulty != null ? difficulty : DEFAULT_DIFFICULTY;
  }
}
