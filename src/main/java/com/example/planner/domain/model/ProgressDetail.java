package com.example.planner.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * A progress write for one activity. When {@code score} is absent it is derived from the content.
 */
public record ProgressDetail(
    @NotBlank String activityId,
    @NotBlank String subject,
    @NotNull ProgressStatus status,
    @Min(0) @Max(100) Integer score,
    @PositiveOrZero long timeSpentSeconds,
    @PositiveOrZero int helpRequestsCount,
    @Valid ActivityContent content
) implements ActivityDetail {

  public Integer effectiveScore() {
    if (score != null) {
      return score;
    }
    return content != null ? content.derivedScore() : null;
  }

  @JsonIgnore
  public boolean isCompleted() {
    return status == ProgressStatus.COMPLETED;
  }
}
