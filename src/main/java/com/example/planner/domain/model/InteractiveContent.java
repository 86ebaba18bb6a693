package com.example.planner.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

public record InteractiveContent(@Positive int totalSteps, @PositiveOrZero int completedSteps)
    implements ActivityContent {

  @JsonIgnore
  @AssertTrue(message = "completedSteps cannot exceed totalSteps")
  public boolean isConsistent() {
    return completedSteps <= totalSteps;
  }

  @Override
  public Integer derivedScore() {
    return Math.round(completedSteps * 100f / totalSteps);
  }
}
