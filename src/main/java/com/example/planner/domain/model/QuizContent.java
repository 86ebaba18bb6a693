package com.example.planner.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

public record QuizContent(@Positive int questionCount, @PositiveOrZero int correctAnswers) implements ActivityContent {

  @JsonIgnore
  @AssertTrue(message = "correctAnswers cannot exceed questionCount")
  public boolean isConsistent() {
    return correctAnswers <= questionCount;
  }

  @Override
  public Integer derivedScore() {
    return Math.round(correctAnswers * 100f / questionCount);
  }
}
