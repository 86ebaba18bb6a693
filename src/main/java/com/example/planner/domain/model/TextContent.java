package com.example.planner.domain.model;

import jakarta.validation.constraints.PositiveOrZero;

public record TextContent(@PositiveOrZero int wordCount) implements ActivityContent {

  @Override
  public Integer derivedScore() {
    return null;
  }
}
