package com.example.planner.web.rest.dto;

import com.example.planner.domain.model.HelpRequestContext;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record HelpRequestCreateRequest(
    @NotBlank @Size(max = 2000) String question,
    @Size(max = 64) String subject,
    @Min(1) @Max(5) Integer difficulty,
    @Size(max = 64) String activityId
) {
  public HelpRequestContext toContext() {
    return HelpRequestContext.of(subject, difficulty, activityId);
  }
}
