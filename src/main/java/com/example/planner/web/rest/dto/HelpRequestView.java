package com.example.planner.web.rest.dto;

import com.example.planner.domain.entity.HelpRequest;
import com.example.planner.domain.model.HelpRequestContext;
import java.time.Instant;

public record HelpRequestView(
    Long id,
    String childId,
    String question,
    String response,
    Instant respondedAt,
    Instant createdAt,
    HelpRequestContext context,
    boolean resolved
) {
  public static HelpRequestView from(HelpRequest request) {
    return new HelpRequestView(
        request.getId(),
        request.getChildId(),
        request.getQuestion(),
        request.getResponse(),
        request.getRespondedAt(),
        request.getCreatedAt(),
        request.getContext(),
        request.isResolved());
  }
}
