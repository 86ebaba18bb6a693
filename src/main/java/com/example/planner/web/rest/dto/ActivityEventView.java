package com.example.planner.web.rest.dto;

import com.example.planner.domain.entity.ActivityEvent;
import com.example.planner.domain.entity.ActivityKind;
import java.time.Instant;

public record ActivityEventView(Long id, String childId, ActivityKind kind, Instant occurredAt) {

  public static ActivityEventView from(ActivityEvent event) {
    return new ActivityEventView(event.getId(), event.getChildId(), event.getKind(), event.getOccurredAt());
  }
}
