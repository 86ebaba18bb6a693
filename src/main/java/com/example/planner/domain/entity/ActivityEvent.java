package com.example.planner.domain.entity;

import com.example.planner.domain.model.ActivityDetail;
import com.example.planner.domain.model.JsonConverters;
import jakarta.persistence.*;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Append-only record of an authenticated action. The identity column gives the per-child append order.
 */
@Entity
@Table(name = "activity_events", indexes = {
    @Index(name = "idx_activity_events_child", columnList = "child_id, occurred_at")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class ActivityEvent {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id", updatable = false, nullable = false)
  private Long id;

  @Column(name = "child_id", length = 36, updatable = false, nullable = false)
  private String childId;

  @Column(name = "session_id", length = 36, updatable = false)
  private String sessionId;

  @Enumerated(EnumType.STRING)
  @Column(name = "kind", length = 20, updatable = false, nullable = false)
  private ActivityKind kind;

  @Column(name = "occurred_at", updatable = false, nullable = false)
  private Instant occurredAt;

  @Convert(converter = JsonConverters.ActivityDetailConverter.class)
  @Column(name = "detail", length = 4000, updatable = false)
  private ActivityDetail detail;
}
