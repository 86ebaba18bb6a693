package com.example.planner.domain.entity;

import com.example.planner.domain.model.HelpRequestContext;
import com.example.planner.domain.model.JsonConverters;
import jakarta.persistence.*;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A child's question. Never deleted; the resolution fields are written once.
 */
@Entity
@Table(name = "help_requests", indexes = {
    @Index(name = "idx_help_requests_child", columnList = "child_id, created_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HelpRequest {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id", updatable = false, nullable = false)
  private Long id;

  @Column(name = "child_id", length = 36, updatable = false, nullable = false)
  private String childId;

  @Column(name = "question", length = 2000, nullable = false, updatable = false)
  private String question;

  @Column(name = "response", length = 8000)
  private String response;

  @Column(name = "responded_at")
  private Instant respondedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Convert(converter = JsonConverters.HelpRequestContextConverter.class)
  @Column(name = "context", length = 4000)
  private HelpRequestContext context;

  @Column(name = "resolved", nullable = false)
  @Builder.Default
  private boolean resolved = false;

  public String subject() {
    return context != null && context.subject() != null ? context.subject() : HelpRequestContext.UNKNOWN_SUBJECT;
  }
}
