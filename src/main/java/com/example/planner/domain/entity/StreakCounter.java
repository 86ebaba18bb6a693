package com.example.planner.domain.entity;

import jakarta.persistence.*;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "streak_counters", uniqueConstraints = {
    @UniqueConstraint(name = "uk_streak_counters_child_kind", columnNames = {"child_id", "kind"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StreakCounter {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id", updatable = false, nullable = false)
  private Long id;

  @Column(name = "child_id", length = 36, nullable = false, updatable = false)
  private String childId;

  @Enumerated(EnumType.STRING)
  @Column(name = "kind", length = 24, nullable = false, updatable = false)
  private StreakKind kind;

  @Column(name = "current_count", nullable = false)
  private int currentCount;

  @Column(name = "longest_count", nullable = false)
  private int longestCount;

  @Column(name = "last_qualifying_date")
  private LocalDate lastQualifyingDate;

  @Column(name = "streak_start_date")
  private LocalDate streakStartDate;

  @Column(name = "active", nullable = false)
  private boolean active;

  @Version
  @Column(name = "version", nullable = false)
  private long version;
}
