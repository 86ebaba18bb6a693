package com.example.planner.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import com.example.planner.domain.entity.ActivityEvent;
import com.example.planner.domain.entity.ActivityKind;
import com.example.planner.domain.entity.HelpRequest;
import com.example.planner.domain.entity.StreakKind;
import com.example.planner.domain.model.AnalyticsWindow;
import com.example.planner.domain.model.ProficiencyLevel;
import com.example.planner.domain.model.ProgressDetail;
import com.example.planner.domain.model.ProgressStatus;
import com.example.planner.domain.model.ProgressSummary;
import com.example.planner.domain.model.StreakSnapshot;
import com.example.planner.domain.model.SubjectProgress;
import com.example.planner.exception.AnalyticsUnavailableException;
import com.example.planner.repository.ActivityEventRepository;
import com.example.planner.repository.HelpRequestRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
@DisplayName("ProgressSummaryService")
class ProgressSummaryServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-04T12:00:00Z");
  private static final LocalDate TODAY = LocalDate.of(2026, 3, 4);
  private static final String CHILD_ID = "child-1";

  @Mock
  private ActivityEventRepository activityEventRepository;

  @Mock
  private HelpRequestRepository helpRequestRepository;

  @Mock
  private StreakService streakService;

  private ProgressSummaryService progressSummaryService;

  @BeforeEach
  void setUp() {
    progressSummaryService = new ProgressSummaryService(
        activityEventRepository, helpRequestRepository, streakService, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private static ActivityEvent progress(long id, String activityId, String subject, ProgressStatus status,
      Integer score, long timeSpent, String occurredAt) {
    return ActivityEvent.builder()
        .id(id)
        .childId(CHILD_ID)
        .kind(ActivityKind.PROGRESS_WRITE)
        .occurredAt(Instant.parse(occurredAt))
        .detail(new ProgressDetail(activityId, subject, status, score, timeSpent, 0, null))
        .build();
  }

  private static List<ActivityEvent> history() {
    return List.of(
        progress(1, "a1", "math", ProgressStatus.IN_PROGRESS, null, 100, "2026-02-01T10:00:00Z"),
        progress(2, "a1", "math", ProgressStatus.COMPLETED, 90, 300, "2026-03-03T10:00:00Z"),
        progress(3, "r1", "reading", ProgressStatus.COMPLETED, 70, 200, "2026-02-20T10:00:00Z"),
        progress(4, "a2", "math", ProgressStatus.IN_PROGRESS, null, 50, "2026-03-04T10:00:00Z"));
  }

  @Test
  @DisplayName("all-time summary keeps the latest write per activity")
  void allTime() {
    // given
    when(activityEventRepository.findByChildIdAndKindOrderByIdAsc(CHILD_ID, ActivityKind.PROGRESS_WRITE))
        .thenReturn(history());
    when(helpRequestRepository.countByChildId(CHILD_ID)).thenReturn(4L);
    when(streakService.currentStreaks(CHILD_ID, TODAY)).thenReturn(List.of(
        new StreakSnapshot(StreakKind.DAILY, 3, 5, TODAY.minusDays(1), TODAY.minusDays(3), true)));

    // when
    ProgressSummary summary = progressSummaryService.computeProgressSummary(CHILD_ID);

    // then
    assertThat(summary.window()).isNull();
    assertThat(summary.totalActivities()).isEqualTo(3);
    assertThat(summary.completedActivities()).isEqualTo(2);
    assertThat(summary.inProgressActivities()).isEqualTo(1);
    assertThat(summary.totalTimeSpentSeconds()).isEqualTo(550);
    assertThat(summary.averageScore()).isEqualTo(80.0);
    assertThat(summary.currentDailyStreak()).isEqualTo(3);
    assertThat(summary.longestDailyStreak()).isEqualTo(5);
    assertThat(summary.lastActivityAt()).isEqualTo(Instant.parse("2026-03-04T10:00:00Z"));
    assertThat(summary.weeklyGoalProgress()).isEqualTo(10);
    assertThat(summary.monthlyGoalProgress()).isEqualTo(5);
    assertThat(summary.helpRequestCount()).isEqualTo(4);
    assertThat(summary.generatedAt()).isEqualTo(NOW);
    assertThat(summary.subjectProgress()).containsExactly(
        new SubjectProgress("math", 2, 1, 90.0, 350, ProficiencyLevel.PROFICIENT),
        new SubjectProgress("reading", 1, 1, 70.0, 200, ProficiencyLevel.DEVELOPING));
  }

  @Test
  @DisplayName("a child without activity gets an empty summary")
  void empty() {
    // given
    when(activityEventRepository.findByChildIdAndKindOrderByIdAsc(CHILD_ID, ActivityKind.PROGRESS_WRITE))
        .thenReturn(List.of());
    when(helpRequestRepository.countByChildId(CHILD_ID)).thenReturn(0L);
    when(streakService.currentStreaks(CHILD_ID, TODAY)).thenReturn(List.of());

    // when
    ProgressSummary summary = progressSummaryService.computeProgressSummary(CHILD_ID);

    // then
    assertThat(summary.totalActivities()).isZero();
    assertThat(summary.averageScore()).isZero();
    assertThat(summary.currentDailyStreak()).isZero();
    assertThat(summary.lastActivityAt()).isNull();
    assertThat(summary.subjectProgress()).isEmpty();
  }

  @Test
  @DisplayName("windowed summary reads only the trailing window")
  void windowed() {
    // given
    Instant since = NOW.minus(AnalyticsWindow.WEEK.duration());
    when(activityEventRepository.findByChildIdAndKindAndOccurredAtAfterOrderByIdAsc(
        CHILD_ID, ActivityKind.PROGRESS_WRITE, since))
        .thenReturn(List.of(history().get(1), history().get(3)));
    when(helpRequestRepository.findByChildIdAndCreatedAtAfterOrderByCreatedAtAsc(CHILD_ID, since))
        .thenReturn(List.of(new HelpRequest(), new HelpRequest()));
    when(streakService.currentStreaks(CHILD_ID, TODAY)).thenReturn(List.of());

    // when
    ProgressSummary summary = progressSummaryService.computeProgressSummary(CHILD_ID, AnalyticsWindow.WEEK);

    // then
    assertThat(summary.window()).isEqualTo(AnalyticsWindow.WEEK);
    assertThat(summary.totalActivities()).isEqualTo(2);
    assertThat(summary.completedActivities()).isEqualTo(1);
    assertThat(summary.averageScore()).isEqualTo(90.0);
    assertThat(summary.helpRequestCount()).isEqualTo(2);
  }

  @Test
  @DisplayName("a failed read surfaces as analytics unavailable")
  void storeFailure() {
    // given
    when(activityEventRepository.findByChildIdAndKindOrderByIdAsc(CHILD_ID, ActivityKind.PROGRESS_WRITE))
        .thenThrow(new DataAccessResourceFailureException("db down"));

    // when / then
    assertThatThrownBy(() -> progressSummaryService.computeProgressSummary(CHILD_ID))
        .isInstanceOf(AnalyticsUnavailableException.class);
  }
}
