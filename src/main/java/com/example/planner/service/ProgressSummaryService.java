package com.example.planner.service;

import com.example.planner.domain.entity.ActivityEvent;
import com.example.planner.domain.entity.ActivityKind;
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
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Builds {@link ProgressSummary} projections from the activity log and streak counters.
 * This is the source computation behind the progress cache.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProgressSummaryService {

  static final int WEEKLY_GOAL = 10;
  static final int MONTHLY_GOAL = 40;

  private final ActivityEventRepository activityEventRepository;
  private final HelpRequestRepository helpRequestRepository;
  private final StreakService streakService;
  private final Clock clock;

  /**
   * All-time summary of the child's progress.
   */
  @Transactional(readOnly = true)
  public ProgressSummary computeProgressSummary(String childId) {
    return compute(childId, null);
  }

  /**
   * Summary restricted to progress written inside the trailing window.
   */
  @Transactional(readOnly = true)
  public ProgressSummary computeProgressSummary(String childId, AnalyticsWindow window) {
    return compute(childId, window);
  }

  private ProgressSummary compute(String childId, AnalyticsWindow window) {
    Instant now = clock.instant();
    LocalDate today = LocalDate.now(clock);

    List<ActivityEvent> events;
    long helpRequestCount;
    List<StreakSnapshot> streaks;
    try {
      if (window == null) {
        events = activityEventRepository.findByChildIdAndKindOrderByIdAsc(childId, ActivityKind.PROGRESS_WRITE);
        helpRequestCount = helpRequestRepository.countByChildId(childId);
      } else {
        Instant since = now.minus(window.duration());
        events = activityEventRepository.findByChildIdAndKindAndOccurredAtAfterOrderByIdAsc(
            childId, ActivityKind.PROGRESS_WRITE, since);
        helpRequestCount = helpRequestRepository.findByChildIdAndCreatedAtAfterOrderByCreatedAtAsc(childId, since)
            .size();
      }
      streaks = streakService.currentStreaks(childId, today);
    } catch (DataAccessException e) {
      log.error("Failed to read progress data for child {}", childId, e);
      throw new AnalyticsUnavailableException("Progress analytics are temporarily unavailable", e);
    }

    // latest write per activity wins
    Map<String, ActivityEvent> latest = new LinkedHashMap<>();
    for (ActivityEvent event : events) {
      if (event.getDetail() instanceof ProgressDetail detail) {
        latest.put(detail.activityId(), event);
      }
    }
    Collection<ActivityEvent> activities = latest.values();

    int completed = (int) activities.stream().filter(e -> progress(e).isCompleted()).count();
    int inProgress = (int) activities.stream()
        .filter(e -> progress(e).status() == ProgressStatus.IN_PROGRESS)
        .count();
    long timeSpent = activities.stream().mapToLong(e -> progress(e).timeSpentSeconds()).sum();

    StreakSnapshot daily = streaks.stream()
        .filter(s -> s.kind() == StreakKind.DAILY)
        .findFirst()
        .orElse(null);

    Instant lastActivityAt = events.isEmpty() ? null : events.get(events.size() - 1).getOccurredAt();

    return new ProgressSummary(
        childId,
        window,
        activities.size(),
        completed,
        inProgress,
        timeSpent,
        averageScore(activities),
        daily != null ? daily.currentCount() : 0,
        daily != null ? daily.longestCount() : 0,
        streaks,
        lastActivityAt,
        goalProgress(activities, now.minus(AnalyticsWindow.WEEK.duration()), WEEKLY_GOAL),
        goalProgress(activities, now.minus(AnalyticsWindow.MONTH.duration()), MONTHLY_GOAL),
        subjectProgress(activities),
        helpRequestCount,
        now);
  }

  private List<SubjectProgress> subjectProgress(Collection<ActivityEvent> activities) {
    Map<String, List<ActivityEvent>> bySubject = activities.stream()
        .collect(Collectors.groupingBy(e -> progress(e).subject(), TreeMap::new, Collectors.toList()));

    return bySubject.entrySet().stream()
        .map(entry -> {
          List<ActivityEvent> subjectActivities = entry.getValue();
          double average = averageScore(subjectActivities);
          return new SubjectProgress(
              entry.getKey(),
              subjectActivities.size(),
              (int) subjectActivities.stream().filter(e -> progress(e).isCompleted()).count(),
              average,
              subjectActivities.stream().mapToLong(e -> progress(e).timeSpentSeconds()).sum(),
              ProficiencyLevel.ofScore(average));
        })
        .toList();
  }

  /**
   * Mean score over completed activities that carry one, rounded to two decimals.
   */
  private double averageScore(Collection<ActivityEvent> activities) {
    double average = activities.stream()
        .map(ProgressSummaryService::progress)
        .filter(ProgressDetail::isCompleted)
        .map(ProgressDetail::effectiveScore)
        .filter(Objects::nonNull)
        .mapToInt(Integer::intValue)
        .average()
        .orElse(0);
    return Math.round(average * 100) / 100.0;
  }

  private int goalProgress(Collection<ActivityEvent> activities, Instant since, int goal) {
    long completedSince = activities.stream()
        .filter(e -> progress(e).isCompleted() && !e.getOccurredAt().isBefore(since))
        .count();
    return (int) Math.min(100, completedSince * 100 / goal);
  }

  private static ProgressDetail progress(ActivityEvent event) {
    return (ProgressDetail) event.getDetail();
  }
}
