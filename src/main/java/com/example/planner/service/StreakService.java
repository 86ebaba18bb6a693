package com.example.planner.service;

import com.example.planner.domain.entity.StreakCounter;
import com.example.planner.domain.entity.StreakKind;
import com.example.planner.domain.model.StreakSnapshot;
import com.example.planner.repository.StreakCounterRepository;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Streak bookkeeping. Counters are mutated only under a pessimistic row lock, so two
 * completions for the same child arriving at once are applied one after the other.
 * <p>
 * DAILY and WEEKLY count consecutive calendar periods. ACTIVITY_COMPLETION, PERFECT_SCORE
 * and HELP_FREE count consecutive qualifying completions. The longest count never decreases.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StreakService {

  static final int PERFECT_SCORE = 100;

  private final StreakCounterRepository streakCounterRepository;

  /**
   * Creates missing counters in their own transaction. A concurrent creator for the same child
   * surfaces as a duplicate-key failure on commit, which the caller may ignore.
   */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public void ensureCounters(String childId) {
    Set<StreakKind> existing = streakCounterRepository.findByChildId(childId).stream()
        .map(StreakCounter::getKind)
        .collect(Collectors.toCollection(() -> EnumSet.noneOf(StreakKind.class)));

    List<StreakCounter> missing = Arrays.stream(StreakKind.values())
        .filter(kind -> !existing.contains(kind))
        .map(kind -> StreakCounter.builder().childId(childId).kind(kind).build())
        .toList();

    if (!missing.isEmpty()) {
      streakCounterRepository.saveAll(missing);
      log.debug("Created {} streak counter(s) for child {}", missing.size(), childId);
    }
  }

  /**
   * Applies one completed activity to every streak kind.
   */
  @Transactional
  public List<StreakCounter> applyCompletion(String childId, Integer score, int helpRequestsCount, LocalDate date) {
    Map<StreakKind, StreakCounter> counters = new EnumMap<>(StreakKind.class);
    for (StreakCounter counter : streakCounterRepository.findByChildIdForUpdate(childId)) {
      counters.put(counter.getKind(), counter);
    }

    advancePeriod(counters.get(StreakKind.DAILY), date, date, 1);
    advancePeriod(counters.get(StreakKind.WEEKLY), weekStart(date), date, 7);
    advanceEvent(counters.get(StreakKind.ACTIVITY_COMPLETION), date, true);

    StreakCounter perfect = counters.get(StreakKind.PERFECT_SCORE);
    if (score != null && score >= PERFECT_SCORE) {
      advanceEvent(perfect, date, false);
    } else {
      reset(perfect);
    }

    StreakCounter helpFree = counters.get(StreakKind.HELP_FREE);
    if (helpRequestsCount == 0) {
      advanceEvent(helpFree, date, false);
    } else {
      reset(helpFree);
    }

    log.debug("Applied completion for child {} on {} (score {}, help {})", childId, date, score, helpRequestsCount);
    return new ArrayList<>(counters.values());
  }

  /**
   * Streaks as of {@code today}. A period that was missed reads as a current count of zero.
   */
  @Transactional(readOnly = true)
  public List<StreakSnapshot> currentStreaks(String childId, LocalDate today) {
    return streakCounterRepository.findByChildId(childId).stream()
        .sorted(Comparator.comparing(StreakCounter::getKind))
        .map(counter -> snapshot(counter, today))
        .toList();
  }

  StreakSnapshot snapshot(StreakCounter counter, LocalDate today) {
    boolean lapsed = isLapsed(counter, today);
    return new StreakSnapshot(
        counter.getKind(),
        lapsed ? 0 : counter.getCurrentCount(),
        counter.getLongestCount(),
        counter.getLastQualifyingDate(),
        lapsed ? null : counter.getStreakStartDate(),
        !lapsed && counter.isActive());
  }

  private boolean isLapsed(StreakCounter counter, LocalDate today) {
    LocalDate last = counter.getLastQualifyingDate();
    if (last == null) {
      return false;
    }
    return switch (counter.getKind()) {
      case DAILY, ACTIVITY_COMPLETION -> ChronoUnit.DAYS.between(last, today) > 1;
      case WEEKLY -> ChronoUnit.DAYS.between(weekStart(last), weekStart(today)) > 7;
      case PERFECT_SCORE, HELP_FREE -> false;
    };
  }

  /**
   * Same period: no change. Next period: +1. Any longer gap restarts at 1.
   */
  private void advancePeriod(StreakCounter counter, LocalDate period, LocalDate date, int periodDays) {
    if (counter == null) {
      return;
    }
    LocalDate last = counter.getLastQualifyingDate();
    LocalDate lastPeriod = last == null ? null : (periodDays == 7 ? weekStart(last) : last);

    if (lastPeriod != null && period.isBefore(lastPeriod)) {
      return;
    }
    if (lastPeriod != null && period.equals(lastPeriod) && counter.getCurrentCount() > 0) {
      return;
    }
    if (lastPeriod != null && ChronoUnit.DAYS.between(lastPeriod, period) == periodDays
        && counter.getCurrentCount() > 0) {
      increment(counter, date);
    } else {
      restart(counter, date);
    }
  }

  private void advanceEvent(StreakCounter counter, LocalDate date, boolean requireConsecutiveDays) {
    if (counter == null) {
      return;
    }
    LocalDate last = counter.getLastQualifyingDate();
    boolean broken = requireConsecutiveDays && last != null && ChronoUnit.DAYS.between(last, date) > 1;
    if (counter.getCurrentCount() == 0 || broken) {
      restart(counter, date);
    } else {
      increment(counter, date);
    }
  }

  private void increment(StreakCounter counter, LocalDate date) {
    counter.setCurrentCount(counter.getCurrentCount() + 1);
    counter.setLongestCount(Math.max(counter.getLongestCount(), counter.getCurrentCount()));
    counter.setLastQualifyingDate(date);
    counter.setActive(true);
  }

  private void restart(StreakCounter counter, LocalDate date) {
    counter.setCurrentCount(1);
    counter.setLongestCount(Math.max(counter.getLongestCount(), 1));
    counter.setStreakStartDate(date);
    counter.setLastQualifyingDate(date);
    counter.setActive(true);
  }

  private void reset(StreakCounter counter) {
    if (counter == null) {
      return;
    }
    counter.setCurrentCount(0);
    counter.setStreakStartDate(null);
    counter.setActive(false);
  }

  private static LocalDate weekStart(LocalDate date) {
    return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
  }
}
