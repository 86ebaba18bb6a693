package com.example.planner.service;

import com.example.planner.cache.ChildAnalyticsChangedEvent;
import com.example.planner.domain.entity.ActivityEvent;
import com.example.planner.domain.entity.ActivityKind;
import com.example.planner.domain.entity.HelpRequest;
import com.example.planner.domain.model.ActivityDetail;
import com.example.planner.domain.model.HelpRequestContext;
import com.example.planner.domain.model.HelpRequestDetail;
import com.example.planner.domain.model.PageAccessDetail;
import com.example.planner.domain.model.ProgressDetail;
import com.example.planner.exception.HelpRequestNotFoundException;
import com.example.planner.repository.ActivityEventRepository;
import com.example.planner.repository.HelpRequestRepository;
import com.example.planner.security.AnomalyDetector;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Writes of child activity: progress, page access and help requests.
 * <p>
 * Each write commits an {@link ActivityEvent} together with its side effects and publishes a
 * {@link ChildAnalyticsChangedEvent} in the same transaction. Anomaly inspection runs after commit.
 */
@Slf4j
@Service
public class ActivityService {

  private final ActivityEventRepository activityEventRepository;
  private final HelpRequestRepository helpRequestRepository;
  private final StreakService streakService;
  private final HelpAnalyticsService helpAnalyticsService;
  private final AnomalyDetector anomalyDetector;
  private final ApplicationEventPublisher eventPublisher;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  public ActivityService(
      ActivityEventRepository activityEventRepository,
      HelpRequestRepository helpRequestRepository,
      StreakService streakService,
      HelpAnalyticsService helpAnalyticsService,
      AnomalyDetector anomalyDetector,
      ApplicationEventPublisher eventPublisher,
      PlatformTransactionManager transactionManager,
      Clock clock) {
    this.activityEventRepository = activityEventRepository;
    this.helpRequestRepository = helpRequestRepository;
    this.streakService = streakService;
    this.helpAnalyticsService = helpAnalyticsService;
    this.anomalyDetector = anomalyDetector;
    this.eventPublisher = eventPublisher;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.clock = clock;
  }

  /**
   * Records a progress write. A completed activity also advances the child's streaks.
   */
  public ActivityEvent recordProgress(String childId, String sessionId, String timezone, ProgressDetail detail) {
    if (detail.isCompleted()) {
      ensureStreakCounters(childId);
    }

    ActivityEvent event = transactionTemplate.execute(status -> {
      ActivityEvent saved = appendEvent(childId, sessionId, ActivityKind.PROGRESS_WRITE, detail);
      if (detail.isCompleted()) {
        LocalDate day = LocalDate.ofInstant(saved.getOccurredAt(), clock.getZone());
        streakService.applyCompletion(childId, detail.effectiveScore(), detail.helpRequestsCount(), day);
      }
      return saved;
    });

    log.debug("Recorded {} progress on activity {} for child {}", detail.status(), detail.activityId(), childId);
    anomalyDetector.inspect(event, timezone);
    return event;
  }

  public ActivityEvent recordPageAccess(String childId, String sessionId, String timezone, String path) {
    ActivityEvent event = transactionTemplate.execute(status ->
        appendEvent(childId, sessionId, ActivityKind.PAGE_ACCESS, new PageAccessDetail(path)));
    anomalyDetector.inspect(event, timezone);
    return event;
  }

  /**
   * Stores a new help request and checks whether the guardian should hear about the help rate.
   */
  public HelpRequest askForHelp(
      String childId, String sessionId, String timezone, String question, HelpRequestContext context) {
    Instant now = clock.instant();
    HelpRequestContext effectiveContext = context != null ? context : HelpRequestContext.empty();

    AskedHelp asked = transactionTemplate.execute(status -> {
      HelpRequest request = helpRequestRepository.save(HelpRequest.builder()
          .childId(childId)
          .question(question)
          .createdAt(now)
          .context(effectiveContext)
          .build());
      ActivityEvent event = appendEvent(childId, sessionId, ActivityKind.HELP_REQUEST,
          new HelpRequestDetail(request.getId(), request.subject(), HelpRequestDetail.ASKED));
      return new AskedHelp(request, event);
    });

    HelpRequest request = asked.request();
    log.info("Help request {} created for child {} (subject {})", request.getId(), childId, request.subject());
    anomalyDetector.inspect(asked.event(), timezone);
    helpAnalyticsService.checkGuardianNotification(childId);
    return request;
  }

  /**
   * Stores the answer to a help request. Resolved requests are returned unchanged.
   */
  public HelpRequest answerHelpRequest(Long helpRequestId, String sessionId, String response) {
    return transactionTemplate.execute(status -> {
      HelpRequest request = helpRequestRepository.findById(helpRequestId)
          .orElseThrow(() -> new HelpRequestNotFoundException(helpRequestId));
      if (request.isResolved()) {
        log.debug("Help request {} already resolved; answer ignored", helpRequestId);
        return request;
      }

      request.setResponse(response);
      request.setRespondedAt(clock.instant());
      HelpRequest saved = helpRequestRepository.save(request);
      appendEvent(saved.getChildId(), sessionId, ActivityKind.HELP_REQUEST,
          new HelpRequestDetail(saved.getId(), saved.subject(), HelpRequestDetail.ANSWERED));
      return saved;
    });
  }

  public HelpRequest getHelpRequest(Long helpRequestId) {
    return helpRequestRepository.findById(helpRequestId)
        .orElseThrow(() -> new HelpRequestNotFoundException(helpRequestId));
  }

  /**
   * Appends one event to the child's log. Must run inside a transaction; the change
   * notification is delivered after that transaction commits.
   */
  ActivityEvent appendEvent(String childId, String sessionId, ActivityKind kind, ActivityDetail detail) {
    ActivityEvent event = activityEventRepository.save(ActivityEvent.builder()
        .childId(childId)
        .sessionId(sessionId)
        .kind(kind)
        .occurredAt(clock.instant())
        .detail(detail)
        .build());
    eventPublisher.publishEvent(new ChildAnalyticsChangedEvent(childId, kind.name()));
    return event;
  }

  private void ensureStreakCounters(String childId) {
    try {
      streakService.ensureCounters(childId);
    } catch (DataIntegrityViolationException e) {
      log.debug("Streak counters for child {} were created concurrently", childId);
    }
  }

  private record AskedHelp(HelpRequest request, ActivityEvent event) {
  }
}
