package com.example.planner.service;

import com.example.planner.cache.ChildAnalyticsChangedEvent;
import com.example.planner.domain.entity.HelpRequest;
import com.example.planner.domain.model.AnalyticsWindow;
import com.example.planner.domain.model.HelpAnalyticsSummary;
import com.example.planner.domain.model.HelpRequestContext;
import com.example.planner.domain.model.HelpSeekingPattern;
import com.example.planner.domain.model.HelpfulResponse;
import com.example.planner.domain.model.PatternRecord;
import com.example.planner.domain.model.QuestionType;
import com.example.planner.domain.model.TimeOfDay;
import com.example.planner.domain.model.TopicFrequency;
import com.example.planner.exception.AnalyticsUnavailableException;
import com.example.planner.exception.HelpRequestNotFoundException;
import com.example.planner.notification.GuardianNotificationPublisher;
import com.example.planner.notification.NotificationType;
import com.example.planner.properties.ApplicationProperties;
import com.example.planner.repository.HelpRequestRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Behavioral analytics over a child's help-request log.
 * <p>
 * Every figure is derived from the stored requests on each call. A failed read surfaces as
 * {@link AnalyticsUnavailableException}; partial results are never returned.
 */
@Slf4j
@Service
public class HelpAnalyticsService {

  static final int MAX_SUGGESTIONS = 3;
  static final int SUBJECT_EXTRA_MIN_CONCEPTS = 3;

  private static final String NOTIFICATION_COOLDOWN_PREFIX = "notify:help:";
  private static final double MILLIS_PER_HOUR = Duration.ofHours(1).toMillis();

  private static final List<QuestionType> TYPE_PRIORITY = List.of(
      QuestionType.PROCEDURE, QuestionType.CONCEPT, QuestionType.APPLICATION, QuestionType.GENERAL);

  private static final Map<QuestionType, List<String>> SUGGESTION_TEMPLATES = Map.of(
      QuestionType.CONCEPT, List.of(
          "What does this %s concept mean?",
          "Can you explain this %s idea differently?",
          "Why is this important in %s?"),
      QuestionType.PROCEDURE, List.of(
          "How do I solve this %s problem?",
          "What's the next step in this %s process?",
          "Can you walk me through this %s method?"),
      QuestionType.APPLICATION, List.of(
          "How do I apply this %s idea to the problem?",
          "Can you check how I set up this %s calculation?",
          "Where do I start with this %s question?"),
      QuestionType.GENERAL, List.of(
          "Can you give me a hint for this %s activity?",
          "What should I look at first in %s?",
          "Can you show me a similar %s example?"));

  private final HelpRequestRepository helpRequestRepository;
  private final GuardianNotificationPublisher notificationPublisher;
  private final ApplicationEventPublisher eventPublisher;
  private final RedisTemplate<String, String> redisTemplate;
  private final ApplicationProperties.AnalyticsProperties.HelpProperties helpProperties;
  private final Clock clock;

  public HelpAnalyticsService(
      HelpRequestRepository helpRequestRepository,
      GuardianNotificationPublisher notificationPublisher,
      ApplicationEventPublisher eventPublisher,
      RedisTemplate<String, String> redisTemplate,
      ApplicationProperties properties,
      Clock clock) {
    this.helpRequestRepository = helpRequestRepository;
    this.notificationPublisher = notificationPublisher;
    this.eventPublisher = eventPublisher;
    this.redisTemplate = redisTemplate;
    this.helpProperties = properties.analytics().help();
    this.clock = clock;
  }

  @Transactional(readOnly = true)
  public HelpAnalyticsSummary getHelpAnalytics(String childId) {
    List<HelpRequest> requests = read(childId, () -> helpRequestRepository.findByChildIdOrderByCreatedAtDesc(childId));

    Instant now = clock.instant();
    Instant startOfToday = LocalDate.now(clock).atStartOfDay(clock.getZone()).toInstant();
    Instant weekStart = now.minus(AnalyticsWindow.WEEK.duration());

    long today = requests.stream().filter(r -> !r.getCreatedAt().isBefore(startOfToday)).count();
    long thisWeek = requests.stream().filter(r -> !r.getCreatedAt().isBefore(weekStart)).count();
    double dailyRate = thisWeek / 7.0;
    int threshold = helpProperties.notificationThreshold();

    return new HelpAnalyticsSummary(
        childId,
        requests.size(),
        today,
        thisWeek,
        frequentTopics(requests),
        averageResponseTimeHours(requests),
        mostHelpfulResponses(requests),
        seekingPattern(dailyRate),
        dailyRate,
        threshold,
        thisWeek >= threshold);
  }

  /**
   * One record per request created inside the window, oldest first.
   */
  @Transactional(readOnly = true)
  public List<PatternRecord> getHelpRequestPatterns(String childId, AnalyticsWindow window) {
    Instant since = clock.instant().minus(window.duration());
    List<HelpRequest> requests = read(childId,
        () -> helpRequestRepository.findByChildIdAndCreatedAtAfterOrderByCreatedAtAsc(childId, since));

    return requests.stream()
        .map(request -> new PatternRecord(
            request.getId(),
            request.getCreatedAt(),
            TimeOfDay.ofHour(request.getCreatedAt().atZone(clock.getZone()).getHour()),
            request.subject(),
            request.getContext() != null
                ? request.getContext().difficultyOrDefault()
                : HelpRequestContext.DEFAULT_DIFFICULTY,
            QuestionType.classify(request.getQuestion()),
            request.isResolved()))
        .toList();
  }

  /**
   * Resolves a request once. Later calls return it unchanged.
   */
  @Transactional
  public HelpRequest markResolved(Long helpRequestId, boolean wasHelpful) {
    HelpRequest request = helpRequestRepository.findById(helpRequestId)
        .orElseThrow(() -> new HelpRequestNotFoundException(helpRequestId));
    if (request.isResolved()) {
      log.debug("Help request {} is already resolved", helpRequestId);
      return request;
    }

    HelpRequestContext context = request.getContext() != null ? request.getContext() : HelpRequestContext.empty();
    request.setContext(context.withResolution(wasHelpful, clock.instant()));
    request.setResolved(true);
    HelpRequest saved = helpRequestRepository.save(request);

    eventPublisher.publishEvent(new ChildAnalyticsChangedEvent(saved.getChildId(), "HELP_RESOLVED"));
    log.info("Help request {} resolved (helpful: {})", helpRequestId, wasHelpful);
    return saved;
  }

  @Transactional
  public HelpRequest reportResponse(Long helpRequestId, String reason, String details) {
    HelpRequest request = helpRequestRepository.findById(helpRequestId)
        .orElseThrow(() -> new HelpRequestNotFoundException(helpRequestId));

    HelpRequestContext context = request.getContext() != null ? request.getContext() : HelpRequestContext.empty();
    request.setContext(context.withReport(reason, details, clock.instant()));
    HelpRequest saved = helpRequestRepository.save(request);

    eventPublisher.publishEvent(new ChildAnalyticsChangedEvent(saved.getChildId(), "HELP_REPORTED"));
    log.warn("Response to help request {} reported: {}", helpRequestId, reason);
    return saved;
  }

  /**
   * Up to three prompts for the subject, led by the question type the child struggles with most.
   */
  @Transactional(readOnly = true)
  public List<String> getPersonalizedSuggestions(String childId, String subject) {
    List<PatternRecord> subjectPatterns = getHelpRequestPatterns(childId, AnalyticsWindow.WEEK).stream()
        .filter(p -> p.subject().equalsIgnoreCase(subject))
        .toList();

    List<PatternRecord> unresolved = subjectPatterns.stream().filter(p -> !p.resolved()).toList();
    QuestionType dominant = dominantType(unresolved.isEmpty() ? subjectPatterns : unresolved);
    long conceptCount = subjectPatterns.stream().filter(p -> p.questionType() == QuestionType.CONCEPT).count();

    List<String> extras = subjectExtras(subject, conceptCount);
    int fromTemplates = extras.isEmpty() ? MAX_SUGGESTIONS : MAX_SUGGESTIONS - 1;

    List<String> suggestions = new ArrayList<>();
    SUGGESTION_TEMPLATES.get(dominant).stream()
        .limit(fromTemplates)
        .map(template -> String.format(template, subject))
        .forEach(suggestions::add);
    extras.stream().limit(MAX_SUGGESTIONS - suggestions.size()).forEach(suggestions::add);
    return suggestions;
  }

  /**
   * Publishes one frequent-help notification per cooldown period once the weekly threshold is reached.
   *
   * @return true when a notification was published
   */
  public boolean checkGuardianNotification(String childId) {
    HelpAnalyticsSummary summary;
    try {
      summary = getHelpAnalytics(childId);
    } catch (AnalyticsUnavailableException e) {
      log.warn("Skipping help notification check for child {}: {}", childId, e.getMessage());
      return false;
    }
    if (!summary.shouldNotifyParent()) {
      return false;
    }

    try {
      Boolean first = redisTemplate.opsForValue().setIfAbsent(
          NOTIFICATION_COOLDOWN_PREFIX + childId,
          clock.instant().toString(),
          helpProperties.notificationCooldown());
      if (!Boolean.TRUE.equals(first)) {
        log.debug("Help notification for child {} is cooling down", childId);
        return false;
      }
    } catch (DataAccessException e) {
      log.error("Error checking help notification cooldown for child {}", childId, e);
      return false;
    }

    notificationPublisher.publish(
        NotificationType.FREQUENT_HELP_REQUESTS,
        childId,
        "Your child asked for help " + summary.helpRequestsThisWeek() + " times this week.",
        Map.of("helpRequestsThisWeek", summary.helpRequestsThisWeek(),
               "frequentTopics", summary.frequentTopics().stream().map(TopicFrequency::subject).toList(),
               "helpSeekingPattern", summary.helpSeekingPattern().name()));
    return true;
  }

  HelpSeekingPattern seekingPattern(double dailyRate) {
    if (dailyRate < helpProperties.independentMaxDailyRate()) {
      return HelpSeekingPattern.INDEPENDENT;
    }
    if (dailyRate < helpProperties.moderateMaxDailyRate()) {
      return HelpSeekingPattern.MODERATE;
    }
    return HelpSeekingPattern.FREQUENT;
  }

  private List<TopicFrequency> frequentTopics(List<HelpRequest> requests) {
    Map<String, Long> counts = requests.stream()
        .filter(r -> r.getContext() != null && r.getContext().subject() != null)
        .collect(Collectors.groupingBy(r -> r.getContext().subject(), Collectors.counting()));

    return counts.entrySet().stream()
        .map(e -> new TopicFrequency(e.getKey(), e.getValue()))
        .sorted(Comparator.comparingLong(TopicFrequency::count).reversed()
            .thenComparing(TopicFrequency::subject))
        .limit(helpProperties.frequentTopicLimit())
        .toList();
  }

  private double averageResponseTimeHours(List<HelpRequest> requests) {
    return requests.stream()
        .filter(r -> r.isResolved() && r.getResponse() != null && r.getRespondedAt() != null)
        .mapToLong(r -> Duration.between(r.getCreatedAt(), r.getRespondedAt()).toMillis())
        .average()
        .orElse(0) / MILLIS_PER_HOUR;
  }

  private List<HelpfulResponse> mostHelpfulResponses(List<HelpRequest> requests) {
    Comparator<HelpRequest> helpfulFirst = Comparator.comparing(
        (HelpRequest r) -> r.getContext() != null && Boolean.TRUE.equals(r.getContext().wasHelpful()));

    return requests.stream()
        .filter(r -> r.isResolved() && r.getResponse() != null)
        .sorted(helpfulFirst.reversed().thenComparing(HelpRequest::getCreatedAt, Comparator.reverseOrder()))
        .limit(helpProperties.helpfulResponseLimit())
        .map(r -> new HelpfulResponse(
            r.getId(),
            r.getQuestion(),
            r.getResponse(),
            r.subject(),
            r.getContext() != null ? r.getContext().wasHelpful() : null,
            r.getContext() != null ? r.getContext().resolvedAt() : null))
        .toList();
  }

  private QuestionType dominantType(List<PatternRecord> records) {
    Map<QuestionType, Long> counts = new EnumMap<>(QuestionType.class);
    records.forEach(r -> counts.merge(r.questionType(), 1L, Long::sum));

    QuestionType dominant = TYPE_PRIORITY.get(0);
    long best = counts.getOrDefault(dominant, 0L);
    for (QuestionType type : TYPE_PRIORITY) {
      long count = counts.getOrDefault(type, 0L);
      if (count > best) {
        dominant = type;
        best = count;
      }
    }
    return dominant;
  }

  private List<String> subjectExtras(String subject, long conceptCount) {
    return switch (subject.toLowerCase(Locale.ROOT)) {
      case "math" -> conceptCount >= SUBJECT_EXTRA_MIN_CONCEPTS
          ? List.of("What does this math symbol mean?", "How does this formula work?")
          : List.of();
      case "science" -> conceptCount >= SUBJECT_EXTRA_MIN_CONCEPTS
          ? List.of("Why does this happen in nature?", "How does this scientific process work?")
          : List.of();
      case "reading" -> List.of("What is the main idea here?", "What does this word mean?");
      default -> List.of();
    };
  }

  private <T> T read(String childId, Supplier<T> query) {
    try {
      return query.get();
    } catch (DataAccessException e) {
      log.error("Failed to read help requests for child {}", childId, e);
      throw new AnalyticsUnavailableException("Help analytics are temporarily unavailable", e);
    }
  }
}
