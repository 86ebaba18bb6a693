package com.example.planner.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.planner.TestProperties;
import com.example.planner.cache.ChildAnalyticsChangedEvent;
import com.example.planner.domain.entity.HelpRequest;
import com.example.planner.domain.model.AnalyticsWindow;
import com.example.planner.domain.model.HelpAnalyticsSummary;
import com.example.planner.domain.model.HelpRequestContext;
import com.example.planner.domain.model.HelpSeekingPattern;
import com.example.planner.domain.model.PatternRecord;
import com.example.planner.domain.model.QuestionType;
import com.example.planner.domain.model.TimeOfDay;
import com.example.planner.exception.AnalyticsUnavailableException;
import com.example.planner.notification.GuardianNotificationPublisher;
import com.example.planner.notification.NotificationType;
import com.example.planner.repository.HelpRequestRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

@ExtendWith(MockitoExtension.class)
@DisplayName("HelpAnalyticsService")
class HelpAnalyticsServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-04T12:00:00Z");
  private static final String CHILD_ID = "child-1";

  @Mock
  private HelpRequestRepository helpRequestRepository;

  @Mock
  private GuardianNotificationPublisher notificationPublisher;

  @Mock
  private ApplicationEventPublisher eventPublisher;

  @Mock
  private RedisTemplate<String, String> redisTemplate;

  @Mock
  private ValueOperations<String, String> valueOperations;

  private HelpAnalyticsService helpAnalyticsService;

  @BeforeEach
  void setUp() {
    helpAnalyticsService = new HelpAnalyticsService(
        helpRequestRepository,
        notificationPublisher,
        eventPublisher,
        redisTemplate,
        TestProperties.defaults(),
        Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private static HelpRequest request(long id, String question, String subject, Instant createdAt) {
    return HelpRequest.builder()
        .id(id)
        .childId(CHILD_ID)
        .question(question)
        .createdAt(createdAt)
        .context(HelpRequestContext.of(subject, 3, "activity-" + id))
        .build();
  }

  @Nested
  @DisplayName("getHelpAnalytics")
  class GetHelpAnalytics {

    @Test
    @DisplayName("two requests, one today and one a day earlier, one resolved")
    void twoRequests() {
      // given
      HelpRequest today = request(2, "How do I add fractions?", "math", NOW.minus(Duration.ofHours(3)));
      today.setResponse("Find a common denominator first.");
      today.setRespondedAt(NOW.minus(Duration.ofHours(1)));
      today.setResolved(true);
      today.setContext(today.getContext().withResolution(true, NOW.minus(Duration.ofMinutes(30))));
      HelpRequest yesterday = request(1, "What is photosynthesis?", "science", NOW.minus(Duration.ofHours(24)));
      when(helpRequestRepository.findByChildIdOrderByCreatedAtDesc(CHILD_ID)).thenReturn(List.of(today, yesterday));

      // when
      HelpAnalyticsSummary summary = helpAnalyticsService.getHelpAnalytics(CHILD_ID);

      // then
      assertThat(summary.totalHelpRequests()).isEqualTo(2);
      assertThat(summary.helpRequestsToday()).isEqualTo(1);
      assertThat(summary.helpRequestsThisWeek()).isEqualTo(2);
      assertThat(summary.averageResponseTimeHours()).isCloseTo(2.0, within(0.001));
      assertThat(summary.averageDailyRate()).isCloseTo(2 / 7.0, within(0.0001));
      assertThat(summary.helpSeekingPattern()).isEqualTo(HelpSeekingPattern.INDEPENDENT);
      assertThat(summary.shouldNotifyParent()).isFalse();
      assertThat(summary.mostHelpfulResponses()).singleElement()
          .satisfies(response -> assertThat(response.helpRequestId()).isEqualTo(2L));
    }

    @Test
    @DisplayName("topics are ordered by count, then name")
    void frequentTopics() {
      // given
      List<HelpRequest> requests = List.of(
          request(1, "q", "science", NOW.minus(Duration.ofHours(1))),
          request(2, "q", "math", NOW.minus(Duration.ofHours(2))),
          request(3, "q", "math", NOW.minus(Duration.ofHours(3))),
          request(4, "q", "art", NOW.minus(Duration.ofHours(4))));
      when(helpRequestRepository.findByChildIdOrderByCreatedAtDesc(CHILD_ID)).thenReturn(requests);

      // when
      HelpAnalyticsSummary summary = helpAnalyticsService.getHelpAnalytics(CHILD_ID);

      // then
      assertThat(summary.frequentTopics())
          .extracting(topic -> topic.subject() + "=" + topic.count())
          .containsExactly("math=2", "art=1", "science=1");
      assertThat(summary.averageResponseTimeHours()).isZero();
    }

    @Test
    @DisplayName("a failing store surfaces as analytics unavailable")
    void storeFailure() {
      // given
      when(helpRequestRepository.findByChildIdOrderByCreatedAtDesc(CHILD_ID))
          .thenThrow(new QueryTimeoutException("timeout"));

      // when / then
      assertThatThrownBy(() -> helpAnalyticsService.getHelpAnalytics(CHILD_ID))
          .isInstanceOf(AnalyticsUnavailableException.class);
    }
  }

  @Test
  @DisplayName("seeking pattern thresholds are exclusive upper bounds")
  void seekingPattern() {
    assertThat(helpAnalyticsService.seekingPattern(0.9)).isEqualTo(HelpSeekingPattern.INDEPENDENT);
    assertThat(helpAnalyticsService.seekingPattern(1.0)).isEqualTo(HelpSeekingPattern.MODERATE);
    assertThat(helpAnalyticsService.seekingPattern(2.9)).isEqualTo(HelpSeekingPattern.MODERATE);
    assertThat(helpAnalyticsService.seekingPattern(3.0)).isEqualTo(HelpSeekingPattern.FREQUENT);
  }

  @Test
  @DisplayName("patterns carry time of day, subject, difficulty and question type")
  void patterns() {
    // given
    Instant since = NOW.minus(AnalyticsWindow.WEEK.duration());
    HelpRequest evening = request(1, "Why is the sky blue?", "science", Instant.parse("2026-03-02T19:30:00Z"));
    HelpRequest noContext = HelpRequest.builder()
        .id(2L).childId(CHILD_ID).question("Solve 3x = 9").createdAt(Instant.parse("2026-03-03T04:00:00Z")).build();
    when(helpRequestRepository.findByChildIdAndCreatedAtAfterOrderByCreatedAtAsc(CHILD_ID, since))
        .thenReturn(List.of(evening, noContext));

    // when
    List<PatternRecord> patterns = helpAnalyticsService.getHelpRequestPatterns(CHILD_ID, AnalyticsWindow.WEEK);

    // then
    assertThat(patterns).hasSize(2);
    assertThat(patterns.get(0).timeOfDay()).isEqualTo(TimeOfDay.EVENING);
    assertThat(patterns.get(0).questionType()).isEqualTo(QuestionType.CONCEPT);
    assertThat(patterns.get(0).difficulty()).isEqualTo(3);
    assertThat(patterns.get(1).timeOfDay()).isEqualTo(TimeOfDay.EARLY_MORNING);
    assertThat(patterns.get(1).subject()).isEqualTo(HelpRequestContext.UNKNOWN_SUBJECT);
    assertThat(patterns.get(1).difficulty()).isEqualTo(HelpRequestContext.DEFAULT_DIFFICULTY);
    assertThat(patterns.get(1).questionType()).isEqualTo(QuestionType.APPLICATION);
  }

  @Nested
  @DisplayName("markResolved")
  class MarkResolved {

    @Test
    @DisplayName("merges the resolution into the existing context")
    void mergesContext() {
      // given
      HelpRequest request = request(7, "How do I divide?", "math", NOW.minus(Duration.ofHours(1)));
      when(helpRequestRepository.findById(7L)).thenReturn(Optional.of(request));
      when(helpRequestRepository.save(request)).thenReturn(request);

      // when
      HelpRequest resolved = helpAnalyticsService.markResolved(7L, true);

      // then
      assertThat(resolved.isResolved()).isTrue();
      HelpRequestContext context = resolved.getContext();
      assertThat(context.subject()).isEqualTo("math");
      assertThat(context.difficulty()).isEqualTo(3);
      assertThat(context.activityId()).isEqualTo("activity-7");
      assertThat(context.wasHelpful()).isTrue();
      assertThat(context.resolvedAt()).isEqualTo(NOW);
      verify(eventPublisher).publishEvent(new ChildAnalyticsChangedEvent(CHILD_ID, "HELP_RESOLVED"));
    }

    @Test
    @DisplayName("resolving twice changes nothing")
    void idempotent() {
      // given
      HelpRequest request = request(7, "How do I divide?", "math", NOW.minus(Duration.ofHours(1)));
      request.setResolved(true);
      request.setContext(request.getContext().withResolution(false, NOW.minus(Duration.ofMinutes(10))));
      when(helpRequestRepository.findById(7L)).thenReturn(Optional.of(request));

      // when
      HelpRequest result = helpAnalyticsService.markResolved(7L, true);

      // then
      assertThat(result.getContext().wasHelpful()).isFalse();
      verify(helpRequestRepository, never()).save(any());
      verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("a report keeps an earlier resolution")
    void reportKeepsResolution() {
      // given
      HelpRequest request = request(7, "How do I divide?", "math", NOW.minus(Duration.ofHours(1)));
      request.setResolved(true);
      request.setContext(request.getContext().withResolution(true, NOW.minus(Duration.ofMinutes(10))));
      when(helpRequestRepository.findById(7L)).thenReturn(Optional.of(request));
      when(helpRequestRepository.save(request)).thenReturn(request);

      // when
      HelpRequest reported = helpAnalyticsService.reportResponse(7L, "wrong answer", "2/4 is not 1/3");

      // then
      HelpRequestContext context = reported.getContext();
      assertThat(context.reported()).isTrue();
      assertThat(context.reportReason()).isEqualTo("wrong answer");
      assertThat(context.wasHelpful()).isTrue();
      assertThat(context.subject()).isEqualTo("math");
    }
  }

  @Nested
  @DisplayName("getPersonalizedSuggestions")
  class Suggestions {

    private void givenWeek(HelpRequest... requests) {
      when(helpRequestRepository.findByChildIdAndCreatedAtAfterOrderByCreatedAtAsc(
          CHILD_ID, NOW.minus(AnalyticsWindow.WEEK.duration())))
          .thenReturn(List.of(requests));
    }

    @Test
    @DisplayName("conceptual math struggles lead with concept prompts and a math extra")
    void mathConcepts() {
      // given
      givenWeek(
          request(1, "What is a fraction?", "math", NOW.minus(Duration.ofHours(5))),
          request(2, "Why do we flip the fraction?", "math", NOW.minus(Duration.ofHours(4))),
          request(3, "Explain the denominator", "Math", NOW.minus(Duration.ofHours(3))),
          request(4, "How do I add these?", "math", NOW.minus(Duration.ofHours(2))));

      // when
      List<String> suggestions = helpAnalyticsService.getPersonalizedSuggestions(CHILD_ID, "math");

      // then
      assertThat(suggestions).containsExactly(
          "What does this math concept mean?",
          "Can you explain this math idea differently?",
          "What does this math symbol mean?");
    }

    @Test
    @DisplayName("without history the procedure prompts are used")
    void noHistory() {
      // given
      givenWeek();

      // when
      List<String> suggestions = helpAnalyticsService.getPersonalizedSuggestions(CHILD_ID, "history");

      // then
      assertThat(suggestions).containsExactly(
          "How do I solve this history problem?",
          "What's the next step in this history process?",
          "Can you walk me through this history method?");
    }

    @Test
    @DisplayName("unresolved questions decide the type when there are any")
    void unresolvedFirst() {
      // given
      HelpRequest resolvedConcept1 = request(1, "What is a noun?", "reading", NOW.minus(Duration.ofHours(5)));
      resolvedConcept1.setResolved(true);
      HelpRequest resolvedConcept2 = request(2, "What is a verb?", "reading", NOW.minus(Duration.ofHours(4)));
      resolvedConcept2.setResolved(true);
      HelpRequest openProcedure = request(3, "How do I find the topic sentence?", "reading", NOW.minus(Duration.ofHours(3)));
      givenWeek(resolvedConcept1, resolvedConcept2, openProcedure);

      // when
      List<String> suggestions = helpAnalyticsService.getPersonalizedSuggestions(CHILD_ID, "reading");

      // then
      assertThat(suggestions).containsExactly(
          "How do I solve this reading problem?",
          "What's the next step in this reading process?",
          "What is the main idea here?");
    }
  }

  @Nested
  @DisplayName("checkGuardianNotification")
  class GuardianNotification {

    private void givenRequestsThisWeek(int count) {
      List<HelpRequest> requests = new ArrayList<>();
      IntStream.range(0, count).forEach(i ->
          requests.add(request(i, "How?", "math", NOW.minus(Duration.ofHours(i + 1)))));
      when(helpRequestRepository.findByChildIdOrderByCreatedAtDesc(CHILD_ID)).thenReturn(requests);
    }

    @Test
    @DisplayName("the fifth request of the week notifies the guardian once")
    void notifiesAtThreshold() {
      // given
      givenRequestsThisWeek(5);
      when(redisTemplate.opsForValue()).thenReturn(valueOperations);
      when(valueOperations.setIfAbsent(eq("notify:help:" + CHILD_ID), anyString(), eq(Duration.ofHours(24))))
          .thenReturn(true);

      // when
      boolean notified = helpAnalyticsService.checkGuardianNotification(CHILD_ID);

      // then
      assertThat(notified).isTrue();
      verify(notificationPublisher).publish(
          eq(NotificationType.FREQUENT_HELP_REQUESTS), eq(CHILD_ID), anyString(), anyMap());
    }

    @Test
    @DisplayName("no second notification inside the cooldown")
    void coolingDown() {
      // given
      givenRequestsThisWeek(6);
      when(redisTemplate.opsForValue()).thenReturn(valueOperations);
      when(valueOperations.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(false);

      // when
      boolean notified = helpAnalyticsService.checkGuardianNotification(CHILD_ID);

      // then
      assertThat(notified).isFalse();
      verifyNoInteractions(notificationPublisher);
    }

    @Test
    @DisplayName("below the threshold nothing is checked or sent")
    void belowThreshold() {
      // given
      givenRequestsThisWeek(4);

      // when
      boolean notified = helpAnalyticsService.checkGuardianNotification(CHILD_ID);

      // then
      assertThat(notified).isFalse();
      verifyNoInteractions(redisTemplate, notificationPublisher);
    }
  }
}
