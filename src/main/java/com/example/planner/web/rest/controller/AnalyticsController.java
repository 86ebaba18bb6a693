package com.example.planner.web.rest.controller;

import com.example.planner.cache.ProgressCacheService;
import com.example.planner.domain.entity.AuthenticatedPrincipal;
import com.example.planner.domain.model.AnalyticsWindow;
import com.example.planner.domain.model.HelpAnalyticsSummary;
import com.example.planner.domain.model.PatternRecord;
import com.example.planner.domain.model.ProgressSummary;
import com.example.planner.service.HelpAnalyticsService;
import com.example.planner.service.PrincipalDirectory;
import com.example.planner.web.rest.CurrentSession;
import com.example.planner.web.rest.dto.CacheStatsView;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class AnalyticsController implements AnalyticsAPI {

  private final HelpAnalyticsService helpAnalyticsService;
  private final ProgressCacheService progressCacheService;
  private final PrincipalDirectory principalDirectory;

  @Override
  public ResponseEntity<HelpAnalyticsSummary> getHelpAnalytics(String childId) {
    assertCanOversee(childId);
    return ResponseEntity.ok(helpAnalyticsService.getHelpAnalytics(childId));
  }

  @Override
  public ResponseEntity<List<PatternRecord>> getHelpRequestPatterns(String childId, AnalyticsWindow window) {
    assertCanOversee(childId);
    return ResponseEntity.ok(helpAnalyticsService.getHelpRequestPatterns(childId, window));
  }

  @Override
  public ResponseEntity<List<String>> getPersonalizedSuggestions(String childId, String subject) {
    assertCanOversee(childId);
    return ResponseEntity.ok(helpAnalyticsService.getPersonalizedSuggestions(childId, subject));
  }

  @Override
  public ResponseEntity<ProgressSummary> getProgressSummary(String childId, AnalyticsWindow window) {
    assertCanOversee(childId);
    ProgressSummary summary = window == null
        ? progressCacheService.get(childId)
        : progressCacheService.getForWindow(childId, window);
    return ResponseEntity.ok(summary);
  }

  @Override
  public ResponseEntity<CacheStatsView> getCacheStats() {
    if (CurrentSession.require().getPrincipal().isChild()) {
      throw new AccessDeniedException("Child sessions cannot read cache statistics");
    }
    return ResponseEntity.ok(CacheStatsView.from(progressCacheService.stats()));
  }

  private void assertCanOversee(String childId) {
    AuthenticatedPrincipal caller = CurrentSession.require().getPrincipal();
    principalDirectory.assertCanOversee(caller, childId);
  }
}
