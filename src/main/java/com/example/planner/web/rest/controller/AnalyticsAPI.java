package com.example.planner.web.rest.controller;

import static com.example.planner.web.rest.ApiConstants.ApiPath.*;

import com.example.planner.domain.model.AnalyticsWindow;
import com.example.planner.domain.model.HelpAnalyticsSummary;
import com.example.planner.domain.model.PatternRecord;
import com.example.planner.domain.model.ProgressSummary;
import com.example.planner.web.rest.dto.CacheStatsView;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Size;
import java.util.List;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;

@Tag(
    name = "Analytics",
    description = "Help-request analytics and progress summaries for a child"
)
@Validated
@RequestMapping(
    value = API_BASE + ANALYTICS,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface AnalyticsAPI {

  @Operation(
      summary = "Help analytics",
      description = "Request counts, frequent topics, response times, helpful answers and the seeking pattern"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Analytics returned"),
      @ApiResponse(responseCode = "401", description = "Not authenticated"),
      @ApiResponse(responseCode = "403", description = "Not the child or its guardian"),
      @ApiResponse(responseCode = "503", description = "Analytics temporarily unavailable")
  })
  @GetMapping(value = HELP_ANALYTICS)
  ResponseEntity<HelpAnalyticsSummary> getHelpAnalytics(@PathVariable String childId);

  @Operation(
      summary = "Help request patterns",
      description = "One record per help request inside the window, oldest first"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Patterns returned"),
      @ApiResponse(responseCode = "400", description = "Unknown window"),
      @ApiResponse(responseCode = "401", description = "Not authenticated"),
      @ApiResponse(responseCode = "403", description = "Not the child or its guardian")
  })
  @GetMapping(value = HELP_PATTERNS)
  ResponseEntity<List<PatternRecord>> getHelpRequestPatterns(
      @PathVariable String childId,
      @Parameter(description = "DAY, WEEK or MONTH")
      @RequestParam(defaultValue = "WEEK") AnalyticsWindow window);

  @Operation(
      summary = "Personalized suggestions",
      description = "Up to three questions the child could ask next in the subject"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Suggestions returned"),
      @ApiResponse(responseCode = "400", description = "Missing subject"),
      @ApiResponse(responseCode = "401", description = "Not authenticated"),
      @ApiResponse(responseCode = "403", description = "Not the child or its guardian")
  })
  @GetMapping(value = HELP_SUGGESTIONS)
  ResponseEntity<List<String>> getPersonalizedSuggestions(
      @PathVariable String childId,
      @RequestParam @Size(min = 1, max = 64) String subject);

  @Operation(
      summary = "Progress summary",
      description = "Cached progress projection, all-time or over a trailing WEEK or MONTH window"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Summary returned"),
      @ApiResponse(responseCode = "401", description = "Not authenticated"),
      @ApiResponse(responseCode = "403", description = "Not the child or its guardian"),
      @ApiResponse(responseCode = "503", description = "Analytics temporarily unavailable")
  })
  @GetMapping(value = PROGRESS)
  ResponseEntity<ProgressSummary> getProgressSummary(
      @PathVariable String childId,
      @Parameter(description = "Optional trailing window")
      @RequestParam(required = false) AnalyticsWindow window);

  @Operation(
      summary = "Cache statistics",
      description = "Key count and memory of the cache store plus this instance's hit and miss counters"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Statistics returned"),
      @ApiResponse(responseCode = "401", description = "Not authenticated"),
      @ApiResponse(responseCode = "403", description = "Child sessions cannot read cache statistics")
  })
  @GetMapping(value = CACHE_STATS)
  ResponseEntity<CacheStatsView> getCacheStats();
}
