package com.example.planner.domain.model;

import java.util.List;

/**
 * Behavioral metrics derived from a child's help-request log.
 */
public record HelpAnalyticsSummary(
    String childId,
    long totalHelpRequests,
    long helpRequestsToday,
    long helpRequestsThisWeek,
    List<TopicFrequency> frequentTopics,
    double averageResponseTimeHours,
    List<HelpfulResponse> mostHelpfulResponses,
    HelpSeekingPattern helpSeekingPattern,
    double averageDailyRate,
    int parentNotificationThreshold,
    boolean shouldNotifyParent
) {
}
