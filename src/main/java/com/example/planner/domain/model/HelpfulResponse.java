package com.example.planner.domain.model;

import java.time.Instant;

public record HelpfulResponse(
    Long helpRequestId,
    String question,
    String response,
    String subject,
    Boolean wasHelpful,
    Instant resolvedAt
) {
}
