package com.example.planner.domain.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Closed set of activity content shapes. Each one knows whether it can produce a score.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = QuizContent.class, name = "quiz"),
    @JsonSubTypes.Type(value = InteractiveContent.class, name = "interactive"),
    @JsonSubTypes.Type(value = TextContent.class, name = "text")
})
public interface ActivityContent {

  /**
   * @return a 0..100 score, or null when the content carries no scoring information
   */
  Integer derivedScore();
}
