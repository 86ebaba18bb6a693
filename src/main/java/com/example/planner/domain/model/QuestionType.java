package com.example.planner.domain.model;

import java.util.Locale;

/**
 * Coarse classification of a question from keyword heuristics.
 */
public enum QuestionType {
  CONCEPT,
  PROCEDURE,
  APPLICATION,
  GENERAL;

  public static QuestionType classify(String question) {
    if (question == null) {
      return GENERAL;
    }
    String text = question.toLowerCase(Locale.ROOT);
    if (text.contains("what") || text.contains("why") || text.contains("explain")) {
      return CONCEPT;
    }
    if (text.contains("how") || text.contains("step")) {
      return PROCEDURE;
    }
    if (text.contains("solve") || text.contains("calculate")) {
      return APPLICATION;
    }
    return GENERAL;
  }
}
