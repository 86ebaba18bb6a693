package com.example.planner.domain.model;

public enum HelpSeekingPattern {
  INDEPENDENT,
  MODERATE,
  FREQUENT
}
