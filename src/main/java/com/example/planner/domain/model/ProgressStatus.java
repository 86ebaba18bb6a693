package com.example.planner.domain.model;

public enum ProgressStatus {
  NOT_STARTED,
  IN_PROGRESS,
  COMPLETED
}
