package com.example.planner.domain.entity;

public enum ActivityKind {
  PAGE_ACCESS,
  HELP_REQUEST,
  PROGRESS_WRITE
}
