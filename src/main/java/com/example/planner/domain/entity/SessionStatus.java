package com.example.planner.domain.entity;

public enum SessionStatus {
  ACTIVE,
  TERMINATED
}
