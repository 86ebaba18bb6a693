package com.example.planner.domain.model;

public enum AnomalyVerdict {
  OK,
  SUSPICIOUS
}
