package com.example.planner.domain.model;

public enum FingerprintMatch {
  MATCH,
  PARTIAL_MATCH,
  MISMATCH
}
