package com.example.planner.domain.entity;

public enum PrincipalRole {
  ADULT,
  CHILD
}
