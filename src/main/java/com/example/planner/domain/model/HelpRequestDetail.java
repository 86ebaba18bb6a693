package com.example.planner.domain.model;

public record HelpRequestDetail(Long helpRequestId, String subject, String action) implements ActivityDetail {

  public static final String ASKED = "asked";
  public static final String ANSWERED = "answered";
}
