package com.example.planner.exception;

public class HelpRequestNotFoundException extends RuntimeException {
  public HelpRequestNotFoundException(Long helpRequestId) {
    super("Help request not found: " + helpRequestId);
  }
}
