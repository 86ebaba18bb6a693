package com.example.planner.exception;

public class SessionNotFoundException extends SessionException {
  public SessionNotFoundException(String message) {
    super(message);
  }
}
