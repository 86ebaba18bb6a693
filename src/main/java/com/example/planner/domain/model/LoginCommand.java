package com.example.planner.domain.model;

/**
 * Child logins carry username and PIN, adult logins email and password.
 */
public record LoginCommand(
    String username,
    String pin,
    String email,
    String password,
    DeviceDescriptor device,
    String sourceAddress
) {
  public boolean isChildLogin() {
    return username != null && !username.isBlank() && pin != null;
  }

  public boolean isAdultLogin() {
    return email != null && !email.isBlank() && password != null;
  }
}
