package com.example.planner.web.rest.dto;

import com.example.planner.domain.model.DeviceDescriptor;
import com.example.planner.domain.model.LoginCommand;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

@Schema(description = "Child login with username and PIN, or adult login with email and password")
public record LoginRequest(
    @Size(max = 64) String username,
    @Pattern(regexp = "\\d{4,8}", message = "PIN must be 4 to 8 digits") String pin,
    @Email @Size(max = 254) String email,
    @Size(max = 128) String password,
    @Valid DeviceDescriptor device
) {
  public LoginCommand toCommand(String sourceAddress) {
    return new LoginCommand(username, pin, email, password, device, sourceAddress);
  }
}
