package com.example.planner.web.rest.controller;

import static com.example.planner.web.rest.ApiConstants.ApiPath.*;

import com.example.planner.domain.model.TokenPair;
import com.example.planner.web.rest.dto.LoginRequest;
import com.example.planner.web.rest.dto.LoginResponse;
import com.example.planner.web.rest.dto.RefreshRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Tag(
    name = "Authentication",
    description = "Login, token refresh and logout for children and guardians"
)
@RequestMapping(
    value = AUTH_BASE,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface AuthAPI {

  @Operation(
      summary = "Log in",
      description = "Children log in with username and PIN, guardians with email and password"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Session created"),
      @ApiResponse(responseCode = "400", description = "Malformed request"),
      @ApiResponse(responseCode = "401", description = "Invalid credentials"),
      @ApiResponse(responseCode = "423", description = "Account temporarily locked after unusual activity")
  })
  @PostMapping(value = LOGIN, consumes = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest loginRequest, HttpServletRequest request);

  @Operation(
      summary = "Refresh tokens",
      description = "Exchanges a single-use refresh token for a new access and refresh token"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Tokens rotated"),
      @ApiResponse(responseCode = "401", description = "Refresh token invalid, used or expired")
  })
  @PostMapping(value = REFRESH, consumes = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<TokenPair> refresh(@Valid @RequestBody RefreshRequest refreshRequest);

  @Operation(
      summary = "Log out",
      description = "Terminates the session of the presented access token"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "204", description = "Logged out")
  })
  @PostMapping(value = LOGOUT)
  ResponseEntity<Void> logout(
      @Parameter(description = "Bearer access token")
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization);
}
