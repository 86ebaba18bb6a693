package com.example.planner.web.rest.controller;

import static com.example.planner.web.rest.ApiConstants.ApiPath.*;

import com.example.planner.web.rest.dto.RevocationResponse;
import com.example.planner.web.rest.dto.SessionView;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.List;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

/**
 * Session oversight. Callers see their own sessions and those of the children they guard.
 */
@Tag(
    name = "Session Management",
    description = "Active sessions, session history and revocation"
)
@Validated
@RequestMapping(
    value = API_BASE + SESSIONS,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface SessionAPI {

  @Operation(
      summary = "List active sessions",
      description = "Sessions that are active and inside their idle and absolute limits"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Sessions returned"),
      @ApiResponse(responseCode = "401", description = "Not authenticated"),
      @ApiResponse(responseCode = "403", description = "Not the principal or its guardian")
  })
  @GetMapping(value = ACTIVE)
  ResponseEntity<List<SessionView>> listActiveSessions(
      @Parameter(description = "Principal to inspect, defaults to the caller")
      @RequestParam(required = false) String principalId);

  @Operation(
      summary = "Session history",
      description = "Sessions issued inside the trailing window, newest first"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "History returned"),
      @ApiResponse(responseCode = "400", description = "Invalid window or limit"),
      @ApiResponse(responseCode = "401", description = "Not authenticated"),
      @ApiResponse(responseCode = "403", description = "Not the principal or its guardian")
  })
  @GetMapping(value = HISTORY)
  ResponseEntity<List<SessionView>> getSessionHistory(
      @Parameter(description = "Principal to inspect, defaults to the caller")
      @RequestParam(required = false) String principalId,
      @Parameter(description = "Trailing window in days, defaults to the configured retention")
      @RequestParam(required = false) @Min(1) @Max(365) Integer days,
      @Parameter(description = "Maximum number of sessions")
      @RequestParam(required = false) @Min(1) @Max(100) Integer limit);

  @Operation(
      summary = "Revoke one session",
      description = "Terminates the session and its refresh tokens. Idempotent."
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "204", description = "Session is terminated"),
      @ApiResponse(responseCode = "401", description = "Not authenticated"),
      @ApiResponse(responseCode = "403", description = "Not the principal or its guardian"),
      @ApiResponse(responseCode = "404", description = "Unknown session")
  })
  @DeleteMapping(value = SESSION_ID)
  ResponseEntity<Void> revokeSession(@PathVariable String sessionId);

  @Operation(
      summary = "Revoke all sessions",
      description = "Terminates every active session of the principal"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Sessions revoked"),
      @ApiResponse(responseCode = "401", description = "Not authenticated"),
      @ApiResponse(responseCode = "403", description = "Not the principal or its guardian")
  })
  @DeleteMapping
  ResponseEntity<RevocationResponse> revokeAllSessions(@RequestParam String principalId);
}
