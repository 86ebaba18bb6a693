package com.example.planner.web.rest.controller;

import static com.example.planner.web.rest.ApiConstants.ApiPath.*;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Unauthenticated probes for the orchestrator. Bodies are informational; callers act on the status code.
 */
@Tag(
    name = "Health",
    description = "Process and dependency probes"
)
@RequestMapping(
    value = HEALTH_BASE,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface HealthAPI {

  @Operation(summary = "Planner process is up")
  @GetMapping
  ResponseEntity<Map<String, Object>> health();

  @Operation(
      summary = "Liveness probe",
      description = "Fails when heap usage crosses the restart threshold"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Heap below threshold"),
      @ApiResponse(responseCode = "503", description = "Heap exhausted, restart the instance")
  })
  @GetMapping(value = LIVE)
  ResponseEntity<Map<String, Object>> liveness();

  @Operation(
      summary = "Readiness probe",
      description = "Sessions, anomaly windows and the progress cache need Redis; "
          + "sessions and analytics need the relational store. Both must answer before traffic is routed here."
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Redis and the relational store are reachable"),
      @ApiResponse(responseCode = "503", description = "A dependency is down or Redis is answering slowly")
  })
  @GetMapping(value = READY)
  ResponseEntity<Map<String, Object>> readiness();
}
