package com.example.planner.web.rest.controller;

import static com.example.planner.web.rest.ApiConstants.ApiPath.*;

import com.example.planner.domain.model.ProgressDetail;
import com.example.planner.web.rest.dto.ActivityEventView;
import com.example.planner.web.rest.dto.PageAccessRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;

@Tag(
    name = "Activity",
    description = "Activity written by a child's own session"
)
@RequestMapping(
    value = API_BASE + ACTIVITIES,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface ActivityAPI {

  @Operation(
      summary = "Record progress",
      description = "Appends a progress write. Completing an activity advances the child's streaks."
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "201", description = "Progress recorded"),
      @ApiResponse(responseCode = "400", description = "Invalid progress"),
      @ApiResponse(responseCode = "401", description = "Not authenticated"),
      @ApiResponse(responseCode = "403", description = "Not a child session")
  })
  @PostMapping(value = PROGRESS_WRITE, consumes = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<ActivityEventView> recordProgress(@Valid @RequestBody ProgressDetail progress);

  @Operation(
      summary = "Record page access",
      description = "Appends a page access event used by anomaly detection"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "201", description = "Page access recorded"),
      @ApiResponse(responseCode = "400", description = "Invalid path"),
      @ApiResponse(responseCode = "401", description = "Not authenticated"),
      @ApiResponse(responseCode = "403", description = "Not a child session")
  })
  @PostMapping(value = PAGE_ACCESS, consumes = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<ActivityEventView> recordPageAccess(@Valid @RequestBody PageAccessRequest request);
}
