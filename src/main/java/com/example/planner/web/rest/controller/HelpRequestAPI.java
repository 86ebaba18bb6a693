package com.example.planner.web.rest.controller;

import static com.example.planner.web.rest.ApiConstants.ApiPath.*;

import com.example.planner.web.rest.dto.HelpRequestCreateRequest;
import com.example.planner.web.rest.dto.HelpRequestView;
import com.example.planner.web.rest.dto.HelpResponseRequest;
import com.example.planner.web.rest.dto.ReportHelpResponseRequest;
import com.example.planner.web.rest.dto.ResolveHelpRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;

@Tag(
    name = "Help Requests",
    description = "Questions asked by a child and their answers"
)
@RequestMapping(
    value = API_BASE + HELP_REQUESTS,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface HelpRequestAPI {

  @Operation(
      summary = "Ask for help",
      description = "Creates a help request for the calling child. May notify the guardian when help is sought often."
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "201", description = "Help request created"),
      @ApiResponse(responseCode = "400", description = "Invalid request"),
      @ApiResponse(responseCode = "401", description = "Not authenticated"),
      @ApiResponse(responseCode = "403", description = "Not a child session")
  })
  @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<HelpRequestView> createHelpRequest(@Valid @RequestBody HelpRequestCreateRequest request);

  @Operation(
      summary = "Answer a help request",
      description = "Stores the response. A resolved request is returned unchanged."
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Response stored"),
      @ApiResponse(responseCode = "400", description = "Invalid response"),
      @ApiResponse(responseCode = "401", description = "Not authenticated"),
      @ApiResponse(responseCode = "403", description = "Not the child or its guardian"),
      @ApiResponse(responseCode = "404", description = "Unknown help request")
  })
  @PostMapping(value = HELP_REQUEST_RESPONSE, consumes = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<HelpRequestView> respond(@PathVariable Long id, @Valid @RequestBody HelpResponseRequest request);

  @Operation(
      summary = "Resolve a help request",
      description = "Marks the request resolved and records whether the answer helped. Idempotent."
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Request resolved"),
      @ApiResponse(responseCode = "401", description = "Not authenticated"),
      @ApiResponse(responseCode = "403", description = "Not the child or its guardian"),
      @ApiResponse(responseCode = "404", description = "Unknown help request")
  })
  @PostMapping(value = HELP_REQUEST_RESOLVE, consumes = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<HelpRequestView> resolve(@PathVariable Long id, @Valid @RequestBody ResolveHelpRequest request);

  @Operation(
      summary = "Report a response",
      description = "Flags the answer of a help request as inappropriate or wrong"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Report stored"),
      @ApiResponse(responseCode = "401", description = "Not authenticated"),
      @ApiResponse(responseCode = "403", description = "Not the child or its guardian"),
      @ApiResponse(responseCode = "404", description = "Unknown help request")
  })
  @PostMapping(value = HELP_REQUEST_REPORT, consumes = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<HelpRequestView> report(@PathVariable Long id, @Valid @RequestBody ReportHelpResponseRequest request);
}
