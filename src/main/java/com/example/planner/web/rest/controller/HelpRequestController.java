package com.example.planner.web.rest.controller;

import com.example.planner.domain.entity.HelpRequest;
import com.example.planner.security.SessionAuthentication;
import com.example.planner.service.ActivityService;
import com.example.planner.service.HelpAnalyticsService;
import com.example.planner.service.PrincipalDirectory;
import com.example.planner.web.rest.CurrentSession;
import com.example.planner.web.rest.dto.HelpRequestCreateRequest;
import com.example.planner.web.rest.dto.HelpRequestView;
import com.example.planner.web.rest.dto.HelpResponseRequest;
import com.example.planner.web.rest.dto.ReportHelpResponseRequest;
import com.example.planner.web.rest.dto.ResolveHelpRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class HelpRequestController implements HelpRequestAPI {

  private final ActivityService activityService;
  private final HelpAnalyticsService helpAnalyticsService;
  private final PrincipalDirectory principalDirectory;

  @Override
  public ResponseEntity<HelpRequestView> createHelpRequest(HelpRequestCreateRequest request) {
    SessionAuthentication session = CurrentSession.requireChild();
    HelpRequest created = activityService.askForHelp(
        session.getPrincipal().id(),
        session.getSessionId(),
        session.getTimezone(),
        request.question(),
        request.toContext());
    return ResponseEntity.status(HttpStatus.CREATED).body(HelpRequestView.from(created));
  }

  @Override
  public ResponseEntity<HelpRequestView> respond(Long id, HelpResponseRequest request) {
    SessionAuthentication session = authorize(id);
    HelpRequest answered = activityService.answerHelpRequest(id, session.getSessionId(), request.response());
    return ResponseEntity.ok(HelpRequestView.from(answered));
  }

  @Override
  public ResponseEntity<HelpRequestView> resolve(Long id, ResolveHelpRequest request) {
    authorize(id);
    return ResponseEntity.ok(HelpRequestView.from(helpAnalyticsService.markResolved(id, request.wasHelpful())));
  }

  @Override
  public ResponseEntity<HelpRequestView> report(Long id, ReportHelpResponseRequest request) {
    authorize(id);
    HelpRequest reported = helpAnalyticsService.reportResponse(id, request.reason(), request.details());
    return ResponseEntity.ok(HelpRequestView.from(reported));
  }

  private SessionAuthentication authorize(Long helpRequestId) {
    SessionAuthentication session = CurrentSession.require();
    String childId = activityService.getHelpRequest(helpRequestId).getChildId();
    principalDirectory.assertCanOversee(session.getPrincipal(), childId);
    return session;
  }
}
