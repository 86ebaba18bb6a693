package com.example.planner.web.rest.controller;

import com.example.planner.domain.entity.ActivityEvent;
import com.example.planner.domain.model.ProgressDetail;
import com.example.planner.security.SessionAuthentication;
import com.example.planner.service.ActivityService;
import com.example.planner.web.rest.CurrentSession;
import com.example.planner.web.rest.dto.ActivityEventView;
import com.example.planner.web.rest.dto.PageAccessRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class ActivityController implements ActivityAPI {

  private final ActivityService activityService;

  @Override
  public ResponseEntity<ActivityEventView> recordProgress(ProgressDetail progress) {
    SessionAuthentication session = CurrentSession.requireChild();
    ActivityEvent event = activityService.recordProgress(
        session.getPrincipal().id(), session.getSessionId(), session.getTimezone(), progress);
    return ResponseEntity.status(HttpStatus.CREATED).body(ActivityEventView.from(event));
  }

  @Override
  public ResponseEntity<ActivityEventView> recordPageAccess(PageAccessRequest request) {
    SessionAuthentication session = CurrentSession.requireChild();
    ActivityEvent event = activityService.recordPageAccess(
        session.getPrincipal().id(), session.getSessionId(), session.getTimezone(), request.path());
    return ResponseEntity.status(HttpStatus.CREATED).body(ActivityEventView.from(event));
  }
}
