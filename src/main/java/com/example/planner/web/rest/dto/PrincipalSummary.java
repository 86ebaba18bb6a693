package com.example.planner.web.rest.dto;

import com.example.planner.domain.entity.AuthenticatedPrincipal;
import com.example.planner.domain.entity.PrincipalRole;

public record PrincipalSummary(String id, PrincipalRole role, String displayName, String guardianId) {

  public static PrincipalSummary from(AuthenticatedPrincipal principal) {
    return new PrincipalSummary(principal.id(), principal.role(), principal.displayName(), principal.guardianId());
  }
}
