package com.example.planner.domain.entity;

/**
 * Immutable view of a principal placed in the security context and the local principal cache.
 */
public record AuthenticatedPrincipal(
    String id,
    PrincipalRole role,
    String loginName,
    String guardianId,
    String displayName
) {
  public static AuthenticatedPrincipal from(Principal principal) {
    return new AuthenticatedPrincipal(
        principal.getId(),
        principal.getRole(),
        principal.getLoginName(),
        principal.getGuardianId(),
        principal.getDisplayName());
  }

  public boolean isChild() {
    return role == PrincipalRole.CHILD;
  }
}
