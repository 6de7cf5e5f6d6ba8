package com.example.sessionguard.domain.entity;

/**
 * What a path requires of the current session.
 */
public enum AccessRequirement {
  PUBLIC(false),
  // No session: redirect to the policy's login path.
  AUTHENTICATED(false),
  // No session: redirect to the rule's own target.
  AUTHENTICATED_REDIRECT(true),
  // No session: 401 instead of a navigation redirect.
  AUTHENTICATED_DENY(false),
  // Session present: redirect to the rule's target (e.g. away from the login page).
  GUEST_ONLY(true),
  DENY_ALL(false);

  private final boolean targetRequired;

  AccessRequirement(boolean targetRequired) {
    this.targetRequired = targetRequired;
  }

  public boolean isTargetRequired() {
    return targetRequired;
  }

  public boolean requiresSession() {
    return this == AUTHENTICATED || this == AUTHENTICATED_REDIRECT || this == AUTHENTICATED_DENY;
  }
}
