package com.example.sessionguard.domain.entity;

import java.util.List;
import java.util.Optional;

/**
 * Everything the edge interceptor needs to respond to one request.
 *
 * @param decision        the route decision
 * @param session         the (possibly refreshed) artifact, {@code null} when unauthenticated
 * @param transportUpdate what to do with the outgoing cookie
 * @param trail           pipeline states visited, in order
 * @param refreshOutcome  outcome of the refresh attempt, {@code null} when refresh was skipped
 */
public record PipelineResult(
    RouteDecision decision,
    SessionArtifact session,
    TransportUpdate transportUpdate,
    List<PipelineState> trail,
    RefreshOutcome refreshOutcome
) {

  public PipelineResult {
    trail = List.copyOf(trail);
  }

  public Optional<SessionArtifact> currentSession() {
    return Optional.ofNullable(session);
  }

  public Optional<RefreshOutcome> refreshAttempt() {
    return Optional.ofNullable(refreshOutcome);
  }
}
