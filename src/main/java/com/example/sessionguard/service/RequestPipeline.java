package com.example.sessionguard.service;

import com.example.sessionguard.domain.entity.AccessPolicy;
import com.example.sessionguard.domain.entity.PipelineResult;
import com.example.sessionguard.domain.entity.PipelineState;
import com.example.sessionguard.domain.entity.RefreshOutcome;
import com.example.sessionguard.domain.entity.RouteDecision;
import com.example.sessionguard.domain.entity.TransportUpdate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Edge-interceptor flow for one inbound request:
 * RECEIVED → SESSION_DECODED → (REFRESH_ATTEMPTED | SKIP_REFRESH) → GUARDED → RESPONDED.
 * <p>
 * Transport independent; {@code SessionPipelineFilter} binds it to the servlet API.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RequestPipeline {

  private final SessionStoreFactory sessionStoreFactory;
  private final TokenRefresher tokenRefresher;
  private final RouteGuard routeGuard;
  private final AccessPolicy accessPolicy;

  public PipelineResult process(String transportValue, String path) {
    return process(transportValue, path, path);
  }

  /**
   * @param transportValue inbound cookie value, may be {@code null}
   * @param path           request path used for rule matching
   * @param returnTo       location carried by a login redirect, usually path plus query
   */
  public PipelineResult process(String transportValue, String path, String returnTo) {
    List<PipelineState> trail = new ArrayList<>();
    trail.add(PipelineState.RECEIVED);

    SessionStore store = sessionStoreFactory.openEdge(transportValue);
    trail.add(PipelineState.SESSION_DECODED);
    if (store.wasPresented() && !store.isAuthenticated()) {
      log.debug("Inbound session value for {} could not be decoded, treating request as unauthenticated", path);
    }

    // BACKEND_UNREACHABLE leaves the prior session in place; irrecoverable outcomes have cleared it
    Optional<RefreshOutcome> refreshOutcome = tokenRefresher.refreshIfDue(store);
    trail.add(refreshOutcome.isPresent() ? PipelineState.REFRESH_ATTEMPTED : PipelineState.SKIP_REFRESH);

    RouteDecision decision = routeGuard.decide(store.isAuthenticated(), path, returnTo, accessPolicy);
    trail.add(PipelineState.GUARDED);

    TransportUpdate transportUpdate = decision.isDeny() ? TransportUpdate.none() : outgoingTransport(store);
    trail.add(PipelineState.RESPONDED);

    if (log.isDebugEnabled()) {
      log.debug("Pipeline {} {} -> {} (cookie {})", path, trail, decision.type(), transportUpdate.action());
    }

    return new PipelineResult(
        decision,
        store.current().orElse(null),
        transportUpdate,
        trail,
        refreshOutcome.orElse(null));
  }

  /**
   * ALLOW and REDIRECT both carry the current session, so a redirect never drops a
   * just-refreshed artifact. A presented cookie that no longer maps to a session is cleared.
   */
  private TransportUpdate outgoingTransport(SessionStore store) {
    if (store.isAuthenticated()) {
      return TransportUpdate.set(store.transportValue());
    }
    if (store.wasPresented()) {
      return TransportUpdate.clear();
    }
    return TransportUpdate.none();
  }
}
