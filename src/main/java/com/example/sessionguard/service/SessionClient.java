package com.example.sessionguard.service;

import com.example.sessionguard.domain.entity.RefreshOutcome;
import com.example.sessionguard.domain.entity.SessionArtifact;
import com.example.sessionguard.domain.entity.SessionContext;
import com.example.sessionguard.exception.BackendException;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Optional;

/**
 * Long-lived client-context session holder.
 * <p>
 * Owns a {@link SessionContext#CLIENT} store and runs the same refresh protocol as the edge
 * interceptor against its own copy. Cookies written elsewhere are reconciled through
 * {@link #adoptTransportValue(String)}, which never moves the session backwards.
 */
@Slf4j
public class SessionClient {

  private final SessionStore store;
  private final SessionStoreFactory storeFactory;
  private final TokenRefresher tokenRefresher;
  private final SessionLifecycleService lifecycleService;

  SessionClient(SessionStore store, SessionStoreFactory storeFactory, TokenRefresher tokenRefresher,
                SessionLifecycleService lifecycleService) {
    if (store.context() != SessionContext.CLIENT) {
      throw new IllegalArgumentException("Session client requires a CLIENT store, got " + store.context());
    }
    this.store = store;
    this.storeFactory = Objects.requireNonNull(storeFactory, "storeFactory");
    this.tokenRefresher = Objects.requireNonNull(tokenRefresher, "tokenRefresher");
    this.lifecycleService = Objects.requireNonNull(lifecycleService, "lifecycleService");
  }

  public Optional<SessionArtifact> current() {
    return store.current();
  }

  public boolean isAuthenticated() {
    return store.isAuthenticated();
  }

  /**
   * Exchange credentials for a brand-new session, replacing whatever was held before.
   *
   * @throws BackendException if the backend rejects the credentials or is unreachable
   */
  public synchronized SessionArtifact signIn(String identifier, String secret) {
    SessionArtifact artifact = lifecycleService.signIn(identifier, secret);
    store.clear();
    store.replace(artifact);
    return artifact;
  }

  /**
   * Refresh the held session if it is within the skew window.
   *
   * @return the refresh outcome, or empty if no refresh was due
   */
  public Optional<RefreshOutcome> ensureFresh() {
    return tokenRefresher.refreshIfDue(store);
  }

  /**
   * Revoke the held session at the backend (best effort) and drop it locally.
   */
  public synchronized void signOut() {
    Optional<SessionArtifact> signedOut = store.current();
    store.clear();
    lifecycleService.signOut(signedOut.orElse(null));
  }

  /**
   * Reconcile with a cookie value observed from another context, such as a response that
   * went through the edge interceptor.
   *
   * @param transportValue the observed cookie value; blank means the session was cleared
   * @return {@code true} if the held session changed
   */
  public synchronized boolean adoptTransportValue(String transportValue) {
    if (transportValue == null || transportValue.isBlank()) {
      if (!store.isAuthenticated()) {
        return false;
      }
      store.clear();
      log.debug("Client session cleared by observed cookie");
      return true;
    }

    Optional<SessionArtifact> observed = storeFactory.openClient(transportValue).current();
    if (observed.isEmpty()) {
      log.debug("Ignoring undecodable cookie value in client context");
      return false;
    }

    SessionArtifact next = observed.get();
    Optional<SessionArtifact> held = store.current();
    if (held.isPresent() && held.get().equals(next)) {
      return false;
    }
    if (held.isPresent() && !held.get().subjectId().equals(next.subjectId())) {
      // A different subject signed in elsewhere; its sequence restarts at zero.
      store.clear();
    }
    return store.replace(next);
  }

  /**
   * Cookie value for the held session, or an empty string when signed out.
   */
  public String transportValue() {
    return store.transportValue();
  }

  @Override
  public String toString() {
    return "SessionClient[" + store + "]";
  }
}
