package com.example.sessionguard.service;

import com.example.sessionguard.adapter.backend.AuthenticationBackend;
import com.example.sessionguard.domain.entity.SessionArtifact;
import com.example.sessionguard.domain.entity.TokenGrant;
import com.example.sessionguard.exception.BackendException;
import com.example.sessionguard.properties.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Session lifecycle outside the refresh protocol: sign-in, sign-out and return-path checks.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionLifecycleService {

  private static final String PATH_PREFIX_SLASH = "/";
  private static final String PROTOCOL_RELATIVE_PREFIX = "//";
  private static final String PATH_TRAVERSAL_SEQUENCE = "..";

  private final AuthenticationBackend backend;
  private final SessionStoreFactory storeFactory;
  private final TokenRefresher tokenRefresher;
  private final ApplicationProperties properties;

  /**
   * Exchange credentials for a new session artifact with refresh sequence zero.
   *
   * @throws BackendException if the backend rejects the credentials or is unreachable
   */
  public SessionArtifact signIn(String identifier, String secret) {
    if (identifier == null || identifier.isBlank() || secret == null || secret.isEmpty()) {
      throw new BackendException(BackendException.Kind.INVALID, "Identifier and secret are required");
    }
    TokenGrant grant = backend.exchangeCredentials(identifier, secret);
    SessionArtifact artifact = SessionArtifact.fromGrant(grant);
    log.info("Signed in subject {}", artifact.subjectId());
    return artifact;
  }

  /**
   * Revoke the session at the backend. Failures are logged and otherwise ignored: the local
   * session is dropped regardless.
   *
   * @param artifact the session being signed out, may be {@code null}
   */
  public void signOut(SessionArtifact artifact) {
    if (artifact == null) {
      return;
    }
    String token = artifact.hasRefreshToken() ? artifact.refreshToken() : artifact.accessToken();
    try {
      boolean revoked = backend.revoke(token);
      log.info("Signed out subject {} (revoked at backend: {})", artifact.subjectId(), revoked);
    } catch (BackendException e) {
      log.warn("Token revocation failed for subject {}: {}", artifact.subjectId(), e.getMessage());
    }
  }

  /**
   * Open a client-context holder seeded from a cookie value.
   *
   * @param transportValue the cookie value, may be {@code null}
   */
  public SessionClient client(String transportValue) {
    return new SessionClient(storeFactory.openClient(transportValue), storeFactory, tokenRefresher, this);
  }

  /**
   * Only local paths are accepted as post-sign-in destinations; anything else falls back to
   * the configured default.
   */
  public String validateReturnPath(String returnTo) {
    String defaultPath = properties.guard().defaultReturnPath();
    if (returnTo == null || returnTo.isBlank()) {
      return defaultPath;
    }

    String path = returnTo.trim();
    if (!path.startsWith(PATH_PREFIX_SLASH)
        || path.startsWith(PROTOCOL_RELATIVE_PREFIX)
        || path.contains(PATH_TRAVERSAL_SEQUENCE)
        || path.contains("\\")
        || path.chars().anyMatch(Character::isISOControl)) {
      log.warn("Invalid return path requested: {}, using default", returnTo);
      return defaultPath;
    }
    return path;
  }
}
