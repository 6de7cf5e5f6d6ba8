package com.example.sessionguard.domain.entity;

import java.time.Duration;
import java.time.Instant;

/**
 * The authenticated-session state carried in the transport cookie.
 * Immutable: a refresh replaces the whole artifact, it never patches fields.
 */
public record SessionArtifact(

    // Opaque bearer token issued by the authentication backend.
    String accessToken,

    // Long-lived credential exchanged for a fresh access token.
    String refreshToken,

    // Access token expiry, UTC epoch seconds.
    long expiresAt,

    // Opaque identifier of the authenticated subject.
    String subjectId,

    // Incremented by every successful refresh, used to reject stale writes.
    long refreshSequence

) {

  /**
   * Latest representable expiry, 9999-12-31T23:59:59Z. Keeps {@code exp} within what JWT dates can carry.
   */
  public static final long MAX_EXPIRES_AT = 253_402_300_799L;

  public SessionArtifact {
    if (accessToken == null || accessToken.isBlank()) {
      throw new IllegalArgumentException("Access token cannot be null or empty");
    }
    if (subjectId == null || subjectId.isBlank()) {
      throw new IllegalArgumentException("Subject ID cannot be null or empty");
    }
    if (expiresAt < 0 || expiresAt > MAX_EXPIRES_AT) {
      throw new IllegalArgumentException("Expiry must be between 0 and " + MAX_EXPIRES_AT + ", but was " + expiresAt);
    }
    if (refreshSequence < 0) {
      throw new IllegalArgumentException("Refresh sequence cannot be negative");
    }
  }

  /**
   * Expiry as an {@link Instant}.
   */
  public Instant expiresAtInstant() {
    return Instant.ofEpochSecond(expiresAt);
  }

  /**
   * Checks if the access token is expired at the given instant.
   */
  public boolean isExpiredAt(Instant now) {
    return !now.isBefore(expiresAtInstant());
  }

  /**
   * Checks if the access token expires within {@code window} of {@code now}.
   * The boundary counts as due: {@code now >= expiresAt - window}.
   *
   * @param now    the current instant
   * @param window lead time before expiry
   * @return {@code true} if a proactive refresh should be attempted
   */
  public boolean expiresWithin(Instant now, Duration window) {
    return !now.isBefore(expiresAtInstant().minus(window));
  }

  public boolean hasRefreshToken() {
    return refreshToken != null && !refreshToken.isBlank();
  }

  /**
   * Creates the artifact that succeeds this one after a refresh.
   * Keeps the current refresh token when the backend did not rotate it.
   */
  public SessionArtifact successor(TokenGrant grant) {
    String nextRefreshToken = grant.refreshToken() != null && !grant.refreshToken().isBlank()
        ? grant.refreshToken()
        : refreshToken;
    String nextSubject = grant.subjectId() != null && !grant.subjectId().isBlank()
        ? grant.subjectId()
        : subjectId;
    return new SessionArtifact(grant.accessToken(), nextRefreshToken, grant.expiresAt(),
                               nextSubject, refreshSequence + 1);
  }

  /**
   * Creates a brand-new artifact from a credential exchange.
   */
  public static SessionArtifact fromGrant(TokenGrant grant) {
    return new SessionArtifact(grant.accessToken(), grant.refreshToken(), grant.expiresAt(),
                               grant.subjectId(), 0);
  }

  @Override
  public String toString() {
    // Token material stays out of logs.
    return "SessionArtifact[subjectId=" + subjectId + ", expiresAt=" + expiresAt
        + ", refreshSequence=" + refreshSequence + "]";
  }
}
