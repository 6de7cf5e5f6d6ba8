package com.example.sessionguard.domain.entity;

/**
 * Result of one refresh exchange, shared by every coalesced caller.
 *
 * @param status   what happened
 * @param artifact the replacement artifact, only for {@link Status#SUCCESS}
 */
public record RefreshOutcome(Status status, SessionArtifact artifact) {

  private static final RefreshOutcome EXPIRED_NO_REFRESH = new RefreshOutcome(Status.EXPIRED_NO_REFRESH, null);
  private static final RefreshOutcome BACKEND_UNREACHABLE = new RefreshOutcome(Status.BACKEND_UNREACHABLE, null);
  private static final RefreshOutcome INVALID_REFRESH_TOKEN = new RefreshOutcome(Status.INVALID_REFRESH_TOKEN, null);

  public enum Status {
    SUCCESS,
    EXPIRED_NO_REFRESH,
    BACKEND_UNREACHABLE,
    INVALID_REFRESH_TOKEN
  }

  public static RefreshOutcome success(SessionArtifact artifact) {
    if (artifact == null) {
      throw new IllegalArgumentException("A successful refresh must carry an artifact");
    }
    return new RefreshOutcome(Status.SUCCESS, artifact);
  }

  public static RefreshOutcome expiredNoRefresh() {
    return EXPIRED_NO_REFRESH;
  }

  public static RefreshOutcome backendUnreachable() {
    return BACKEND_UNREACHABLE;
  }

  public static RefreshOutcome invalidRefreshToken() {
    return INVALID_REFRESH_TOKEN;
  }

  public boolean isSuccess() {
    return status == Status.SUCCESS;
  }

  /**
   * Whether the session must be cleared: the refresh token can never be exchanged again.
   */
  public boolean isIrrecoverable() {
    return status == Status.INVALID_REFRESH_TOKEN || status == Status.EXPIRED_NO_REFRESH;
  }

  /**
   * Transient failures are not retained for coalescing, so a later request retries.
   */
  public boolean isTransient() {
    return status == Status.BACKEND_UNREACHABLE;
  }
}
