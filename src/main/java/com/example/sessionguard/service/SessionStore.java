package com.example.sessionguard.service;

import com.example.sessionguard.domain.entity.SessionArtifact;
import com.example.sessionguard.domain.entity.SessionContext;
import com.example.sessionguard.exception.SessionException;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Optional;

/**
 * Context-scoped holder of the current session artifact.
 * <p>
 * One type serves every context; the {@link SessionContext} tag decides whether
 * {@link #replace} and {@link #clear} are permitted. Decoding happens once, when the
 * store is opened, so reads never block.
 */
@Slf4j
public final class SessionStore {

  private final SessionContext context;
  private final SessionCodec codec;
  private final boolean presented;

  private volatile SessionArtifact current;
  private volatile boolean modified;

  SessionStore(SessionContext context, SessionCodec codec, SessionArtifact initial, boolean presented) {
    this.context = Objects.requireNonNull(context, "context");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.current = initial;
    this.presented = presented;
  }

  public SessionContext context() {
    return context;
  }

  public Optional<SessionArtifact> current() {
    return Optional.ofNullable(current);
  }

  public boolean isAuthenticated() {
    return current != null;
  }

  /**
   * Whether the inbound transport value was non-blank, even if it failed to decode.
   */
  public boolean wasPresented() {
    return presented;
  }

  public boolean isModified() {
    return modified;
  }

  /**
   * Atomically replace the whole artifact.
   *
   * @param next the new artifact
   * @return {@code false} if the write was rejected as stale
   * @throws SessionException if this context is read-only
   */
  public synchronized boolean replace(SessionArtifact next) {
    requireMutable("replace");
    Objects.requireNonNull(next, "next");

    SessionArtifact prior = current;
    if (prior != null) {
      if (prior.equals(next)) {
        return true;
      }
      if (next.refreshSequence() <= prior.refreshSequence()) {
        log.warn("Rejected stale session write for subject {}: sequence {} is not newer than {}",
                 next.subjectId(), next.refreshSequence(), prior.refreshSequence());
        return false;
      }
    }

    current = next;
    modified = true;
    return true;
  }

  /**
   * Drop the session: explicit sign-out or irrecoverable refresh failure.
   *
   * @throws SessionException if this context is read-only
   */
  public synchronized void clear() {
    requireMutable("clear");
    if (current != null) {
      current = null;
      modified = true;
    }
  }

  /**
   * The encoded current artifact, or an empty string when there is no session.
   */
  public String transportValue() {
    SessionArtifact artifact = current;
    return artifact != null ? codec.encode(artifact) : "";
  }

  private void requireMutable(String operation) {
    if (!context.isMutable()) {
      throw new SessionException("Cannot " + operation + " session in read-only context " + context);
    }
  }

  @Override
  public String toString() {
    return "SessionStore[context=" + context + ", session=" + current + ", modified=" + modified + "]";
  }
}
