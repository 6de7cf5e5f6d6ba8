package com.example.sessionguard.domain.entity;

/**
 * Execution contexts sharing one session cookie.
 * The tag decides whether a {@code SessionStore} may be mutated.
 */
public enum SessionContext {
  // Request interceptor running before every request; may rewrite response headers.
  EDGE_INTERCEPTOR(true),
  // Request handlers rendering a response; headers are already committed.
  SERVER_RENDER(false),
  // Long-lived holder with its own refresh lifecycle.
  CLIENT(true);

  private final boolean mutable;

  SessionContext(boolean mutable) {
    this.mutable = mutable;
  }

  public boolean isMutable() {
    return mutable;
  }
}
