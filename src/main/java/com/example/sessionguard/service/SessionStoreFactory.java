package com.example.sessionguard.service;

import com.example.sessionguard.domain.entity.SessionArtifact;
import com.example.sessionguard.domain.entity.SessionContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Opens {@link SessionStore}s for each execution context over the shared codec.
 */
@Component
@RequiredArgsConstructor
public class SessionStoreFactory {

  private final SessionCodec codec;

  /**
   * Decode a transport value into a store for the given context.
   */
  public SessionStore open(SessionContext context, String transportValue) {
    boolean presented = transportValue != null && !transportValue.isBlank();
    SessionArtifact artifact = codec.decode(transportValue).orElse(null);
    return new SessionStore(context, codec, artifact, presented);
  }

  public SessionStore openEdge(String transportValue) {
    return open(SessionContext.EDGE_INTERCEPTOR, transportValue);
  }

  public SessionStore openServerRender(String transportValue) {
    return open(SessionContext.SERVER_RENDER, transportValue);
  }

  public SessionStore openClient(String transportValue) {
    return open(SessionContext.CLIENT, transportValue);
  }

  /**
   * Read-only view over an artifact the edge interceptor already decided on.
   *
   * @param artifact the artifact, or {@code null} for "no session"
   */
  public SessionStore serverRenderView(SessionArtifact artifact) {
    return new SessionStore(SessionContext.SERVER_RENDER, codec, artifact, artifact != null);
  }
}
