package com.example.sessionguard.web.rest.controller;

import com.example.sessionguard.domain.entity.SessionArtifact;
import com.example.sessionguard.exception.SessionException;
import com.example.sessionguard.security.RenderSessionAccessor;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Session inspection. Reads through the server-rendering context and never refreshes.
 */
@RestController
@Slf4j
@RequiredArgsConstructor
public class SessionController implements SessionAPI {

  private final RenderSessionAccessor renderSessionAccessor;

  @Override
  public ResponseEntity<Map<String, Object>> status(HttpServletRequest request) {
    boolean authenticated = renderSessionAccessor.current(request).isAuthenticated();
    log.trace("Session status check: {}", authenticated);

    return ResponseEntity.ok(Map.of(
        "authenticated", authenticated,
        "timestamp", System.currentTimeMillis()
                                   ));
  }

  @Override
  public ResponseEntity<Map<String, Object>> current(HttpServletRequest request) {
    SessionArtifact artifact = renderSessionAccessor.current(request).current()
        .orElseThrow(() -> new SessionException("No session found"));

    return ResponseEntity.ok(Map.of(
        "subjectId", artifact.subjectId(),
        "expiresAt", artifact.expiresAt(),
        "refreshSequence", artifact.refreshSequence(),
        "timestamp", System.currentTimeMillis()
                                   ));
  }
}
