package com.example.sessionguard.web.rest.controller;

import static com.example.sessionguard.web.rest.ApiConstants.ErrorCode.*;
import static com.example.sessionguard.web.rest.ApiConstants.Param.*;

import com.example.sessionguard.domain.entity.SessionArtifact;
import com.example.sessionguard.exception.BackendException;
import com.example.sessionguard.properties.ApplicationProperties;
import com.example.sessionguard.security.AuthenticationFailureTracker;
import com.example.sessionguard.security.RenderSessionAccessor;
import com.example.sessionguard.service.SessionCodec;
import com.example.sessionguard.service.SessionLifecycleService;
import com.example.sessionguard.util.CookieUtil;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Map;

/**
 * REST controller for sign-in and sign-out.
 */
@RestController
@Slf4j
@RequiredArgsConstructor
public class AuthController implements AuthAPI {

  private final SessionLifecycleService lifecycleService;
  private final SessionCodec sessionCodec;
  private final RenderSessionAccessor renderSessionAccessor;
  private final AuthenticationFailureTracker failureTracker;
  private final ApplicationProperties properties;

  /**
   * Exchange credentials for a session and redirect to the validated return path.
   */
  @Override
  public ResponseEntity<Void> signIn(String identifier, String secret, String next,
                                     HttpServletRequest request, HttpServletResponse response) {
    String returnPath = lifecycleService.validateReturnPath(next);
    String clientIp = extractClientIp(request);

    if (failureTracker.isBlocked(clientIp)) {
      log.warn("Sign-in rejected for blocked client");
      return redirectToLogin(TOO_MANY_ATTEMPTS, returnPath);
    }

    try {
      SessionArtifact artifact = lifecycleService.signIn(identifier, secret);
      CookieUtil.setSessionCookie(response, sessionCodec.encode(artifact), properties.session().cookie());
      failureTracker.clearFailures(clientIp);

      return ResponseEntity.status(HttpStatus.FOUND)
          .header(HttpHeaders.CACHE_CONTROL, "no-cache, no-store, must-revalidate")
          .location(URI.create(request.getContextPath() + returnPath))
          .build();

    } catch (BackendException e) {
      if (e.getKind() == BackendException.Kind.UNREACHABLE) {
        log.error("Sign-in failed, authentication backend unreachable: {}", e.getMessage());
        return redirectToLogin(SERVICE_UNAVAILABLE, returnPath);
      }
      failureTracker.recordFailure(clientIp);
      log.info("Sign-in rejected by authentication backend: {}", e.getMessage());
      return redirectToLogin(INVALID_CREDENTIALS, returnPath);
    }
  }

  /**
   * Sign out: revoke at the backend, clear the cookie.
   */
  @Override
  public ResponseEntity<Map<String, Object>> signOut(HttpServletRequest request, HttpServletResponse response) {
    lifecycleService.signOut(renderSessionAccessor.current(request).current().orElse(null));

    // Written after any refreshed cookie the interceptor set, so this one wins
    CookieUtil.clearSessionCookie(response, properties.session().cookie());

    return ResponseEntity.ok(Map.of(
        "message", "Signed out successfully",
        "redirectUrl", request.getContextPath() + properties.guard().loginPath(),
        "timestamp", System.currentTimeMillis()
                                   ));
  }

  private ResponseEntity<Void> redirectToLogin(String error, String returnPath) {
    URI location = UriComponentsBuilder.fromUriString(properties.guard().loginPath())
        .queryParam(ERROR, error)
        .queryParam(properties.guard().returnToParameter(), "{next}")
        .encode()
        .buildAndExpand(returnPath)
        .toUri();
    return ResponseEntity.status(HttpStatus.FOUND)
        .location(location)
        .build();
  }

  private String extractClientIp(HttpServletRequest request) {
    // Check forwarded headers first (for proxies/load balancers)
    String xForwardedFor = request.getHeader("X-Forwarded-For");
    if (xForwardedFor != null && !xForwardedFor.isEmpty()) {
      return xForwardedFor.split(",")[0].trim();
    }

    String xRealIp = request.getHeader("X-Real-IP");
    if (xRealIp != null && !xRealIp.isEmpty()) {
      return xRealIp;
    }

    return request.getRemoteAddr();
  }
}
