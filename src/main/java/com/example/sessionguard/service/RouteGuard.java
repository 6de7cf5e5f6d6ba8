package com.example.sessionguard.service;

import com.example.sessionguard.domain.entity.AccessPolicy;
import com.example.sessionguard.domain.entity.AccessRequirement;
import com.example.sessionguard.domain.entity.AccessRule;
import com.example.sessionguard.domain.entity.RouteDecision;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.util.PathMatcher;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Optional;

/**
 * Maps (session presence, path, policy) to exactly one {@link RouteDecision}.
 * <p>
 * Pure and deterministic: no I/O, no clock, no state beyond the thread-safe path matcher.
 * Rules are walked in declaration order and the first match wins; unmatched paths get the
 * policy's configured default requirement.
 */
@Component
public class RouteGuard {

  private final PathMatcher pathMatcher = new AntPathMatcher();

  public RouteDecision decide(boolean sessionPresent, String path, AccessPolicy policy) {
    return decide(sessionPresent, path, path, policy);
  }

  /**
   * @param sessionPresent whether the (possibly refreshed) request carries a session
   * @param path           the request path matched against the rules
   * @param returnTo       the location a post-login flow should resume at, usually path plus query
   * @param policy         the access policy
   */
  public RouteDecision decide(boolean sessionPresent, String path, String returnTo, AccessPolicy policy) {
    String normalizedPath = (path == null || path.isEmpty()) ? "/" : path;

    Optional<AccessRule> match = firstMatch(normalizedPath, policy);
    AccessRequirement requirement = match.map(AccessRule::requirement).orElse(policy.unmatchedRequirement());
    String target = match.map(AccessRule::target).orElse(null);

    return switch (requirement) {
      case PUBLIC -> RouteDecision.allow();
      case AUTHENTICATED -> sessionPresent
          ? RouteDecision.allow()
          : RouteDecision.redirect(withReturnTo(policy.loginPath(), returnTo, policy));
      case AUTHENTICATED_REDIRECT -> sessionPresent
          ? RouteDecision.allow()
          : RouteDecision.redirect(withReturnTo(target != null ? target : policy.loginPath(), returnTo, policy));
      case AUTHENTICATED_DENY -> sessionPresent
          ? RouteDecision.allow()
          : RouteDecision.deny(HttpStatus.UNAUTHORIZED.value());
      case GUEST_ONLY -> sessionPresent
          ? RouteDecision.redirect(target != null ? target : "/")
          : RouteDecision.allow();
      case DENY_ALL -> RouteDecision.deny(HttpStatus.FORBIDDEN.value());
    };
  }

  /**
   * The first rule whose pattern matches the path, in declaration order.
   */
  public Optional<AccessRule> firstMatch(String path, AccessPolicy policy) {
    for (AccessRule rule : policy.rules()) {
      if (pathMatcher.match(rule.pattern(), path)) {
        return Optional.of(rule);
      }
    }
    return Optional.empty();
  }

  private String withReturnTo(String target, String returnTo, AccessPolicy policy) {
    if (returnTo == null || returnTo.isEmpty()) {
      return target;
    }
    return UriComponentsBuilder.fromUriString(target)
        .queryParam(policy.returnToParameter(), "{returnTo}")
        .encode()
        .buildAndExpand(returnTo)
        .toUriString();
  }
}
