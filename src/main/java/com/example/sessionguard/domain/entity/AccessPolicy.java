package com.example.sessionguard.domain.entity;

import java.util.List;
import java.util.Objects;

/**
 * Immutable, ordered access policy. Loaded once per process and read without locking.
 *
 * @param rules                rules in declaration order; the first match wins
 * @param unmatchedRequirement requirement applied when no rule matches
 * @param loginPath            redirect target for {@link AccessRequirement#AUTHENTICATED}
 * @param returnToParameter    query parameter carrying the originally requested location
 */
public record AccessPolicy(
    List<AccessRule> rules,
    AccessRequirement unmatchedRequirement,
    String loginPath,
    String returnToParameter
) {

  public static final String DEFAULT_RETURN_TO_PARAMETER = "next";

  public AccessPolicy {
    rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
    Objects.requireNonNull(unmatchedRequirement, "unmatchedRequirement");
    Objects.requireNonNull(loginPath, "loginPath");
    Objects.requireNonNull(returnToParameter, "returnToParameter");
  }

  public static AccessPolicy of(List<AccessRule> rules, String loginPath) {
    return new AccessPolicy(rules, AccessRequirement.PUBLIC, loginPath, DEFAULT_RETURN_TO_PARAMETER);
  }
}
