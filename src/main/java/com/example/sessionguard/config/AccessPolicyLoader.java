package com.example.sessionguard.config;

import com.example.sessionguard.domain.entity.AccessPolicy;
import com.example.sessionguard.domain.entity.AccessRequirement;
import com.example.sessionguard.domain.entity.AccessRule;
import com.example.sessionguard.exception.PolicyException;
import com.example.sessionguard.properties.ApplicationProperties.GuardProperties;
import com.example.sessionguard.properties.ApplicationProperties.GuardProperties.RuleProperties;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.AntPathMatcher;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the immutable {@link AccessPolicy} from the guard configuration.
 * Collects every problem and fails with a single {@link PolicyException}.
 */
@Slf4j
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class AccessPolicyLoader {

  private static final String PATH_PREFIX_SLASH = "/";
  private static final String PROTOCOL_RELATIVE_PREFIX = "//";
  private static final String PATH_TRAVERSAL_SEQUENCE = "..";
  private static final String MATCH_EVERYTHING = "/**";

  public static AccessPolicy load(GuardProperties guard) {
    List<String> errors = new ArrayList<>();
    AntPathMatcher matcher = new AntPathMatcher();

    validateLocalPath(guard.loginPath(), "Login path", errors);
    validateLocalPath(guard.defaultReturnPath(), "Default return path", errors);
    if (guard.returnToParameter() == null || guard.returnToParameter().isBlank()) {
      errors.add("Return-to parameter name cannot be blank.");
    }
    if (guard.unmatched() == null) {
      errors.add("Requirement for unmatched paths must be set.");
    } else if (guard.unmatched().isTargetRequired()) {
      errors.add("Requirement for unmatched paths cannot be %s: it needs a per-rule target."
                     .formatted(guard.unmatched()));
    }

    List<RuleProperties> ruleProperties = guard.rules() != null ? guard.rules() : List.of();
    List<AccessRule> rules = new ArrayList<>();
    Set<String> seenPatterns = new HashSet<>();
    String catchAllPattern = null;

    for (int i = 0; i < ruleProperties.size(); i++) {
      RuleProperties rule = ruleProperties.get(i);
      String label = "Rule #%d".formatted(i + 1);

      if (rule == null) {
        errors.add(label + " is empty.");
        continue;
      }
      if (rule.pattern() == null || rule.pattern().isBlank()) {
        errors.add(label + " has no path pattern.");
        continue;
      }
      label = "%s (%s)".formatted(label, rule.pattern());

      if (!rule.pattern().startsWith(PATH_PREFIX_SLASH)) {
        errors.add(label + " pattern must start with a '/'.");
      }
      if (!seenPatterns.add(rule.pattern())) {
        errors.add(label + " duplicates an earlier pattern and can never match.");
      }
      if (catchAllPattern != null) {
        errors.add("%s is unreachable: it follows catch-all pattern %s.".formatted(label, catchAllPattern));
      }
      if (MATCH_EVERYTHING.equals(rule.pattern())) {
        catchAllPattern = rule.pattern();
      }

      if (rule.requirement() == null) {
        errors.add(label + " has no requirement.");
        continue;
      }
      boolean hasTarget = rule.target() != null && !rule.target().isBlank();
      if (rule.requirement().isTargetRequired() && !hasTarget) {
        errors.add("%s requirement %s needs a target.".formatted(label, rule.requirement()));
      }
      if (!rule.requirement().isTargetRequired() && hasTarget) {
        errors.add("%s requirement %s does not take a target.".formatted(label, rule.requirement()));
      }
      if (hasTarget) {
        validateLocalPath(rule.target(), label + " target", errors);
      }

      rules.add(new AccessRule(rule.pattern(), rule.requirement(), hasTarget ? rule.target() : null));
    }

    if (errors.isEmpty()) {
      validateLoginReachable(guard, rules, matcher, errors);
    }

    if (!errors.isEmpty()) {
      PolicyException exception = new PolicyException(errors);
      log.error(exception.getMessage());
      throw exception;
    }

    AccessPolicy policy = new AccessPolicy(rules, guard.unmatched(), guard.loginPath(), guard.returnToParameter());
    log.info("Access policy loaded: {} rule(s), unmatched paths are {}", rules.size(), guard.unmatched());
    return policy;
  }

  /**
   * The login page must be reachable without a session, otherwise every redirect loops.
   */
  private static void validateLoginReachable(GuardProperties guard, List<AccessRule> rules,
                                             AntPathMatcher matcher, List<String> errors) {
    String loginPath = stripQuery(guard.loginPath());
    AccessRequirement loginRequirement = rules.stream()
        .filter(rule -> matcher.match(rule.pattern(), loginPath))
        .map(AccessRule::requirement)
        .findFirst()
        .orElse(guard.unmatched());

    if (loginRequirement.requiresSession() || loginRequirement == AccessRequirement.DENY_ALL) {
      errors.add("Login path %s must be reachable without a session, but it is %s."
                     .formatted(guard.loginPath(), loginRequirement));
    }
  }

  private static void validateLocalPath(String path, String fieldName, List<String> errors) {
    if (path == null || path.isBlank()) {
      errors.add(fieldName + " cannot be blank.");
      return;
    }
    if (!path.startsWith(PATH_PREFIX_SLASH) || path.startsWith(PROTOCOL_RELATIVE_PREFIX)) {
      errors.add("%s must be a local path starting with a single '/': %s".formatted(fieldName, path));
    }
    if (path.contains(PATH_TRAVERSAL_SEQUENCE)) {
      errors.add("%s cannot contain path traversal sequence '..': %s".formatted(fieldName, path));
    }
  }

  private static String stripQuery(String path) {
    int query = path.indexOf('?');
    return query >= 0 ? path.substring(0, query) : path;
  }
}
