package com.example.sessionguard.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.sessionguard.domain.entity.AccessPolicy;
import com.example.sessionguard.domain.entity.AccessRequirement;
import com.example.sessionguard.exception.PolicyException;
import com.example.sessionguard.properties.ApplicationProperties.GuardProperties;
import com.example.sessionguard.properties.ApplicationProperties.GuardProperties.RuleProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

@DisplayName("AccessPolicyLoader")
class AccessPolicyLoaderTest {

  private static GuardProperties guard(RuleProperties... rules) {
    return new GuardProperties("/login", "next", AccessRequirement.PUBLIC, "/", new ArrayList<>(Arrays.asList(rules)));
  }

  private static RuleProperties rule(String pattern, AccessRequirement requirement) {
    return new RuleProperties(pattern, requirement, null);
  }

  private static PolicyException failure(GuardProperties guard) {
    return assertThrows(PolicyException.class, () -> AccessPolicyLoader.load(guard));
  }

  @Nested
  @DisplayName("valid configuration")
  class ValidTests {

    @Test
    @DisplayName("should keep rules in declaration order")
    void shouldKeepOrder() {
      AccessPolicy policy = AccessPolicyLoader.load(guard(
          new RuleProperties("/login", AccessRequirement.GUEST_ONLY, "/"),
          rule("/admin/**", AccessRequirement.AUTHENTICATED),
          rule("/**", AccessRequirement.PUBLIC)));

      assertEquals(3, policy.rules().size());
      assertEquals("/login", policy.rules().get(0).pattern());
      assertEquals("/**", policy.rules().get(2).pattern());
      assertEquals(AccessRequirement.PUBLIC, policy.unmatchedRequirement());
      assertEquals("next", policy.returnToParameter());
    }

    @Test
    @DisplayName("should accept an empty rule list")
    void shouldAcceptNoRules() {
      assertTrue(AccessPolicyLoader.load(guard()).rules().isEmpty());
    }

    @Test
    @DisplayName("should drop a blank target on rules that take none")
    void shouldNormalizeBlankTarget() {
      AccessPolicy policy = AccessPolicyLoader.load(guard(new RuleProperties("/a", AccessRequirement.PUBLIC, " ")));

      assertNull(policy.rules().get(0).target());
    }

    @Test
    @DisplayName("should produce an immutable policy")
    void shouldBeImmutable() {
      AccessPolicy policy = AccessPolicyLoader.load(guard(rule("/a", AccessRequirement.PUBLIC)));

      assertThrows(UnsupportedOperationException.class,
                   () -> policy.rules().add(policy.rules().get(0)));
    }
  }

  @Nested
  @DisplayName("malformed configuration")
  class MalformedTests {

    @Test
    @DisplayName("should reject a pattern without a leading slash")
    void shouldRejectRelativePattern() {
      PolicyException e = failure(guard(rule("admin/**", AccessRequirement.AUTHENTICATED)));

      assertTrue(e.getErrors().get(0).contains("must start with a '/'"));
    }

    @Test
    @DisplayName("should reject duplicate patterns")
    void shouldRejectDuplicates() {
      PolicyException e = failure(guard(rule("/a", AccessRequirement.PUBLIC), rule("/a", AccessRequirement.DENY_ALL)));

      assertTrue(e.getErrors().get(0).contains("duplicates"));
    }

    @Test
    @DisplayName("should reject rules after a catch-all")
    void shouldRejectUnreachableRules() {
      PolicyException e = failure(guard(rule("/**", AccessRequirement.PUBLIC),
                                        rule("/admin/**", AccessRequirement.AUTHENTICATED)));

      assertTrue(e.getErrors().get(0).contains("unreachable"));
    }

    @Test
    @DisplayName("should reject missing and unexpected targets")
    void shouldRejectTargetMismatch() {
      PolicyException e = failure(guard(
          rule("/account/**", AccessRequirement.AUTHENTICATED_REDIRECT),
          new RuleProperties("/admin/**", AccessRequirement.AUTHENTICATED, "/elsewhere")));

      assertEquals(2, e.getErrors().size());
    }

    @Test
    @DisplayName("should reject a non-local target")
    void shouldRejectExternalTarget() {
      PolicyException e = failure(guard(
          new RuleProperties("/account/**", AccessRequirement.AUTHENTICATED_REDIRECT, "//evil.example.com")));

      assertTrue(e.getErrors().get(0).contains("local path"));
    }

    @Test
    @DisplayName("should reject a rule without requirement")
    void shouldRejectMissingRequirement() {
      PolicyException e = failure(guard(rule("/a", null)));

      assertTrue(e.getErrors().get(0).contains("no requirement"));
    }

    @Test
    @DisplayName("should reject a login page that needs a session")
    void shouldRejectLoginLoop() {
      PolicyException e = failure(guard(rule("/**", AccessRequirement.AUTHENTICATED)));

      assertTrue(e.getErrors().get(0).contains("reachable without a session"));
    }

    @Test
    @DisplayName("should reject an unmatched default that needs a target")
    void shouldRejectUnmatchedWithTarget() {
      GuardProperties guard = new GuardProperties("/login", "next", AccessRequirement.GUEST_ONLY, "/", List.of());

      assertTrue(failure(guard).getErrors().get(0).contains("per-rule target"));
    }

    @Test
    @DisplayName("should report every problem at once")
    void shouldCollectAllErrors() {
      GuardProperties guard = new GuardProperties("login", " ", AccessRequirement.PUBLIC, "/../x",
                                                  List.of(rule("a", AccessRequirement.PUBLIC)));

      PolicyException e = failure(guard);

      assertEquals(4, e.getErrors().size());
      assertTrue(e.getMessage().startsWith("Access policy validation failed with 4 error(s)"));
    }
  }
}
