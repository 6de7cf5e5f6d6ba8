package com.example.sessionguard.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.sessionguard.domain.entity.AccessPolicy;
import com.example.sessionguard.domain.entity.AccessRequirement;
import com.example.sessionguard.domain.entity.AccessRule;
import com.example.sessionguard.domain.entity.RouteDecision;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.List;

@DisplayName("RouteGuard")
class RouteGuardTest {

  private final RouteGuard guard = new RouteGuard();

  private static final AccessPolicy ADMIN_POLICY = AccessPolicy.of(List.of(
      AccessRule.of("/admin/*", AccessRequirement.AUTHENTICATED),
      AccessRule.of("/*", AccessRequirement.PUBLIC)), "/login");

  private static String decodedNext(String location) {
    UriComponents components = UriComponentsBuilder.fromUriString(location).build();
    String next = components.getQueryParams().getFirst("next");
    return next != null ? UriUtils.decode(next, StandardCharsets.UTF_8) : null;
  }

  private static String pathOf(String location) {
    return UriComponentsBuilder.fromUriString(location).build().getPath();
  }

  @Nested
  @DisplayName("first-match policy")
  class FirstMatchTests {

    @Test
    @DisplayName("should redirect an anonymous admin request to login with the original path")
    void shouldRedirectAnonymousAdmin() {
      RouteDecision decision = guard.decide(false, "/admin/x", ADMIN_POLICY);

      assertTrue(decision.isRedirect());
      assertEquals("/login", pathOf(decision.location()));
      assertEquals("/admin/x", decodedNext(decision.location()));
    }

    @Test
    @DisplayName("should allow an authenticated admin request")
    void shouldAllowAuthenticatedAdmin() {
      assertTrue(guard.decide(true, "/admin/x", ADMIN_POLICY).isAllow());
    }

    @Test
    @DisplayName("should allow an anonymous public request")
    void shouldAllowAnonymousPublic() {
      assertTrue(guard.decide(false, "/about", ADMIN_POLICY).isAllow());
    }

    @Test
    @DisplayName("should honor declaration order over specificity")
    void shouldUseDeclarationOrder() {
      AccessPolicy reversed = AccessPolicy.of(List.of(
          AccessRule.of("/**", AccessRequirement.PUBLIC),
          AccessRule.of("/admin/**", AccessRequirement.AUTHENTICATED)), "/login");

      assertTrue(guard.decide(false, "/admin/x", reversed).isAllow());
      assertEquals("/**", guard.firstMatch("/admin/x", reversed).orElseThrow().pattern());
    }

    @Test
    @DisplayName("should be deterministic")
    void shouldBeDeterministic() {
      RouteDecision first = guard.decide(false, "/admin/x", ADMIN_POLICY);
      for (int i = 0; i < 10; i++) {
        assertEquals(first, guard.decide(false, "/admin/x", ADMIN_POLICY));
      }
    }
  }

  @Nested
  @DisplayName("unmatched paths")
  class UnmatchedTests {

    @Test
    @DisplayName("should default to PUBLIC")
    void shouldDefaultToPublic() {
      AccessPolicy policy = AccessPolicy.of(List.of(AccessRule.of("/admin/*", AccessRequirement.AUTHENTICATED)),
                                            "/login");

      assertTrue(guard.decide(false, "/other/page", policy).isAllow());
    }

    @Test
    @DisplayName("should apply a configured default")
    void shouldApplyConfiguredDefault() {
      AccessPolicy policy = new AccessPolicy(List.of(AccessRule.of("/login", AccessRequirement.PUBLIC)),
                                             AccessRequirement.AUTHENTICATED, "/login", "next");

      assertTrue(guard.decide(false, "/other/page", policy).isRedirect());
      assertTrue(guard.decide(false, "/login", policy).isAllow());
    }

    @Test
    @DisplayName("should treat an empty path as the root")
    void shouldNormalizeEmptyPath() {
      AccessPolicy policy = AccessPolicy.of(List.of(AccessRule.of("/", AccessRequirement.AUTHENTICATED)), "/login");

      assertTrue(guard.decide(false, "", policy).isRedirect());
      assertTrue(guard.decide(false, null, policy).isRedirect());
    }
  }

  @Nested
  @DisplayName("requirements")
  class RequirementTests {

    @Test
    @DisplayName("AUTHENTICATED_REDIRECT should redirect to the rule target")
    void shouldRedirectToRuleTarget() {
      AccessPolicy policy = AccessPolicy.of(List.of(
          AccessRule.of("/account/**", AccessRequirement.AUTHENTICATED_REDIRECT, "/welcome")), "/login");

      RouteDecision decision = guard.decide(false, "/account/settings", policy);

      assertTrue(decision.isRedirect());
      assertEquals("/welcome", pathOf(decision.location()));
      assertEquals("/account/settings", decodedNext(decision.location()));
    }

    @Test
    @DisplayName("AUTHENTICATED_DENY should deny with 401")
    void shouldDenyUnauthenticated() {
      AccessPolicy policy = AccessPolicy.of(List.of(AccessRule.of("/api/**", AccessRequirement.AUTHENTICATED_DENY)),
                                            "/login");

      assertEquals(RouteDecision.deny(401), guard.decide(false, "/api/orders", policy));
      assertTrue(guard.decide(true, "/api/orders", policy).isAllow());
    }

    @Test
    @DisplayName("GUEST_ONLY should send signed-in users away")
    void shouldRedirectSignedInGuestOnly() {
      AccessPolicy policy = AccessPolicy.of(List.of(AccessRule.of("/login", AccessRequirement.GUEST_ONLY, "/home")),
                                            "/login");

      assertEquals(RouteDecision.redirect("/home"), guard.decide(true, "/login", policy));
      assertTrue(guard.decide(false, "/login", policy).isAllow());
    }

    @Test
    @DisplayName("DENY_ALL should deny with 403 regardless of session")
    void shouldDenyAll() {
      AccessPolicy policy = AccessPolicy.of(List.of(AccessRule.of("/internal/**", AccessRequirement.DENY_ALL)),
                                            "/login");

      assertEquals(RouteDecision.deny(403), guard.decide(true, "/internal/metrics", policy));
      assertEquals(RouteDecision.deny(403), guard.decide(false, "/internal/metrics", policy));
    }
  }

  @Nested
  @DisplayName("return-to parameter")
  class ReturnToTests {

    @Test
    @DisplayName("should carry the query string and encode it as one parameter")
    void shouldEncodeQuery() {
      RouteDecision decision = guard.decide(false, "/admin/x", "/admin/x?tab=a&page=2", ADMIN_POLICY);

      assertEquals("/admin/x?tab=a&page=2", decodedNext(decision.location()));
      assertEquals(1, UriComponentsBuilder.fromUriString(decision.location()).build().getQueryParams().size());
    }

    @Test
    @DisplayName("should use the configured parameter name")
    void shouldUseConfiguredParameter() {
      AccessPolicy policy = new AccessPolicy(List.of(AccessRule.of("/admin/*", AccessRequirement.AUTHENTICATED)),
                                             AccessRequirement.PUBLIC, "/signin", "returnTo");

      RouteDecision decision = guard.decide(false, "/admin/x", policy);

      assertTrue(decision.location().startsWith("/signin?returnTo="));
    }
  }
}
