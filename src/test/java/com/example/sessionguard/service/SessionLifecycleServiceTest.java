package com.example.sessionguard.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.sessionguard.TestProperties;
import com.example.sessionguard.adapter.backend.AuthenticationBackend;
import com.example.sessionguard.domain.entity.SessionArtifact;
import com.example.sessionguard.domain.entity.TokenGrant;
import com.example.sessionguard.exception.BackendException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@DisplayName("SessionLifecycleService")
@ExtendWith(MockitoExtension.class)
class SessionLifecycleServiceTest {

  @Mock
  private AuthenticationBackend backend;

  @Mock
  private TokenRefresher tokenRefresher;

  private SessionLifecycleService service;

  @BeforeEach
  void setUp() {
    SessionStoreFactory factory = new SessionStoreFactory(new SessionCodec(SessionCodecTest.KEY));
    service = new SessionLifecycleService(backend, factory, tokenRefresher, TestProperties.defaults());
  }

  @Nested
  @DisplayName("signIn()")
  class SignInTests {

    @Test
    @DisplayName("should create a session with sequence zero")
    void shouldCreateSession() {
      when(backend.exchangeCredentials("alice", "s3cret"))
          .thenReturn(new TokenGrant("access-1", "refresh-1", 1_900_000_000L, "user-42"));

      SessionArtifact artifact = service.signIn("alice", "s3cret");

      assertEquals("user-42", artifact.subjectId());
      assertEquals(0, artifact.refreshSequence());
    }

    @Test
    @DisplayName("should reject missing credentials without calling the backend")
    void shouldRejectMissingCredentials() {
      BackendException e = assertThrows(BackendException.class, () -> service.signIn(" ", "s3cret"));

      assertEquals(BackendException.Kind.INVALID, e.getKind());
      verify(backend, never()).exchangeCredentials(anyString(), anyString());
    }
  }

  @Nested
  @DisplayName("signOut()")
  class SignOutTests {

    @Test
    @DisplayName("should revoke the refresh token")
    void shouldRevokeRefreshToken() {
      service.signOut(new SessionArtifact("access-1", "refresh-1", 1_900_000_000L, "user-42", 2));

      verify(backend).revoke("refresh-1");
    }

    @Test
    @DisplayName("should revoke the access token when there is no refresh token")
    void shouldRevokeAccessToken() {
      service.signOut(new SessionArtifact("access-1", null, 1_900_000_000L, "user-42", 2));

      verify(backend).revoke("access-1");
    }

    @Test
    @DisplayName("should tolerate revocation failures")
    void shouldTolerateRevocationFailure() {
      when(backend.revoke("refresh-1")).thenThrow(new BackendException(BackendException.Kind.UNREACHABLE, "down"));

      service.signOut(new SessionArtifact("access-1", "refresh-1", 1_900_000_000L, "user-42", 2));

      verify(backend).revoke("refresh-1");
    }

    @Test
    @DisplayName("should do nothing without a session")
    void shouldIgnoreMissingSession() {
      service.signOut(null);

      verify(backend, never()).revoke(anyString());
    }
  }

  @Nested
  @DisplayName("validateReturnPath()")
  class ReturnPathTests {

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"https://evil.example.com/x", "//evil.example.com", "/../etc", "relative",
                            "/\\evil.example.com", "/a\r\nSet-Cookie: x"})
    @DisplayName("should fall back to the default for unsafe paths")
    void shouldRejectUnsafe(String returnTo) {
      assertEquals("/dashboard", service.validateReturnPath(returnTo));
    }

    @Test
    @DisplayName("should keep local paths with query")
    void shouldKeepLocal() {
      assertEquals("/admin/x?tab=1", service.validateReturnPath("/admin/x?tab=1"));
    }
  }
}
