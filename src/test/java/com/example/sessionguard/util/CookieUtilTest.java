package com.example.sessionguard.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.sessionguard.TestProperties;
import com.example.sessionguard.domain.entity.TransportUpdate;
import com.example.sessionguard.properties.ApplicationProperties.SessionProperties.CookieProperties;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.time.Duration;

@DisplayName("CookieUtil")
class CookieUtilTest {

  private final CookieProperties cookie = TestProperties.cookie();

  @Test
  @DisplayName("should set the session cookie with secure attributes")
  void shouldSetSecureCookie() {
    MockHttpServletResponse response = new MockHttpServletResponse();

    CookieUtil.setSessionCookie(response, "value-1", cookie);

    String header = response.getHeader(HttpHeaders.SET_COOKIE);
    assertTrue(header.startsWith("app_session=value-1;"));
    assertTrue(header.contains("Path=/"));
    assertTrue(header.contains("Max-Age=" + Duration.ofDays(30).toSeconds()));
    assertTrue(header.contains("Secure"));
    assertTrue(header.contains("HttpOnly"));
    assertTrue(header.contains("SameSite=Lax"));
    assertFalse(header.contains("Domain="));
  }

  @Test
  @DisplayName("should include the configured domain")
  void shouldSetDomain() {
    CookieProperties scoped = new CookieProperties("sid", "/app", "example.com", true, "Strict", Duration.ofDays(1));
    MockHttpServletResponse response = new MockHttpServletResponse();

    CookieUtil.setSessionCookie(response, "value-1", scoped);

    String header = response.getHeader(HttpHeaders.SET_COOKIE);
    assertTrue(header.startsWith("sid=value-1;"));
    assertTrue(header.contains("Domain=example.com"));
    assertTrue(header.contains("Path=/app"));
    assertTrue(header.contains("SameSite=Strict"));
  }

  @Test
  @DisplayName("should clear with an empty value and zero max-age")
  void shouldClear() {
    MockHttpServletResponse response = new MockHttpServletResponse();

    CookieUtil.apply(response, TransportUpdate.clear(), cookie);

    String header = response.getHeader(HttpHeaders.SET_COOKIE);
    assertTrue(header.startsWith("app_session=;"));
    assertTrue(header.contains("Max-Age=0"));
  }

  @Test
  @DisplayName("should leave the response alone for NONE")
  void shouldIgnoreNone() {
    MockHttpServletResponse response = new MockHttpServletResponse();

    CookieUtil.apply(response, TransportUpdate.none(), cookie);

    assertTrue(response.getHeaders(HttpHeaders.SET_COOKIE).isEmpty());
  }

  @Test
  @DisplayName("should refuse to set an empty value")
  void shouldRejectEmptyValue() {
    assertThrows(IllegalArgumentException.class,
                 () -> CookieUtil.setSessionCookie(new MockHttpServletResponse(), " ", cookie));
  }

  @Test
  @DisplayName("should read the session value and ignore blank cookies")
  void shouldReadSessionValue() {
    MockHttpServletRequest request = new MockHttpServletRequest();
    request.setCookies(new Cookie("other", "x"), new Cookie("app_session", "value-1"));
    MockHttpServletRequest blank = new MockHttpServletRequest();
    blank.setCookies(new Cookie("app_session", ""));

    assertEquals("value-1", CookieUtil.getSessionValue(request, cookie).orElseThrow());
    assertTrue(CookieUtil.getSessionValue(blank, cookie).isEmpty());
    assertTrue(CookieUtil.getSessionValue(new MockHttpServletRequest(), cookie).isEmpty());
  }
}
