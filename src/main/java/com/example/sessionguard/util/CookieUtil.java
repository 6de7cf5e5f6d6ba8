package com.example.sessionguard.util;

import com.example.sessionguard.domain.entity.TransportUpdate;
import com.example.sessionguard.properties.ApplicationProperties.SessionProperties.CookieProperties;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.web.util.WebUtils;

import java.time.Duration;
import java.util.Optional;

/**
 * Cookie utility for the session transport cookie.
 * Uses Spring's ResponseCookie builder for proper cookie handling.
 */
@Slf4j
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class CookieUtil {

  /**
   * Extract cookie by name using Spring's WebUtils
   *
   * @param request HTTP request
   * @param name    cookie name
   * @return Optional containing the cookie if found
   */
  public static Optional<Cookie> getCookie(HttpServletRequest request, String name) {
    if (request == null || name == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(WebUtils.getCookie(request, name));
  }

  /**
   * Raw session cookie value. The value is a compact JWS and is never URL-encoded.
   */
  public static Optional<String> getSessionValue(HttpServletRequest request, CookieProperties cookie) {
    return getCookie(request, cookie.name())
        .map(Cookie::getValue)
        .filter(value -> !value.isBlank());
  }

  /**
   * Set the session cookie with the configured attributes.
   *
   * @param response HTTP response
   * @param value    encoded session artifact
   * @param cookie   cookie attributes
   */
  public static void setSessionCookie(HttpServletResponse response, String value, CookieProperties cookie) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Session cookie value cannot be null or empty");
    }
    response.addHeader(HttpHeaders.SET_COOKIE, buildSessionCookie(value, cookie.maxAge(), cookie).toString());
    log.debug("Set session cookie: name={}, path={}, secure={}, sameSite={}",
              cookie.name(), cookie.path(), cookie.secure(), cookie.sameSite());
  }

  /**
   * Clear the session cookie. Attributes must match those used when setting it.
   */
  public static void clearSessionCookie(HttpServletResponse response, CookieProperties cookie) {
    response.addHeader(HttpHeaders.SET_COOKIE, buildSessionCookie("", Duration.ZERO, cookie).toString());
    log.debug("Cleared session cookie: name={}", cookie.name());
  }

  /**
   * Apply a pipeline transport update to the response.
   */
  public static void apply(HttpServletResponse response, TransportUpdate update, CookieProperties cookie) {
    switch (update.action()) {
      case SET -> setSessionCookie(response, update.value(), cookie);
      case CLEAR -> clearSessionCookie(response, cookie);
      case NONE -> {
        // cookie left untouched
      }
    }
  }

  static ResponseCookie buildSessionCookie(String value, Duration maxAge, CookieProperties cookie) {
    ResponseCookie.ResponseCookieBuilder cookieBuilder = ResponseCookie
        .from(cookie.name(), value)
        .httpOnly(true)
        .secure(cookie.secure())
        .path(cookie.path())
        .maxAge(maxAge)
        .sameSite(cookie.sameSite());

    // Add domain if specified (for subdomain sharing)
    if (cookie.domain() != null && !cookie.domain().isBlank()) {
      cookieBuilder.domain(cookie.domain());
    }
    return cookieBuilder.build();
  }
}
