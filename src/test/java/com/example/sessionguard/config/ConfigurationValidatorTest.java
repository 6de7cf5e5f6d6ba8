package com.example.sessionguard.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.sessionguard.TestProperties;
import com.example.sessionguard.properties.ApplicationProperties.SessionProperties.CookieProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

@DisplayName("ConfigurationValidator")
class ConfigurationValidatorTest {

  @Test
  @DisplayName("should accept a valid configuration")
  void shouldAcceptValid() {
    ConfigurationValidator validator = new ConfigurationValidator(
        TestProperties.withBackend("https://auth.example.com/oauth2/token", "https://auth.example.com/oauth2/revoke"));

    assertDoesNotThrow(validator::afterPropertiesSet);
  }

  @Test
  @DisplayName("should allow plain HTTP to a local backend")
  void shouldAllowLocalHttp() {
    ConfigurationValidator validator = new ConfigurationValidator(
        TestProperties.withBackend("http://localhost:9000/oauth2/token", null));

    assertDoesNotThrow(validator::afterPropertiesSet);
  }

  @Test
  @DisplayName("should require HTTPS for remote backends")
  void shouldRequireHttps() {
    ConfigurationValidator validator = new ConfigurationValidator(
        TestProperties.withBackend("http://auth.example.com/oauth2/token", null));

    IllegalStateException e = assertThrows(IllegalStateException.class, validator::afterPropertiesSet);
    assertTrue(e.getMessage().contains("must use HTTPS"));
  }

  @Test
  @DisplayName("should reject SameSite=None")
  void shouldRejectSameSiteNone() {
    CookieProperties cookie = new CookieProperties("app_session", "/", null, true, "None", Duration.ofDays(30));
    ConfigurationValidator validator = new ConfigurationValidator(TestProperties.withCookie(cookie));

    IllegalStateException e = assertThrows(IllegalStateException.class, validator::afterPropertiesSet);
    assertTrue(e.getMessage().contains("SameSite"));
  }

  @Test
  @DisplayName("should reject a zero cookie lifetime")
  void shouldRejectShortCookie() {
    CookieProperties cookie = new CookieProperties("app_session", "/", null, true, "Lax", Duration.ZERO);
    ConfigurationValidator validator = new ConfigurationValidator(TestProperties.withCookie(cookie));

    assertThrows(IllegalStateException.class, validator::afterPropertiesSet);
  }
}
