package com.example.sessionguard.config;

import com.example.sessionguard.properties.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Configuration validator that enforces cross-field rules beyond basic JSR-303 validation.
 * Fails fast at startup. The access policy is validated separately by {@link AccessPolicyLoader}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfigurationValidator implements InitializingBean {

  private static final String ERROR_INVALID_URI = "%s is invalid: %s";
  private static final String ERROR_HTTPS_REQUIRED = "%s must use HTTPS in non-local environments: %s";
  private static final String ERROR_MIN_DURATION = "%s must be at least %s.";
  private static final String PROTOCOL_HTTP = "http://";
  private static final String HOST_LOCALHOST = "localhost";
  private static final String HOST_LOOPBACK = "127.0.0.1";
  private static final String SAME_SITE_NONE = "None";
  private static final int MIN_SIGNING_KEY_BYTES = 32;

  private final ApplicationProperties properties;

  @Override
  public void afterPropertiesSet() {
    log.info("Validating application configuration business rules...");
    List<String> errors = new ArrayList<>();

    validateSessionConfig(errors);
    validateRefreshConfig(errors);
    validateBackendConfig(errors);
    validateHttpConfig(errors);

    if (!errors.isEmpty()) {
      String errorMessage = String.format("Configuration validation failed with %d error(s):\n- %s",
                                          errors.size(), String.join("\n- ", errors));
      log.error(errorMessage);
      throw new IllegalStateException(errorMessage);
    }
    log.info("Configuration validated successfully.");
  }

  private void validateSessionConfig(List<String> errors) {
    ApplicationProperties.SessionProperties session = properties.session();
    try {
      byte[] key = Base64.getDecoder().decode(session.signingKey());
      if (key.length < MIN_SIGNING_KEY_BYTES) {
        errors.add("Session signing key must be at least 256 bits, but was %d bits.".formatted(key.length * 8));
      }
    } catch (IllegalArgumentException e) {
      errors.add("Session signing key must be Base64 encoded.");
    }

    ApplicationProperties.SessionProperties.CookieProperties cookie = session.cookie();
    if (SAME_SITE_NONE.equalsIgnoreCase(cookie.sameSite())) {
      errors.add("Session cookie SameSite must be Strict or Lax.");
    }
    if (!cookie.secure()) {
      log.warn("Session cookie 'secure' flag is disabled. Only acceptable for local development.");
    }
    if (cookie.maxAge().compareTo(Duration.ofMinutes(1)) < 0) {
      errors.add(ERROR_MIN_DURATION.formatted("Session cookie max-age", "1 minute"));
    }
  }

  private void validateRefreshConfig(List<String> errors) {
    ApplicationProperties.RefreshProperties refresh = properties.refresh();
    if (refresh.skewWindow().isNegative()) {
      errors.add("Refresh skew window cannot be negative.");
    }
    if (refresh.exchangeTimeout().compareTo(Duration.ofMillis(100)) < 0) {
      errors.add(ERROR_MIN_DURATION.formatted("Refresh exchange timeout", "100ms"));
    }
    if (refresh.outcomeRetention().compareTo(refresh.exchangeTimeout()) < 0) {
      errors.add("Refresh outcome retention (%s) must not be shorter than the exchange timeout (%s)."
                     .formatted(refresh.outcomeRetention(), refresh.exchangeTimeout()));
    }
    if (refresh.executor().maxPoolSize() < refresh.executor().corePoolSize()) {
      errors.add("Refresh executor max pool size must be greater than or equal to its core pool size.");
    }
  }

  private void validateBackendConfig(List<String> errors) {
    ApplicationProperties.BackendProperties backend = properties.backend();
    validateUri(backend.tokenUri(), "Backend token URI", errors);
    validateHttpsRequired(backend.tokenUri(), "Backend token URI", errors);
    if (backend.revocationUri() != null && !backend.revocationUri().isBlank()) {
      validateUri(backend.revocationUri(), "Backend revocation URI", errors);
      validateHttpsRequired(backend.revocationUri(), "Backend revocation URI", errors);
    } else {
      log.warn("No backend revocation URI configured: sign-out will only clear the local session.");
    }
  }

  private void validateHttpConfig(List<String> errors) {
    ApplicationProperties.OkHttpProperties.ClientProperties client = properties.http().client();
    if (client.maxRequests() < client.maxRequestsPerHost()) {
      errors.add("Total max requests must be greater than or equal to max requests per host.");
    }
  }

  private void validateUri(String uri, String fieldName, List<String> errors) {
    try {
      URI parsed = new URI(uri);
      if (!parsed.isAbsolute() || parsed.getHost() == null) {
        errors.add(ERROR_INVALID_URI.formatted(fieldName, uri));
      }
    } catch (URISyntaxException e) {
      errors.add(ERROR_INVALID_URI.formatted(fieldName, uri));
    }
  }

  private void validateHttpsRequired(String uri, String fieldName, List<String> errors) {
    if (uri != null && uri.startsWith(PROTOCOL_HTTP)
        && !uri.contains(HOST_LOCALHOST) && !uri.contains(HOST_LOOPBACK)) {
      errors.add(ERROR_HTTPS_REQUIRED.formatted(fieldName, uri));
    }
  }
}
