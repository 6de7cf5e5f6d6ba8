package com.example.sessionguard.adapter.backend;

import com.example.sessionguard.adapter.backend.dto.TokenEndpointResponse;
import com.example.sessionguard.domain.entity.TokenGrant;
import com.example.sessionguard.exception.BackendException;
import com.example.sessionguard.properties.ApplicationProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nimbusds.jwt.JWTParser;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;

/**
 * Authentication backend speaking the OAuth2 token endpoint protocol:
 * {@code refresh_token} and {@code password} grants, RFC 7009 revocation,
 * HTTP basic client authentication.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OAuthAuthenticationBackend implements AuthenticationBackend {

  static final String CIRCUIT_BREAKER_NAME = "authBackend";
  private static final String ERROR_EXPIRED_TOKEN = "expired_token";
  private static final String TOKEN_TYPE_HINT_REFRESH = "refresh_token";
  // Longest access-token lifetime taken at face value from the token endpoint.
  static final long MAX_EXPIRES_IN_SECONDS = Duration.ofDays(365).toSeconds();

  @Qualifier("defaultOkHttpClient")
  private final OkHttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final ApplicationProperties properties;
  private final Clock clock;

  @Override
  @CircuitBreaker(name = CIRCUIT_BREAKER_NAME, fallbackMethod = "exchangeRefreshTokenFallback")
  public TokenGrant exchangeRefreshToken(String refreshToken) {
    log.debug("Exchanging refresh token with authentication backend");

    FormBody formBody = new FormBody.Builder()
        .add("grant_type", "refresh_token")
        .add("refresh_token", refreshToken)
        .build();

    return postTokenRequest(formBody, null);
  }

  @Override
  @CircuitBreaker(name = CIRCUIT_BREAKER_NAME, fallbackMethod = "exchangeCredentialsFallback")
  public TokenGrant exchangeCredentials(String identifier, String secret) {
    log.debug("Exchanging credentials with authentication backend");

    FormBody.Builder formBody = new FormBody.Builder()
        .add("grant_type", "password")
        .add("username", identifier)
        .add("password", secret);
    String scope = properties.backend().scope();
    if (scope != null && !scope.isBlank()) {
      formBody.add("scope", scope);
    }

    return postTokenRequest(formBody.build(), identifier);
  }

  @Override
  @CircuitBreaker(name = CIRCUIT_BREAKER_NAME, fallbackMethod = "revokeFallback")
  public boolean revoke(String token) {
    String revocationUri = properties.backend().revocationUri();
    if (revocationUri == null || revocationUri.isBlank()) {
      log.debug("No revocation endpoint configured, skipping token revocation");
      return false;
    }

    FormBody formBody = new FormBody.Builder()
        .add("token", token)
        .add("token_type_hint", TOKEN_TYPE_HINT_REFRESH)
        .build();

    Request request = new Request.Builder()
        .url(revocationUri)
        .header("Authorization", clientCredentials())
        .post(formBody)
        .build();

    try (Response response = httpClient.newCall(request).execute()) {
      if (response.code() >= 500) {
        throw new BackendException(BackendException.Kind.UNREACHABLE,
                                   "Token revocation failed, status: " + response.code());
      }
      if (!response.isSuccessful()) {
        throw new BackendException(BackendException.Kind.INVALID,
                                   "Token revocation rejected, status: " + response.code());
      }
      return true;
    } catch (IOException e) {
      throw new BackendException(BackendException.Kind.UNREACHABLE,
                                 "Token revocation failed due to network error", e);
    }
  }

  public TokenGrant exchangeRefreshTokenFallback(String refreshToken, Throwable ex) {
    throw asBackendException("refresh token exchange", ex);
  }

  public TokenGrant exchangeCredentialsFallback(String identifier, String secret, Throwable ex) {
    throw asBackendException("credential exchange", ex);
  }

  public boolean revokeFallback(String token, Throwable ex) {
    throw asBackendException("token revocation", ex);
  }

  private TokenGrant postTokenRequest(RequestBody formBody, String fallbackSubject) {
    Request request = new Request.Builder()
        .url(properties.backend().tokenUri())
        .header("Authorization", clientCredentials())
        .header("Accept", "application/json")
        .post(formBody)
        .build();

    try (Response response = httpClient.newCall(request).execute()) {
      if (response.code() >= 500) {
        throw new BackendException(BackendException.Kind.UNREACHABLE,
                                   "Token endpoint failed, status: " + response.code());
      }

      ResponseBody body = response.body();
      TokenEndpointResponse tokenResponse = body != null
          ? parseBody(body.string())
          : null;

      if (!response.isSuccessful()) {
        throw rejection(response.code(), tokenResponse);
      }
      if (tokenResponse == null || tokenResponse.isError() || !tokenResponse.hasAccessToken()) {
        throw new BackendException(BackendException.Kind.INVALID,
                                   "Token endpoint returned no access token");
      }

      return toGrant(tokenResponse, fallbackSubject);

    } catch (IOException e) {
      throw new BackendException(BackendException.Kind.UNREACHABLE,
                                 "Token exchange failed due to network error", e);
    }
  }

  private TokenEndpointResponse parseBody(String json) {
    if (json == null || json.isBlank()) {
      return null;
    }
    try {
      return objectMapper.readValue(json, TokenEndpointResponse.class);
    } catch (IOException e) {
      log.warn("Token endpoint returned an unreadable body: {}", e.getMessage());
      return null;
    }
  }

  private BackendException rejection(int status, TokenEndpointResponse tokenResponse) {
    String error = tokenResponse != null ? tokenResponse.error() : null;
    if (ERROR_EXPIRED_TOKEN.equals(error)) {
      return new BackendException(BackendException.Kind.EXPIRED,
                                  "Token endpoint reported an expired token");
    }
    log.debug("Token endpoint rejected the exchange, status: {}, error: {}", status, error);
    return new BackendException(BackendException.Kind.INVALID,
                                "Token endpoint rejected the exchange, status: " + status
                                    + (error != null ? ", error: " + error : ""));
  }

  private TokenGrant toGrant(TokenEndpointResponse tokenResponse, String fallbackSubject) {
    long expiresAt = Math.addExact(clock.instant().getEpochSecond(), resolveExpiresIn(tokenResponse.expiresIn()));

    String subject = extractSubject(tokenResponse);
    return new TokenGrant(
        tokenResponse.accessToken(),
        tokenResponse.refreshToken(),
        expiresAt,
        subject != null ? subject : fallbackSubject);
  }

  private long resolveExpiresIn(Long expiresIn) {
    long defaultExpiresIn = properties.backend().defaultExpiresInSeconds();
    if (expiresIn == null) {
      return defaultExpiresIn;
    }
    if (expiresIn <= 0) {
      log.warn("Token endpoint returned non-positive expires_in {}, using {}s", expiresIn, defaultExpiresIn);
      return defaultExpiresIn;
    }
    if (expiresIn > MAX_EXPIRES_IN_SECONDS) {
      log.warn("Token endpoint returned expires_in {}, capping at {}s", expiresIn, MAX_EXPIRES_IN_SECONDS);
      return MAX_EXPIRES_IN_SECONDS;
    }
    return expiresIn;
  }

  /**
   * Reads the {@code sub} claim from the ID token, or from the access token when it is a JWT.
   * Structural parse only; signatures are the backend's concern.
   */
  private String extractSubject(TokenEndpointResponse tokenResponse) {
    String candidate = tokenResponse.hasIdToken() ? tokenResponse.idToken() : tokenResponse.accessToken();
    try {
      return JWTParser.parse(candidate).getJWTClaimsSet().getSubject();
    } catch (ParseException e) {
      return null;
    }
  }

  private String clientCredentials() {
    return Credentials.basic(properties.backend().clientId(), properties.backend().clientSecret());
  }

  private BackendException asBackendException(String operation, Throwable ex) {
    if (ex instanceof BackendException) {
      return (BackendException) ex;
    }
    log.error("Authentication backend unavailable during {}.", operation, ex);
    return new BackendException(BackendException.Kind.UNREACHABLE,
                                "Authentication backend is temporarily unavailable.", ex);
  }
}
