package com.example.sessionguard.adapter.backend;

import com.example.sessionguard.domain.entity.TokenGrant;
import com.example.sessionguard.exception.BackendException;

/**
 * Capability interface of the authentication backend.
 * The core depends only on this interface, never on a concrete backend.
 * Every operation reports failures as {@link BackendException} with a
 * {@link BackendException.Kind}.
 */
public interface AuthenticationBackend {

  /**
   * Exchanges a refresh token for a new access/refresh pair.
   */
  TokenGrant exchangeRefreshToken(String refreshToken);

  /**
   * Exchanges user credentials for an initial token set.
   */
  TokenGrant exchangeCredentials(String identifier, String secret);

  /**
   * Revokes a token.
   *
   * @return {@code true} once the backend acknowledged the revocation
   */
  boolean revoke(String token);
}
