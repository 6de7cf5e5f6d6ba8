package com.example.sessionguard.adapter.backend.dto;


import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * OAuth2 Token Endpoint Response DTO
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TokenEndpointResponse(
    @JsonProperty("access_token")
    String accessToken,
    @JsonProperty("token_type")
    String tokenType,
    @JsonProperty("expires_in")
    Long expiresIn,
    @JsonProperty("refresh_token")
    String refreshToken,
    @JsonProperty("id_token")
    String idToken,
    @JsonProperty("scope")
    String scope,
    @JsonProperty("error")
    String error,
    @JsonProperty("error_description")
    String errorDescription
) {

  public boolean isError() {
    return error != null;
  }

  public boolean hasAccessToken() {
    return accessToken != null && !accessToken.isEmpty();
  }

  public boolean hasIdToken() {
    return idToken != null && !idToken.isEmpty();
  }
}
