package com.example.sessionguard.properties;

import com.example.sessionguard.domain.entity.AccessRequirement;
import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Centralized configuration properties for the Session Guard application.
 * Uses records for immutability and type safety.
 */
@Validated
@ConfigurationProperties(prefix = "app")
public record ApplicationProperties(
    @NotNull @Valid SessionProperties session,
    @NotNull @Valid RefreshProperties refresh,
    @NotNull @Valid BackendProperties backend,
    @NotNull @Valid GuardProperties guard,
    @NotNull @Valid SecurityProperties security,
    @NotNull @Valid OkHttpProperties http
) {

  /**
   * Transport cookie and its signing key
   */
  public record SessionProperties(
      @NotBlank String signingKey,
      @NotNull @Valid CookieProperties cookie
  ) {
    public record CookieProperties(
        @DefaultValue("app_session") @NotBlank String name,
        @DefaultValue("/") @NotBlank String path,
        String domain,
        @DefaultValue("true") boolean secure,
        @DefaultValue("Lax") @Pattern(regexp = "Strict|Lax") String sameSite,
        // Aligned with the refresh token lifetime, not the access token lifetime
        @DefaultValue("30d") @DurationUnit(ChronoUnit.DAYS) Duration maxAge
    ) {}
  }

  /**
   * Token refresh policy
   */
  public record RefreshProperties(
      @DefaultValue("30s") @DurationUnit(ChronoUnit.SECONDS) Duration skewWindow,
      @DefaultValue("5s") @DurationUnit(ChronoUnit.SECONDS) Duration exchangeTimeout,
      @DefaultValue("30s") @DurationUnit(ChronoUnit.SECONDS) Duration outcomeRetention,
      @DefaultValue("10000") @Positive int maxTrackedExchanges,
      @NotNull @Valid ExecutorProperties executor
  ) {
    public record ExecutorProperties(
        @DefaultValue("4") @Positive int corePoolSize,
        @DefaultValue("32") @Positive int maxPoolSize,
        @DefaultValue("500") @PositiveOrZero int queueCapacity
    ) {}
  }

  /**
   * OAuth2 token endpoint of the authentication backend
   */
  public record BackendProperties(
      @NotBlank String tokenUri,
      String revocationUri,
      @NotBlank String clientId,
      @NotBlank String clientSecret,
      @DefaultValue("openid") String scope,
      @DefaultValue("3600") @Positive long defaultExpiresInSeconds
  ) {}

  /**
   * Route guard policy, loaded once at startup
   */
  public record GuardProperties(
      @DefaultValue("/login") @NotBlank String loginPath,
      @DefaultValue("next") @NotBlank String returnToParameter,
      // Applied to paths no rule matches
      @DefaultValue("PUBLIC") @NotNull AccessRequirement unmatched,
      @DefaultValue("/") @NotBlank String defaultReturnPath,
      @DefaultValue List<RuleProperties> rules
  ) {
    public record RuleProperties(
        String pattern,
        AccessRequirement requirement,
        String target
    ) {}
  }

  /**
   * Sign-in brute force protection
   */
  public record SecurityProperties(
      @NotNull @Valid AuthSecurityProperties auth
  ) {
    public record AuthSecurityProperties(
        @DefaultValue("5") @Positive int maxFailures,
        @DefaultValue("5") @Positive int failureWindowMinutes,
        @DefaultValue("15") @Positive int blockDurationMinutes
    ) {}
  }

  /**
   * OkHttp client configuration
   */
  public record OkHttpProperties(
      @NotNull @Valid ClientProperties client
  ) {
    public record ClientProperties(
        @DefaultValue("20") @Positive int maxIdleConnections,
        @DefaultValue("5") @Positive int keepAliveDurationMinutes,
        @DefaultValue("100") @Positive int maxRequests,
        @DefaultValue("20") @Positive int maxRequestsPerHost,
        @DefaultValue("3s") @DurationUnit(ChronoUnit.SECONDS) Duration connectTimeout,
        @DefaultValue("5s") @DurationUnit(ChronoUnit.SECONDS) Duration readTimeout
    ) {}
  }
}
