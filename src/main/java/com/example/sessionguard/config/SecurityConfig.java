package com.example.sessionguard.config;

import com.example.sessionguard.security.filter.SessionPipelineFilter;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.annotation.web.configurers.HeadersConfigurer.FrameOptionsConfig;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.security.web.header.writers.ReferrerPolicyHeaderWriter.ReferrerPolicy;

import java.time.Duration;

/**
 * Stateless security configuration.
 * <p>
 * A single chain: {@link SessionPipelineFilter} runs the route guard for every request, so Spring
 * Security's own authorization permits everything the guard lets through. Server-side HTTP
 * sessions are never created; the session lives in the signed cookie.
 */
@Configuration(proxyBeanMethods = false)
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

  private final SessionPipelineFilter sessionPipelineFilter;

  @Bean
  public SecurityFilterChain sessionGuardFilterChain(HttpSecurity http) throws Exception {
    http
        .addFilterBefore(sessionPipelineFilter, UsernamePasswordAuthenticationFilter.class)
        .authorizeHttpRequests(authorize -> authorize.anyRequest().permitAll())
        // Form login and HTTP basic are replaced by /auth/sign-in
        .formLogin(AbstractHttpConfigurer::disable)
        .httpBasic(AbstractHttpConfigurer::disable)
        .logout(AbstractHttpConfigurer::disable);

    applyCommonSettings(http);
    return http.build();
  }

  /**
   * Keeps the servlet container from registering the filter a second time outside the chain.
   */
  @Bean
  public FilterRegistrationBean<SessionPipelineFilter> sessionPipelineFilterRegistration() {
    FilterRegistrationBean<SessionPipelineFilter> registration = new FilterRegistrationBean<>(sessionPipelineFilter);
    registration.setEnabled(false);
    return registration;
  }

  /**
   * Common security settings. These protect against common web vulnerabilities
   */
  private void applyCommonSettings(HttpSecurity http) throws Exception {
    http
        // Session cookie is SameSite and HttpOnly
        .csrf(AbstractHttpConfigurer::disable)

        .sessionManagement(session -> session
                               .sessionCreationPolicy(SessionCreationPolicy.STATELESS)
                          )

        .headers(headers -> headers
                     .frameOptions(FrameOptionsConfig::deny)

                     .contentTypeOptions(contentType -> {
                     })

                     .referrerPolicy(referrer -> referrer
                                         .policy(ReferrerPolicy.STRICT_ORIGIN_WHEN_CROSS_ORIGIN)
                                    )

                     .permissionsPolicy(permissions -> permissions
                                            .policy("camera=(), microphone="
                                                        + "(), geolocation="
                                                        + "(), payment=()")
                                       )
                     .and()

                     // Only sent over HTTPS
                     .httpStrictTransportSecurity(hsts -> hsts
                                                      .maxAgeInSeconds(Duration.ofDays(365).toSeconds())
                                                      .includeSubDomains(true)
                                                 )

                     .contentSecurityPolicy(csp -> csp
                                                .policyDirectives(
                                                    "default-src 'self'; "
                                                        + "script-src 'self'; "
                                                        + "style-src 'self' 'unsafe-inline'; "
                                                        + "img-src 'self' data: https:; "
                                                        + "frame-ancestors 'none'; "
                                                        + "form-action 'self'; "
                                                        + "base-uri 'self'"
                                                                 )
                                           )

                     // Responses vary with the session cookie and must not be cached
                     .addHeaderWriter((request, response) -> {
                       response.setHeader("Cache-Control", "no-cache, no-store, must-revalidate");
                       response.setHeader("Pragma", "no-cache");
                       response.setHeader("Expires", "0");
                     })
                );
  }
}
