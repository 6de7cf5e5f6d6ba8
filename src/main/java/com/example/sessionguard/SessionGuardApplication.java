package com.example.sessionguard;

import com.example.sessionguard.properties.ApplicationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Session Guard Application
 *
 * Session propagation, refresh and route guarding for server-rendered web apps:
 * - signed session cookie shared by the edge interceptor, request handlers and clients
 * - coalesced token refresh against an OAuth2 token endpoint
 * - ordered, first-match access policy
 */
@SpringBootApplication
@EnableConfigurationProperties(ApplicationProperties.class)
public class SessionGuardApplication {
  public static void main(String[] args) {
    SpringApplication app = new SpringApplication(SessionGuardApplication.class);
    app.setRegisterShutdownHook(true); // lets in-flight refresh exchanges finish
    app.run(args);
  }
}
