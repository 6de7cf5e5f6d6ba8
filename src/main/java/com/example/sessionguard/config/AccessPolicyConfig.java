package com.example.sessionguard.config;

import com.example.sessionguard.domain.entity.AccessPolicy;
import com.example.sessionguard.properties.ApplicationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Access policy, loaded once per process and immutable thereafter.
 * A malformed policy fails application startup.
 */
@Configuration(proxyBeanMethods = false)
public class AccessPolicyConfig {

  @Bean
  public AccessPolicy accessPolicy(ApplicationProperties properties) {
    return AccessPolicyLoader.load(properties.guard());
  }
}
