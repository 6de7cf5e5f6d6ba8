package com.example.sessionguard.security;

import com.example.sessionguard.properties.ApplicationProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sign-in failure tracker for brute force protection, keyed by client IP.
 * In-process: each instance counts its own failures.
 */
@Slf4j
@Component
public class AuthenticationFailureTracker {

  private static final int MAX_TRACKED_CLIENTS = 100_000;

  private final int maxFailures;
  private final Duration blockDuration;
  private final Cache<String, AtomicInteger> failureCounts;
  private final Cache<String, Boolean> blockedClients;

  @Autowired
  public AuthenticationFailureTracker(ApplicationProperties properties) {
    this(properties.security().auth().maxFailures(),
         Duration.ofMinutes(properties.security().auth().failureWindowMinutes()),
         Duration.ofMinutes(properties.security().auth().blockDurationMinutes()),
         Ticker.systemTicker());
  }

  public AuthenticationFailureTracker(int maxFailures, Duration failureWindow, Duration blockDuration,
                                      Ticker ticker) {
    this.maxFailures = maxFailures;
    this.blockDuration = blockDuration;
    // Window starts at the first failure, like a counter whose TTL is set once.
    this.failureCounts = Caffeine.newBuilder()
        .expireAfterWrite(failureWindow)
        .maximumSize(MAX_TRACKED_CLIENTS)
        .ticker(ticker)
        .build();
    this.blockedClients = Caffeine.newBuilder()
        .expireAfterWrite(blockDuration)
        .maximumSize(MAX_TRACKED_CLIENTS)
        .ticker(ticker)
        .build();
  }

  /**
   * Record authentication failure
   */
  public void recordFailure(String clientIp) {
    int failureCount = failureCounts.get(clientIp, key -> new AtomicInteger()).incrementAndGet();
    log.info("Authentication failure recorded for IP: {} (count: {})", maskIpAddress(clientIp), failureCount);

    if (failureCount >= maxFailures) {
      blockIp(clientIp);
    }
  }

  /**
   * Check if IP is blocked
   */
  public boolean isBlocked(String clientIp) {
    return blockedClients.getIfPresent(clientIp) != null;
  }

  /**
   * Clear failure history
   */
  public void clearFailures(String clientIp) {
    failureCounts.invalidate(clientIp);
    blockedClients.invalidate(clientIp);
    log.debug("Cleared failure history for IP: {}", maskIpAddress(clientIp));
  }

  private void blockIp(String clientIp) {
    blockedClients.put(clientIp, Boolean.TRUE);
    failureCounts.invalidate(clientIp);
    log.warn("Blocked IP {} for {} minutes due to repeated failures",
             maskIpAddress(clientIp), blockDuration.toMinutes());
  }

  private String maskIpAddress(String ip) {
    if (ip == null || !ip.contains(".")) {
      return "***";
    }
    String[] parts = ip.split("\\.");
    if (parts.length == 4) {
      return parts[0] + "." + parts[1] + ".***." + parts[3];
    }
    return "***";
  }
}
