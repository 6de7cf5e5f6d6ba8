package com.example.sessionguard.security;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.github.benmanes.caffeine.cache.Ticker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

@DisplayName("AuthenticationFailureTracker")
class AuthenticationFailureTrackerTest {

  private static final String CLIENT_IP = "203.0.113.7";

  private final AtomicLong nanos = new AtomicLong();
  private final Ticker ticker = nanos::get;
  private AuthenticationFailureTracker tracker;

  @BeforeEach
  void setUp() {
    tracker = new AuthenticationFailureTracker(3, Duration.ofMinutes(5), Duration.ofMinutes(15), ticker);
  }

  private void advance(Duration duration) {
    nanos.addAndGet(duration.toNanos());
  }

  @Test
  @DisplayName("should block after the configured number of failures")
  void shouldBlockAfterMaxFailures() {
    tracker.recordFailure(CLIENT_IP);
    tracker.recordFailure(CLIENT_IP);
    assertFalse(tracker.isBlocked(CLIENT_IP));

    tracker.recordFailure(CLIENT_IP);

    assertTrue(tracker.isBlocked(CLIENT_IP));
    assertFalse(tracker.isBlocked("198.51.100.1"));
  }

  @Test
  @DisplayName("should unblock once the block duration has passed")
  void shouldExpireBlock() {
    for (int i = 0; i < 3; i++) {
      tracker.recordFailure(CLIENT_IP);
    }

    advance(Duration.ofMinutes(16));

    assertFalse(tracker.isBlocked(CLIENT_IP));
  }

  @Test
  @DisplayName("should forget failures outside the window")
  void shouldExpireFailureWindow() {
    tracker.recordFailure(CLIENT_IP);
    tracker.recordFailure(CLIENT_IP);

    advance(Duration.ofMinutes(6));
    tracker.recordFailure(CLIENT_IP);

    assertFalse(tracker.isBlocked(CLIENT_IP));
  }

  @Test
  @DisplayName("should clear history on success")
  void shouldClear() {
    for (int i = 0; i < 3; i++) {
      tracker.recordFailure(CLIENT_IP);
    }

    tracker.clearFailures(CLIENT_IP);

    assertFalse(tracker.isBlocked(CLIENT_IP));
  }
}
