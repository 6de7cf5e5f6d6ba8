package com.example.sessionguard.service;

import com.example.sessionguard.adapter.backend.AuthenticationBackend;
import com.example.sessionguard.config.RefreshExecutorConfig;
import com.example.sessionguard.domain.entity.RefreshOutcome;
import com.example.sessionguard.domain.entity.SessionArtifact;
import com.example.sessionguard.domain.entity.TokenGrant;
import com.example.sessionguard.exception.BackendException;
import com.example.sessionguard.exception.SessionException;
import com.example.sessionguard.properties.ApplicationProperties;
import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Exchanges expiring session artifacts for fresh ones.
 * <p>
 * At most one backend exchange is in flight per refresh token: concurrent callers presenting
 * the same token join the first caller's exchange and all receive its outcome. The outcome is
 * retained for a short period so that requests still carrying the consumed token get the same
 * answer instead of replaying it. Callers that stop waiting never cancel the exchange.
 */
@Slf4j
@Service
public class TokenRefresher {

  private final AuthenticationBackend backend;
  private final Clock clock;
  private final Duration skewWindow;
  private final Duration exchangeTimeout;
  private final AsyncCache<String, RefreshOutcome> exchanges;

  @Autowired
  public TokenRefresher(AuthenticationBackend backend,
                        Clock clock,
                        ApplicationProperties properties,
                        @Qualifier(RefreshExecutorConfig.REFRESH_EXECUTOR) Executor refreshExecutor) {
    this(backend, clock,
         properties.refresh().skewWindow(),
         properties.refresh().exchangeTimeout(),
         properties.refresh().outcomeRetention(),
         properties.refresh().maxTrackedExchanges(),
         refreshExecutor);
  }

  public TokenRefresher(AuthenticationBackend backend,
                        Clock clock,
                        Duration skewWindow,
                        Duration exchangeTimeout,
                        Duration outcomeRetention,
                        long maxTrackedExchanges,
                        Executor refreshExecutor) {
    this.backend = backend;
    this.clock = clock;
    this.skewWindow = skewWindow;
    this.exchangeTimeout = exchangeTimeout;
    // Async weighing counts an exchange only once it settles, so size eviction never drops one in flight.
    // Past maxTrackedExchanges settled outcomes may be evicted before outcomeRetention elapses.
    this.exchanges = Caffeine.newBuilder()
        .expireAfterWrite(outcomeRetention)
        .maximumWeight(maxTrackedExchanges)
        .weigher((String key, RefreshOutcome outcome) -> 1)
        .executor(refreshExecutor)
        .buildAsync();
  }

  /**
   * Checks whether the artifact is inside the skew window: {@code now >= expiresAt - skewWindow}.
   */
  public boolean isRefreshDue(SessionArtifact artifact) {
    return artifact.expiresWithin(clock.instant(), skewWindow);
  }

  /**
   * Refresh the session held by a mutable store if it is due, and apply the outcome to it.
   * <ul>
   *   <li>SUCCESS replaces the artifact.</li>
   *   <li>BACKEND_UNREACHABLE keeps the prior artifact; an outage must not sign users out.</li>
   *   <li>INVALID_REFRESH_TOKEN and EXPIRED_NO_REFRESH clear the session.</li>
   * </ul>
   *
   * @return the outcome, or empty when no refresh was attempted
   * @throws SessionException if the store is read-only
   */
  public Optional<RefreshOutcome> refreshIfDue(SessionStore store) {
    if (!store.context().isMutable()) {
      throw new SessionException("Refresh requires a mutable session context, got " + store.context());
    }

    Optional<SessionArtifact> current = store.current();
    if (current.isEmpty() || !isRefreshDue(current.get())) {
      return Optional.empty();
    }

    SessionArtifact prior = current.get();
    RefreshOutcome outcome = refresh(prior);
    switch (outcome.status()) {
      case SUCCESS -> {
        if (!store.replace(outcome.artifact())) {
          log.warn("Refreshed session for subject {} was not applied: a newer session is already held",
                   prior.subjectId());
        }
      }
      case BACKEND_UNREACHABLE ->
          log.warn("Authentication backend unreachable, keeping current session for subject {}",
                   prior.subjectId());
      case INVALID_REFRESH_TOKEN, EXPIRED_NO_REFRESH -> {
        log.info("Clearing session for subject {} after refresh outcome {}", prior.subjectId(), outcome.status());
        store.clear();
      }
    }
    return Optional.of(outcome);
  }

  /**
   * Exchange the artifact's refresh token, coalescing with any exchange already in flight
   * for the same token.
   *
   * @param artifact the artifact to refresh
   * @return the outcome, identical for every coalesced caller
   */
  public RefreshOutcome refresh(SessionArtifact artifact) {
    Objects.requireNonNull(artifact, "artifact");
    if (!artifact.hasRefreshToken()) {
      log.debug("Session for subject {} carries no refresh token", artifact.subjectId());
      return RefreshOutcome.expiredNoRefresh();
    }

    String key = exchangeKey(artifact.refreshToken());
    CompletableFuture<RefreshOutcome> exchange;
    try {
      exchange = exchanges.get(key, (k, executor) -> startExchange(k, artifact, executor));
    } catch (RuntimeException e) {
      log.error("Could not start refresh exchange for subject {}", artifact.subjectId(), e);
      return RefreshOutcome.backendUnreachable();
    }

    RefreshOutcome outcome = await(exchange, artifact);
    forgetIfTransient(key, exchange);
    return outcome;
  }

  private CompletableFuture<RefreshOutcome> startExchange(String key, SessionArtifact artifact, Executor executor) {
    CompletableFuture<RefreshOutcome> exchange = CompletableFuture.supplyAsync(() -> exchange(artifact), executor);
    exchange.thenRun(() -> forgetIfTransient(key, exchange));
    return exchange;
  }

  private RefreshOutcome exchange(SessionArtifact artifact) {
    try {
      TokenGrant grant = backend.exchangeRefreshToken(artifact.refreshToken());
      SessionArtifact next = artifact.successor(grant);
      log.info("Refreshed session for subject {} (sequence {})", next.subjectId(), next.refreshSequence());
      return RefreshOutcome.success(next);

    } catch (BackendException e) {
      return switch (e.getKind()) {
        case EXPIRED -> {
          log.info("Refresh token expired for subject {}", artifact.subjectId());
          yield RefreshOutcome.expiredNoRefresh();
        }
        case INVALID -> {
          log.info("Refresh token rejected for subject {}: {}", artifact.subjectId(), e.getMessage());
          yield RefreshOutcome.invalidRefreshToken();
        }
        case UNREACHABLE -> {
          log.warn("Refresh exchange failed for subject {}: {}", artifact.subjectId(), e.getMessage());
          yield RefreshOutcome.backendUnreachable();
        }
      };
    } catch (RuntimeException e) {
      log.error("Unexpected error during refresh exchange for subject {}", artifact.subjectId(), e);
      return RefreshOutcome.backendUnreachable();
    }
  }

  private RefreshOutcome await(CompletableFuture<RefreshOutcome> exchange, SessionArtifact artifact) {
    try {
      return exchange.get(exchangeTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      log.warn("Refresh for subject {} still in flight after {}ms, keeping current session",
               artifact.subjectId(), exchangeTimeout.toMillis());
      return RefreshOutcome.backendUnreachable();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for refresh of subject {}", artifact.subjectId());
      return RefreshOutcome.backendUnreachable();
    } catch (ExecutionException e) {
      log.error("Refresh exchange for subject {} failed", artifact.subjectId(), e.getCause());
      return RefreshOutcome.backendUnreachable();
    }
  }

  /**
   * Drops a settled transient outcome so the next request retries the exchange.
   * In-flight and settled non-transient exchanges stay cached.
   */
  private void forgetIfTransient(String key, CompletableFuture<RefreshOutcome> exchange) {
    if (!exchange.isDone() || exchange.isCompletedExceptionally()) {
      if (exchange.isCompletedExceptionally()) {
        exchanges.asMap().remove(key, exchange);
      }
      return;
    }
    RefreshOutcome settled = exchange.getNow(null);
    if (settled != null && settled.isTransient()) {
      exchanges.asMap().remove(key, exchange);
    }
  }

  private String exchangeKey(String refreshToken) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(refreshToken.getBytes(StandardCharsets.UTF_8));
      return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }
}
