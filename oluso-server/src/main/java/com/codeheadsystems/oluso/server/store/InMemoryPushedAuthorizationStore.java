package com.codeheadsystems.oluso.server.store;

import com.codeheadsystems.oluso.server.request.AuthorizeRequest;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link PushedAuthorizationStore}.
 */
public class InMemoryPushedAuthorizationStore implements PushedAuthorizationStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryPushedAuthorizationStore.class);

  private record Entry(AuthorizeRequest request, Instant expiresAt) {
  }

  private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemoryPushedAuthorizationStore() {
    this(Clock.systemUTC());
  }

  public InMemoryPushedAuthorizationStore(Clock clock) {
    this.clock = clock;
    log.warn("Using InMemoryPushedAuthorizationStore - pushed requests will NOT survive restarts.");
  }

  @Override
  public void store(String requestUri, AuthorizeRequest request, Instant expiresAt) {
    entries.put(requestUri, new Entry(request, expiresAt));
  }

  @Override
  public Optional<AuthorizeRequest> consume(String requestUri) {
    if (requestUri == null) {
      return Optional.empty();
    }
    Entry entry = entries.remove(requestUri);
    if (entry == null || entry.expiresAt().isBefore(clock.instant())) {
      return Optional.empty();
    }
    return Optional.of(entry.request());
  }
}
