package com.codeheadsystems.oluso.server.store;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link RefreshTokenStore}. Expired tokens are evicted lazily on load.
 */
public class InMemoryRefreshTokenStore implements RefreshTokenStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryRefreshTokenStore.class);

  private final ConcurrentHashMap<String, RefreshTokenData> tokens = new ConcurrentHashMap<>();

  public InMemoryRefreshTokenStore() {
    log.warn("Using InMemoryRefreshTokenStore - refresh tokens will NOT survive restarts.");
  }

  @Override
  public void store(RefreshTokenData data) {
    tokens.put(data.handle(), data);
  }

  @Override
  public Optional<RefreshTokenData> load(String handle) {
    if (handle == null) {
      return Optional.empty();
    }
    RefreshTokenData data = tokens.get(handle);
    if (data == null) {
      return Optional.empty();
    }
    if (data.isExpired(Instant.now())) {
      tokens.remove(handle);
      return Optional.empty();
    }
    return Optional.of(data);
  }

  @Override
  public Optional<RefreshTokenData> consume(String handle) {
    if (handle == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(tokens.remove(handle));
  }

  @Override
  public int revokeBySession(String subjectId, String clientId, String sessionId) {
    int before = tokens.size();
    tokens.values().removeIf(t -> Objects.equals(t.subjectId(), subjectId)
        && Objects.equals(t.clientId(), clientId)
        && (sessionId == null || Objects.equals(t.sessionId(), sessionId)));
    int revoked = before - tokens.size();
    log.debug("Revoked {} refresh token(s) for client {}", revoked, clientId);
    return revoked;
  }
}
