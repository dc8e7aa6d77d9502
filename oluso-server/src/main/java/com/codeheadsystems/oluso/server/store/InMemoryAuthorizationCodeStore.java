package com.codeheadsystems.oluso.server.store;

import com.codeheadsystems.oluso.server.request.AuthorizationCodeData;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link AuthorizationCodeStore}.
 */
public class InMemoryAuthorizationCodeStore implements AuthorizationCodeStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryAuthorizationCodeStore.class);

  private final ConcurrentHashMap<String, AuthorizationCodeData> codes = new ConcurrentHashMap<>();

  public InMemoryAuthorizationCodeStore() {
    log.warn("Using InMemoryAuthorizationCodeStore - authorization codes will NOT survive restarts.");
  }

  @Override
  public void store(AuthorizationCodeData data) {
    codes.put(data.code(), data);
  }

  @Override
  public Optional<AuthorizationCodeData> consume(String code) {
    if (code == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(codes.remove(code));
  }
}
