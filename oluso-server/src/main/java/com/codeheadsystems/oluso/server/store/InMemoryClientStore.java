package com.codeheadsystems.oluso.server.store;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link ClientStore}.
 */
public class InMemoryClientStore implements ClientStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryClientStore.class);

  private final ConcurrentHashMap<String, RegisteredClient> clients = new ConcurrentHashMap<>();

  public InMemoryClientStore() {
    log.warn("Using InMemoryClientStore - client registrations will NOT survive restarts.");
  }

  @Override
  public Optional<RegisteredClient> findById(String clientId) {
    if (clientId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(clients.get(clientId));
  }

  @Override
  public void save(RegisteredClient client) {
    clients.put(client.client().clientId(), client);
    log.debug("Saved client {}", client.client().clientId());
  }
}
