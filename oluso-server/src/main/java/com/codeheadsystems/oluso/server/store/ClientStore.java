package com.codeheadsystems.oluso.server.store;

import java.util.Optional;

/**
 * Client registry lookup.
 */
public interface ClientStore {

  Optional<RegisteredClient> findById(String clientId);

  void save(RegisteredClient client);
}
