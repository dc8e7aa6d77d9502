package com.codeheadsystems.oluso.server.store;

import com.codeheadsystems.oluso.server.request.AuthorizeRequest;
import java.time.Instant;
import java.util.Optional;

/**
 * Storage for pushed authorization requests (RFC 9126). References are single use.
 */
public interface PushedAuthorizationStore {

  void store(String requestUri, AuthorizeRequest request, Instant expiresAt);

  /**
   * Removes and returns the request if it has not expired.
   *
   * @param requestUri the request uri
   * @return the pushed request, empty when unknown, used or expired
   */
  Optional<AuthorizeRequest> consume(String requestUri);
}
