package com.codeheadsystems.oluso.server.store;

import com.codeheadsystems.oluso.server.request.AuthorizationCodeData;
import java.util.Optional;

/**
 * Storage for issued authorization codes.
 * <p>
 * {@link #consume(String)} must be an atomic fetch-and-delete: of two concurrent redemptions of
 * the same code exactly one receives the data.
 */
public interface AuthorizationCodeStore {

  void store(AuthorizationCodeData data);

  /**
   * Removes the code and returns its data.
   *
   * @param code the code handle
   * @return the data, empty if unknown or already consumed
   */
  Optional<AuthorizationCodeData> consume(String code);
}
