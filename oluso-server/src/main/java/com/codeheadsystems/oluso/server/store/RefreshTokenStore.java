package com.codeheadsystems.oluso.server.store;

import java.util.Optional;

/**
 * Storage for refresh tokens. {@link #consume(String)} is an atomic fetch-and-delete used for
 * one-time-use rotation.
 */
public interface RefreshTokenStore {

  void store(RefreshTokenData data);

  Optional<RefreshTokenData> load(String handle);

  Optional<RefreshTokenData> consume(String handle);

  /**
   * Revokes every refresh token of a user's session at a client.
   *
   * @param subjectId the user
   * @param clientId  the client
   * @param sessionId the session, null for all sessions
   * @return the number of revoked tokens
   */
  int revokeBySession(String subjectId, String clientId, String sessionId);
}
