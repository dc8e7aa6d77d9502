package com.codeheadsystems.oluso.server.store;

import java.time.Duration;

/**
 * Server nonces and proof replay tracking for DPoP (RFC 9449 sections 8 and 11.1).
 */
public interface DPoPNonceStore {

  /**
   * Whether proofs from this client must carry a server-issued nonce.
   *
   * @param clientId the client, may be null at resource servers
   * @return true if a nonce is required
   */
  boolean isNonceRequired(String clientId);

  /**
   * Issues a fresh nonce for the client.
   *
   * @param clientId the client, may be null
   * @return the nonce
   */
  String generateNonce(String clientId);

  /**
   * Checks a nonce presented in a proof.
   *
   * @param nonce    the nonce claim
   * @param clientId the client, may be null
   * @return true if the nonce was issued by this server, for this client, and is still live
   */
  boolean validateNonce(String nonce, String clientId);

  /**
   * Records a proof's {@code jti}. Must be an atomic insert-if-absent so that of two concurrent
   * presentations of the same proof only one is accepted.
   *
   * @param jti      the proof id
   * @param lifetime how long the id must be remembered
   * @return true if the jti was not seen before
   */
  boolean validateJti(String jti, Duration lifetime);
}
