package com.codeheadsystems.oluso.server.dpop;

import com.codeheadsystems.oluso.model.OidcConstants.Errors;
import com.nimbusds.jose.jwk.JWK;

/**
 * Outcome of DPoP proof validation. A success always carries both the thumbprint and the key;
 * a nonce-required outcome always carries a fresh server nonce.
 *
 * @param status           the outcome
 * @param jwkThumbprint    RFC 7638 thumbprint of the proof key, success only
 * @param jwk              the proof public key, success only
 * @param error            error code, failures only
 * @param errorDescription error description, failures only
 * @param serverNonce      nonce the client must use, nonce-required only
 */
public record DPoPValidationResult(Status status,
                                   String jwkThumbprint,
                                   JWK jwk,
                                   String error,
                                   String errorDescription,
                                   String serverNonce) {

  public enum Status {
    SUCCESS,
    FAILURE,
    NONCE_REQUIRED
  }

  public static DPoPValidationResult success(String jwkThumbprint, JWK jwk) {
    if (jwkThumbprint == null || jwk == null) {
      throw new IllegalArgumentException("A successful DPoP result needs a thumbprint and a key");
    }
    return new DPoPValidationResult(Status.SUCCESS, jwkThumbprint, jwk, null, null, null);
  }

  public static DPoPValidationResult failure(String description) {
    return failure(Errors.INVALID_DPOP_PROOF, description);
  }

  public static DPoPValidationResult failure(String error, String description) {
    return new DPoPValidationResult(Status.FAILURE, null, null, error, description, null);
  }

  public static DPoPValidationResult nonceRequired(String serverNonce) {
    if (serverNonce == null) {
      throw new IllegalArgumentException("A nonce-required result needs a server nonce");
    }
    return new DPoPValidationResult(Status.NONCE_REQUIRED, null, null, Errors.USE_DPOP_NONCE,
        "Authorization server requires nonce in DPoP proof", serverNonce);
  }

  public boolean isValid() {
    return status == Status.SUCCESS;
  }
}
