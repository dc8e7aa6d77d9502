package com.codeheadsystems.oluso.server.ciba;

/**
 * Why a CIBA hint did not resolve to a user. Logged, never returned to the client.
 */
public enum HintFailureReason {
  NO_HINT,
  USER_NOT_FOUND,
  MALFORMED_TOKEN,
  TOKEN_EXPIRED,
  INVALID_SIGNATURE,
  INVALID_ISSUER,
  INVALID_AUDIENCE,
  MISSING_SUBJECT,
  NO_VALIDATION_KEYS,
  LOOKUP_FAILED
}
