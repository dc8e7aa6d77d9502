package com.codeheadsystems.oluso.server.keys;

import com.nimbusds.jose.jwk.RSAKey;
import java.util.List;

/**
 * Signing keys of the issuer. The current key signs; every validation key is still trusted
 * for verification (key rotation).
 */
public interface SigningCredentialStore {

  /**
   * The key used to sign new tokens, including its private part.
   *
   * @return the signing key
   */
  RSAKey getSigningKey();

  /**
   * Public keys accepted when validating tokens this issuer signed (hint tokens, id_token_hint,
   * exchanged tokens).
   *
   * @return the validation keys
   */
  List<RSAKey> getValidationKeys();
}
