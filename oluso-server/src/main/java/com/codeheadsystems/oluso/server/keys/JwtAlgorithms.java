package com.codeheadsystems.oluso.server.keys;

import com.auth0.jwt.algorithms.Algorithm;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.jwk.RSAKey;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.util.Optional;

/**
 * Bridges nimbus RSA JWKs to java-jwt {@link Algorithm}s.
 */
public final class JwtAlgorithms {

  private JwtAlgorithms() {
  }

  /**
   * Verification algorithm for a token header {@code alg} and an RSA key.
   *
   * @param alg the header algorithm
   * @param key the public key
   * @return the algorithm, empty when {@code alg} is not an RSA PKCS#1 algorithm
   */
  public static Optional<Algorithm> verifier(String alg, RSAKey key) {
    if (alg == null) {
      return Optional.empty();
    }
    RSAPublicKey publicKey = toPublicKey(key);
    switch (alg) {
      case "RS256":
        return Optional.of(Algorithm.RSA256(publicKey, null));
      case "RS384":
        return Optional.of(Algorithm.RSA384(publicKey, null));
      case "RS512":
        return Optional.of(Algorithm.RSA512(publicKey, null));
      default:
        return Optional.empty();
    }
  }

  /**
   * RS256 signing algorithm for a private RSA key.
   *
   * @param key the key, with private material
   * @return the algorithm
   */
  public static Algorithm signer(RSAKey key) {
    try {
      RSAPrivateKey privateKey = key.toRSAPrivateKey();
      return Algorithm.RSA256(key.toRSAPublicKey(), privateKey);
    } catch (JOSEException e) {
      throw new IllegalStateException("Signing key " + key.getKeyID() + " is not usable", e);
    }
  }

  private static RSAPublicKey toPublicKey(RSAKey key) {
    try {
      return key.toRSAPublicKey();
    } catch (JOSEException e) {
      throw new IllegalStateException("Validation key " + key.getKeyID() + " is not usable", e);
    }
  }
}
