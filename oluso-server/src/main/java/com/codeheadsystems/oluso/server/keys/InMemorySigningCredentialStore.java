package com.codeheadsystems.oluso.server.keys;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.jwk.KeyUse;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jose.jwk.gen.RSAKeyGenerator;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory {@link SigningCredentialStore} holding generated RSA keys. Tokens signed by one
 * process are not verifiable after it restarts.
 */
public class InMemorySigningCredentialStore implements SigningCredentialStore {

  private static final Logger log = LoggerFactory.getLogger(InMemorySigningCredentialStore.class);

  private volatile RSAKey signingKey;
  private final List<RSAKey> retiredKeys = new CopyOnWriteArrayList<>();

  public InMemorySigningCredentialStore() {
    this(generate());
    log.warn("Using InMemorySigningCredentialStore with a generated key - tokens will NOT verify after a restart.");
  }

  public InMemorySigningCredentialStore(RSAKey signingKey) {
    if (!signingKey.isPrivate()) {
      throw new IllegalArgumentException("Signing key must include private key material");
    }
    this.signingKey = signingKey;
  }

  /**
   * Generates a new signing key. The previous key stays trusted for validation.
   *
   * @return the new signing key
   */
  public RSAKey rotate() {
    retiredKeys.add(signingKey.toPublicJWK());
    signingKey = generate();
    log.info("Rotated signing key, new kid={}", signingKey.getKeyID());
    return signingKey;
  }

  @Override
  public RSAKey getSigningKey() {
    return signingKey;
  }

  @Override
  public List<RSAKey> getValidationKeys() {
    List<RSAKey> keys = new ArrayList<>();
    keys.add(signingKey.toPublicJWK());
    keys.addAll(retiredKeys);
    return keys;
  }

  private static RSAKey generate() {
    try {
      return new RSAKeyGenerator(2048)
          .keyUse(KeyUse.SIGNATURE)
          .keyID(UUID.randomUUID().toString())
          .generate();
    } catch (JOSEException e) {
      throw new IllegalStateException("Unable to generate RSA signing key", e);
    }
  }
}
