package com.codeheadsystems.oluso.server.store;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link DPoPNonceStore}.
 * <p>
 * Replay state is per instance, so behind a load balancer a proof could be replayed against a
 * different node. Use a shared store in production.
 */
public class InMemoryDPoPNonceStore implements DPoPNonceStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryDPoPNonceStore.class);
  private static final Duration DEFAULT_NONCE_LIFETIME = Duration.ofMinutes(5);

  private record IssuedNonce(String clientId, Instant expiresAt) {
  }

  private final SecureRandom random = new SecureRandom();
  private final ConcurrentHashMap<String, IssuedNonce> nonces = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, Instant> seenJtis = new ConcurrentHashMap<>();
  private final Set<String> nonceRequiredClients = ConcurrentHashMap.newKeySet();
  private final boolean nonceRequiredForAll;
  private final Duration nonceLifetime;
  private final Clock clock;

  public InMemoryDPoPNonceStore() {
    this(false, DEFAULT_NONCE_LIFETIME);
  }

  public InMemoryDPoPNonceStore(boolean nonceRequiredForAll, Duration nonceLifetime) {
    this(nonceRequiredForAll, nonceLifetime, Clock.systemUTC());
  }

  /**
   * Instantiates a new store.
   *
   * @param nonceRequiredForAll whether every client must use server nonces
   * @param nonceLifetime       how long an issued nonce stays valid
   * @param clock               the clock for nonce and jti expiry
   */
  public InMemoryDPoPNonceStore(boolean nonceRequiredForAll, Duration nonceLifetime, Clock clock) {
    this.nonceRequiredForAll = nonceRequiredForAll;
    this.nonceLifetime = nonceLifetime;
    this.clock = clock;
    log.warn("Using InMemoryDPoPNonceStore - DPoP replay protection is NOT shared between instances.");
  }

  public void requireNonceFor(String clientId) {
    nonceRequiredClients.add(clientId);
  }

  @Override
  public boolean isNonceRequired(String clientId) {
    return nonceRequiredForAll || (clientId != null && nonceRequiredClients.contains(clientId));
  }

  @Override
  public String generateNonce(String clientId) {
    byte[] bytes = new byte[32];
    random.nextBytes(bytes);
    String nonce = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    Instant now = clock.instant();
    nonces.values().removeIf(issued -> issued.expiresAt().isBefore(now));
    nonces.put(nonce, new IssuedNonce(clientId, now.plus(nonceLifetime)));
    return nonce;
  }

  @Override
  public boolean validateNonce(String nonce, String clientId) {
    if (nonce == null) {
      return false;
    }
    IssuedNonce issued = nonces.get(nonce);
    if (issued == null) {
      return false;
    }
    if (issued.expiresAt().isBefore(clock.instant())) {
      nonces.remove(nonce);
      return false;
    }
    return issued.clientId() == null || Objects.equals(issued.clientId(), clientId);
  }

  @Override
  public boolean validateJti(String jti, Duration lifetime) {
    Instant now = clock.instant();
    seenJtis.values().removeIf(expiry -> expiry.isBefore(now));
    Instant previous = seenJtis.putIfAbsent(jti, now.plus(lifetime));
    if (previous != null) {
      log.debug("DPoP proof jti replay detected");
      return false;
    }
    return true;
  }

  int issuedNonceCount() {
    return nonces.size();
  }
}
