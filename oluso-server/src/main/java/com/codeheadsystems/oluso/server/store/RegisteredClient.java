package com.codeheadsystems.oluso.server.store;

import com.codeheadsystems.oluso.server.request.ValidatedClient;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

/**
 * A client as held by the {@link ClientStore}: its policy plus the hash of its secret.
 *
 * @param client     the client policy
 * @param secretHash base64 SHA-256 of the client secret, null for public clients
 */
public record RegisteredClient(ValidatedClient client, String secretHash) {

  /**
   * Registers a confidential client with a plain-text secret, hashing it.
   *
   * @param client the client
   * @param secret the plain secret
   * @return the registered client
   */
  public static RegisteredClient withSecret(ValidatedClient client, String secret) {
    return new RegisteredClient(client, hashSecret(secret));
  }

  public static RegisteredClient publicClient(ValidatedClient client) {
    return new RegisteredClient(client, null);
  }

  public static String hashSecret(String secret) {
    try {
      byte[] digest = MessageDigest.getInstance("SHA-256").digest(secret.getBytes(StandardCharsets.UTF_8));
      return Base64.getEncoder().encodeToString(digest);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
