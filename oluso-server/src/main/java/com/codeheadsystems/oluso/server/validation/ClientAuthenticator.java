package com.codeheadsystems.oluso.server.validation;

import com.codeheadsystems.oluso.model.OidcConstants.Errors;
import com.codeheadsystems.oluso.server.request.ClientAuthenticationMethod;
import com.codeheadsystems.oluso.server.request.TokenRequest;
import com.codeheadsystems.oluso.server.request.ValidatedClient;
import com.codeheadsystems.oluso.server.store.ClientStore;
import com.codeheadsystems.oluso.server.store.RegisteredClient;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authenticates the client of a token endpoint request. Methods are tried in order: HTTP Basic,
 * form post secret, client assertion, then public client by id alone. Client assertions are not
 * supported and always fail.
 */
@Singleton
public class ClientAuthenticator {

  private static final Logger log = LoggerFactory.getLogger(ClientAuthenticator.class);
  private static final String BASIC_PREFIX = "Basic ";

  private final ClientStore clientStore;

  @Inject
  public ClientAuthenticator(ClientStore clientStore) {
    this.clientStore = clientStore;
  }

  /**
   * Authenticates the request's client.
   *
   * @param request the token request
   * @return the result; every failure is {@code invalid_client}
   */
  public ClientAuthenticationResult authenticate(TokenRequest request) {
    String header = request.authorizationHeader();
    if (header != null && header.regionMatches(true, 0, BASIC_PREFIX, 0, BASIC_PREFIX.length())) {
      Optional<String[]> credentials = decodeBasic(header.substring(BASIC_PREFIX.length()).trim());
      if (credentials.isEmpty()) {
        return ClientAuthenticationResult.failure(Errors.INVALID_CLIENT, "Malformed Basic authorization header");
      }
      String[] pair = credentials.get();
      if (request.clientId() != null && !request.clientId().equals(pair[0])) {
        return ClientAuthenticationResult.failure(Errors.INVALID_CLIENT, "client_id does not match the credentials");
      }
      return withSecret(pair[0], pair[1], ClientAuthenticationMethod.CLIENT_SECRET_BASIC, request.tenantId());
    }
    if (request.clientSecret() != null) {
      return withSecret(request.clientId(), request.clientSecret(), ClientAuthenticationMethod.CLIENT_SECRET_POST,
          request.tenantId());
    }
    if (request.clientAssertion() != null) {
      log.debug("Rejected client assertion for client {}", request.clientId());
      return ClientAuthenticationResult.failure(Errors.INVALID_CLIENT, "Unsupported client authentication method");
    }
    if (request.clientId() != null) {
      Optional<RegisteredClient> found = lookup(request.clientId(), request.tenantId());
      if (found.isEmpty()) {
        return unknownClient(request.clientId());
      }
      if (!found.get().client().isPublicClient()) {
        return ClientAuthenticationResult.failure(Errors.INVALID_CLIENT, "Client authentication is required");
      }
      return ClientAuthenticationResult.success(found.get().client(), ClientAuthenticationMethod.NONE);
    }
    return ClientAuthenticationResult.failure(Errors.INVALID_CLIENT, "Client authentication is required");
  }

  private ClientAuthenticationResult withSecret(String clientId, String secret, ClientAuthenticationMethod method,
                                                String tenantId) {
    if (clientId == null || clientId.isBlank()) {
      return ClientAuthenticationResult.failure(Errors.INVALID_CLIENT, "client_id is required");
    }
    Optional<RegisteredClient> found = lookup(clientId, tenantId);
    if (found.isEmpty()) {
      return unknownClient(clientId);
    }
    RegisteredClient registered = found.get();
    if (registered.secretHash() == null) {
      return ClientAuthenticationResult.failure(Errors.INVALID_CLIENT, "Public clients cannot use a secret");
    }
    byte[] expected = registered.secretHash().getBytes(StandardCharsets.US_ASCII);
    byte[] actual = RegisteredClient.hashSecret(secret).getBytes(StandardCharsets.US_ASCII);
    if (!MessageDigest.isEqual(expected, actual)) {
      log.warn("Invalid secret for client {}", clientId);
      return ClientAuthenticationResult.failure(Errors.INVALID_CLIENT, "Invalid client credentials");
    }
    return ClientAuthenticationResult.success(registered.client(), method);
  }

  // Clients of another tenant are treated as unknown.
  private Optional<RegisteredClient> lookup(String clientId, String tenantId) {
    return clientStore.findById(clientId).filter(registered -> matchesTenant(registered.client(), tenantId));
  }

  private static boolean matchesTenant(ValidatedClient client, String tenantId) {
    return client.tenantId() == null || tenantId == null || client.tenantId().equals(tenantId);
  }

  private static ClientAuthenticationResult unknownClient(String clientId) {
    log.warn("Unknown client {}", clientId);
    return ClientAuthenticationResult.failure(Errors.INVALID_CLIENT, "Unknown client");
  }

  // RFC 6749 section 2.3.1: id and secret are form-urlencoded before base64.
  private static Optional<String[]> decodeBasic(String encoded) {
    try {
      String decoded = new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8);
      int colon = decoded.indexOf(':');
      if (colon <= 0) {
        return Optional.empty();
      }
      return Optional.of(new String[]{
          URLDecoder.decode(decoded.substring(0, colon), StandardCharsets.UTF_8),
          URLDecoder.decode(decoded.substring(colon + 1), StandardCharsets.UTF_8)});
    } catch (IllegalArgumentException e) {
      log.debug("Undecodable Basic credentials: {}", e.getMessage());
      return Optional.empty();
    }
  }
}
