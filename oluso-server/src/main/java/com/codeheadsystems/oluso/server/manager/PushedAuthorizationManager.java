package com.codeheadsystems.oluso.server.manager;

import com.codeheadsystems.oluso.model.OidcConstants.Errors;
import com.codeheadsystems.oluso.model.OidcConstants.ProtocolEndpoints;
import com.codeheadsystems.oluso.model.token.PushedAuthorizationResponse;
import com.codeheadsystems.oluso.server.config.OlusoServerConfig;
import com.codeheadsystems.oluso.server.protocol.ProtocolError;
import com.codeheadsystems.oluso.server.request.AuthorizeRequest;
import com.codeheadsystems.oluso.server.request.ValidatedClient;
import com.codeheadsystems.oluso.server.store.PushedAuthorizationStore;
import com.codeheadsystems.oluso.server.validation.AuthorizeRequestValidator;
import com.codeheadsystems.oluso.server.validation.AuthorizeValidationResult;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Base64;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pushed authorization requests (RFC 9126). A pushed request is validated up front and stored
 * under a one-time {@code request_uri} reference.
 */
@Singleton
public class PushedAuthorizationManager {

  private static final Logger log = LoggerFactory.getLogger(PushedAuthorizationManager.class);
  private static final Base64.Encoder B64URL = Base64.getUrlEncoder().withoutPadding();

  private final AuthorizeRequestValidator validator;
  private final PushedAuthorizationStore store;
  private final OlusoServerConfig config;
  private final Clock clock;
  private final SecureRandom random = new SecureRandom();

  @Inject
  public PushedAuthorizationManager(AuthorizeRequestValidator validator,
                                    PushedAuthorizationStore store,
                                    OlusoServerConfig config) {
    this(validator, store, config, Clock.systemUTC());
  }

  public PushedAuthorizationManager(AuthorizeRequestValidator validator,
                                    PushedAuthorizationStore store,
                                    OlusoServerConfig config,
                                    Clock clock) {
    this.validator = validator;
    this.store = store;
    this.config = config;
    this.clock = clock;
    log.info("PushedAuthorizationManager()");
  }

  /**
   * Validates and stores a pushed request.
   *
   * @param request the authorize parameters
   * @param client  the authenticated client
   * @return the result
   */
  public PushedAuthorizationResult push(AuthorizeRequest request, ValidatedClient client) {
    if (request.requestUri() != null) {
      return PushedAuthorizationResult.failure(
          ProtocolError.of(Errors.INVALID_REQUEST, "request_uri is not allowed in a pushed request"));
    }
    if (request.clientId() != null && !request.clientId().equals(client.clientId())) {
      return PushedAuthorizationResult.failure(
          ProtocolError.of(Errors.INVALID_REQUEST, "client_id does not match the authenticated client"));
    }
    AuthorizeRequest bound = request.clientId() == null ? withClientId(request, client.clientId()) : request;
    AuthorizeValidationResult validation = validator.validate(bound, true);
    if (!validation.isValid()) {
      return PushedAuthorizationResult.failure(validation.error());
    }
    byte[] bytes = new byte[32];
    random.nextBytes(bytes);
    String requestUri = ProtocolEndpoints.PAR_REQUEST_URI_PREFIX + B64URL.encodeToString(bytes);
    int lifetime = config.parLifetimeSeconds();
    store.store(requestUri, bound, clock.instant().plusSeconds(lifetime));
    log.debug("Stored pushed authorization request for client {}", client.clientId());
    return PushedAuthorizationResult.success(new PushedAuthorizationResponse(requestUri, lifetime));
  }

  /**
   * Redeems a reference once.
   *
   * @param requestUri the reference
   * @param clientId   the client presenting it
   * @return the pushed request, empty when unknown, used, expired or pushed by another client
   */
  public Optional<AuthorizeRequest> redeem(String requestUri, String clientId) {
    return store.consume(requestUri).filter(r -> r.clientId().equals(clientId));
  }

  private static AuthorizeRequest withClientId(AuthorizeRequest r, String clientId) {
    return new AuthorizeRequest(clientId, r.responseType(), r.redirectUri(), r.scope(), r.state(), r.codeChallenge(),
        r.codeChallengeMethod(), r.nonce(), r.responseMode(), r.prompt(), r.maxAge(), r.loginHint(),
        r.idTokenHint(), r.acrValues(), r.uiLocales(), r.requestUri(), r.uiMode(), r.policy(), r.resources(),
        r.dpopJkt(), r.tenantId());
  }
}
