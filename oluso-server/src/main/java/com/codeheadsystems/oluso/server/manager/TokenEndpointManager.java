package com.codeheadsystems.oluso.server.manager;

import com.codeheadsystems.oluso.model.OidcConstants.Errors;
import com.codeheadsystems.oluso.model.OidcConstants.ProtocolEndpoints;
import com.codeheadsystems.oluso.model.token.TokenResponse;
import com.codeheadsystems.oluso.server.config.OlusoServerConfig;
import com.codeheadsystems.oluso.server.dpop.DPoPProofValidator;
import com.codeheadsystems.oluso.server.dpop.DPoPValidationContext;
import com.codeheadsystems.oluso.server.dpop.DPoPValidationResult;
import com.codeheadsystems.oluso.server.event.EventSink;
import com.codeheadsystems.oluso.server.event.OlusoEvent;
import com.codeheadsystems.oluso.server.grant.GrantHandler;
import com.codeheadsystems.oluso.server.grant.GrantResult;
import com.codeheadsystems.oluso.server.protocol.ProtocolError;
import com.codeheadsystems.oluso.server.request.TokenRequest;
import com.codeheadsystems.oluso.server.request.ValidatedClient;
import com.codeheadsystems.oluso.server.token.TokenService;
import com.codeheadsystems.oluso.server.validation.ClientAuthenticationResult;
import com.codeheadsystems.oluso.server.validation.ClientAuthenticator;
import com.codeheadsystems.oluso.server.validation.TokenRequestValidator;
import com.codeheadsystems.oluso.server.validation.ValidationResult;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic token endpoint.
 * <p>
 * Order of processing: client authentication, request validation, DPoP proof, grant handler,
 * key binding, token issuance. Every failure is returned as a value with its HTTP status and an
 * audit event is published for every outcome.
 */
@Singleton
public class TokenEndpointManager {

  private static final Logger log = LoggerFactory.getLogger(TokenEndpointManager.class);
  private static final String METHOD = "POST";

  private final ClientAuthenticator clientAuthenticator;
  private final TokenRequestValidator requestValidator;
  private final DPoPProofValidator dpopProofValidator;
  private final TokenService tokenService;
  private final EventSink eventSink;
  private final OlusoServerConfig config;
  private final Clock clock;
  private final Map<String, GrantHandler> grantHandlers = new HashMap<>();

  @Inject
  public TokenEndpointManager(ClientAuthenticator clientAuthenticator,
                              TokenRequestValidator requestValidator,
                              DPoPProofValidator dpopProofValidator,
                              TokenService tokenService,
                              Set<GrantHandler> grantHandlers,
                              EventSink eventSink,
                              OlusoServerConfig config) {
    this(clientAuthenticator, requestValidator, dpopProofValidator, tokenService, grantHandlers, eventSink, config,
        Clock.systemUTC());
  }

  public TokenEndpointManager(ClientAuthenticator clientAuthenticator,
                              TokenRequestValidator requestValidator,
                              DPoPProofValidator dpopProofValidator,
                              TokenService tokenService,
                              Set<GrantHandler> grantHandlers,
                              EventSink eventSink,
                              OlusoServerConfig config,
                              Clock clock) {
    this.clientAuthenticator = clientAuthenticator;
    this.requestValidator = requestValidator;
    this.dpopProofValidator = dpopProofValidator;
    this.tokenService = tokenService;
    this.eventSink = eventSink;
    this.config = config;
    this.clock = clock;
    for (GrantHandler handler : grantHandlers) {
      if (this.grantHandlers.put(handler.grantType(), handler) != null) {
        throw new IllegalArgumentException("Duplicate grant handler for " + handler.grantType());
      }
    }
  }

  /**
   * Processes a token request.
   *
   * @param request the token request
   * @return the outcome
   */
  public TokenEndpointResult token(TokenRequest request) {
    log.debug("token({})", request.grantType());
    ClientAuthenticationResult auth = clientAuthenticator.authenticate(request);
    if (!auth.isAuthenticated()) {
      return fail(request, request.clientId(), auth.error(), TokenEndpointResult.UNAUTHORIZED);
    }
    ValidatedClient client = auth.client();

    GrantHandler handler = request.grantType() == null ? null : grantHandlers.get(request.grantType());
    if (handler == null && request.grantType() != null && !request.grantType().isBlank()) {
      return fail(request, client.clientId(),
          ProtocolError.of(Errors.UNSUPPORTED_GRANT_TYPE, "Unsupported grant type"), TokenEndpointResult.BAD_REQUEST);
    }
    ValidationResult validation = requestValidator.validate(request, client);
    if (!validation.isValid()) {
      return fail(request, client.clientId(), validation.error(), TokenEndpointResult.BAD_REQUEST);
    }

    String proofJkt = null;
    if (request.dpopProof() != null) {
      DPoPValidationResult dpop = dpopProofValidator.validate(DPoPValidationContext.forTokenRequest(
          request.dpopProof(), METHOD, tokenEndpointUri(request.tenantId()), client.clientId()));
      if (dpop.status() == DPoPValidationResult.Status.NONCE_REQUIRED) {
        eventSink.publish(new OlusoEvent.DPoPProofRejected(clock.instant(), request.tenantId(), client.clientId(),
            dpop.errorDescription()));
        return TokenEndpointResult.nonceRequired(ProtocolError.of(dpop.error(), dpop.errorDescription()),
            dpop.serverNonce());
      }
      if (!dpop.isValid()) {
        eventSink.publish(new OlusoEvent.DPoPProofRejected(clock.instant(), request.tenantId(), client.clientId(),
            dpop.errorDescription()));
        return fail(request, client.clientId(), ProtocolError.of(dpop.error(), dpop.errorDescription()),
            TokenEndpointResult.BAD_REQUEST);
      }
      proofJkt = dpop.jwkThumbprint();
    } else if (client.requireDPoP()) {
      return fail(request, client.clientId(),
          ProtocolError.of(Errors.INVALID_DPOP_PROOF, "DPoP proof is required"), TokenEndpointResult.BAD_REQUEST);
    }

    GrantResult grant = handler.handle(request, client);
    if (!grant.isSuccess()) {
      return fail(request, client.clientId(), grant.error(), TokenEndpointResult.BAD_REQUEST);
    }
    if (grant.boundJkt() != null && !grant.boundJkt().equals(proofJkt)) {
      log.warn("Grant for client {} is bound to a different DPoP key", client.clientId());
      return fail(request, client.clientId(),
          ProtocolError.of(Errors.INVALID_DPOP_PROOF, "DPoP key does not match the key bound to the grant"),
          TokenEndpointResult.BAD_REQUEST);
    }

    TokenResponse response = tokenService.createTokenResponse(grant, request, client, proofJkt);
    eventSink.publish(new OlusoEvent.TokenIssued(clock.instant(), request.tenantId(), client.clientId(),
        grant.subjectId(), request.grantType(), grant.scopes(), proofJkt != null));
    return TokenEndpointResult.success(response);
  }

  private String tokenEndpointUri(String tenantId) {
    return config.issuerFor(tenantId) + ProtocolEndpoints.TOKEN;
  }

  private TokenEndpointResult fail(TokenRequest request, String clientId, ProtocolError error, int status) {
    log.debug("Token request failed: {} {}", error.error(), error.description());
    eventSink.publish(new OlusoEvent.TokenRequestFailed(clock.instant(), request.tenantId(), clientId,
        request.grantType(), error.error()));
    return TokenEndpointResult.failure(error, status);
  }
}
