package com.codeheadsystems.oluso.server.validation;

import com.codeheadsystems.oluso.model.OidcConstants.Errors;
import com.codeheadsystems.oluso.model.OidcConstants.GrantTypes;
import com.codeheadsystems.oluso.model.OidcConstants.PromptModes;
import com.codeheadsystems.oluso.model.OidcConstants.ResponseTypes;
import com.codeheadsystems.oluso.server.protocol.ProtocolError;
import com.codeheadsystems.oluso.server.request.AuthorizeRequest;
import com.codeheadsystems.oluso.server.request.Scopes;
import com.codeheadsystems.oluso.server.request.ValidatedClient;
import com.codeheadsystems.oluso.server.store.ClientStore;
import com.codeheadsystems.oluso.server.store.RegisteredClient;
import java.util.Optional;
import java.util.Set;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates authorize and pushed authorization requests.
 * <p>
 * Until the redirect uri has been checked against the client's registration, errors must be
 * shown to the user rather than redirected; every later error is flagged as safe to redirect.
 */
@Singleton
public class AuthorizeRequestValidator {

  private static final Logger log = LoggerFactory.getLogger(AuthorizeRequestValidator.class);
  private static final Set<String> SUPPORTED_RESPONSE_TYPES = Set.of(ResponseTypes.CODE, ResponseTypes.CODE_ID_TOKEN);

  private final ClientStore clientStore;
  private final RedirectUriValidator redirectUriValidator;
  private final ScopeValidator scopeValidator;
  private final PkceValidator pkceValidator;

  @Inject
  public AuthorizeRequestValidator(ClientStore clientStore,
                                   RedirectUriValidator redirectUriValidator,
                                   ScopeValidator scopeValidator,
                                   PkceValidator pkceValidator) {
    this.clientStore = clientStore;
    this.redirectUriValidator = redirectUriValidator;
    this.scopeValidator = scopeValidator;
    this.pkceValidator = pkceValidator;
  }

  /**
   * Validates a request.
   *
   * @param request the request
   * @param pushed  whether the request arrived through the PAR endpoint or was redeemed from it
   * @return the result
   */
  public AuthorizeValidationResult validate(AuthorizeRequest request, boolean pushed) {
    if (request.clientId() == null || request.clientId().isBlank()) {
      return failure(request, null, ProtocolError.of(Errors.INVALID_REQUEST, "client_id is required"));
    }
    Optional<ValidatedClient> found = clientStore.findById(request.clientId())
        .map(RegisteredClient::client)
        .filter(c -> c.tenantId() == null || request.tenantId() == null || c.tenantId().equals(request.tenantId()));
    if (found.isEmpty()) {
      log.warn("Authorize request for unknown client {}", request.clientId());
      return failure(request, null, ProtocolError.of(Errors.INVALID_CLIENT, "Unknown client"));
    }
    ValidatedClient client = found.get();
    if (!redirectUriValidator.isValid(request.redirectUri(), client.redirectUris())) {
      log.warn("Client {} sent an unregistered redirect_uri", client.clientId());
      return failure(request, client, ProtocolError.of(Errors.INVALID_REQUEST, "Invalid redirect_uri"));
    }

    if (client.requirePushedAuthorization() && !pushed) {
      return redirectable(request, client, Errors.INVALID_REQUEST, "Pushed authorization request required");
    }
    if (request.responseType() == null || !SUPPORTED_RESPONSE_TYPES.contains(request.responseType())) {
      return redirectable(request, client, Errors.UNSUPPORTED_RESPONSE_TYPE, "Unsupported response_type");
    }
    if (!client.allowedGrantTypes().contains(GrantTypes.AUTHORIZATION_CODE)) {
      return redirectable(request, client, Errors.UNAUTHORIZED_CLIENT, "Client may not use the authorization code flow");
    }
    Set<String> scopes = request.requestedScopes();
    if (scopes.isEmpty()) {
      return redirectable(request, client, Errors.INVALID_SCOPE, "scope is required");
    }
    ValidationResult scopeResult = scopeValidator.validate(scopes, client);
    if (!scopeResult.isValid()) {
      return failure(request, client, scopeResult.error().withRedirectUriValidated());
    }
    if (Scopes.parse(request.responseType()).contains(ResponseTypes.ID_TOKEN)) {
      if (!request.isOpenIdRequest()) {
        return redirectable(request, client, Errors.INVALID_REQUEST, "id_token response types require the openid scope");
      }
      if (request.nonce() == null || request.nonce().isBlank()) {
        return redirectable(request, client, Errors.INVALID_REQUEST, "nonce is required for id_token response types");
      }
    }
    Set<String> prompts = request.promptModes();
    if (prompts.contains(PromptModes.NONE) && prompts.size() > 1) {
      return redirectable(request, client, Errors.INVALID_REQUEST, "prompt=none cannot be combined with other values");
    }
    ValidationResult pkce = pkceValidator.validateCodeChallenge(request.codeChallenge(),
        request.codeChallengeMethod(), client);
    if (!pkce.isValid()) {
      return failure(request, client, pkce.error().withRedirectUriValidated());
    }
    return AuthorizeValidationResult.success(request, client);
  }

  private static AuthorizeValidationResult redirectable(AuthorizeRequest request, ValidatedClient client,
                                                        String error, String description) {
    return failure(request, client, ProtocolError.of(error, description).withRedirectUriValidated());
  }

  private static AuthorizeValidationResult failure(AuthorizeRequest request, ValidatedClient client,
                                                   ProtocolError error) {
    log.debug("Authorize request rejected: {} ({})", error.error(), error.description());
    return AuthorizeValidationResult.failure(request, client, error);
  }
}
