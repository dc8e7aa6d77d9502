package com.codeheadsystems.oluso.server.grant;

import com.codeheadsystems.oluso.model.OidcConstants.Errors;
import com.codeheadsystems.oluso.model.OidcConstants.GrantTypes;
import com.codeheadsystems.oluso.model.OidcConstants.StandardClaims;
import com.codeheadsystems.oluso.model.OidcConstants.TokenTypes;
import com.codeheadsystems.oluso.server.request.TokenRequest;
import com.codeheadsystems.oluso.server.request.ValidatedClient;
import com.codeheadsystems.oluso.server.token.TokenIssuer;
import com.codeheadsystems.oluso.server.token.TokenIssuer.VerifiedAccessToken;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OAuth 2.0 Token Exchange (RFC 8693) for access tokens this server issued. The exchanged token
 * can only narrow the subject token's scopes. A valid actor token adds an {@code act} claim.
 */
@Singleton
public class TokenExchangeGrantHandler implements GrantHandler {

  private static final Logger log = LoggerFactory.getLogger(TokenExchangeGrantHandler.class);
  private static final Set<String> SUPPORTED_TYPES = Set.of(TokenTypes.ACCESS_TOKEN, TokenTypes.JWT);
  static final String ACTOR_CLAIM = "act";

  private final TokenIssuer tokenIssuer;

  @Inject
  public TokenExchangeGrantHandler(TokenIssuer tokenIssuer) {
    this.tokenIssuer = tokenIssuer;
  }

  @Override
  public String grantType() {
    return GrantTypes.TOKEN_EXCHANGE;
  }

  @Override
  public GrantResult handle(TokenRequest request, ValidatedClient client) {
    if (request.subjectToken() == null || request.subjectTokenType() == null) {
      return GrantResult.failure(Errors.INVALID_REQUEST, "subject_token and subject_token_type are required");
    }
    if (!SUPPORTED_TYPES.contains(request.subjectTokenType())) {
      return GrantResult.failure(Errors.INVALID_REQUEST, "Unsupported subject_token_type");
    }
    if (request.requestedTokenType() != null && !TokenTypes.ACCESS_TOKEN.equals(request.requestedTokenType())) {
      return GrantResult.failure(Errors.INVALID_REQUEST, "Unsupported requested_token_type");
    }
    Optional<VerifiedAccessToken> subject = tokenIssuer.verifyAccessToken(request.subjectToken(), request.tenantId());
    if (subject.isEmpty()) {
      return GrantResult.failure(Errors.INVALID_GRANT, "Invalid subject_token");
    }
    Map<String, Object> claims = Map.of();
    if (request.actorToken() != null) {
      Optional<VerifiedAccessToken> actor = tokenIssuer.verifyAccessToken(request.actorToken(), request.tenantId());
      if (actor.isEmpty()) {
        return GrantResult.failure(Errors.INVALID_GRANT, "Invalid actor_token");
      }
      String actorSubject = actor.get().subject() != null ? actor.get().subject() : actor.get().clientId();
      claims = Map.of(ACTOR_CLAIM, Map.of(StandardClaims.SUBJECT, actorSubject));
    }
    Set<String> requested = request.requestedScopes();
    if (!subject.get().scopes().containsAll(requested)) {
      return GrantResult.failure(Errors.INVALID_SCOPE, "Requested scope exceeds the subject token");
    }
    Set<String> scopes = requested.isEmpty() ? subject.get().scopes() : requested;
    log.debug("Exchanging token of client {} for client {}", subject.get().clientId(), client.clientId());
    return new GrantResult(subject.get().subject(), null, scopes, claims, null, null, null, null, null,
        TokenTypes.ACCESS_TOKEN, false, null);
  }
}
