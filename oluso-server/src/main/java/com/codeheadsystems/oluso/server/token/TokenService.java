package com.codeheadsystems.oluso.server.token;

import com.codeheadsystems.oluso.model.OidcConstants.GrantTypes;
import com.codeheadsystems.oluso.model.OidcConstants.Scopes;
import com.codeheadsystems.oluso.model.OidcConstants.TokenTypes;
import com.codeheadsystems.oluso.model.token.TokenResponse;
import com.codeheadsystems.oluso.server.grant.GrantResult;
import com.codeheadsystems.oluso.server.request.TokenRequest;
import com.codeheadsystems.oluso.server.request.ValidatedClient;
import java.util.ArrayList;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Turns a successful grant into a token response.
 * <ul>
 *   <li>The access token is DPoP bound when a key thumbprint is known, Bearer otherwise.</li>
 *   <li>An ID token is issued when {@code openid} was granted and a user is present.</li>
 *   <li>A refresh token is issued when {@code offline_access} was granted to a client allowed to
 *   hold one. On the refresh grant a new one is issued only when the old one was rotated out.</li>
 * </ul>
 */
@Singleton
public class TokenService {

  private final TokenIssuer tokenIssuer;

  @Inject
  public TokenService(TokenIssuer tokenIssuer) {
    this.tokenIssuer = tokenIssuer;
  }

  /**
   * Creates the token response for a grant.
   *
   * @param grant   the successful grant
   * @param request the token request
   * @param client  the authenticated client
   * @param dpopJkt the key thumbprint the tokens are bound to, null for bearer tokens
   * @return the token response
   */
  public TokenResponse createTokenResponse(GrantResult grant, TokenRequest request, ValidatedClient client,
                                           String dpopJkt) {
    TokenCreationRequest creation = new TokenCreationRequest(client.clientId(), request.tenantId(),
        grant.subjectId(), grant.sessionId(), grant.scopes(), grant.claims(), audiences(request),
        client.accessTokenLifetime(), client.identityTokenLifetime(), dpopJkt, grant.nonce(), grant.authTime(),
        grant.amr(), grant.acr());

    String accessToken = tokenIssuer.createAccessToken(creation);
    String idToken = null;
    if (grant.scopes().contains(Scopes.OPENID) && grant.subjectId() != null) {
      idToken = tokenIssuer.createIdToken(creation, accessToken);
    }
    String refreshToken = null;
    if (issuesRefreshToken(grant, request, client)) {
      refreshToken = tokenIssuer.createRefreshToken(creation, client.refreshTokenLifetime());
    }
    return new TokenResponse(accessToken, dpopJkt != null ? TokenTypes.DPOP : TokenTypes.BEARER,
        client.accessTokenLifetime(), refreshToken, String.join(" ", grant.scopes()), idToken,
        grant.issuedTokenType(), null);
  }

  private static boolean issuesRefreshToken(GrantResult grant, TokenRequest request, ValidatedClient client) {
    if (!grant.scopes().contains(Scopes.OFFLINE_ACCESS) || !client.allowOfflineAccess()
        || grant.subjectId() == null) {
      return false;
    }
    if (GrantTypes.REFRESH_TOKEN.equals(request.grantType())) {
      return grant.rotatedRefreshToken();
    }
    return !GrantTypes.TOKEN_EXCHANGE.equals(request.grantType());
  }

  // RFC 8707 resource indicators and the token exchange audience become the token audiences.
  private static List<String> audiences(TokenRequest request) {
    List<String> audiences = new ArrayList<>(request.resources());
    if (request.audience() != null && !request.audience().isBlank()) {
      audiences.add(request.audience());
    }
    return audiences;
  }
}
