package com.codeheadsystems.oluso.server.grant;

import com.codeheadsystems.oluso.model.OidcConstants.Errors;
import com.codeheadsystems.oluso.model.OidcConstants.GrantTypes;
import com.codeheadsystems.oluso.model.OidcConstants.Scopes;
import com.codeheadsystems.oluso.server.request.TokenRequest;
import com.codeheadsystems.oluso.server.request.ValidatedClient;
import java.util.Set;
import java.util.TreeSet;
import javax.inject.Singleton;

/**
 * The {@code client_credentials} grant. No user is involved, so OpenID and offline scopes are
 * refused.
 */
@Singleton
public class ClientCredentialsGrantHandler implements GrantHandler {

  @Override
  public String grantType() {
    return GrantTypes.CLIENT_CREDENTIALS;
  }

  @Override
  public GrantResult handle(TokenRequest request, ValidatedClient client) {
    if (client.isPublicClient()) {
      return GrantResult.failure(Errors.UNAUTHORIZED_CLIENT, "Public clients cannot use client_credentials");
    }
    Set<String> scopes = request.requestedScopes();
    if (scopes.contains(Scopes.OPENID) || scopes.contains(Scopes.OFFLINE_ACCESS)) {
      return GrantResult.failure(Errors.INVALID_SCOPE, "User scopes are not available without a user");
    }
    if (scopes.isEmpty()) {
      Set<String> all = new TreeSet<>(client.allowedScopes());
      all.remove(Scopes.OPENID);
      all.remove(Scopes.OFFLINE_ACCESS);
      scopes = all;
    }
    return GrantResult.of(null, null, scopes);
  }
}
