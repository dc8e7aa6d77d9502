package com.codeheadsystems.oluso.server.grant;

import com.codeheadsystems.oluso.server.request.TokenRequest;
import com.codeheadsystems.oluso.server.request.ValidatedClient;

/**
 * Validates one grant type at the token endpoint. Handlers only decide what the client is
 * entitled to; tokens are minted by {@link com.codeheadsystems.oluso.server.token.TokenService}.
 */
public interface GrantHandler {

  /**
   * The {@code grant_type} value this handler serves.
   *
   * @return the grant type
   */
  String grantType();

  /**
   * Validates the grant.
   *
   * @param request the token request, already shape-checked
   * @param client  the authenticated client
   * @return the grant, or a protocol error
   */
  GrantResult handle(TokenRequest request, ValidatedClient client);
}
