package com.codeheadsystems.oluso.model.token;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Successful token endpoint response (RFC 6749 section 5.1).
 * <p>
 * Used by: {@code POST /connect/token} response
 *
 * @param accessToken     the issued access token
 * @param tokenType       {@code Bearer}, or {@code DPoP} when the token is key-bound
 * @param expiresIn       access token lifetime in seconds
 * @param refreshToken    optional refresh token handle
 * @param scope           granted scopes, space separated
 * @param idToken         optional OpenID Connect ID token
 * @param issuedTokenType token exchange only: type of the issued token
 * @param dpopNonce       server nonce the client must use in its next DPoP proof
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TokenResponse(
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("token_type") String tokenType,
    @JsonProperty("expires_in") int expiresIn,
    @JsonProperty("refresh_token") String refreshToken,
    @JsonProperty("scope") String scope,
    @JsonProperty("id_token") String idToken,
    @JsonProperty("issued_token_type") String issuedTokenType,
    @JsonProperty("dpop_nonce") String dpopNonce) {

  /**
   * Copy of this response carrying a DPoP nonce.
   *
   * @param nonce the server nonce
   * @return the token response
   */
  public TokenResponse withDpopNonce(String nonce) {
    return new TokenResponse(accessToken, tokenType, expiresIn, refreshToken, scope, idToken,
        issuedTokenType, nonce);
  }
}
