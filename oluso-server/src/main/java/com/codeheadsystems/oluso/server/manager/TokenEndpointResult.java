package com.codeheadsystems.oluso.server.manager;

import com.codeheadsystems.oluso.model.token.TokenResponse;
import com.codeheadsystems.oluso.server.protocol.ProtocolError;

/**
 * Token endpoint outcome, ready to be written as an HTTP response.
 *
 * @param response  the token response, null on failure
 * @param error     the failure, null on success
 * @param status    the HTTP status
 * @param dpopNonce a server nonce to send in the {@code DPoP-Nonce} header, may be null
 */
public record TokenEndpointResult(TokenResponse response, ProtocolError error, int status, String dpopNonce) {

  public static final int OK = 200;
  public static final int BAD_REQUEST = 400;
  public static final int UNAUTHORIZED = 401;

  public static TokenEndpointResult success(TokenResponse response) {
    return new TokenEndpointResult(response, null, OK, null);
  }

  public static TokenEndpointResult failure(ProtocolError error, int status) {
    return new TokenEndpointResult(null, error, status, null);
  }

  public static TokenEndpointResult nonceRequired(ProtocolError error, String nonce) {
    return new TokenEndpointResult(null, error, BAD_REQUEST, nonce);
  }

  public boolean isSuccess() {
    return error == null;
  }
}
