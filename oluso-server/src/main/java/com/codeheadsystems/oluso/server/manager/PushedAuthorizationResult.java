package com.codeheadsystems.oluso.server.manager;

import com.codeheadsystems.oluso.model.token.PushedAuthorizationResponse;
import com.codeheadsystems.oluso.server.protocol.ProtocolError;

/**
 * PAR endpoint outcome.
 *
 * @param response the response, null on failure
 * @param error    the failure, null on success
 */
public record PushedAuthorizationResult(PushedAuthorizationResponse response, ProtocolError error) {

  public static PushedAuthorizationResult success(PushedAuthorizationResponse response) {
    return new PushedAuthorizationResult(response, null);
  }

  public static PushedAuthorizationResult failure(ProtocolError error) {
    return new PushedAuthorizationResult(null, error);
  }

  public boolean isSuccess() {
    return error == null;
  }
}
