package com.codeheadsystems.oluso.server.ciba;

import com.codeheadsystems.oluso.server.protocol.ProtocolError;

/**
 * Outcome of {@link CibaService#authenticate}.
 *
 * @param authReqId the request handle, success only
 * @param expiresIn lifetime in seconds, success only
 * @param interval  polling interval in seconds, success only
 * @param error     the failure, null on success
 */
public record CibaAuthenticationResult(String authReqId, int expiresIn, int interval, ProtocolError error) {

  public static CibaAuthenticationResult success(String authReqId, int expiresIn, int interval) {
    return new CibaAuthenticationResult(authReqId, expiresIn, interval, null);
  }

  public static CibaAuthenticationResult failure(String error, String description) {
    return new CibaAuthenticationResult(null, 0, 0, ProtocolError.of(error, description));
  }

  public boolean isSuccess() {
    return error == null;
  }
}
