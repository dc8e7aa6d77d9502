package com.codeheadsystems.oluso.server.manager;

import com.codeheadsystems.oluso.model.device.DeviceAuthorizationResponse;
import com.codeheadsystems.oluso.server.protocol.ProtocolError;

/**
 * Device authorization endpoint outcome.
 *
 * @param response the response, null on failure
 * @param error    the failure, null on success
 */
public record DeviceAuthorizationResult(DeviceAuthorizationResponse response, ProtocolError error) {

  public static DeviceAuthorizationResult success(DeviceAuthorizationResponse response) {
    return new DeviceAuthorizationResult(response, null);
  }

  public static DeviceAuthorizationResult failure(String error, String description) {
    return new DeviceAuthorizationResult(null, ProtocolError.of(error, description));
  }

  public boolean isSuccess() {
    return error == null;
  }
}
