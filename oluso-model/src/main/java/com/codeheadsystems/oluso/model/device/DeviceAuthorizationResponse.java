package com.codeheadsystems.oluso.model.device;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Device authorization response (RFC 8628 section 3.2).
 *
 * @param deviceCode              the device verification code
 * @param userCode                the end-user verification code
 * @param verificationUri         where the user enters the user code
 * @param verificationUriComplete verification URI with the user code embedded
 * @param expiresIn               lifetime of both codes in seconds
 * @param interval                minimum polling interval in seconds
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeviceAuthorizationResponse(
    @JsonProperty("device_code") String deviceCode,
    @JsonProperty("user_code") String userCode,
    @JsonProperty("verification_uri") String verificationUri,
    @JsonProperty("verification_uri_complete") String verificationUriComplete,
    @JsonProperty("expires_in") int expiresIn,
    @JsonProperty("interval") int interval) {

  /**
   * Polling interval used when the server does not specify one.
   */
  public static final int DEFAULT_INTERVAL = 5;
}
