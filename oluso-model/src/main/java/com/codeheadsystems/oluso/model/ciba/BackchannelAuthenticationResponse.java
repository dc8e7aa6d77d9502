package com.codeheadsystems.oluso.model.ciba;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Successful backchannel authentication response (CIBA Core section 7.3).
 *
 * @param authReqId unique identifier of the authentication request
 * @param expiresIn lifetime of the request in seconds
 * @param interval  minimum polling interval in seconds
 */
public record BackchannelAuthenticationResponse(
    @JsonProperty("auth_req_id") String authReqId,
    @JsonProperty("expires_in") int expiresIn,
    @JsonProperty("interval") int interval) {
}
