package com.codeheadsystems.oluso.model.token;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Pushed authorization request response (RFC 9126).
 *
 * @param requestUri reference the client passes to the authorize endpoint
 * @param expiresIn  lifetime of the reference in seconds
 */
public record PushedAuthorizationResponse(
    @JsonProperty("request_uri") String requestUri,
    @JsonProperty("expires_in") int expiresIn) {
}
