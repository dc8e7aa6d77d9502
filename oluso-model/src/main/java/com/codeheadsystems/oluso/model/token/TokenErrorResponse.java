package com.codeheadsystems.oluso.model.token;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Protocol error body (RFC 6749 section 5.2), shared by every endpoint.
 *
 * @param error            machine readable error code
 * @param errorDescription human readable description
 * @param errorUri         optional link to documentation
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TokenErrorResponse(
    @JsonProperty("error") String error,
    @JsonProperty("error_description") String errorDescription,
    @JsonProperty("error_uri") String errorUri) {

  public TokenErrorResponse(String error, String errorDescription) {
    this(error, errorDescription, null);
  }
}
