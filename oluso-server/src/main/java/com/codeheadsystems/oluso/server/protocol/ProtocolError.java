package com.codeheadsystems.oluso.server.protocol;

import com.codeheadsystems.oluso.model.token.TokenErrorResponse;

/**
 * A protocol-level failure returned to the client. Never carries exception text.
 *
 * @param error                error code from {@link com.codeheadsystems.oluso.model.OidcConstants.Errors}
 * @param description          human readable description
 * @param uri                  optional documentation link
 * @param redirectUriValidated whether the redirect uri was validated before the failure, i.e.
 *                             whether the error may be sent back through the user agent
 */
public record ProtocolError(String error, String description, String uri, boolean redirectUriValidated) {

  public static ProtocolError of(String error, String description) {
    return new ProtocolError(error, description, null, false);
  }

  /**
   * Marks this error as safe to deliver through the validated redirect uri.
   *
   * @return the protocol error
   */
  public ProtocolError withRedirectUriValidated() {
    return new ProtocolError(error, description, uri, true);
  }

  public TokenErrorResponse toResponse() {
    return new TokenErrorResponse(error, description, uri);
  }
}
