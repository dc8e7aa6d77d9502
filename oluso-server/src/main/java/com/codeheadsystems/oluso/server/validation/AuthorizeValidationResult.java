package com.codeheadsystems.oluso.server.validation;

import com.codeheadsystems.oluso.server.protocol.ProtocolError;
import com.codeheadsystems.oluso.server.request.AuthorizeRequest;
import com.codeheadsystems.oluso.server.request.ValidatedClient;

/**
 * Outcome of validating an authorize request.
 *
 * @param request the validated request
 * @param client  the client, null when it could not be resolved
 * @param error   the failure, null when valid
 */
public record AuthorizeValidationResult(AuthorizeRequest request, ValidatedClient client, ProtocolError error) {

  public static AuthorizeValidationResult success(AuthorizeRequest request, ValidatedClient client) {
    return new AuthorizeValidationResult(request, client, null);
  }

  public static AuthorizeValidationResult failure(AuthorizeRequest request, ValidatedClient client,
                                                  ProtocolError error) {
    return new AuthorizeValidationResult(request, client, error);
  }

  public boolean isValid() {
    return error == null;
  }
}
