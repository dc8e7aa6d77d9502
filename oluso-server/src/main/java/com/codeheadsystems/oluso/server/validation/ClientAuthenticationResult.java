package com.codeheadsystems.oluso.server.validation;

import com.codeheadsystems.oluso.server.protocol.ProtocolError;
import com.codeheadsystems.oluso.server.request.ClientAuthenticationMethod;
import com.codeheadsystems.oluso.server.request.ValidatedClient;

/**
 * Outcome of token endpoint client authentication.
 *
 * @param client the authenticated client, null on failure
 * @param method the method the client used, null on failure
 * @param error  the failure, null on success
 */
public record ClientAuthenticationResult(ValidatedClient client, ClientAuthenticationMethod method,
                                         ProtocolError error) {

  public static ClientAuthenticationResult success(ValidatedClient client, ClientAuthenticationMethod method) {
    return new ClientAuthenticationResult(client, method, null);
  }

  public static ClientAuthenticationResult failure(String error, String description) {
    return new ClientAuthenticationResult(null, null, ProtocolError.of(error, description));
  }

  public boolean isAuthenticated() {
    return error == null;
  }
}
