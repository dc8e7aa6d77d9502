package com.codeheadsystems.oluso.server.manager;

import com.codeheadsystems.oluso.server.protocol.ProtocolContext;
import com.codeheadsystems.oluso.server.protocol.ProtocolError;
import com.codeheadsystems.oluso.server.request.AuthorizeRequest;
import com.codeheadsystems.oluso.server.request.ValidatedClient;

/**
 * A validated authorize request ready for user interaction, or the reason it was rejected.
 *
 * @param request the effective request, the pushed one when a {@code request_uri} was redeemed
 * @param client  the client, null when unknown
 * @param context the protocol context, null on failure
 * @param error   the failure, null on success
 */
public record AuthorizationResult(AuthorizeRequest request,
                                  ValidatedClient client,
                                  ProtocolContext context,
                                  ProtocolError error) {

  public static AuthorizationResult success(AuthorizeRequest request, ValidatedClient client,
                                            ProtocolContext context) {
    return new AuthorizationResult(request, client, context, null);
  }

  public static AuthorizationResult failure(AuthorizeRequest request, ValidatedClient client, ProtocolError error) {
    return new AuthorizationResult(request, client, null, error);
  }

  public boolean isSuccess() {
    return error == null;
  }
}
