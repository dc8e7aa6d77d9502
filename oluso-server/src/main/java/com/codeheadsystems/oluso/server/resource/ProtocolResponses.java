package com.codeheadsystems.oluso.server.resource;

import com.codeheadsystems.oluso.model.OidcConstants.Errors;
import com.codeheadsystems.oluso.server.protocol.ProtocolError;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

/**
 * Builds protocol responses. Every response carries {@code Cache-Control: no-store}.
 */
final class ProtocolResponses {

  static final int BAD_REQUEST = 400;
  static final int UNAUTHORIZED = 401;
  static final String PRAGMA = "Pragma";
  static final String DPOP_NONCE_HEADER = "DPoP-Nonce";
  static final String TENANT_HEADER = "X-Oluso-Tenant";

  private ProtocolResponses() {
  }

  static Response ok(Object entity) {
    return noStore(Response.ok(entity, MediaType.APPLICATION_JSON_TYPE)).build();
  }

  static Response error(ProtocolError error, int status) {
    Response.ResponseBuilder builder = noStore(Response.status(status)
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(error.toResponse()));
    if (status == UNAUTHORIZED) {
      builder.header(HttpHeaders.WWW_AUTHENTICATE, "Basic realm=\"oluso\"");
    }
    return builder.build();
  }

  /**
   * Status for a protocol error: 401 for client authentication failures, 400 otherwise.
   *
   * @param error the error
   * @return the HTTP status
   */
  static int statusFor(ProtocolError error) {
    return Errors.INVALID_CLIENT.equals(error.error()) ? UNAUTHORIZED : BAD_REQUEST;
  }

  static Response repeated(String parameter) {
    return error(ProtocolError.of(Errors.INVALID_REQUEST, "Parameter " + parameter + " was repeated"), BAD_REQUEST);
  }

  private static Response.ResponseBuilder noStore(Response.ResponseBuilder builder) {
    return builder.header(HttpHeaders.CACHE_CONTROL, "no-store").header(PRAGMA, "no-cache");
  }
}
