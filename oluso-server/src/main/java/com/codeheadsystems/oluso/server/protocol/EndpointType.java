package com.codeheadsystems.oluso.server.protocol;

/**
 * The protocol endpoints a request can be dispatched to.
 */
public enum EndpointType {
  AUTHORIZE,
  TOKEN,
  METADATA,
  USER_INFO,
  LOGOUT,
  INTROSPECTION,
  REVOCATION,
  DEVICE_AUTHORIZATION,
  PUSHED_AUTHORIZATION,
  BACKCHANNEL_AUTHENTICATION
}
