package com.codeheadsystems.oluso.server.request;

import java.util.Locale;

/**
 * Token endpoint client authentication methods.
 */
public enum ClientAuthenticationMethod {
  CLIENT_SECRET_BASIC("client_secret_basic"),
  CLIENT_SECRET_POST("client_secret_post"),
  PRIVATE_KEY_JWT("private_key_jwt"),
  NONE("none");

  private final String value;

  ClientAuthenticationMethod(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static ClientAuthenticationMethod fromValue(String value) {
    String normalized = value == null ? "" : value.toLowerCase(Locale.ROOT);
    for (ClientAuthenticationMethod method : values()) {
      if (method.value.equals(normalized)) {
        return method;
      }
    }
    throw new IllegalArgumentException("Unknown client authentication method: " + value);
  }
}
