package com.codeheadsystems.oluso.server.request;

import java.util.Locale;

/**
 * How CIBA tokens reach the client.
 */
public enum CibaTokenDeliveryMode {
  POLL,
  PING,
  PUSH;

  /**
   * Parses a configured delivery mode. Anything other than {@code ping} or {@code push} is poll.
   *
   * @param value the configured value
   * @return the delivery mode
   */
  public static CibaTokenDeliveryMode parse(String value) {
    if (value == null) {
      return POLL;
    }
    switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "ping":
        return PING;
      case "push":
        return PUSH;
      default:
        return POLL;
    }
  }
}
