package com.codeheadsystems.oluso.server.protocol;

import java.util.Locale;
import java.util.Optional;

/**
 * How the interactive part of a flow is rendered.
 */
public enum UiMode {
  /** Policy-driven journey UI. */
  JOURNEY("journey"),
  /** Classic standalone login pages. */
  STANDALONE("standalone"),
  /** No server UI, the client drives the steps through the API. */
  HEADLESS("headless");

  private final String value;

  UiMode(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /**
   * Parses the {@code ui_mode} request parameter.
   *
   * @param value the raw parameter, may be null
   * @return the mode, empty when absent or not recognised
   */
  public static Optional<UiMode> parse(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (UiMode mode : values()) {
      if (mode.value.equals(normalized)) {
        return Optional.of(mode);
      }
    }
    return Optional.empty();
  }
}
