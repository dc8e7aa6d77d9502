package com.codeheadsystems.oluso.server.journey.transform;

import java.util.Locale;

/**
 * The kinds of transform a {@link TransformRule} can apply. Names that match no known kind map to
 * {@link #UNKNOWN}, which passes the input through unchanged so that policies written for newer
 * servers still run.
 */
public enum TransformType {
  COPY("copy"),
  CONSTANT("constant"),
  UPPERCASE("uppercase"),
  LOWERCASE("lowercase"),
  TRIM("trim"),
  HASH("hash"),
  PREFIX("prefix"),
  SUFFIX("suffix"),
  REPLACE("replace"),
  REGEX_REPLACE("regex_replace"),
  REGEX_MATCH("regex_match"),
  SUBSTRING("substring"),
  SPLIT("split"),
  COMBINE("combine"),
  TEMPLATE("template"),
  MAP("map"),
  CONDITIONAL("conditional"),
  BASE64_ENCODE("base64encode"),
  BASE64_DECODE("base64decode"),
  URL_ENCODE("urlencode"),
  URL_DECODE("urldecode"),
  UNKNOWN("unknown");

  private final String value;

  TransformType(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /**
   * Whether this kind produces a value without reading the rule's input.
   *
   * @return true for constant, combine and template
   */
  public boolean ignoresInput() {
    return this == CONSTANT || this == COMBINE || this == TEMPLATE;
  }

  /**
   * Case-insensitive lookup. A missing name means {@link #COPY}.
   *
   * @param name the configured name
   * @return the type, {@link #UNKNOWN} when not recognised
   */
  public static TransformType fromValue(String name) {
    if (name == null || name.isBlank()) {
      return COPY;
    }
    String normalized = name.trim().toLowerCase(Locale.ROOT);
    for (TransformType type : values()) {
      if (type != UNKNOWN && type.value.equals(normalized)) {
        return type;
      }
    }
    return UNKNOWN;
  }
}
