package com.codeheadsystems.oluso.server.request;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Scope string helpers.
 */
public final class Scopes {

  private Scopes() {
  }

  /**
   * Splits a space separated scope parameter, keeping first-seen order and dropping duplicates.
   *
   * @param scope the scope parameter, may be null
   * @return the scopes
   */
  public static Set<String> parse(String scope) {
    if (scope == null || scope.isBlank()) {
      return Set.of();
    }
    Set<String> result = new LinkedHashSet<>();
    Arrays.stream(scope.trim().split("\\s+")).forEach(result::add);
    return Collections.unmodifiableSet(result);
  }

  public static String join(Iterable<String> scopes) {
    return String.join(" ", scopes);
  }
}
