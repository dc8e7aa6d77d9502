package com.codeheadsystems.oluso.server.resource;

import jakarta.ws.rs.core.MultivaluedMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read access to a form-encoded protocol request. Parameters other than the repeatable ones must
 * appear at most once (RFC 6749 section 3.2).
 */
final class FormParameters {

  private static final Set<String> REPEATABLE = Set.of("resource", "audience");

  private final MultivaluedMap<String, String> form;

  FormParameters(MultivaluedMap<String, String> form) {
    this.form = form;
  }

  String get(String name) {
    List<String> values = form.get(name);
    if (values == null || values.isEmpty()) {
      return null;
    }
    String value = values.get(0);
    return value == null || value.isEmpty() ? null : value;
  }

  Integer getInt(String name) {
    String value = get(name);
    if (value == null) {
      return null;
    }
    try {
      return Integer.valueOf(value.trim());
    } catch (NumberFormatException e) {
      return null;
    }
  }

  List<String> all(String name) {
    List<String> values = form.get(name);
    return values == null ? List.of() : List.copyOf(values);
  }

  /**
   * The first non-repeatable parameter that was sent more than once.
   *
   * @return the parameter name, empty when none
   */
  Optional<String> repeatedParameter() {
    for (Map.Entry<String, List<String>> entry : form.entrySet()) {
      if (!REPEATABLE.contains(entry.getKey()) && entry.getValue() != null && entry.getValue().size() > 1) {
        return Optional.of(entry.getKey());
      }
    }
    return Optional.empty();
  }
}
