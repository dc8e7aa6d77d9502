package com.codeheadsystems.oluso.server.policy;

import java.util.Locale;
import java.util.Set;

/**
 * Operators available to {@link JourneyPolicyCondition}s. Unrecognized operator names map to
 * {@link #UNKNOWN}, which never matches.
 */
public enum PolicyConditionOperator {
  EQUALS(Set.of("eq", "equals")),
  NOT_EQUALS(Set.of("ne", "not_equals", "notequals")),
  CONTAINS(Set.of("contains")),
  STARTS_WITH(Set.of("starts_with", "startswith")),
  ENDS_WITH(Set.of("ends_with", "endswith")),
  EXISTS(Set.of("exists")),
  NOT_EXISTS(Set.of("not_exists", "notexists")),
  UNKNOWN(Set.of());

  private final Set<String> names;

  PolicyConditionOperator(Set<String> names) {
    this.names = names;
  }

  public static PolicyConditionOperator fromName(String name) {
    if (name == null) {
      return UNKNOWN;
    }
    String normalized = name.toLowerCase(Locale.ROOT);
    for (PolicyConditionOperator operator : values()) {
      if (operator.names.contains(normalized)) {
        return operator;
      }
    }
    return UNKNOWN;
  }

  /**
   * Applies the operator.
   *
   * @param actual   the value taken from the match context, may be null
   * @param expected the configured value
   * @return whether the condition holds
   */
  public boolean test(String actual, String expected) {
    switch (this) {
      case EQUALS:
        return actual != null && actual.equals(expected);
      case NOT_EQUALS:
        return actual == null || !actual.equals(expected);
      case CONTAINS:
        return actual != null && expected != null && actual.contains(expected);
      case STARTS_WITH:
        return actual != null && expected != null && actual.startsWith(expected);
      case ENDS_WITH:
        return actual != null && expected != null && actual.endsWith(expected);
      case EXISTS:
        return actual != null && !actual.isEmpty();
      case NOT_EXISTS:
        return actual == null || actual.isEmpty();
      default:
        return false;
    }
  }
}
