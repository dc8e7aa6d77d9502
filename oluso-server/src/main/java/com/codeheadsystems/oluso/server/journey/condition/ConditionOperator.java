package com.codeheadsystems.oluso.server.journey.condition;

import java.util.Locale;
import java.util.Set;

/**
 * Operators a {@link StepCondition} may use, each with the names it accepts in configuration.
 */
public enum ConditionOperator {
  EQ("eq", "equals"),
  NE("ne", "not_equals"),
  GT("gt", "greater_than"),
  LT("lt", "less_than"),
  GTE("gte", "greater_than_or_equals"),
  LTE("lte", "less_than_or_equals"),
  CONTAINS("contains"),
  STARTS_WITH("starts_with"),
  ENDS_WITH("ends_with"),
  EXISTS("exists"),
  NOT_EXISTS("not_exists"),
  EMPTY("empty"),
  NOT_EMPTY("not_empty"),
  REGEX("regex", "matches"),
  IN("in"),
  NOT_IN("not_in"),
  TRUE("true"),
  FALSE("false"),
  /** Any name not listed above. Always evaluates to false. */
  UNKNOWN();

  private final Set<String> names;

  ConditionOperator(String... names) {
    this.names = Set.of(names);
  }

  public static ConditionOperator fromName(String name) {
    if (name == null) {
      return UNKNOWN;
    }
    String normalized = name.toLowerCase(Locale.ROOT);
    for (ConditionOperator operator : values()) {
      if (operator.names.contains(normalized)) {
        return operator;
      }
    }
    return UNKNOWN;
  }
}
