package com.codeheadsystems.oluso.server.journey.condition;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One condition over journey state.
 *
 * @param type            where the field comes from: {@code data}, {@code claim}, {@code context}
 *                        or {@code path} (dot-separated path into nested journey data)
 * @param field           the field name or path
 * @param operator        the operator name, see {@link ConditionOperator}
 * @param value           the comparison value, may be null
 * @param logicalOperator how the next condition combines with the result so far, {@code and}
 *                        or {@code or}
 * @param negate          invert this condition's own result
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StepCondition(@JsonProperty("type") String type,
                            @JsonProperty("field") String field,
                            @JsonProperty("operator") String operator,
                            @JsonProperty("value") String value,
                            @JsonProperty("logicalOperator") String logicalOperator,
                            @JsonProperty("negate") boolean negate) {

  public static final String AND = "and";
  public static final String OR = "or";

  public StepCondition {
    if (logicalOperator == null || logicalOperator.isBlank()) {
      logicalOperator = AND;
    }
  }

  public static StepCondition of(String type, String field, String operator, String value) {
    return new StepCondition(type, field, operator, value, AND, false);
  }

  public StepCondition negated() {
    return new StepCondition(type, field, operator, value, logicalOperator, !negate);
  }

  public StepCondition thenOr() {
    return new StepCondition(type, field, operator, value, OR, negate);
  }
}
