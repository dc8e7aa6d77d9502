package com.codeheadsystems.oluso.server.journey.condition;

import java.util.List;

/**
 * Evaluates {@link StepCondition}s.
 */
public interface ConditionEvaluator {

  /**
   * Evaluates a list of conditions left to right. Each condition's {@code logicalOperator} says
   * how the next one combines with the result so far. An empty list is true.
   *
   * @param conditions the conditions
   * @param context    the evaluation context
   * @return the combined result
   */
  boolean evaluate(List<StepCondition> conditions, ConditionEvaluationContext context);

  /**
   * Evaluates one condition, honoring its {@code negate} flag.
   *
   * @param condition the condition
   * @param context   the evaluation context
   * @return the result
   */
  boolean evaluate(StepCondition condition, ConditionEvaluationContext context);
}
