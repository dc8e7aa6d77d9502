package com.codeheadsystems.oluso.server.journey.condition;

import com.codeheadsystems.oluso.server.journey.StepExecutionContext;
import com.codeheadsystems.oluso.server.journey.StepHandler;
import com.codeheadsystems.oluso.server.journey.StepHandlerResult;
import com.fasterxml.jackson.core.type.TypeReference;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The {@code condition} step: evaluates its conditions and branches on the outcome.
 * <p>
 * Settings: {@code conditions} (list of {@link StepCondition}), {@code combineWith}
 * ({@code and} or {@code or}; when absent each condition's own logical operator chains them),
 * {@code onTrue} and {@code onFalse} (branch names).
 */
@Singleton
public class ConditionStepHandler implements StepHandler {

  public static final String STEP_TYPE = "condition";
  public static final String RESULT_KEY = "condition_result";

  private static final Logger log = LoggerFactory.getLogger(ConditionStepHandler.class);
  private static final TypeReference<List<StepCondition>> CONDITIONS = new TypeReference<>() {
  };

  private final ConditionEvaluator evaluator;

  @Inject
  public ConditionStepHandler(ConditionEvaluator evaluator) {
    this.evaluator = evaluator;
  }

  @Override
  public String stepType() {
    return STEP_TYPE;
  }

  @Override
  public StepHandlerResult execute(StepExecutionContext context) {
    List<StepCondition> conditions = context.setting("conditions", CONDITIONS).orElse(List.of());
    if (conditions.isEmpty()) {
      log.debug("Condition step {} has no conditions, skipping", context.stepId());
      return StepHandlerResult.skip();
    }
    ConditionEvaluationContext conditionContext = context.conditionContext();
    boolean result = combine(conditions, context.stringSetting("combineWith"), conditionContext);
    log.debug("Condition step {} evaluated {}", context.stepId(), result);
    if (result) {
      return context.stringSetting("onTrue")
          .map(StepHandlerResult::branch)
          .orElseGet(() -> StepHandlerResult.success(Map.of(RESULT_KEY, "true")));
    }
    return context.stringSetting("onFalse")
        .map(StepHandlerResult::branch)
        .orElseGet(StepHandlerResult::skip);
  }

  private boolean combine(List<StepCondition> conditions,
                          Optional<String> combineWith,
                          ConditionEvaluationContext conditionContext) {
    if (combineWith.isEmpty()) {
      return evaluator.evaluate(conditions, conditionContext);
    }
    if (StepCondition.OR.equalsIgnoreCase(combineWith.get())) {
      return conditions.stream().anyMatch(c -> evaluator.evaluate(c, conditionContext));
    }
    return conditions.stream().allMatch(c -> evaluator.evaluate(c, conditionContext));
  }
}
