package com.codeheadsystems.oluso.server.journey;

import com.codeheadsystems.oluso.server.protocol.ProtocolError;
import java.util.Map;

/**
 * Result of running one step.
 *
 * @param outcome     what happens next
 * @param nextStepId  explicit next step for {@link StepOutcome#CONTINUE}, may be null
 * @param branchName  branch to follow for {@link StepOutcome#BRANCH}
 * @param viewName    view to render for {@link StepOutcome#REQUIRE_INPUT}
 * @param redirectUrl target for {@link StepOutcome#REDIRECT}
 * @param outputData  values the step produced, merged into journey data
 * @param error       the failure for {@link StepOutcome#FAILED}
 */
public record StepHandlerResult(StepOutcome outcome,
                                String nextStepId,
                                String branchName,
                                String viewName,
                                String redirectUrl,
                                Map<String, Object> outputData,
                                ProtocolError error) {

  public StepHandlerResult {
    outputData = outputData == null ? Map.of() : Map.copyOf(outputData);
  }

  public static StepHandlerResult success() {
    return success(Map.of());
  }

  public static StepHandlerResult success(Map<String, Object> outputData) {
    return new StepHandlerResult(StepOutcome.CONTINUE, null, null, null, null, outputData, null);
  }

  public static StepHandlerResult continueTo(String stepId) {
    return new StepHandlerResult(StepOutcome.CONTINUE, stepId, null, null, null, Map.of(), null);
  }

  public static StepHandlerResult requireInput(String viewName) {
    return new StepHandlerResult(StepOutcome.REQUIRE_INPUT, null, null, viewName, null, Map.of(), null);
  }

  public static StepHandlerResult redirect(String url) {
    return new StepHandlerResult(StepOutcome.REDIRECT, null, null, null, url, Map.of(), null);
  }

  public static StepHandlerResult branch(String branchName) {
    return branch(branchName, Map.of());
  }

  public static StepHandlerResult branch(String branchName, Map<String, Object> outputData) {
    return new StepHandlerResult(StepOutcome.BRANCH, null, branchName, null, null, outputData, null);
  }

  public static StepHandlerResult skip() {
    return new StepHandlerResult(StepOutcome.SKIP, null, null, null, null, Map.of(), null);
  }

  public static StepHandlerResult complete() {
    return new StepHandlerResult(StepOutcome.COMPLETE, null, null, null, null, Map.of(), null);
  }

  public static StepHandlerResult fail(String error, String description) {
    return new StepHandlerResult(StepOutcome.FAILED, null, null, null, null, Map.of(),
        ProtocolError.of(error, description));
  }
}
