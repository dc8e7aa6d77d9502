package com.codeheadsystems.oluso.server.journey;

/**
 * Executes one kind of journey step.
 */
public interface StepHandler {

  /**
   * The step type this handler serves, matched case-insensitively against
   * {@link com.codeheadsystems.oluso.server.policy.JourneyPolicyStep#type()}.
   *
   * @return the step type
   */
  String stepType();

  /**
   * Runs the step. Protocol failures are returned, not thrown.
   *
   * @param context the execution context, journey data may be updated in place
   * @return the result
   */
  StepHandlerResult execute(StepExecutionContext context);
}
