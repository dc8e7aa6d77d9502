package com.codeheadsystems.oluso.server.journey;

/**
 * What the orchestrator does after a step ran.
 */
public enum StepOutcome {
  /** Move on to the next step. */
  CONTINUE,
  /** Pause until the user submits input. */
  REQUIRE_INPUT,
  /** Jump to a named branch of the step. */
  BRANCH,
  /** Finish the journey successfully. */
  COMPLETE,
  /** The step failed. */
  FAILED,
  /** The step did not apply. */
  SKIP,
  /** Send the user agent elsewhere. */
  REDIRECT
}
