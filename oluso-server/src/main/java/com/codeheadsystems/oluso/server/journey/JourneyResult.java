package com.codeheadsystems.oluso.server.journey;

import com.codeheadsystems.oluso.server.protocol.ProtocolError;
import java.util.HashMap;
import java.util.Map;

/**
 * Where a journey stands after the orchestrator advanced it as far as it could.
 *
 * @param journeyId     the journey, null when none could be started
 * @param status        the journey status
 * @param currentStepId the step waiting for input or the last step that ran
 * @param viewName      view to render while waiting for input
 * @param redirectUrl   where to send the user agent, for redirects
 * @param journeyData   snapshot of the collected data
 * @param error         the failure, when the journey failed or could not run
 */
public record JourneyResult(String journeyId,
                            JourneyStatus status,
                            String currentStepId,
                            String viewName,
                            String redirectUrl,
                            Map<String, Object> journeyData,
                            ProtocolError error) {

  public static final String JOURNEY_NOT_FOUND = "journey_not_found";
  public static final String JOURNEY_EXPIRED = "journey_expired";
  public static final String JOURNEY_NOT_ACTIVE = "journey_not_active";
  public static final String POLICY_NOT_FOUND = "journey_policy_not_found";
  public static final String STEP_NOT_FOUND = "step_not_found";
  public static final String HANDLER_NOT_FOUND = "handler_not_found";
  public static final String BRANCH_STEP_NOT_FOUND = "branch_step_not_found";
  public static final String MISSING_CLAIMS = "missing_claims";
  public static final String STEP_FAILED = "step_failed";
  public static final String STEP_LIMIT_EXCEEDED = "step_limit_exceeded";

  public JourneyResult {
    journeyData = journeyData == null ? Map.of() : Map.copyOf(journeyData);
  }

  static JourneyResult awaitingInput(JourneyState state, String viewName) {
    return new JourneyResult(state.journeyId(), state.status(), state.currentStepId(), viewName, null,
        snapshot(state), null);
  }

  static JourneyResult redirect(JourneyState state, String url) {
    return new JourneyResult(state.journeyId(), state.status(), state.currentStepId(), null, url,
        snapshot(state), null);
  }

  static JourneyResult finished(JourneyState state, ProtocolError error) {
    return new JourneyResult(state.journeyId(), state.status(), state.currentStepId(), null, null,
        snapshot(state), error);
  }

  static JourneyResult rejected(String journeyId, String error, String description) {
    return new JourneyResult(journeyId, null, null, null, null, Map.of(), ProtocolError.of(error, description));
  }

  public boolean isCompleted() {
    return status == JourneyStatus.COMPLETED;
  }

  public boolean isAwaitingInput() {
    return status == JourneyStatus.IN_PROGRESS && redirectUrl == null && error == null;
  }

  public boolean isSuccess() {
    return error == null;
  }

  private static Map<String, Object> snapshot(JourneyState state) {
    Map<String, Object> copy = new HashMap<>();
    state.journeyData().forEach((k, v) -> {
      if (v != null) {
        copy.put(k, v);
      }
    });
    return copy;
  }
}
