package com.codeheadsystems.oluso.server.journey;

import com.codeheadsystems.oluso.server.config.OlusoServerConfig;
import com.codeheadsystems.oluso.server.event.EventSink;
import com.codeheadsystems.oluso.server.event.OlusoEvent;
import com.codeheadsystems.oluso.server.journey.condition.ConditionEvaluator;
import com.codeheadsystems.oluso.server.policy.JourneyPolicy;
import com.codeheadsystems.oluso.server.policy.JourneyPolicyMatchContext;
import com.codeheadsystems.oluso.server.policy.JourneyPolicyStep;
import com.codeheadsystems.oluso.server.protocol.ProtocolError;
import com.codeheadsystems.oluso.server.store.JourneyPolicyStore;
import com.codeheadsystems.oluso.server.store.JourneyStateStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs journeys: starts them from a policy, advances through steps until one needs the user,
 * and resumes them when input arrives.
 * <p>
 * Steps run in configured order unless a step names its successor ({@code onSuccess}), a
 * branch target, or a failure step ({@code onFailure}). A journey completes when a step
 * completes it or when no step is left. Journey state is removed on completion; failed,
 * cancelled and expired journeys stay until the expiry sweep.
 */
@Singleton
public class JourneyOrchestrator {

  /** Upper bound on steps executed in one advance, guards against cyclic step graphs. */
  public static final int MAX_STEPS_PER_ADVANCE = 100;

  public static final String LAST_ERROR_KEY = "lastError";
  public static final String LAST_ERROR_DESCRIPTION_KEY = "lastErrorDescription";
  public static final String FAILED_STEP_KEY = "failedStepId";

  private static final Logger log = LoggerFactory.getLogger(JourneyOrchestrator.class);

  private final JourneyPolicyStore policyStore;
  private final JourneyStateStore stateStore;
  private final StepHandlerRegistry handlers;
  private final ConditionEvaluator conditionEvaluator;
  private final EventSink eventSink;
  private final OlusoServerConfig config;
  private final Clock clock;

  @Inject
  public JourneyOrchestrator(JourneyPolicyStore policyStore,
                             JourneyStateStore stateStore,
                             StepHandlerRegistry handlers,
                             ConditionEvaluator conditionEvaluator,
                             EventSink eventSink,
                             OlusoServerConfig config) {
    this(policyStore, stateStore, handlers, conditionEvaluator, eventSink, config, Clock.systemUTC());
  }

  public JourneyOrchestrator(JourneyPolicyStore policyStore,
                             JourneyStateStore stateStore,
                             StepHandlerRegistry handlers,
                             ConditionEvaluator conditionEvaluator,
                             EventSink eventSink,
                             OlusoServerConfig config,
                             Clock clock) {
    this.policyStore = policyStore;
    this.stateStore = stateStore;
    this.handlers = handlers;
    this.conditionEvaluator = conditionEvaluator;
    this.eventSink = eventSink;
    this.config = config;
    this.clock = clock;
    log.info("JourneyOrchestrator()");
  }

  /**
   * Starts a journey with the best matching policy.
   *
   * @param context       what the policy is matched against
   * @param correlationId the protocol correlation id, may be null
   * @param initialData   data to seed the journey with
   * @return the result
   */
  public JourneyResult start(JourneyPolicyMatchContext context,
                             String correlationId,
                             Map<String, Object> initialData) {
    Optional<JourneyPolicy> policy = policyStore.findMatching(context);
    if (policy.isEmpty()) {
      log.warn("No journey policy of type {} for tenant {}", context.type(), context.tenantId());
      return JourneyResult.rejected(null, JourneyResult.POLICY_NOT_FOUND, "No journey policy matches the request");
    }
    return start(policy.get(), context.clientId(), correlationId, initialData);
  }

  /**
   * Starts a journey with the given policy and runs it until a step needs the user.
   *
   * @param policy        the policy
   * @param clientId      the client the journey runs for
   * @param correlationId the protocol correlation id, may be null
   * @param initialData   data to seed the journey with
   * @return the result
   */
  public JourneyResult start(JourneyPolicy policy,
                             String clientId,
                             String correlationId,
                             Map<String, Object> initialData) {
    Optional<JourneyPolicyStep> first = policy.firstStep();
    if (first.isEmpty()) {
      return JourneyResult.rejected(null, JourneyResult.STEP_NOT_FOUND, "Journey policy has no steps");
    }
    Instant now = clock.instant();
    int minutes = policy.maxJourneyDurationMinutes() > 0
        ? policy.maxJourneyDurationMinutes()
        : config.journeyLifetimeMinutes();
    JourneyState state = new JourneyState(UUID.randomUUID().toString(), policy.tenantId(), clientId,
        policy.id(), correlationId, now, now.plus(Duration.ofMinutes(minutes)));
    if (initialData != null) {
      initialData.forEach((k, v) -> {
        if (v != null) {
          state.journeyData().put(k, v);
        }
      });
    }
    state.currentStepId(first.get().id());
    log.debug("Starting journey {} with policy {}", state.journeyId(), policy.id());
    return advance(state, policy, Map.of());
  }

  /**
   * Resumes a journey that is waiting for input.
   *
   * @param journeyId the journey
   * @param input     the user's input for the waiting step
   * @return the result
   */
  public JourneyResult resume(String journeyId, Map<String, String> input) {
    Optional<JourneyState> found = stateStore.get(journeyId);
    if (found.isEmpty()) {
      return JourneyResult.rejected(journeyId, JourneyResult.JOURNEY_NOT_FOUND, "Unknown journey");
    }
    JourneyState state = found.get();
    Instant now = clock.instant();
    if (state.status() == JourneyStatus.IN_PROGRESS && state.isExpired(now)) {
      state.status(JourneyStatus.EXPIRED);
      state.touch(now);
      stateStore.save(state);
      log.debug("Journey {} expired", journeyId);
      return JourneyResult.rejected(journeyId, JourneyResult.JOURNEY_EXPIRED, "The journey has expired");
    }
    if (state.status() != JourneyStatus.IN_PROGRESS) {
      return JourneyResult.rejected(journeyId, JourneyResult.JOURNEY_NOT_ACTIVE, "The journey is not active");
    }
    Optional<JourneyPolicy> policy = policyStore.getById(state.policyId());
    if (policy.isEmpty()) {
      return fail(state, ProtocolError.of(JourneyResult.POLICY_NOT_FOUND, "The journey policy no longer exists"));
    }
    return advance(state, policy.get(), input == null ? Map.of() : input);
  }

  /**
   * Cancels a running journey.
   *
   * @param journeyId the journey
   * @return true when the journey was running
   */
  public boolean cancel(String journeyId) {
    Optional<JourneyState> found = stateStore.get(journeyId);
    if (found.isEmpty() || found.get().status() != JourneyStatus.IN_PROGRESS) {
      return false;
    }
    JourneyState state = found.get();
    state.status(JourneyStatus.CANCELLED);
    state.touch(clock.instant());
    stateStore.save(state);
    log.debug("Journey {} cancelled", journeyId);
    return true;
  }

  public Optional<JourneyState> get(String journeyId) {
    return stateStore.get(journeyId);
  }

  public int cleanupExpired() {
    return stateStore.cleanupExpired(clock.instant());
  }

  private JourneyResult advance(JourneyState state, JourneyPolicy policy, Map<String, String> input) {
    Map<String, String> pendingInput = input;
    String stepId = state.currentStepId();
    for (int executed = 0; executed < MAX_STEPS_PER_ADVANCE; executed++) {
      if (stepId == null) {
        return complete(state);
      }
      Optional<JourneyPolicyStep> found = policy.step(stepId);
      if (found.isEmpty()) {
        return fail(state, ProtocolError.of(JourneyResult.STEP_NOT_FOUND, "Step " + stepId + " does not exist"));
      }
      JourneyPolicyStep step = found.get();
      state.currentStepId(step.id());
      state.touch(clock.instant());

      StepExecutionContext context = new StepExecutionContext(state.journeyId(), step.id(), state.tenantId(),
          state.clientId(), state.userId(), step.configuration(), state.journeyData(), pendingInput);
      pendingInput = Map.of();

      if (step.skipIfCompleted() && state.completedSteps().contains(step.id())) {
        log.debug("Journey {} skipping completed step {}", state.journeyId(), step.id());
        stepId = successor(policy, step);
        continue;
      }
      if (!step.conditions().isEmpty()
          && !conditionEvaluator.evaluate(step.conditions(), context.conditionContext())) {
        log.debug("Journey {} skipping step {}, conditions not met", state.journeyId(), step.id());
        stepId = successor(policy, step);
        continue;
      }

      StepHandlerResult result = execute(step, context);
      state.userId(context.userId());
      result.outputData().forEach((k, v) -> state.journeyData().put(k, v));

      switch (result.outcome()) {
        case CONTINUE:
          state.markCompleted(step.id());
          stepId = result.nextStepId() != null ? result.nextStepId() : successor(policy, step);
          break;
        case SKIP:
          stepId = successor(policy, step);
          break;
        case BRANCH: {
          String target = result.branchName() == null ? null : step.branches().get(result.branchName());
          if (target == null) {
            return fail(state, ProtocolError.of(JourneyResult.BRANCH_STEP_NOT_FOUND,
                "Step " + step.id() + " has no branch " + result.branchName()));
          }
          state.markCompleted(step.id());
          stepId = target;
          break;
        }
        case REQUIRE_INPUT:
          stateStore.save(state);
          return JourneyResult.awaitingInput(state, result.viewName());
        case REDIRECT:
          stateStore.save(state);
          return JourneyResult.redirect(state, result.redirectUrl());
        case COMPLETE:
          state.markCompleted(step.id());
          return complete(state);
        case FAILED:
        default: {
          ProtocolError error = result.error() == null
              ? ProtocolError.of(JourneyResult.STEP_FAILED, "Step failed")
              : result.error();
          if (step.onFailure() == null) {
            return fail(state, error);
          }
          log.debug("Journey {} step {} failed with {}, continuing at {}",
              state.journeyId(), step.id(), error.error(), step.onFailure());
          state.journeyData().put(LAST_ERROR_KEY, error.error());
          state.journeyData().put(LAST_ERROR_DESCRIPTION_KEY, error.description() == null ? "" : error.description());
          state.journeyData().put(FAILED_STEP_KEY, step.id());
          stepId = step.onFailure();
          break;
        }
      }
    }
    log.warn("Journey {} exceeded {} steps in one advance", state.journeyId(), MAX_STEPS_PER_ADVANCE);
    return fail(state, ProtocolError.of(JourneyResult.STEP_LIMIT_EXCEEDED, "Too many steps without user input"));
  }

  private StepHandlerResult execute(JourneyPolicyStep step, StepExecutionContext context) {
    List<String> missing = step.requiredClaims().stream()
        .filter(claim -> context.journeyData().get(claim) == null)
        .collect(Collectors.toList());
    if (!missing.isEmpty()) {
      return StepHandlerResult.fail(JourneyResult.MISSING_CLAIMS, "Missing required data: " + String.join(", ", missing));
    }
    Optional<StepHandler> handler = handlers.handlerFor(step.type());
    if (handler.isEmpty()) {
      log.warn("No step handler for type {} (step {})", step.type(), step.id());
      return StepHandlerResult.fail(JourneyResult.HANDLER_NOT_FOUND, "No handler for step type " + step.type());
    }
    return handler.get().execute(context);
  }

  private static String successor(JourneyPolicy policy, JourneyPolicyStep step) {
    if (step.onSuccess() != null) {
      return step.onSuccess();
    }
    return policy.stepAfter(step.id()).map(JourneyPolicyStep::id).orElse(null);
  }

  private JourneyResult complete(JourneyState state) {
    state.status(JourneyStatus.COMPLETED);
    state.touch(clock.instant());
    stateStore.delete(state.journeyId());
    publish(state, true);
    log.debug("Journey {} completed", state.journeyId());
    return JourneyResult.finished(state, null);
  }

  private JourneyResult fail(JourneyState state, ProtocolError error) {
    state.status(JourneyStatus.FAILED);
    state.touch(clock.instant());
    stateStore.save(state);
    publish(state, false);
    log.debug("Journey {} failed: {}", state.journeyId(), error.error());
    return JourneyResult.finished(state, error);
  }

  private void publish(JourneyState state, boolean succeeded) {
    eventSink.publish(new OlusoEvent.JourneyCompleted(clock.instant(), state.tenantId(), state.clientId(),
        state.journeyId(), state.policyId(), state.userId(), succeeded));
  }
}
