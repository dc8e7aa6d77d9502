package com.codeheadsystems.oluso.server.policy;

import com.codeheadsystems.oluso.server.journey.condition.StepCondition;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One step of a journey policy. Immutable configuration; never changed while a journey runs.
 *
 * @param id              unique within the policy
 * @param type            the step handler type, e.g. {@code transform}
 * @param displayName     label for UIs
 * @param optional        whether the step may be skipped by the user
 * @param order           position in the default sequence
 * @param configuration   handler settings
 * @param conditions      the step runs only when these hold, empty for always
 * @param onSuccess       explicit next step, null for the next in order
 * @param onFailure       step to go to on failure, null to fail the journey
 * @param branches        branch name to step id
 * @param skipIfCompleted skip when already completed earlier in the journey
 * @param requiredClaims  journey data keys that must be present before the step runs
 */
public record JourneyPolicyStep(String id,
                                String type,
                                String displayName,
                                boolean optional,
                                int order,
                                Map<String, Object> configuration,
                                List<StepCondition> conditions,
                                String onSuccess,
                                String onFailure,
                                Map<String, String> branches,
                                boolean skipIfCompleted,
                                List<String> requiredClaims) {

  public JourneyPolicyStep {
    if (id == null || type == null) {
      throw new IllegalArgumentException("A step needs an id and a type");
    }
    configuration = configuration == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(configuration));
    conditions = conditions == null ? List.of() : List.copyOf(conditions);
    branches = branches == null ? Map.of() : Map.copyOf(branches);
    requiredClaims = requiredClaims == null ? List.of() : List.copyOf(requiredClaims);
  }

  public static Builder builder(String id, String type) {
    return new Builder(id, type);
  }

  public static final class Builder {
    private final String id;
    private final String type;
    private String displayName;
    private boolean optional;
    private int order;
    private Map<String, Object> configuration = new LinkedHashMap<>();
    private List<StepCondition> conditions = List.of();
    private String onSuccess;
    private String onFailure;
    private Map<String, String> branches = new LinkedHashMap<>();
    private boolean skipIfCompleted;
    private List<String> requiredClaims = List.of();

    private Builder(String id, String type) {
      this.id = id;
      this.type = type;
    }

    public Builder withDisplayName(String value) {
      this.displayName = value;
      return this;
    }

    public Builder withOptional(boolean value) {
      this.optional = value;
      return this;
    }

    public Builder withOrder(int value) {
      this.order = value;
      return this;
    }

    public Builder withSetting(String key, Object value) {
      this.configuration.put(key, value);
      return this;
    }

    public Builder withConditions(StepCondition... values) {
      this.conditions = List.of(values);
      return this;
    }

    public Builder withOnSuccess(String value) {
      this.onSuccess = value;
      return this;
    }

    public Builder withOnFailure(String value) {
      this.onFailure = value;
      return this;
    }

    public Builder withBranch(String name, String stepId) {
      this.branches.put(name, stepId);
      return this;
    }

    public Builder withSkipIfCompleted(boolean value) {
      this.skipIfCompleted = value;
      return this;
    }

    public Builder withRequiredClaims(String... values) {
      this.requiredClaims = List.of(values);
      return this;
    }

    public JourneyPolicyStep build() {
      return new JourneyPolicyStep(id, type, displayName, optional, order, configuration, conditions, onSuccess,
          onFailure, branches, skipIfCompleted, requiredClaims);
    }
  }
}
