package com.codeheadsystems.oluso.server.policy;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * A configured journey: its steps, when it applies and how long it may run.
 *
 * @param id                        policy id
 * @param name                      display name
 * @param tenantId                  owning tenant, null for a global policy
 * @param type                      the journey type it serves
 * @param enabled                   disabled policies are never matched
 * @param priority                  higher wins when several policies match
 * @param description               free text
 * @param version                   configuration version
 * @param steps                     the steps
 * @param conditions                all must hold for the policy to match, empty for always
 * @param maxJourneyDurationMinutes lifetime of a journey started from this policy
 * @param requiresAuthentication    false for data collection journeys
 * @param createdAt                 creation time
 * @param updatedAt                 last update
 */
public record JourneyPolicy(String id,
                            String name,
                            String tenantId,
                            JourneyType type,
                            boolean enabled,
                            int priority,
                            String description,
                            int version,
                            List<JourneyPolicyStep> steps,
                            List<JourneyPolicyCondition> conditions,
                            int maxJourneyDurationMinutes,
                            boolean requiresAuthentication,
                            Instant createdAt,
                            Instant updatedAt) {

  public static final int DEFAULT_PRIORITY = 100;
  public static final int DEFAULT_MAX_DURATION_MINUTES = 30;

  public JourneyPolicy {
    if (id == null || type == null) {
      throw new IllegalArgumentException("A policy needs an id and a type");
    }
    steps = steps == null ? List.of() : List.copyOf(steps);
    conditions = conditions == null ? List.of() : List.copyOf(conditions);
  }

  public static Builder builder(String id, JourneyType type) {
    return new Builder(id, type);
  }

  /**
   * Steps in their configured order.
   *
   * @return the ordered steps
   */
  public List<JourneyPolicyStep> orderedSteps() {
    List<JourneyPolicyStep> ordered = new ArrayList<>(steps);
    ordered.sort(Comparator.comparingInt(JourneyPolicyStep::order));
    return ordered;
  }

  public Optional<JourneyPolicyStep> firstStep() {
    return orderedSteps().stream().findFirst();
  }

  public Optional<JourneyPolicyStep> step(String stepId) {
    return steps.stream().filter(s -> s.id().equals(stepId)).findFirst();
  }

  /**
   * The step after the given one in configured order.
   *
   * @param stepId the current step
   * @return the next step, empty at the end
   */
  public Optional<JourneyPolicyStep> stepAfter(String stepId) {
    List<JourneyPolicyStep> ordered = orderedSteps();
    for (int i = 0; i < ordered.size() - 1; i++) {
      if (ordered.get(i).id().equals(stepId)) {
        return Optional.of(ordered.get(i + 1));
      }
    }
    return Optional.empty();
  }

  public JourneyPolicy withUpdatedAt(Instant now) {
    return new JourneyPolicy(id, name, tenantId, type, enabled, priority, description, version, steps, conditions,
        maxJourneyDurationMinutes, requiresAuthentication, createdAt, now);
  }

  public static final class Builder {
    private final String id;
    private final JourneyType type;
    private String name;
    private String tenantId;
    private boolean enabled = true;
    private int priority = DEFAULT_PRIORITY;
    private String description;
    private int version = 1;
    private final List<JourneyPolicyStep> steps = new ArrayList<>();
    private final List<JourneyPolicyCondition> conditions = new ArrayList<>();
    private int maxJourneyDurationMinutes = DEFAULT_MAX_DURATION_MINUTES;
    private boolean requiresAuthentication = true;
    private Instant createdAt = Instant.now();

    private Builder(String id, JourneyType type) {
      this.id = id;
      this.type = type;
      this.name = id;
    }

    public Builder withName(String value) {
      this.name = value;
      return this;
    }

    public Builder withTenantId(String value) {
      this.tenantId = value;
      return this;
    }

    public Builder withEnabled(boolean value) {
      this.enabled = value;
      return this;
    }

    public Builder withPriority(int value) {
      this.priority = value;
      return this;
    }

    public Builder withDescription(String value) {
      this.description = value;
      return this;
    }

    public Builder withVersion(int value) {
      this.version = value;
      return this;
    }

    public Builder withStep(JourneyPolicyStep step) {
      this.steps.add(step);
      return this;
    }

    public Builder withCondition(String conditionType, String operator, String value) {
      this.conditions.add(new JourneyPolicyCondition(conditionType, operator, value));
      return this;
    }

    public Builder withMaxJourneyDurationMinutes(int value) {
      this.maxJourneyDurationMinutes = value;
      return this;
    }

    public Builder withRequiresAuthentication(boolean value) {
      this.requiresAuthentication = value;
      return this;
    }

    public Builder withCreatedAt(Instant value) {
      this.createdAt = value;
      return this;
    }

    public JourneyPolicy build() {
      return new JourneyPolicy(id, name, tenantId, type, enabled, priority, description, version, steps,
          conditions, maxJourneyDurationMinutes, requiresAuthentication, createdAt, createdAt);
    }
  }
}
