package com.codeheadsystems.oluso.server.journey;

import com.codeheadsystems.oluso.server.journey.condition.ConditionEvaluationContext;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Everything a step handler can see while it runs. Journey data is live: writes are visible to
 * later steps.
 */
public class StepExecutionContext {

  /** Journey data key holding the user's claims as a map. */
  public static final String CLAIMS_KEY = "claims";

  private static final ObjectMapper MAPPER = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private final String journeyId;
  private final String stepId;
  private final String tenantId;
  private final String clientId;
  private final Map<String, Object> configuration;
  private final Map<String, Object> journeyData;
  private final Map<String, String> input;
  private String userId;

  public StepExecutionContext(String journeyId,
                              String stepId,
                              String tenantId,
                              String clientId,
                              String userId,
                              Map<String, Object> configuration,
                              Map<String, Object> journeyData,
                              Map<String, String> input) {
    this.journeyId = journeyId;
    this.stepId = stepId;
    this.tenantId = tenantId;
    this.clientId = clientId;
    this.userId = userId;
    this.configuration = configuration == null ? Map.of() : configuration;
    this.journeyData = journeyData;
    this.input = input == null ? Map.of() : Map.copyOf(input);
  }

  public String journeyId() {
    return journeyId;
  }

  public String stepId() {
    return stepId;
  }

  public String tenantId() {
    return tenantId;
  }

  public String clientId() {
    return clientId;
  }

  public String userId() {
    return userId;
  }

  public void userId(String value) {
    this.userId = value;
  }

  public Map<String, Object> journeyData() {
    return journeyData;
  }

  public Map<String, String> input() {
    return input;
  }

  public Map<String, Object> configuration() {
    return configuration;
  }

  public Optional<Object> setting(String key) {
    return Optional.ofNullable(configuration.get(key));
  }

  public Optional<String> stringSetting(String key) {
    return setting(key).map(Object::toString);
  }

  /**
   * Reads a structured setting, converting maps and lists loaded from policy JSON into typed
   * configuration objects.
   *
   * @param key  the setting name
   * @param type the target type
   * @param <T>  the target type
   * @return the converted setting, empty when absent
   * @throws IllegalArgumentException when the setting does not have the expected shape
   */
  public <T> Optional<T> setting(String key, TypeReference<T> type) {
    return setting(key).map(raw -> MAPPER.convertValue(raw, type));
  }

  /**
   * Snapshot of this context for condition evaluation.
   *
   * @return the condition context
   */
  public ConditionEvaluationContext conditionContext() {
    Map<String, String> claims = new HashMap<>();
    if (journeyData.get(CLAIMS_KEY) instanceof Map<?, ?> raw) {
      raw.forEach((k, v) -> {
        if (k != null && v != null) {
          claims.put(k.toString(), v.toString());
        }
      });
    }
    return new ConditionEvaluationContext(journeyData, userId, tenantId, clientId, claims);
  }
}
