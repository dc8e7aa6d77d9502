package com.codeheadsystems.oluso.server.journey.condition;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * What conditions are evaluated against.
 *
 * @param journeyData the journey data bag
 * @param userId      the current user, may be null
 * @param tenantId    the tenant, may be null
 * @param clientId    the client, may be null
 * @param claims      user claims, may be empty
 */
public record ConditionEvaluationContext(Map<String, Object> journeyData,
                                         String userId,
                                         String tenantId,
                                         String clientId,
                                         Map<String, String> claims) {

  public ConditionEvaluationContext {
    journeyData = journeyData == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(journeyData));
    claims = claims == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(claims));
  }
}
