package com.codeheadsystems.oluso.server.policy;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * The request attributes a policy is matched against.
 *
 * @param tenantId             the tenant, null for global
 * @param clientId             the client
 * @param type                 the journey type wanted
 * @param scopes               requested scopes
 * @param acrValues            requested acr values, space separated
 * @param additionalParameters any other request parameters conditions may test
 */
public record JourneyPolicyMatchContext(String tenantId,
                                        String clientId,
                                        JourneyType type,
                                        Set<String> scopes,
                                        String acrValues,
                                        Map<String, String> additionalParameters) {

  public JourneyPolicyMatchContext {
    if (type == null) {
      throw new IllegalArgumentException("type is required");
    }
    scopes = scopes == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(scopes));
    additionalParameters = additionalParameters == null ? Map.of() : Map.copyOf(additionalParameters);
  }

  public static JourneyPolicyMatchContext of(String tenantId, String clientId, JourneyType type) {
    return new JourneyPolicyMatchContext(tenantId, clientId, type, null, null, null);
  }

  /**
   * Value of a condition source.
   *
   * @param conditionType the condition type, case-insensitive, {@code _} optional
   * @return the value, null when absent
   */
  public String valueOf(String conditionType) {
    if (conditionType == null) {
      return null;
    }
    switch (conditionType.toLowerCase(Locale.ROOT).replace("_", "")) {
      case "clientid":
        return clientId;
      case "tenantid":
        return tenantId;
      case "acrvalue":
      case "acrvalues":
        return acrValues;
      case "scope":
      case "scopes":
        return scopes.isEmpty() ? null : String.join(" ", scopes);
      default:
        return additionalParameters.get(conditionType);
    }
  }
}
