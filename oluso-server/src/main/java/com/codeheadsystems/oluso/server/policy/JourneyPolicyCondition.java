package com.codeheadsystems.oluso.server.policy;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A precondition for selecting a policy, e.g. {@code acr_values contains mfa}.
 *
 * @param type     what to test: {@code client_id}, {@code tenant_id}, {@code acr_values},
 *                 {@code scope}, or the name of an additional request parameter
 * @param operator the operator name, see {@link PolicyConditionOperator}
 * @param value    the value to compare with
 */
public record JourneyPolicyCondition(@JsonProperty("type") String type,
                                     @JsonProperty("operator") String operator,
                                     @JsonProperty("value") String value) {

  public boolean matches(JourneyPolicyMatchContext context) {
    return PolicyConditionOperator.fromName(operator).test(context.valueOf(type), value);
  }
}
