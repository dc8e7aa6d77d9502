package com.codeheadsystems.oluso.server.store;

import com.codeheadsystems.oluso.server.policy.JourneyPolicy;
import com.codeheadsystems.oluso.server.policy.JourneyPolicyMatchContext;
import com.codeheadsystems.oluso.server.policy.JourneyType;
import java.util.List;
import java.util.Optional;

/**
 * Storage and selection of journey policies.
 */
public interface JourneyPolicyStore {

  Optional<JourneyPolicy> getById(String policyId);

  /**
   * The enabled policy of a type with the highest priority, ignoring conditions.
   *
   * @param type the journey type
   * @return the policy
   */
  Optional<JourneyPolicy> getByType(JourneyType type);

  /**
   * Policies visible to a tenant: its own plus the global ones, by descending priority.
   *
   * @param tenantId the tenant, null for global policies only
   * @return the policies
   */
  List<JourneyPolicy> getByTenant(String tenantId);

  /**
   * Selects the policy for a journey. Candidates are the enabled policies of the context's tenant
   * and the global ones, ordered by descending priority and then tenant-specific before global.
   * The first candidate of the wanted type whose conditions all hold is returned.
   *
   * @param context the match context
   * @return the policy, empty when none matches; callers supply their own default
   */
  Optional<JourneyPolicy> findMatching(JourneyPolicyMatchContext context);

  void save(JourneyPolicy policy);

  void delete(String policyId);
}
