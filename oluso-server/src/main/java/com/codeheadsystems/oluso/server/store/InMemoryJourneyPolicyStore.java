package com.codeheadsystems.oluso.server.store;

import com.codeheadsystems.oluso.server.policy.JourneyPolicy;
import com.codeheadsystems.oluso.server.policy.JourneyPolicyMatchContext;
import com.codeheadsystems.oluso.server.policy.JourneyPolicyStep;
import com.codeheadsystems.oluso.server.policy.JourneyType;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link JourneyPolicyStore}, seeded with the global default policies.
 */
public class InMemoryJourneyPolicyStore implements JourneyPolicyStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryJourneyPolicyStore.class);

  private static final Comparator<JourneyPolicy> BY_PRIORITY =
      Comparator.comparingInt(JourneyPolicy::priority).reversed();
  private static final Comparator<JourneyPolicy> TENANT_FIRST =
      Comparator.comparing(policy -> policy.tenantId() == null);

  private final ConcurrentHashMap<String, JourneyPolicy> policies = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemoryJourneyPolicyStore() {
    this(Clock.systemUTC(), true);
  }

  public InMemoryJourneyPolicyStore(Clock clock, boolean seedDefaults) {
    log.warn("Using InMemoryJourneyPolicyStore - policy changes will NOT survive restarts.");
    this.clock = clock;
    if (seedDefaults) {
      defaultPolicies().forEach(policy -> policies.put(policy.id(), policy));
    }
  }

  @Override
  public Optional<JourneyPolicy> getById(String policyId) {
    if (policyId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(policies.get(policyId));
  }

  @Override
  public Optional<JourneyPolicy> getByType(JourneyType type) {
    return policies.values().stream()
        .filter(JourneyPolicy::enabled)
        .filter(policy -> policy.type() == type)
        .min(BY_PRIORITY);
  }

  @Override
  public List<JourneyPolicy> getByTenant(String tenantId) {
    return policies.values().stream()
        .filter(policy -> policy.tenantId() == null || policy.tenantId().equals(tenantId))
        .sorted(BY_PRIORITY.thenComparing(TENANT_FIRST))
        .collect(Collectors.toList());
  }

  @Override
  public Optional<JourneyPolicy> findMatching(JourneyPolicyMatchContext context) {
    List<JourneyPolicy> candidates = policies.values().stream()
        .filter(JourneyPolicy::enabled)
        .filter(policy -> policy.tenantId() == null || Objects.equals(policy.tenantId(), context.tenantId()))
        .sorted(BY_PRIORITY.thenComparing(TENANT_FIRST))
        .collect(Collectors.toList());
    for (JourneyPolicy policy : candidates) {
      if (policy.type() == context.type()
          && policy.conditions().stream().allMatch(condition -> condition.matches(context))) {
        log.debug("Matched policy {} for type {} tenant {}", policy.id(), context.type(), context.tenantId());
        return Optional.of(policy);
      }
    }
    log.debug("No policy matches type {} tenant {}", context.type(), context.tenantId());
    return Optional.empty();
  }

  @Override
  public void save(JourneyPolicy policy) {
    policies.put(policy.id(), policy.withUpdatedAt(clock.instant()));
  }

  @Override
  public void delete(String policyId) {
    policies.remove(policyId);
  }

  static List<JourneyPolicy> defaultPolicies() {
    JourneyPolicyStep consent = JourneyPolicyStep.builder("consent", "consent")
        .withDisplayName("Consent").withOrder(3).build();
    return List.of(
        JourneyPolicy.builder("signin", JourneyType.SIGN_IN)
            .withName("Sign In")
            .withDescription("Default sign-in policy with optional MFA")
            .withPriority(100)
            .withStep(JourneyPolicyStep.builder("login", "local_login").withDisplayName("Sign In").withOrder(1)
                .withSetting("allowRememberMe", true).withSetting("allowSelfRegistration", false).build())
            .withStep(JourneyPolicyStep.builder("mfa", "mfa").withDisplayName("Multi-Factor Authentication")
                .withOrder(2).withOptional(true).withSetting("required", false)
                .withSetting("methods", List.of("totp", "phone")).build())
            .withStep(consent)
            .build(),
        JourneyPolicy.builder("signin-mfa", JourneyType.SIGN_IN)
            .withName("Sign In with MFA")
            .withDescription("Sign-in requiring multi-factor authentication")
            .withPriority(110)
            .withCondition("acr_values", "contains", "mfa")
            .withStep(JourneyPolicyStep.builder("login", "local_login").withDisplayName("Sign In").withOrder(1).build())
            .withStep(JourneyPolicyStep.builder("mfa", "mfa").withDisplayName("Multi-Factor Authentication")
                .withOrder(2).withSetting("required", true).build())
            .withStep(consent)
            .build(),
        JourneyPolicy.builder("signup", JourneyType.SIGN_UP)
            .withName("Sign Up")
            .withDescription("Self-registration flow")
            .withPriority(95)
            .withStep(JourneyPolicyStep.builder("create_user", "create_user").withDisplayName("Create Account")
                .withOrder(1).build())
            .withStep(JourneyPolicyStep.builder("consent", "consent").withDisplayName("Consent").withOrder(2).build())
            .build(),
        JourneyPolicy.builder("signup-signin", JourneyType.SIGN_IN_SIGN_UP)
            .withName("Sign Up or Sign In")
            .withDescription("Combined sign-up and sign-in flow")
            .withPriority(90)
            .withStep(JourneyPolicyStep.builder("login", "local_login").withDisplayName("Sign In or Sign Up")
                .withOrder(1).withSetting("allowRememberMe", true).withSetting("allowSelfRegistration", true)
                .withBranch("signup", "create_user").build())
            .withStep(JourneyPolicyStep.builder("create_user", "create_user").withDisplayName("Create Account")
                .withOrder(2).withOptional(true).build())
            .withStep(consent)
            .build(),
        JourneyPolicy.builder("password-reset", JourneyType.PASSWORD_RESET)
            .withName("Password Reset")
            .withDescription("Self-service password reset")
            .withPriority(100)
            .withStep(JourneyPolicyStep.builder("reset", "password_reset").withDisplayName("Reset Password")
                .withOrder(1).build())
            .build(),
        JourneyPolicy.builder("profile-edit", JourneyType.PROFILE_EDIT)
            .withName("Edit Profile")
            .withDescription("Update user profile information")
            .withPriority(100)
            .withStep(JourneyPolicyStep.builder("update", "update_user").withDisplayName("Update Profile")
                .withOrder(1).build())
            .build());
  }
}
