package com.codeheadsystems.oluso.server.manager;

import com.codeheadsystems.oluso.model.OidcConstants.Errors;
import com.codeheadsystems.oluso.model.OidcConstants.GrantTypes;
import com.codeheadsystems.oluso.model.device.DeviceAuthorizationResponse;
import com.codeheadsystems.oluso.server.config.OlusoServerConfig;
import com.codeheadsystems.oluso.server.request.Scopes;
import com.codeheadsystems.oluso.server.request.ValidatedClient;
import com.codeheadsystems.oluso.server.store.DeviceCodeData;
import com.codeheadsystems.oluso.server.store.DeviceCodeStatus;
import com.codeheadsystems.oluso.server.store.DeviceCodeStore;
import com.codeheadsystems.oluso.server.validation.ScopeValidator;
import com.codeheadsystems.oluso.server.validation.ValidationResult;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Device authorization grant (RFC 8628): issues device and user codes and records the user's
 * decision.
 * <p>
 * User codes are eight characters from an alphabet without vowels or look-alike characters and
 * are shown as {@code XXXX-XXXX}. Lookups ignore case, separators and whitespace.
 */
@Singleton
public class DeviceAuthorizationManager {

  public static final String USER_CODE_ALPHABET = "BCDFGHJKLMNPQRSTVWXZ";
  public static final int USER_CODE_LENGTH = 8;

  private static final Logger log = LoggerFactory.getLogger(DeviceAuthorizationManager.class);
  private static final Base64.Encoder B64URL = Base64.getUrlEncoder().withoutPadding();
  private static final int MAX_USER_CODE_ATTEMPTS = 10;

  private final DeviceCodeStore deviceCodeStore;
  private final ScopeValidator scopeValidator;
  private final OlusoServerConfig config;
  private final Clock clock;
  private final SecureRandom random = new SecureRandom();

  @Inject
  public DeviceAuthorizationManager(DeviceCodeStore deviceCodeStore,
                                    ScopeValidator scopeValidator,
                                    OlusoServerConfig config) {
    this(deviceCodeStore, scopeValidator, config, Clock.systemUTC());
  }

  public DeviceAuthorizationManager(DeviceCodeStore deviceCodeStore,
                                    ScopeValidator scopeValidator,
                                    OlusoServerConfig config,
                                    Clock clock) {
    this.deviceCodeStore = deviceCodeStore;
    this.scopeValidator = scopeValidator;
    this.config = config;
    this.clock = clock;
    log.info("DeviceAuthorizationManager()");
  }

  /**
   * Starts a device authorization for an authenticated client.
   *
   * @param client the client
   * @param scope  requested scopes, space separated, may be null
   * @return the result
   */
  public DeviceAuthorizationResult authorize(ValidatedClient client, String scope) {
    if (!client.allowedGrantTypes().contains(GrantTypes.DEVICE_CODE)) {
      return DeviceAuthorizationResult.failure(Errors.UNAUTHORIZED_CLIENT, "Client may not use the device flow");
    }
    Set<String> scopes = Scopes.parse(scope);
    ValidationResult scopeResult = scopeValidator.validate(scopes, client);
    if (!scopeResult.isValid()) {
      return new DeviceAuthorizationResult(null, scopeResult.error());
    }
    Optional<String> userCode = uniqueUserCode();
    if (userCode.isEmpty()) {
      log.warn("Could not allocate a unique user code for client {}", client.clientId());
      return DeviceAuthorizationResult.failure(Errors.SERVER_ERROR, "Could not allocate a user code");
    }
    Instant now = clock.instant();
    String deviceCode = randomHandle();
    int lifetime = config.deviceCodeLifetimeSeconds();
    int interval = config.deviceCodeInterval() > 0 ? config.deviceCodeInterval() : DeviceAuthorizationResponse.DEFAULT_INTERVAL;
    deviceCodeStore.store(new DeviceCodeData(deviceCode, userCode.get(), client.clientId(), client.tenantId(),
        Scopes.join(scopes), DeviceCodeStatus.PENDING, null, null, now, now.plusSeconds(lifetime), interval, null));

    String display = formatUserCode(userCode.get());
    String verificationUri = config.verificationUri();
    String complete = verificationUri + "?user_code=" + URLEncoder.encode(display, StandardCharsets.UTF_8);
    log.debug("Issued device code for client {}", client.clientId());
    return DeviceAuthorizationResult.success(
        new DeviceAuthorizationResponse(deviceCode, display, verificationUri, complete, lifetime, interval));
  }

  /**
   * The pending authorization for a user code, for showing the user what they approve.
   *
   * @param userCode the code as typed by the user
   * @return the pending authorization, empty when unknown, decided or expired
   */
  public Optional<DeviceCodeData> findPending(String userCode) {
    return deviceCodeStore.findByUserCode(normalizeUserCode(userCode))
        .filter(d -> d.status() == DeviceCodeStatus.PENDING)
        .filter(d -> !d.isExpired(clock.instant()));
  }

  /**
   * Approves a pending authorization.
   *
   * @param userCode  the code as typed by the user
   * @param subjectId the approving user
   * @param sessionId the user's session
   * @return true when the authorization was pending and is now approved
   */
  public boolean approve(String userCode, String subjectId, String sessionId) {
    return decide(userCode, DeviceCodeStatus.APPROVED, subjectId, sessionId);
  }

  public boolean deny(String userCode) {
    return decide(userCode, DeviceCodeStatus.DENIED, null, null);
  }

  private boolean decide(String userCode, DeviceCodeStatus status, String subjectId, String sessionId) {
    Optional<DeviceCodeData> pending = findPending(userCode);
    if (pending.isEmpty()) {
      return false;
    }
    boolean updated = deviceCodeStore.replace(pending.get(), pending.get().withStatus(status, subjectId, sessionId));
    log.debug("Device authorization for client {} {}: {}", pending.get().clientId(), status, updated);
    return updated;
  }

  /**
   * Normalizes a user-entered code: upper case, without separators or whitespace.
   *
   * @param userCode the entered code
   * @return the normalized code
   */
  public static String normalizeUserCode(String userCode) {
    if (userCode == null) {
      return null;
    }
    return userCode.replaceAll("[\\s-]", "").toUpperCase(Locale.ROOT);
  }

  static String formatUserCode(String userCode) {
    int half = userCode.length() / 2;
    return userCode.substring(0, half) + "-" + userCode.substring(half);
  }

  private Optional<String> uniqueUserCode() {
    for (int attempt = 0; attempt < MAX_USER_CODE_ATTEMPTS; attempt++) {
      StringBuilder code = new StringBuilder(USER_CODE_LENGTH);
      for (int i = 0; i < USER_CODE_LENGTH; i++) {
        code.append(USER_CODE_ALPHABET.charAt(random.nextInt(USER_CODE_ALPHABET.length())));
      }
      if (deviceCodeStore.findByUserCode(code.toString()).isEmpty()) {
        return Optional.of(code.toString());
      }
    }
    return Optional.empty();
  }

  private String randomHandle() {
    byte[] bytes = new byte[32];
    random.nextBytes(bytes);
    return B64URL.encodeToString(bytes);
  }
}
