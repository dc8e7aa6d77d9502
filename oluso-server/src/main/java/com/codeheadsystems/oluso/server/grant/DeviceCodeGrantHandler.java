package com.codeheadsystems.oluso.server.grant;

import com.codeheadsystems.oluso.model.OidcConstants.Errors;
import com.codeheadsystems.oluso.model.OidcConstants.GrantTypes;
import com.codeheadsystems.oluso.server.request.TokenRequest;
import com.codeheadsystems.oluso.server.request.ValidatedClient;
import com.codeheadsystems.oluso.server.store.DeviceCodeData;
import com.codeheadsystems.oluso.server.store.DeviceCodeStatus;
import com.codeheadsystems.oluso.server.store.DeviceCodeStore;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The device code grant (RFC 8628 section 3.4). Polling faster than the advertised interval
 * yields {@code slow_down}; an approved code is consumed exactly once.
 */
@Singleton
public class DeviceCodeGrantHandler implements GrantHandler {

  private static final Logger log = LoggerFactory.getLogger(DeviceCodeGrantHandler.class);

  private final DeviceCodeStore deviceCodeStore;
  private final Clock clock;

  @Inject
  public DeviceCodeGrantHandler(DeviceCodeStore deviceCodeStore) {
    this(deviceCodeStore, Clock.systemUTC());
  }

  public DeviceCodeGrantHandler(DeviceCodeStore deviceCodeStore, Clock clock) {
    this.deviceCodeStore = deviceCodeStore;
    this.clock = clock;
  }

  @Override
  public String grantType() {
    return GrantTypes.DEVICE_CODE;
  }

  @Override
  public GrantResult handle(TokenRequest request, ValidatedClient client) {
    if (request.deviceCode() == null || request.deviceCode().isBlank()) {
      return GrantResult.failure(Errors.INVALID_REQUEST, "device_code is required");
    }
    Optional<DeviceCodeData> found = deviceCodeStore.findByDeviceCode(request.deviceCode());
    if (found.isEmpty()) {
      return GrantResult.failure(Errors.INVALID_GRANT, "Invalid device code");
    }
    DeviceCodeData data = found.get();
    if (!data.clientId().equals(client.clientId())) {
      return GrantResult.failure(Errors.INVALID_GRANT, "Device code was issued to different client");
    }
    Instant now = clock.instant();
    if (data.isExpired(now)) {
      deviceCodeStore.remove(data.deviceCode());
      return GrantResult.failure(Errors.EXPIRED_TOKEN, "The device code has expired");
    }
    switch (data.status()) {
      case PENDING:
        return pending(data, now);
      case DENIED:
        deviceCodeStore.remove(data.deviceCode());
        return GrantResult.failure(Errors.ACCESS_DENIED, "The user denied the request");
      case APPROVED:
        if (!deviceCodeStore.replace(data, data.withStatus(DeviceCodeStatus.CONSUMED, data.subjectId(),
            data.sessionId()))) {
          return GrantResult.failure(Errors.INVALID_GRANT, "Device code already used");
        }
        log.debug("Device code redeemed for client {}", client.clientId());
        return GrantResult.of(data.subjectId(), data.sessionId(), data.scopes());
      default:
        return GrantResult.failure(Errors.INVALID_GRANT, "Device code already used");
    }
  }

  private GrantResult pending(DeviceCodeData data, Instant now) {
    boolean tooFast = data.lastPolledAt() != null
        && now.isBefore(data.lastPolledAt().plusSeconds(data.interval()));
    deviceCodeStore.replace(data, data.polledAt(now));
    if (tooFast) {
      return GrantResult.failure(Errors.SLOW_DOWN, "Polling too frequently");
    }
    return GrantResult.failure(Errors.AUTHORIZATION_PENDING, "The user has not yet completed authorization");
  }
}
