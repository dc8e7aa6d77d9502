package com.codeheadsystems.oluso.server.store;

import com.codeheadsystems.oluso.server.request.Scopes;
import java.time.Instant;
import java.util.Set;

/**
 * State of one device authorization (RFC 8628).
 *
 * @param deviceCode   the device code polled by the device
 * @param userCode     the code the user types in, normalized without separator
 * @param clientId     the client
 * @param tenantId     the tenant, may be null
 * @param scope        requested scopes, space separated
 * @param status       current status
 * @param subjectId    the user who approved, null until approval
 * @param sessionId    the session of the approving user
 * @param createdAt    issue time
 * @param expiresAt    expiry time
 * @param interval     minimum polling interval in seconds
 * @param lastPolledAt last token endpoint poll, null before the first poll
 */
public record DeviceCodeData(String deviceCode,
                             String userCode,
                             String clientId,
                             String tenantId,
                             String scope,
                             DeviceCodeStatus status,
                             String subjectId,
                             String sessionId,
                             Instant createdAt,
                             Instant expiresAt,
                             int interval,
                             Instant lastPolledAt) {

  public Set<String> scopes() {
    return Scopes.parse(scope);
  }

  public boolean isExpired(Instant now) {
    return expiresAt.isBefore(now);
  }

  public DeviceCodeData withStatus(DeviceCodeStatus newStatus, String subject, String session) {
    return new DeviceCodeData(deviceCode, userCode, clientId, tenantId, scope, newStatus, subject, session,
        createdAt, expiresAt, interval, lastPolledAt);
  }

  public DeviceCodeData polledAt(Instant now) {
    return new DeviceCodeData(deviceCode, userCode, clientId, tenantId, scope, status, subjectId, sessionId,
        createdAt, expiresAt, interval, now);
  }
}
