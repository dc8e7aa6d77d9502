package com.codeheadsystems.oluso.server.ciba;

import com.codeheadsystems.oluso.server.request.CibaTokenDeliveryMode;
import com.codeheadsystems.oluso.server.request.Scopes;
import java.time.Instant;
import java.util.Set;

/**
 * One backchannel authentication attempt. Immutable; state changes produce copies that the
 * {@link com.codeheadsystems.oluso.server.store.CibaStore} swaps in.
 *
 * @param authReqId               the unguessable request handle
 * @param clientId                the requesting client
 * @param subjectId               the user resolved from the hint
 * @param tenantId                the tenant, may be null
 * @param loginHint               the login_hint as sent, may be null
 * @param bindingMessage          message shown on both devices, may be null
 * @param userCode                user code supplied by the client, may be null
 * @param requestedScopes         space separated scopes
 * @param acrValues               requested acr values, may be null
 * @param status                  current status
 * @param createdAt               creation time
 * @param expiresAt               expiry time
 * @param interval                polling interval in seconds
 * @param completedAt             approval or denial time
 * @param sessionId               session bound on approval
 * @param error                   error code on denial
 * @param errorDescription        error description on denial
 * @param clientNotificationToken bearer token for ping and push callbacks
 * @param tokenDeliveryMode       poll, ping or push
 */
public record CibaRequest(String authReqId,
                          String clientId,
                          String subjectId,
                          String tenantId,
                          String loginHint,
                          String bindingMessage,
                          String userCode,
                          String requestedScopes,
                          String acrValues,
                          CibaRequestStatus status,
                          Instant createdAt,
                          Instant expiresAt,
                          int interval,
                          Instant completedAt,
                          String sessionId,
                          String error,
                          String errorDescription,
                          String clientNotificationToken,
                          CibaTokenDeliveryMode tokenDeliveryMode) {

  public Set<String> scopes() {
    return Scopes.parse(requestedScopes);
  }

  public boolean isExpired(Instant now) {
    return expiresAt.isBefore(now);
  }

  public CibaRequest approved(Instant now, String boundSessionId) {
    return new CibaRequest(authReqId, clientId, subjectId, tenantId, loginHint, bindingMessage, userCode,
        requestedScopes, acrValues, CibaRequestStatus.APPROVED, createdAt, expiresAt, interval, now,
        boundSessionId, null, null, clientNotificationToken, tokenDeliveryMode);
  }

  public CibaRequest denied(Instant now, String errorCode, String description) {
    return new CibaRequest(authReqId, clientId, subjectId, tenantId, loginHint, bindingMessage, userCode,
        requestedScopes, acrValues, CibaRequestStatus.DENIED, createdAt, expiresAt, interval, now,
        sessionId, errorCode, description, clientNotificationToken, tokenDeliveryMode);
  }

  public CibaRequest withStatus(CibaRequestStatus newStatus) {
    return new CibaRequest(authReqId, clientId, subjectId, tenantId, loginHint, bindingMessage, userCode,
        requestedScopes, acrValues, newStatus, createdAt, expiresAt, interval, completedAt,
        sessionId, error, errorDescription, clientNotificationToken, tokenDeliveryMode);
  }
}
