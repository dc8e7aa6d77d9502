package com.codeheadsystems.oluso.server.ciba;

import com.codeheadsystems.oluso.model.OidcConstants.Errors;
import com.codeheadsystems.oluso.model.OidcConstants.Scopes;
import com.codeheadsystems.oluso.server.common.Result;
import com.codeheadsystems.oluso.server.event.EventSink;
import com.codeheadsystems.oluso.server.event.OlusoEvent;
import com.codeheadsystems.oluso.server.request.CibaTokenDeliveryMode;
import com.codeheadsystems.oluso.server.request.ValidatedClient;
import com.codeheadsystems.oluso.server.store.CibaStore;
import com.codeheadsystems.oluso.server.user.OlusoUser;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.Locale;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client-Initiated Backchannel Authentication (OpenID Connect CIBA Core 1.0).
 * <p>
 * Owns the request lifecycle: {@code PENDING} moves to {@code APPROVED}, {@code DENIED} or
 * {@code EXPIRED}; an approved request is consumed once by the token endpoint. Every state change
 * goes through {@link CibaStore#transition} so concurrent callers cannot both win.
 * <p>
 * Failures are returned as protocol errors, never thrown.
 */
@Singleton
public class CibaService {

  private static final Logger log = LoggerFactory.getLogger(CibaService.class);

  /**
   * Size of the random part of an auth_req_id, in bytes.
   */
  public static final int AUTH_REQ_ID_BYTES = 32;

  /**
   * Longest binding message accepted.
   */
  public static final int MAX_BINDING_MESSAGE_LENGTH = 256;

  private static final Base64.Encoder B64URL = Base64.getUrlEncoder().withoutPadding();

  private final CibaStore cibaStore;
  private final CibaHintResolver hintResolver;
  private final Optional<CibaUserNotificationService> notificationService;
  private final EventSink eventSink;
  private final Clock clock;
  private final SecureRandom random = new SecureRandom();

  @Inject
  public CibaService(CibaStore cibaStore,
                     CibaHintResolver hintResolver,
                     Optional<CibaUserNotificationService> notificationService,
                     EventSink eventSink) {
    this(cibaStore, hintResolver, notificationService, eventSink, Clock.systemUTC());
  }

  public CibaService(CibaStore cibaStore,
                     CibaHintResolver hintResolver,
                     Optional<CibaUserNotificationService> notificationService,
                     EventSink eventSink,
                     Clock clock) {
    this.cibaStore = cibaStore;
    this.hintResolver = hintResolver;
    this.notificationService = notificationService;
    this.eventSink = eventSink;
    this.clock = clock;
  }

  // ── Backchannel authentication endpoint ─────────────────────────────────

  /**
   * Accepts a backchannel authentication request.
   *
   * @param request the request parameters
   * @param client  the authenticated client
   * @return the auth_req_id with its lifetime and polling interval, or a protocol error
   */
  public CibaAuthenticationResult authenticate(CibaAuthenticationRequest request, ValidatedClient client) {
    log.debug("authenticate(client={})", client.clientId());
    if (!client.cibaEnabled()) {
      return CibaAuthenticationResult.failure(Errors.UNAUTHORIZED_CLIENT,
          "Client is not authorized to use backchannel authentication");
    }
    if (!request.hasAnyHint()) {
      return CibaAuthenticationResult.failure(Errors.INVALID_REQUEST,
          "One of login_hint, login_hint_token, or id_token_hint is required");
    }
    if (request.bindingMessage() != null && request.bindingMessage().length() > MAX_BINDING_MESSAGE_LENGTH) {
      return CibaAuthenticationResult.failure(Errors.INVALID_BINDING_MESSAGE, "binding_message is too long");
    }

    Result<OlusoUser, HintFailureReason> resolved = hintResolver.resolve(request, client);
    if (!resolved.isSuccess()) {
      log.info("CIBA hint for client {} not resolved: {}", client.clientId(), resolved.failure());
      return CibaAuthenticationResult.failure(Errors.UNKNOWN_USER_ID,
          "Unable to identify the user from the provided hint");
    }
    OlusoUser user = resolved.value();

    if (client.cibaRequireUserCode() && (request.userCode() == null || request.userCode().isEmpty())) {
      return CibaAuthenticationResult.failure(Errors.INVALID_REQUEST, "user_code is required");
    }

    CibaTokenDeliveryMode deliveryMode = client.cibaTokenDeliveryMode();
    if (deliveryMode != CibaTokenDeliveryMode.POLL) {
      if (client.cibaClientNotificationEndpoint() == null || client.cibaClientNotificationEndpoint().isEmpty()) {
        return CibaAuthenticationResult.failure(Errors.INVALID_REQUEST,
            "Client notification endpoint is required for ping/push mode");
      }
      if (request.clientNotificationToken() == null || request.clientNotificationToken().isEmpty()) {
        return CibaAuthenticationResult.failure(Errors.INVALID_REQUEST,
            "client_notification_token is required for ping/push mode");
      }
    }

    int expiresIn = effectiveExpiry(request.requestedExpiry(), client.cibaRequestLifetime());
    Instant now = clock.instant();
    String scope = request.scope() == null || request.scope().isBlank() ? Scopes.OPENID : request.scope();
    CibaRequest cibaRequest = new CibaRequest(
        generateAuthReqId(),
        client.clientId(),
        user.id(),
        client.tenantId(),
        request.loginHint(),
        request.bindingMessage(),
        request.userCode(),
        scope,
        request.acrValues(),
        CibaRequestStatus.PENDING,
        now,
        now.plusSeconds(expiresIn),
        client.cibaPollingInterval(),
        null,
        null,
        null,
        null,
        request.clientNotificationToken(),
        deliveryMode);
    cibaStore.storeRequest(cibaRequest);
    log.info("CIBA request created for client {} in {} mode, expires in {}s",
        client.clientId(), deliveryMode, expiresIn);

    notifyUser(cibaRequest);
    eventSink.publish(new OlusoEvent.CibaRequestCreated(now, client.tenantId(), client.clientId(), user.id(),
        deliveryMode.name().toLowerCase(Locale.ROOT)));
    return CibaAuthenticationResult.success(cibaRequest.authReqId(), expiresIn, cibaRequest.interval());
  }

  // ── Polling ─────────────────────────────────────────────────────────────

  /**
   * Current status of a request, as seen by the client that created it. Any request past its
   * expiry answers {@code expired_token}; a pending one is also moved to {@code EXPIRED}.
   *
   * @param authReqId the request handle
   * @param clientId  the polling client
   * @return the status snapshot
   */
  public CibaStatusResult getStatus(String authReqId, String clientId) {
    Optional<CibaRequest> found = cibaStore.getByAuthReqId(authReqId);
    if (found.isEmpty()) {
      return CibaStatusResult.failed(CibaRequestStatus.EXPIRED, Errors.EXPIRED_TOKEN,
          "The auth_req_id has expired or does not exist");
    }
    CibaRequest request = found.get();
    if (!request.clientId().equals(clientId)) {
      log.warn("Client {} polled a CIBA request issued to another client", clientId);
      return CibaStatusResult.failed(CibaRequestStatus.DENIED, Errors.ACCESS_DENIED,
          "The auth_req_id was not issued to this client");
    }
    if (request.isExpired(clock.instant())) {
      if (request.status() == CibaRequestStatus.PENDING) {
        cibaStore.transition(request, request.withStatus(CibaRequestStatus.EXPIRED));
      }
      return CibaStatusResult.failed(CibaRequestStatus.EXPIRED, Errors.EXPIRED_TOKEN,
          "The auth_req_id has expired");
    }
    return CibaStatusResult.of(request);
  }

  // ── User decision ───────────────────────────────────────────────────────

  /**
   * Records the user's approval. Only a pending, unexpired request for the same user moves.
   *
   * @param authReqId the request handle
   * @param subjectId the approving user
   * @param sessionId the user's session to bind
   * @return true if the request moved to approved
   */
  public boolean approveRequest(String authReqId, String subjectId, String sessionId) {
    Optional<CibaRequest> pending = findPending(authReqId);
    if (pending.isEmpty()) {
      log.warn("Cannot approve CIBA request: not found or not pending");
      return false;
    }
    CibaRequest request = pending.get();
    if (!request.subjectId().equals(subjectId)) {
      log.warn("Subject mismatch approving CIBA request for client {}", request.clientId());
      return false;
    }
    Instant now = clock.instant();
    if (!cibaStore.transition(request, request.approved(now, sessionId))) {
      return false;
    }
    log.info("CIBA request approved for client {}", request.clientId());
    eventSink.publish(new OlusoEvent.CibaRequestCompleted(now, request.tenantId(), request.clientId(),
        subjectId, true));
    return true;
  }

  /**
   * Records the user's denial.
   *
   * @param authReqId the request handle
   * @return true if the request moved to denied
   */
  public boolean denyRequest(String authReqId) {
    Optional<CibaRequest> pending = findPending(authReqId);
    if (pending.isEmpty()) {
      log.warn("Cannot deny CIBA request: not found or not pending");
      return false;
    }
    CibaRequest request = pending.get();
    Instant now = clock.instant();
    CibaRequest denied = request.denied(now, Errors.ACCESS_DENIED, "The user denied the authentication request");
    if (!cibaStore.transition(request, denied)) {
      return false;
    }
    log.info("CIBA request denied for client {}", request.clientId());
    eventSink.publish(new OlusoEvent.CibaRequestCompleted(now, request.tenantId(), request.clientId(),
        request.subjectId(), false));
    return true;
  }

  /**
   * Removes expired requests from the store.
   *
   * @return the number removed
   */
  public int cleanupExpired() {
    return cibaStore.removeExpiredRequests(clock.instant());
  }

  private Optional<CibaRequest> findPending(String authReqId) {
    return cibaStore.getByAuthReqId(authReqId)
        .filter(r -> r.status() == CibaRequestStatus.PENDING)
        .filter(r -> !r.isExpired(clock.instant()));
  }

  private void notifyUser(CibaRequest request) {
    if (notificationService.isEmpty()) {
      return;
    }
    try {
      notificationService.get().notifyUser(request);
    } catch (RuntimeException e) {
      log.warn("Failed to notify user of CIBA request for client {}: {}", request.clientId(), e.getMessage());
    }
  }

  static int effectiveExpiry(Integer requestedExpiry, int lifetime) {
    if (requestedExpiry == null || requestedExpiry <= 0) {
      return lifetime;
    }
    return Math.min(requestedExpiry, lifetime);
  }

  private String generateAuthReqId() {
    byte[] bytes = new byte[AUTH_REQ_ID_BYTES];
    random.nextBytes(bytes);
    return B64URL.encodeToString(bytes);
  }
}
