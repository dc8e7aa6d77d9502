package com.codeheadsystems.oluso.server.grant;

import com.codeheadsystems.oluso.model.OidcConstants.Errors;
import com.codeheadsystems.oluso.model.OidcConstants.GrantTypes;
import com.codeheadsystems.oluso.server.ciba.CibaRequest;
import com.codeheadsystems.oluso.server.ciba.CibaRequestStatus;
import com.codeheadsystems.oluso.server.request.TokenRequest;
import com.codeheadsystems.oluso.server.request.ValidatedClient;
import com.codeheadsystems.oluso.server.store.CibaStore;
import java.time.Clock;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The CIBA grant (poll mode). An approved request moves to {@link CibaRequestStatus#CONSUMED}
 * through the store's compare-and-swap, so concurrent polls redeem it at most once.
 */
@Singleton
public class CibaGrantHandler implements GrantHandler {

  private static final Logger log = LoggerFactory.getLogger(CibaGrantHandler.class);

  private final CibaStore cibaStore;
  private final Clock clock;

  @Inject
  public CibaGrantHandler(CibaStore cibaStore) {
    this(cibaStore, Clock.systemUTC());
  }

  public CibaGrantHandler(CibaStore cibaStore, Clock clock) {
    this.cibaStore = cibaStore;
    this.clock = clock;
  }

  @Override
  public String grantType() {
    return GrantTypes.CIBA;
  }

  @Override
  public GrantResult handle(TokenRequest request, ValidatedClient client) {
    if (!client.cibaEnabled()) {
      return GrantResult.failure(Errors.UNAUTHORIZED_CLIENT, "Client is not authorized for CIBA");
    }
    if (request.authReqId() == null || request.authReqId().isBlank()) {
      return GrantResult.failure(Errors.INVALID_REQUEST, "auth_req_id is required");
    }
    Optional<CibaRequest> found = cibaStore.getByAuthReqId(request.authReqId());
    if (found.isEmpty()) {
      return GrantResult.failure(Errors.EXPIRED_TOKEN, "The auth_req_id has expired");
    }
    CibaRequest ciba = found.get();
    if (!ciba.clientId().equals(client.clientId())) {
      log.warn("auth_req_id of {} presented by {}", ciba.clientId(), client.clientId());
      return GrantResult.failure(Errors.INVALID_GRANT, "auth_req_id was issued to different client");
    }
    if (ciba.status() == CibaRequestStatus.EXPIRED
        || (ciba.status() == CibaRequestStatus.PENDING && ciba.isExpired(clock.instant()))) {
      return GrantResult.failure(Errors.EXPIRED_TOKEN, "The auth_req_id has expired");
    }
    switch (ciba.status()) {
      case PENDING:
        return GrantResult.failure(Errors.AUTHORIZATION_PENDING, "The user has not yet been authenticated");
      case DENIED:
        return GrantResult.failure(Errors.ACCESS_DENIED,
            ciba.errorDescription() == null ? "The user denied the request" : ciba.errorDescription());
      case APPROVED:
        if (!cibaStore.transition(ciba, ciba.withStatus(CibaRequestStatus.CONSUMED))) {
          return GrantResult.failure(Errors.INVALID_GRANT, "auth_req_id already used");
        }
        log.debug("CIBA request redeemed for client {}", client.clientId());
        return new GrantResult(ciba.subjectId(), ciba.sessionId(), ciba.scopes(), null, null,
            ciba.completedAt(), null, ciba.acrValues(), null, null, false, null);
      default:
        return GrantResult.failure(Errors.INVALID_GRANT, "auth_req_id already used");
    }
  }
}
