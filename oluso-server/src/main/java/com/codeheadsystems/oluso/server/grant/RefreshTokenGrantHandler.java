package com.codeheadsystems.oluso.server.grant;

import com.codeheadsystems.oluso.model.OidcConstants.Errors;
import com.codeheadsystems.oluso.model.OidcConstants.GrantTypes;
import com.codeheadsystems.oluso.server.request.TokenRequest;
import com.codeheadsystems.oluso.server.request.ValidatedClient;
import com.codeheadsystems.oluso.server.store.RefreshTokenData;
import com.codeheadsystems.oluso.server.store.RefreshTokenStore;
import com.codeheadsystems.oluso.server.user.UserService;
import java.time.Clock;
import java.util.Optional;
import java.util.Set;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The {@code refresh_token} grant. Requested scopes may only narrow the original grant. Clients
 * that rotate refresh tokens spend the presented token; the new one is minted by the token service.
 */
@Singleton
public class RefreshTokenGrantHandler implements GrantHandler {

  private static final Logger log = LoggerFactory.getLogger(RefreshTokenGrantHandler.class);

  private final RefreshTokenStore refreshTokenStore;
  private final UserService userService;
  private final Clock clock;

  @Inject
  public RefreshTokenGrantHandler(RefreshTokenStore refreshTokenStore, UserService userService) {
    this(refreshTokenStore, userService, Clock.systemUTC());
  }

  public RefreshTokenGrantHandler(RefreshTokenStore refreshTokenStore, UserService userService, Clock clock) {
    this.refreshTokenStore = refreshTokenStore;
    this.userService = userService;
    this.clock = clock;
  }

  @Override
  public String grantType() {
    return GrantTypes.REFRESH_TOKEN;
  }

  @Override
  public GrantResult handle(TokenRequest request, ValidatedClient client) {
    Optional<RefreshTokenData> found = refreshTokenStore.load(request.refreshToken());
    if (found.isEmpty()) {
      return GrantResult.failure(Errors.INVALID_GRANT, "Invalid refresh token");
    }
    RefreshTokenData data = found.get();
    if (!data.clientId().equals(client.clientId())) {
      log.warn("Refresh token of {} presented by {}", data.clientId(), client.clientId());
      return GrantResult.failure(Errors.INVALID_GRANT, "Refresh token was issued to different client");
    }
    if (data.isExpired(clock.instant())) {
      refreshTokenStore.consume(data.handle());
      return GrantResult.failure(Errors.INVALID_GRANT, "Refresh token has expired");
    }
    Set<String> requested = request.requestedScopes();
    if (!data.scopes().containsAll(requested)) {
      return GrantResult.failure(Errors.INVALID_SCOPE, "Requested scope exceeds the original grant");
    }
    if (data.subjectId() != null && !userService.isActive(data.subjectId())) {
      return GrantResult.failure(Errors.INVALID_GRANT, "User is not active");
    }
    boolean rotate = client.rotateRefreshTokens();
    if (rotate && refreshTokenStore.consume(data.handle()).isEmpty()) {
      log.warn("Refresh token for client {} was redeemed concurrently", client.clientId());
      return GrantResult.failure(Errors.INVALID_GRANT, "Invalid refresh token");
    }
    Set<String> scopes = requested.isEmpty() ? data.scopes() : requested;
    return new GrantResult(data.subjectId(), data.sessionId(), scopes, data.claims(), null, null, null, null,
        data.dpopJkt(), null, rotate, null);
  }
}
