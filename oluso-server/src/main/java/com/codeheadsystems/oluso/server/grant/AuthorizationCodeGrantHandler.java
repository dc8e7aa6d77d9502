package com.codeheadsystems.oluso.server.grant;

import com.codeheadsystems.oluso.model.OidcConstants.CodeChallengeMethods;
import com.codeheadsystems.oluso.model.OidcConstants.Errors;
import com.codeheadsystems.oluso.model.OidcConstants.GrantTypes;
import com.codeheadsystems.oluso.server.request.AuthorizationCodeData;
import com.codeheadsystems.oluso.server.request.TokenRequest;
import com.codeheadsystems.oluso.server.request.ValidatedClient;
import com.codeheadsystems.oluso.server.store.AuthorizationCodeStore;
import com.codeheadsystems.oluso.server.user.UserService;
import com.codeheadsystems.oluso.server.validation.PkceValidator;
import com.codeheadsystems.oluso.server.validation.ValidationResult;
import java.time.Clock;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The {@code authorization_code} grant (RFC 6749 section 4.1.3).
 * <p>
 * The code is consumed before any other check, so a code is spent even when redemption fails.
 */
@Singleton
public class AuthorizationCodeGrantHandler implements GrantHandler {

  private static final Logger log = LoggerFactory.getLogger(AuthorizationCodeGrantHandler.class);

  private final AuthorizationCodeStore codeStore;
  private final PkceValidator pkceValidator;
  private final UserService userService;
  private final Clock clock;

  @Inject
  public AuthorizationCodeGrantHandler(AuthorizationCodeStore codeStore, PkceValidator pkceValidator,
                                       UserService userService) {
    this(codeStore, pkceValidator, userService, Clock.systemUTC());
  }

  public AuthorizationCodeGrantHandler(AuthorizationCodeStore codeStore, PkceValidator pkceValidator,
                                       UserService userService, Clock clock) {
    this.codeStore = codeStore;
    this.pkceValidator = pkceValidator;
    this.userService = userService;
    this.clock = clock;
  }

  @Override
  public String grantType() {
    return GrantTypes.AUTHORIZATION_CODE;
  }

  @Override
  public GrantResult handle(TokenRequest request, ValidatedClient client) {
    Optional<AuthorizationCodeData> found = codeStore.consume(request.code());
    if (found.isEmpty()) {
      log.warn("Authorization code not found or already used, client {}", client.clientId());
      return GrantResult.failure(Errors.INVALID_GRANT, "Invalid authorization code");
    }
    AuthorizationCodeData code = found.get();
    if (code.isExpired(clock.instant())) {
      return GrantResult.failure(Errors.INVALID_GRANT, "Authorization code has expired");
    }
    if (!code.clientId().equals(client.clientId())) {
      log.warn("Authorization code issued to {} presented by {}", code.clientId(), client.clientId());
      return GrantResult.failure(Errors.INVALID_GRANT, "Authorization code was issued to different client");
    }
    if (code.redirectUri() != null && !code.redirectUri().equals(request.redirectUri())) {
      return GrantResult.failure(Errors.INVALID_GRANT, "redirect_uri does not match");
    }
    if (code.codeChallenge() != null) {
      String method = code.codeChallengeMethod() == null ? CodeChallengeMethods.PLAIN : code.codeChallengeMethod();
      ValidationResult pkce = pkceValidator.validateCodeVerifier(request.codeVerifier(), code.codeChallenge(), method);
      if (!pkce.isValid()) {
        return GrantResult.failure(pkce.error().error(), pkce.error().description());
      }
    } else if (client.requirePkce()) {
      return GrantResult.failure(Errors.INVALID_GRANT, "PKCE is required but code_challenge was not used");
    }
    if (code.subjectId() != null && !userService.isActive(code.subjectId())) {
      return GrantResult.failure(Errors.INVALID_GRANT, "User is not active");
    }
    log.debug("Redeemed authorization code for client {}", client.clientId());
    return new GrantResult(code.subjectId(), code.sessionId(), code.scopes(), code.claims(), code.nonce(),
        code.authTime(), code.amr(), code.acr(), code.dpopJkt(), null, false, null);
  }
}
