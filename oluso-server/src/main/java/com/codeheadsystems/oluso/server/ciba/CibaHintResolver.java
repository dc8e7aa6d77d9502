package com.codeheadsystems.oluso.server.ciba;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.AlgorithmMismatchException;
import com.auth0.jwt.exceptions.IncorrectClaimException;
import com.auth0.jwt.exceptions.JWTDecodeException;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.exceptions.SignatureVerificationException;
import com.auth0.jwt.exceptions.TokenExpiredException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.codeheadsystems.oluso.model.OidcConstants.StandardClaims;
import com.codeheadsystems.oluso.server.common.Result;
import com.codeheadsystems.oluso.server.config.OlusoServerConfig;
import com.codeheadsystems.oluso.server.keys.JwtAlgorithms;
import com.codeheadsystems.oluso.server.keys.SigningCredentialStore;
import com.codeheadsystems.oluso.server.request.ValidatedClient;
import com.codeheadsystems.oluso.server.user.OlusoUser;
import com.codeheadsystems.oluso.server.user.UserService;
import com.nimbusds.jose.jwk.RSAKey;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the user a backchannel request is about.
 * <p>
 * Hints are tried in order: {@code login_hint} (as e-mail, then user name, then subject id),
 * {@code login_hint_token}, {@code id_token_hint}. The first hint that yields a known user wins.
 * Token hints must be signed by one of the issuer's validation keys and carry this tenant's
 * issuer. The {@code id_token_hint} must be addressed to the requesting client; its lifetime is
 * not checked unless {@link OlusoServerConfig#validateIdTokenHintLifetime()} is set.
 */
@Singleton
public class CibaHintResolver {

  private static final Logger log = LoggerFactory.getLogger(CibaHintResolver.class);

  private final UserService userService;
  private final SigningCredentialStore signingCredentialStore;
  private final OlusoServerConfig config;
  private final Clock clock;

  @Inject
  public CibaHintResolver(UserService userService, SigningCredentialStore signingCredentialStore,
                          OlusoServerConfig config) {
    this(userService, signingCredentialStore, config, Clock.systemUTC());
  }

  public CibaHintResolver(UserService userService, SigningCredentialStore signingCredentialStore,
                          OlusoServerConfig config, Clock clock) {
    this.userService = userService;
    this.signingCredentialStore = signingCredentialStore;
    this.config = config;
    this.clock = clock;
  }

  /**
   * Resolves the request's hints to a user.
   *
   * @param request the backchannel request
   * @param client  the requesting client
   * @return the user, or the reason the last attempted hint failed
   */
  public Result<OlusoUser, HintFailureReason> resolve(CibaAuthenticationRequest request, ValidatedClient client) {
    Result<OlusoUser, HintFailureReason> result = Result.failure(HintFailureReason.NO_HINT);
    if (notEmpty(request.loginHint())) {
      result = guarded("login_hint", () -> resolveLoginHint(request.loginHint()));
      if (result.isSuccess()) {
        return result;
      }
    }
    if (notEmpty(request.loginHintToken())) {
      result = guarded("login_hint_token", () -> resolveLoginHintToken(request.loginHintToken(), client));
      if (result.isSuccess()) {
        return result;
      }
      log.debug("login_hint_token not resolved: {}", result.failure());
    }
    if (notEmpty(request.idTokenHint())) {
      result = guarded("id_token_hint", () -> resolveIdTokenHint(request.idTokenHint(), client));
      if (!result.isSuccess()) {
        log.debug("id_token_hint not resolved: {}", result.failure());
      }
    }
    return result;
  }

  // Store and key faults degrade to an unresolved hint.
  private Result<OlusoUser, HintFailureReason> guarded(String hintType,
                                                       Supplier<Result<OlusoUser, HintFailureReason>> attempt) {
    try {
      return attempt.get();
    } catch (RuntimeException e) {
      log.warn("Resolving {} failed: {}", hintType, e.toString());
      return Result.failure(HintFailureReason.LOOKUP_FAILED);
    }
  }

  Result<OlusoUser, HintFailureReason> resolveLoginHint(String loginHint) {
    Optional<OlusoUser> user = userService.findByEmail(loginHint)
        .or(() -> userService.findByUsername(loginHint))
        .or(() -> userService.findById(loginHint));
    return user.<Result<OlusoUser, HintFailureReason>>map(Result::success)
        .orElseGet(() -> Result.failure(HintFailureReason.USER_NOT_FOUND));
  }

  Result<OlusoUser, HintFailureReason> resolveLoginHintToken(String token, ValidatedClient client) {
    String issuer = config.issuerFor(client.tenantId());
    Result<DecodedJWT, HintFailureReason> verified = verifyWithIssuerKeys(token, (decoded, algorithm) -> {
      JWT.require(algorithm)
          .withIssuer(issuer)
          .acceptLeeway(config.hintTokenClockSkewSeconds())
          .build()
          .verify(decoded);
    });
    return verified.isSuccess() ? toUser(verified.value()) : Result.failure(verified.failure());
  }

  Result<OlusoUser, HintFailureReason> resolveIdTokenHint(String token, ValidatedClient client) {
    String issuer = config.issuerFor(client.tenantId());
    Result<DecodedJWT, HintFailureReason> verified = verifyWithIssuerKeys(token,
        (decoded, algorithm) -> algorithm.verify(decoded));
    if (!verified.isSuccess()) {
      return Result.failure(verified.failure());
    }
    DecodedJWT decoded = verified.value();
    if (!issuer.equals(decoded.getIssuer())) {
      log.debug("id_token_hint issuer mismatch");
      return Result.failure(HintFailureReason.INVALID_ISSUER);
    }
    if (decoded.getAudience() == null || !decoded.getAudience().contains(client.clientId())) {
      log.debug("id_token_hint audience does not include client {}", client.clientId());
      return Result.failure(HintFailureReason.INVALID_AUDIENCE);
    }
    if (config.validateIdTokenHintLifetime()) {
      Instant expiresAt = decoded.getExpiresAtAsInstant();
      if (expiresAt != null
          && expiresAt.plusSeconds(config.hintTokenClockSkewSeconds()).isBefore(clock.instant())) {
        return Result.failure(HintFailureReason.TOKEN_EXPIRED);
      }
    }
    return toUser(decoded);
  }

  private interface TokenCheck {
    void check(DecodedJWT decoded, Algorithm algorithm);
  }

  private Result<DecodedJWT, HintFailureReason> verifyWithIssuerKeys(String token, TokenCheck check) {
    DecodedJWT decoded;
    try {
      decoded = JWT.decode(token);
    } catch (JWTDecodeException e) {
      log.debug("Hint token is not a JWT: {}", e.getMessage());
      return Result.failure(HintFailureReason.MALFORMED_TOKEN);
    }
    List<RSAKey> keys = candidateKeys(decoded.getKeyId());
    if (keys.isEmpty()) {
      log.warn("No validation key available for hint token kid={}", decoded.getKeyId());
      return Result.failure(HintFailureReason.NO_VALIDATION_KEYS);
    }
    for (RSAKey key : keys) {
      Optional<Algorithm> algorithm = JwtAlgorithms.verifier(decoded.getAlgorithm(), key);
      if (algorithm.isEmpty()) {
        log.debug("Unsupported hint token algorithm {}", decoded.getAlgorithm());
        return Result.failure(HintFailureReason.INVALID_SIGNATURE);
      }
      try {
        check.check(decoded, algorithm.get());
        return Result.success(decoded);
      } catch (SignatureVerificationException | AlgorithmMismatchException e) {
        log.debug("Hint token signature not valid for kid={}", key.getKeyID());
      } catch (TokenExpiredException e) {
        log.debug("Hint token expired: {}", e.getMessage());
        return Result.failure(HintFailureReason.TOKEN_EXPIRED);
      } catch (IncorrectClaimException e) {
        log.debug("Hint token claim {} rejected", e.getClaimName());
        return Result.failure(StandardClaims.AUDIENCE.equals(e.getClaimName())
            ? HintFailureReason.INVALID_AUDIENCE
            : HintFailureReason.INVALID_ISSUER);
      } catch (JWTVerificationException e) {
        log.debug("Hint token rejected: {}", e.getMessage());
        return Result.failure(HintFailureReason.INVALID_ISSUER);
      }
    }
    return Result.failure(HintFailureReason.INVALID_SIGNATURE);
  }

  private List<RSAKey> candidateKeys(String kid) {
    List<RSAKey> keys = signingCredentialStore.getValidationKeys();
    if (kid == null) {
      return keys;
    }
    return keys.stream().filter(k -> kid.equals(k.getKeyID())).collect(Collectors.toList());
  }

  private Result<OlusoUser, HintFailureReason> toUser(DecodedJWT decoded) {
    String subject = decoded.getSubject();
    if (subject == null || subject.isEmpty()) {
      return Result.failure(HintFailureReason.MISSING_SUBJECT);
    }
    return userService.findById(subject)
        .<Result<OlusoUser, HintFailureReason>>map(Result::success)
        .orElseGet(() -> Result.failure(HintFailureReason.USER_NOT_FOUND));
  }

  private static boolean notEmpty(String value) {
    return value != null && !value.isEmpty();
  }
}
