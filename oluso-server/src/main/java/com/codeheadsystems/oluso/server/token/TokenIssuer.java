package com.codeheadsystems.oluso.server.token;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTCreator;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.Claim;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.codeheadsystems.oluso.model.OidcConstants.StandardClaims;
import com.codeheadsystems.oluso.server.config.OlusoServerConfig;
import com.codeheadsystems.oluso.server.keys.JwtAlgorithms;
import com.codeheadsystems.oluso.server.keys.SigningCredentialStore;
import com.codeheadsystems.oluso.server.request.Scopes;
import com.codeheadsystems.oluso.server.store.RefreshTokenData;
import com.codeheadsystems.oluso.server.store.RefreshTokenStore;
import com.nimbusds.jose.jwk.RSAKey;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mints and verifies the issuer's tokens.
 * <p>
 * Access and ID tokens are RS256 JWTs signed with the current key of the
 * {@link SigningCredentialStore}. Refresh tokens are opaque random handles whose state lives in
 * the {@link RefreshTokenStore}.
 */
@Singleton
public class TokenIssuer {

  private static final Logger log = LoggerFactory.getLogger(TokenIssuer.class);
  private static final Base64.Encoder B64URL = Base64.getUrlEncoder().withoutPadding();

  private final SigningCredentialStore signingCredentialStore;
  private final RefreshTokenStore refreshTokenStore;
  private final OlusoServerConfig config;
  private final Clock clock;
  private final SecureRandom random = new SecureRandom();

  @Inject
  public TokenIssuer(SigningCredentialStore signingCredentialStore, RefreshTokenStore refreshTokenStore,
                     OlusoServerConfig config) {
    this(signingCredentialStore, refreshTokenStore, config, Clock.systemUTC());
  }

  public TokenIssuer(SigningCredentialStore signingCredentialStore, RefreshTokenStore refreshTokenStore,
                     OlusoServerConfig config, Clock clock) {
    this.signingCredentialStore = signingCredentialStore;
    this.refreshTokenStore = refreshTokenStore;
    this.config = config;
    this.clock = clock;
  }

  /**
   * Result of verifying an access token this issuer signed.
   *
   * @param subject   the subject, null for client credentials tokens
   * @param clientId  the client the token was issued to
   * @param scopes    the token scopes
   * @param jti       the token id
   * @param dpopJkt   the bound key thumbprint, null for bearer tokens
   * @param expiresAt expiry
   */
  public record VerifiedAccessToken(String subject, String clientId, Set<String> scopes, String jti,
                                    String dpopJkt, Instant expiresAt) {
  }

  /**
   * Creates a signed access token.
   *
   * @param request the token parameters
   * @return the compact JWT
   */
  public String createAccessToken(TokenCreationRequest request) {
    RSAKey key = signingCredentialStore.getSigningKey();
    Instant now = clock.instant();
    JWTCreator.Builder builder = JWT.create().withPayload(request.claims());
    builder.withKeyId(key.getKeyID())
        .withIssuer(config.issuerFor(request.tenantId()))
        .withJWTId(UUID.randomUUID().toString())
        .withIssuedAt(now)
        .withNotBefore(now)
        .withExpiresAt(now.plusSeconds(request.accessTokenLifetime()))
        .withClaim(StandardClaims.CLIENT_ID, request.clientId())
        .withClaim(StandardClaims.SCOPE, Scopes.join(request.scopes()));
    if (request.audiences().isEmpty()) {
      builder.withAudience(request.clientId());
    } else {
      builder.withAudience(request.audiences().toArray(new String[0]));
    }
    if (request.subjectId() != null) {
      builder.withSubject(request.subjectId());
    }
    if (request.sessionId() != null) {
      builder.withClaim(StandardClaims.SESSION_ID, request.sessionId());
    }
    if (request.tenantId() != null) {
      builder.withClaim(StandardClaims.TENANT_ID, request.tenantId());
    }
    if (request.dpopJkt() != null) {
      builder.withClaim(StandardClaims.CONFIRMATION, Map.of(StandardClaims.JWK_THUMBPRINT, request.dpopJkt()));
    }
    String token = builder.sign(JwtAlgorithms.signer(key));
    log.debug("Issued access token for client {}", request.clientId());
    return token;
  }

  /**
   * Creates a signed ID token.
   *
   * @param request     the token parameters, must carry a subject
   * @param accessToken the access token issued alongside, for {@code at_hash}; may be null
   * @return the compact JWT
   */
  public String createIdToken(TokenCreationRequest request, String accessToken) {
    if (request.subjectId() == null) {
      throw new IllegalArgumentException("An ID token needs a subject");
    }
    RSAKey key = signingCredentialStore.getSigningKey();
    Instant now = clock.instant();
    JWTCreator.Builder builder = JWT.create().withPayload(request.claims());
    builder.withKeyId(key.getKeyID())
        .withIssuer(config.issuerFor(request.tenantId()))
        .withSubject(request.subjectId())
        .withAudience(request.clientId())
        .withIssuedAt(now)
        .withExpiresAt(now.plusSeconds(request.identityTokenLifetime()));
    if (request.nonce() != null) {
      builder.withClaim(StandardClaims.NONCE, request.nonce());
    }
    if (request.authTime() != null) {
      builder.withClaim(StandardClaims.AUTH_TIME, request.authTime().getEpochSecond());
    }
    if (request.sessionId() != null) {
      builder.withClaim(StandardClaims.SESSION_ID, request.sessionId());
    }
    if (!request.amr().isEmpty()) {
      builder.withClaim(StandardClaims.AMR, request.amr());
    }
    if (request.acr() != null) {
      builder.withClaim(StandardClaims.ACR, request.acr());
    }
    if (accessToken != null) {
      builder.withClaim(StandardClaims.AT_HASH, leftHalfHash(accessToken));
    }
    return builder.sign(JwtAlgorithms.signer(key));
  }

  /**
   * Creates and stores a refresh token.
   *
   * @param request  the token parameters
   * @param lifetime lifetime in seconds
   * @return the opaque handle
   */
  public String createRefreshToken(TokenCreationRequest request, int lifetime) {
    byte[] bytes = new byte[32];
    random.nextBytes(bytes);
    String handle = B64URL.encodeToString(bytes);
    Instant now = clock.instant();
    refreshTokenStore.store(new RefreshTokenData(handle, request.clientId(), request.subjectId(),
        request.sessionId(), request.tenantId(), request.scopes(), request.dpopJkt(), request.claims(), now,
        now.plusSeconds(lifetime)));
    return handle;
  }

  /**
   * Verifies an access token signed by one of this issuer's keys.
   *
   * @param token    the compact JWT
   * @param tenantId the tenant whose issuer must match, may be null
   * @return the verified token, empty if invalid or expired
   */
  public Optional<VerifiedAccessToken> verifyAccessToken(String token, String tenantId) {
    try {
      DecodedJWT decoded = JWT.decode(token);
      for (RSAKey key : signingCredentialStore.getValidationKeys()) {
        if (decoded.getKeyId() != null && !decoded.getKeyId().equals(key.getKeyID())) {
          continue;
        }
        Optional<Algorithm> algorithm = JwtAlgorithms.verifier(decoded.getAlgorithm(), key);
        if (algorithm.isEmpty()) {
          return Optional.empty();
        }
        DecodedJWT verified = JWT.require(algorithm.get())
            .withIssuer(config.issuerFor(tenantId))
            .withClaimPresence(StandardClaims.CLIENT_ID)
            .build()
            .verify(decoded);
        Claim cnf = verified.getClaim(StandardClaims.CONFIRMATION);
        String jkt = cnf.isMissing() || cnf.isNull() ? null : (String) cnf.asMap().get(StandardClaims.JWK_THUMBPRINT);
        return Optional.of(new VerifiedAccessToken(verified.getSubject(),
            verified.getClaim(StandardClaims.CLIENT_ID).asString(),
            Scopes.parse(verified.getClaim(StandardClaims.SCOPE).asString()),
            verified.getId(), jkt, verified.getExpiresAtAsInstant()));
      }
      log.debug("No validation key matches access token kid={}", decoded.getKeyId());
      return Optional.empty();
    } catch (JWTVerificationException e) {
      log.debug("Access token verification failed: {}", e.getMessage());
      return Optional.empty();
    }
  }

  // OIDC Core 3.1.3.6: base64url of the left-most half of the SHA-256 hash.
  static String leftHalfHash(String value) {
    try {
      byte[] digest = MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.US_ASCII));
      return B64URL.encodeToString(Arrays.copyOf(digest, digest.length / 2));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
