package com.codeheadsystems.oluso.server.dpop;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTDecodeException;
import com.auth0.jwt.exceptions.SignatureVerificationException;
import com.auth0.jwt.interfaces.Claim;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.codeheadsystems.oluso.server.config.OlusoServerConfig;
import com.codeheadsystems.oluso.server.store.DPoPNonceStore;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.crypto.RSASSAVerifier;
import com.nimbusds.jose.jwk.ECKey;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jwt.SignedJWT;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates DPoP proof JWTs (RFC 9449 section 4.3).
 * <p>
 * Checks run in a fixed order and the first failure wins: header shape, embedded key, signature,
 * claims, server nonce, replay, access token hash, key binding. The result is always a value;
 * nothing thrown by the JWT libraries escapes.
 */
@Singleton
public class DPoPProofValidator {

  private static final Logger log = LoggerFactory.getLogger(DPoPProofValidator.class);

  public static final String DPOP_JWT_TYPE = "dpop+jwt";

  private static final Set<String> SUPPORTED_ALGORITHMS = Set.of(
      "RS256", "RS384", "RS512", "PS256", "PS384", "PS512", "ES256", "ES384", "ES512");
  private static final Base64.Encoder B64URL = Base64.getUrlEncoder().withoutPadding();

  private final DPoPNonceStore nonceStore;
  private final Duration proofLifetime;
  private final Duration clockSkew;
  private final Clock clock;

  @Inject
  public DPoPProofValidator(DPoPNonceStore nonceStore, OlusoServerConfig config) {
    this(nonceStore, Duration.ofSeconds(config.dpopProofLifetimeSeconds()),
        Duration.ofSeconds(config.dpopClockSkewSeconds()), Clock.systemUTC());
  }

  public DPoPProofValidator(DPoPNonceStore nonceStore, Duration proofLifetime, Duration clockSkew, Clock clock) {
    this.nonceStore = nonceStore;
    this.proofLifetime = proofLifetime;
    this.clockSkew = clockSkew;
    this.clock = clock;
  }

  /**
   * Validates a proof.
   *
   * @param context the request the proof must match
   * @return the validation result
   */
  public DPoPValidationResult validate(DPoPValidationContext context) {
    if (context.proof() == null || context.proof().isBlank()) {
      return DPoPValidationResult.failure("Missing DPoP proof");
    }
    try {
      DecodedJWT decoded = JWT.decode(context.proof());

      if (decoded.getType() == null || !DPOP_JWT_TYPE.equalsIgnoreCase(decoded.getType())) {
        return DPoPValidationResult.failure("Invalid typ header, expected dpop+jwt");
      }
      String alg = decoded.getAlgorithm();
      if (alg == null || !SUPPORTED_ALGORITHMS.contains(alg)) {
        return DPoPValidationResult.failure("Unsupported DPoP algorithm");
      }
      Claim jwkClaim = decoded.getHeaderClaim("jwk");
      Map<String, Object> jwkJson = jwkClaim.isMissing() || jwkClaim.isNull() ? null : jwkClaim.asMap();
      if (jwkJson == null) {
        return DPoPValidationResult.failure("Missing jwk header");
      }
      JWK jwk = JWK.parse(jwkJson);
      if (jwk.isPrivate()) {
        return DPoPValidationResult.failure("jwk header must not contain private key material");
      }
      if (!verifySignature(context.proof(), decoded, alg, jwk)) {
        return DPoPValidationResult.failure("Invalid DPoP proof signature");
      }

      String jti = decoded.getId();
      if (jti == null || jti.isBlank()) {
        return DPoPValidationResult.failure("Missing jti claim");
      }
      String htm = decoded.getClaim("htm").asString();
      if (htm == null || !htm.equalsIgnoreCase(context.httpMethod())) {
        return DPoPValidationResult.failure("htm does not match the request method");
      }
      String htu = decoded.getClaim("htu").asString();
      if (htu == null || !urisMatch(htu, context.httpUri())) {
        return DPoPValidationResult.failure("htu does not match the request uri");
      }
      Instant iat = decoded.getIssuedAtAsInstant();
      if (iat == null) {
        return DPoPValidationResult.failure("Missing iat claim");
      }
      Instant now = clock.instant();
      if (iat.isAfter(now.plus(clockSkew))) {
        return DPoPValidationResult.failure("DPoP proof is issued in the future");
      }
      if (iat.isBefore(now.minus(proofLifetime).minus(clockSkew))) {
        return DPoPValidationResult.failure("DPoP proof has expired");
      }

      if (context.requireNonce() || nonceStore.isNonceRequired(context.clientId())) {
        String nonce = decoded.getClaim("nonce").asString();
        if (nonce == null || !nonceStore.validateNonce(nonce, context.clientId())) {
          log.debug("DPoP proof without a valid server nonce for client {}", context.clientId());
          return DPoPValidationResult.nonceRequired(nonceStore.generateNonce(context.clientId()));
        }
      }

      if (!nonceStore.validateJti(jti, proofLifetime.plus(clockSkew).plus(clockSkew))) {
        log.warn("DPoP proof replay rejected for client {}", context.clientId());
        return DPoPValidationResult.failure("DPoP proof has already been used");
      }

      if (context.expectedAccessTokenHash() != null) {
        String ath = decoded.getClaim("ath").asString();
        if (ath == null) {
          return DPoPValidationResult.failure("Missing ath claim");
        }
        if (!MessageDigest.isEqual(ath.getBytes(StandardCharsets.US_ASCII),
            context.expectedAccessTokenHash().getBytes(StandardCharsets.US_ASCII))) {
          return DPoPValidationResult.failure("ath does not match the access token");
        }
      }

      String thumbprint = jwk.computeThumbprint().toString();
      if (context.expectedJwkThumbprint() != null && !context.expectedJwkThumbprint().equals(thumbprint)) {
        log.warn("DPoP key does not match the bound key for client {}", context.clientId());
        return DPoPValidationResult.failure("DPoP key does not match the bound key");
      }
      return DPoPValidationResult.success(thumbprint, jwk);
    } catch (JWTDecodeException e) {
      log.debug("Malformed DPoP proof: {}", e.getMessage());
      return DPoPValidationResult.failure("Malformed DPoP proof");
    } catch (ParseException e) {
      log.debug("Unparseable jwk header: {}", e.getMessage());
      return DPoPValidationResult.failure("Invalid jwk header");
    } catch (JOSEException e) {
      log.debug("Unusable DPoP key: {}", e.getMessage());
      return DPoPValidationResult.failure("Invalid jwk header");
    }
  }

  /**
   * SHA-256 over the UTF-8 bytes of the access token, base64url without padding.
   *
   * @param accessToken the access token
   * @return the {@code ath} value
   */
  public static String computeAccessTokenHash(String accessToken) {
    try {
      byte[] digest = MessageDigest.getInstance("SHA-256").digest(accessToken.getBytes(StandardCharsets.UTF_8));
      return B64URL.encodeToString(digest);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  private boolean verifySignature(String proof, DecodedJWT decoded, String alg, JWK jwk)
      throws JOSEException, ParseException {
    if (alg.startsWith("PS")) {
      // java-jwt has no RSASSA-PSS support
      if (!(jwk instanceof RSAKey rsaKey)) {
        return false;
      }
      SignedJWT signed = SignedJWT.parse(proof);
      return JWSAlgorithm.parse(alg).equals(signed.getHeader().getAlgorithm())
          && signed.verify(new RSASSAVerifier(rsaKey));
    }
    Algorithm algorithm = toAlgorithm(alg, jwk);
    if (algorithm == null) {
      return false;
    }
    try {
      algorithm.verify(decoded);
      return true;
    } catch (SignatureVerificationException e) {
      log.debug("DPoP signature verification failed: {}", e.getMessage());
      return false;
    }
  }

  private static Algorithm toAlgorithm(String alg, JWK jwk) throws JOSEException {
    if (alg.startsWith("RS") && jwk instanceof RSAKey rsaKey) {
      switch (alg) {
        case "RS256":
          return Algorithm.RSA256(rsaKey.toRSAPublicKey(), null);
        case "RS384":
          return Algorithm.RSA384(rsaKey.toRSAPublicKey(), null);
        default:
          return Algorithm.RSA512(rsaKey.toRSAPublicKey(), null);
      }
    }
    if (alg.startsWith("ES") && jwk instanceof ECKey ecKey) {
      switch (alg) {
        case "ES256":
          return Algorithm.ECDSA256(ecKey.toECPublicKey(), null);
        case "ES384":
          return Algorithm.ECDSA384(ecKey.toECPublicKey(), null);
        default:
          return Algorithm.ECDSA512(ecKey.toECPublicKey(), null);
      }
    }
    return null;
  }

  // Scheme, host, port and path must match; query and fragment are ignored.
  static boolean urisMatch(String htu, String requestUri) {
    if (requestUri == null) {
      return false;
    }
    try {
      URI a = new URI(htu);
      URI b = new URI(requestUri);
      return a.getScheme() != null && a.getScheme().equalsIgnoreCase(b.getScheme())
          && a.getHost() != null && a.getHost().equalsIgnoreCase(b.getHost())
          && effectivePort(a) == effectivePort(b)
          && normalizePath(a.getPath()).equals(normalizePath(b.getPath()));
    } catch (URISyntaxException e) {
      return false;
    }
  }

  private static int effectivePort(URI uri) {
    if (uri.getPort() != -1) {
      return uri.getPort();
    }
    return "https".equals(uri.getScheme().toLowerCase(Locale.ROOT)) ? 443 : 80;
  }

  private static String normalizePath(String path) {
    return path == null || path.isEmpty() ? "/" : path;
  }
}
