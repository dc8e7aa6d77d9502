package com.codeheadsystems.oluso.server.token;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.auth0.jwt.JWT;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.codeheadsystems.oluso.server.config.OlusoServerConfig;
import com.codeheadsystems.oluso.server.keys.InMemorySigningCredentialStore;
import com.codeheadsystems.oluso.server.request.Scopes;
import com.codeheadsystems.oluso.server.store.InMemoryRefreshTokenStore;
import com.codeheadsystems.oluso.server.store.RefreshTokenData;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TokenIssuerTest {

  private static final String ISSUER = "https://idp.example.com";

  private static InMemorySigningCredentialStore keys;

  private InMemoryRefreshTokenStore refreshTokens;
  private TokenIssuer issuer;

  @BeforeAll
  static void generateKeys() {
    keys = new InMemorySigningCredentialStore();
  }

  @BeforeEach
  void setUp() {
    refreshTokens = new InMemoryRefreshTokenStore();
    issuer = new TokenIssuer(keys, refreshTokens, new OlusoServerConfig(ISSUER));
  }

  @Test
  void createAccessToken_carriesStandardClaims() {
    DecodedJWT jwt = JWT.decode(issuer.createAccessToken(request("acme", List.of("https://api.example.com"), "jkt-1")));

    assertThat(jwt.getKeyId()).isEqualTo(keys.getSigningKey().getKeyID());
    assertThat(jwt.getAlgorithm()).isEqualTo("RS256");
    assertThat(jwt.getIssuer()).isEqualTo(ISSUER + "/acme");
    assertThat(jwt.getSubject()).isEqualTo("user-1");
    assertThat(jwt.getAudience()).containsExactly("https://api.example.com");
    assertThat(jwt.getClaim("client_id").asString()).isEqualTo("web");
    assertThat(jwt.getClaim("scope").asString()).isEqualTo("openid orders");
    assertThat(jwt.getClaim("sid").asString()).isEqualTo("sess-1");
    assertThat(jwt.getClaim("tenant_id").asString()).isEqualTo("acme");
    assertThat(jwt.getClaim("cnf").asMap()).containsEntry("jkt", "jkt-1");
    assertThat(jwt.getClaim("tier").asString()).isEqualTo("gold");
    assertThat(jwt.getId()).isNotBlank();
  }

  @Test
  void createAccessToken_withoutAudiences_usesClientId() {
    DecodedJWT jwt = JWT.decode(issuer.createAccessToken(request(null, List.of(), null)));

    assertThat(jwt.getAudience()).containsExactly("web");
    assertThat(jwt.getIssuer()).isEqualTo(ISSUER);
    assertThat(jwt.getClaim("cnf").isMissing()).isTrue();
  }

  @Test
  void createIdToken_carriesAuthenticationContextAndAtHash() {
    String accessToken = issuer.createAccessToken(request(null, List.of(), null));

    DecodedJWT jwt = JWT.decode(issuer.createIdToken(request(null, List.of(), null), accessToken));

    assertThat(jwt.getAudience()).containsExactly("web");
    assertThat(jwt.getClaim("nonce").asString()).isEqualTo("n-1");
    assertThat(jwt.getClaim("auth_time").asLong()).isEqualTo(1_700_000_000L);
    assertThat(jwt.getClaim("amr").asList(String.class)).containsExactly("pwd", "otp");
    assertThat(jwt.getClaim("acr").asString()).isEqualTo("urn:acr:mfa");
    assertThat(jwt.getClaim("at_hash").asString()).isEqualTo(TokenIssuer.leftHalfHash(accessToken));
  }

  @Test
  void createIdToken_withoutSubject_isRejected() {
    TokenCreationRequest noSubject = new TokenCreationRequest("web", null, null, null, Set.of("openid"), null, null,
        300, 300, null, null, null, null, null);

    assertThatThrownBy(() -> issuer.createIdToken(noSubject, null)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void leftHalfHash_isHalfOfSha256() {
    // base64url of the first 16 bytes of SHA-256("abc")
    assertThat(TokenIssuer.leftHalfHash("abc")).isEqualTo("ungWv48Bz-pBQUDeXa4iIw");
  }

  @Test
  void createRefreshToken_storesOpaqueHandle() {
    String handle = issuer.createRefreshToken(request(null, List.of(), "jkt-1"), 3600);

    RefreshTokenData data = refreshTokens.load(handle).orElseThrow();
    assertThat(handle).hasSize(43).doesNotContain("=", "+", "/");
    assertThat(data.clientId()).isEqualTo("web");
    assertThat(data.subjectId()).isEqualTo("user-1");
    assertThat(data.dpopJkt()).isEqualTo("jkt-1");
    assertThat(Duration.between(data.createdAt(), data.expiresAt())).isEqualTo(Duration.ofHours(1));
  }

  @Test
  void verifyAccessToken_acceptsOwnTokensOnly() {
    String token = issuer.createAccessToken(request("acme", List.of(), "jkt-1"));

    TokenIssuer.VerifiedAccessToken verified = issuer.verifyAccessToken(token, "acme").orElseThrow();
    assertThat(verified.subject()).isEqualTo("user-1");
    assertThat(verified.clientId()).isEqualTo("web");
    assertThat(verified.scopes()).containsExactlyInAnyOrder("openid", "orders");
    assertThat(verified.dpopJkt()).isEqualTo("jkt-1");
    assertThat(issuer.verifyAccessToken(token, "globex")).isEmpty();
    assertThat(issuer.verifyAccessToken(token.substring(0, token.length() - 4) + "AAAA", "acme")).isEmpty();
  }

  @Test
  void verifyAccessToken_expired_isEmpty() {
    TokenIssuer past = new TokenIssuer(keys, refreshTokens, new OlusoServerConfig(ISSUER),
        Clock.offset(Clock.systemUTC(), Duration.ofHours(-2)));

    assertThat(issuer.verifyAccessToken(past.createAccessToken(request(null, List.of(), null)), null)).isEmpty();
  }

  @Test
  void verifyAccessToken_afterRotation_stillAcceptsOldKey() {
    InMemorySigningCredentialStore rotating = new InMemorySigningCredentialStore();
    TokenIssuer rotatingIssuer = new TokenIssuer(rotating, refreshTokens, new OlusoServerConfig(ISSUER));
    String before = rotatingIssuer.createAccessToken(request(null, List.of(), null));

    rotating.rotate();

    assertThat(rotatingIssuer.verifyAccessToken(before, null)).isPresent();
    assertThat(rotating.getValidationKeys()).hasSize(2);
  }

  private static TokenCreationRequest request(String tenantId, List<String> audiences, String jkt) {
    return new TokenCreationRequest("web", tenantId, "user-1", "sess-1", Scopes.parse("openid orders"),
        Map.of("tier", "gold"), audiences, 300, 300, jkt, "n-1", Instant.ofEpochSecond(1_700_000_000L),
        List.of("pwd", "otp"), "urn:acr:mfa");
  }
}
