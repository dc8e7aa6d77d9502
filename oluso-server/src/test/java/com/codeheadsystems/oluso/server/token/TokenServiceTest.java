package com.codeheadsystems.oluso.server.token;

import static org.assertj.core.api.Assertions.assertThat;

import com.auth0.jwt.JWT;
import com.codeheadsystems.oluso.model.OidcConstants.GrantTypes;
import com.codeheadsystems.oluso.model.OidcConstants.TokenTypes;
import com.codeheadsystems.oluso.model.token.TokenResponse;
import com.codeheadsystems.oluso.server.config.OlusoServerConfig;
import com.codeheadsystems.oluso.server.grant.GrantResult;
import com.codeheadsystems.oluso.server.keys.InMemorySigningCredentialStore;
import com.codeheadsystems.oluso.server.request.Scopes;
import com.codeheadsystems.oluso.server.request.TokenRequest;
import com.codeheadsystems.oluso.server.request.ValidatedClient;
import com.codeheadsystems.oluso.server.store.InMemoryRefreshTokenStore;
import java.util.List;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TokenServiceTest {

  private static InMemorySigningCredentialStore keys;

  private final ValidatedClient client = ValidatedClient.builder("web").withAllowOfflineAccess(true).build();
  private InMemoryRefreshTokenStore refreshTokens;
  private TokenService service;

  @BeforeAll
  static void generateKeys() {
    keys = new InMemorySigningCredentialStore();
  }

  @BeforeEach
  void setUp() {
    refreshTokens = new InMemoryRefreshTokenStore();
    service = new TokenService(new TokenIssuer(keys, refreshTokens, new OlusoServerConfig("https://idp.example.com")));
  }

  @Test
  void createTokenResponse_userGrantWithOpenIdAndOffline_issuesAllThree() {
    TokenResponse response = service.createTokenResponse(grant("user-1", "openid offline_access"),
        TokenRequest.builder(GrantTypes.AUTHORIZATION_CODE).build(), client, null);

    assertThat(response.tokenType()).isEqualTo(TokenTypes.BEARER);
    assertThat(response.expiresIn()).isEqualTo(3600);
    assertThat(response.scope()).isEqualTo("openid offline_access");
    assertThat(response.idToken()).isNotNull();
    assertThat(refreshTokens.load(response.refreshToken())).isPresent();
  }

  @Test
  void createTokenResponse_dpopBound_isDpopTokenType() {
    TokenResponse response = service.createTokenResponse(grant("user-1", "openid"),
        TokenRequest.builder(GrantTypes.AUTHORIZATION_CODE).build(), client, "jkt-1");

    assertThat(response.tokenType()).isEqualTo(TokenTypes.DPOP);
    assertThat(JWT.decode(response.accessToken()).getClaim("cnf").asMap()).containsEntry("jkt", "jkt-1");
  }

  @Test
  void createTokenResponse_noSubject_noIdTokenOrRefreshToken() {
    TokenResponse response = service.createTokenResponse(grant(null, "openid offline_access"),
        TokenRequest.builder(GrantTypes.CLIENT_CREDENTIALS).build(), client, null);

    assertThat(response.idToken()).isNull();
    assertThat(response.refreshToken()).isNull();
  }

  @Test
  void createTokenResponse_clientWithoutOfflineAccess_noRefreshToken() {
    ValidatedClient noOffline = ValidatedClient.builder("web").build();

    TokenResponse response = service.createTokenResponse(grant("user-1", "openid offline_access"),
        TokenRequest.builder(GrantTypes.AUTHORIZATION_CODE).build(), noOffline, null);

    assertThat(response.refreshToken()).isNull();
  }

  @Test
  void createTokenResponse_refreshGrant_newRefreshTokenOnlyWhenRotated() {
    TokenRequest refresh = TokenRequest.builder(GrantTypes.REFRESH_TOKEN).build();
    GrantResult rotated = new GrantResult("user-1", null, Scopes.parse("offline_access"), null, null, null, null,
        null, null, null, true, null);

    assertThat(service.createTokenResponse(grant("user-1", "offline_access"), refresh, client, null).refreshToken())
        .isNull();
    assertThat(service.createTokenResponse(rotated, refresh, client, null).refreshToken()).isNotNull();
  }

  @Test
  void createTokenResponse_tokenExchange_neverIssuesRefreshToken() {
    GrantResult exchanged = new GrantResult("user-1", null, Scopes.parse("orders offline_access"), null, null, null,
        null, null, null, TokenTypes.ACCESS_TOKEN, false, null);

    TokenResponse response = service.createTokenResponse(exchanged,
        TokenRequest.builder(GrantTypes.TOKEN_EXCHANGE).withAudience("https://orders.example.com").build(), client,
        null);

    assertThat(response.refreshToken()).isNull();
    assertThat(response.issuedTokenType()).isEqualTo(TokenTypes.ACCESS_TOKEN);
  }

  @Test
  void createTokenResponse_resourcesAndAudienceBecomeAudiences() {
    TokenResponse response = service.createTokenResponse(grant(null, "orders"),
        TokenRequest.builder(GrantTypes.CLIENT_CREDENTIALS)
            .withResources(List.of("https://orders.example.com"))
            .withAudience("https://billing.example.com")
            .build(), client, null);

    assertThat(JWT.decode(response.accessToken()).getAudience())
        .containsExactly("https://orders.example.com", "https://billing.example.com");
  }

  private static GrantResult grant(String subject, String scope) {
    return GrantResult.of(subject, null, Scopes.parse(scope));
  }
}
