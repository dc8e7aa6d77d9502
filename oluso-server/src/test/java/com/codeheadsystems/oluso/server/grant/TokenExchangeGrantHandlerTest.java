package com.codeheadsystems.oluso.server.grant;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.oluso.model.OidcConstants.Errors;
import com.codeheadsystems.oluso.model.OidcConstants.GrantTypes;
import com.codeheadsystems.oluso.model.OidcConstants.TokenTypes;
import com.codeheadsystems.oluso.server.config.OlusoServerConfig;
import com.codeheadsystems.oluso.server.keys.InMemorySigningCredentialStore;
import com.codeheadsystems.oluso.server.request.TokenRequest;
import com.codeheadsystems.oluso.server.request.ValidatedClient;
import com.codeheadsystems.oluso.server.store.InMemoryRefreshTokenStore;
import com.codeheadsystems.oluso.server.token.TokenCreationRequest;
import com.codeheadsystems.oluso.server.token.TokenIssuer;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TokenExchangeGrantHandlerTest {

  private static InMemorySigningCredentialStore keys;

  private final ValidatedClient gateway = ValidatedClient.builder("gateway").build();
  private TokenIssuer issuer;
  private TokenExchangeGrantHandler handler;

  @BeforeAll
  static void generateKeys() {
    keys = new InMemorySigningCredentialStore();
  }

  @BeforeEach
  void setUp() {
    issuer = new TokenIssuer(keys, new InMemoryRefreshTokenStore(), new OlusoServerConfig("https://idp.example.com"));
    handler = new TokenExchangeGrantHandler(issuer);
  }

  @Test
  void handle_validSubjectToken_keepsSubjectAndScopes() {
    String subjectToken = accessToken("web", "user-1", Set.of("orders", "profile"));

    GrantResult result = handler.handle(exchange(subjectToken).build(), gateway);

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.subjectId()).isEqualTo("user-1");
    assertThat(result.scopes()).containsExactlyInAnyOrder("orders", "profile");
    assertThat(result.issuedTokenType()).isEqualTo(TokenTypes.ACCESS_TOKEN);
    assertThat(result.claims()).isEmpty();
  }

  @Test
  void handle_actorToken_addsActClaim() {
    String subjectToken = accessToken("web", "user-1", Set.of("orders"));
    String actorToken = accessToken("gateway", null, Set.of("orders"));

    GrantResult result = handler.handle(exchange(subjectToken)
        .withActorToken(actorToken, TokenTypes.ACCESS_TOKEN).build(), gateway);

    assertThat(result.claims()).containsEntry(TokenExchangeGrantHandler.ACTOR_CLAIM, Map.of("sub", "gateway"));
  }

  @Test
  void handle_scopesMayOnlyNarrow() {
    String subjectToken = accessToken("web", "user-1", Set.of("orders", "profile"));

    assertThat(handler.handle(exchange(subjectToken).withScope("orders").build(), gateway).scopes())
        .containsExactly("orders");
    assertThat(handler.handle(exchange(subjectToken).withScope("orders admin").build(), gateway).error().error())
        .isEqualTo(Errors.INVALID_SCOPE);
  }

  @Test
  void handle_foreignOrGarbageTokens_areInvalidGrant() {
    InMemorySigningCredentialStore otherKeys = new InMemorySigningCredentialStore();
    TokenIssuer otherIssuer = new TokenIssuer(otherKeys, new InMemoryRefreshTokenStore(),
        new OlusoServerConfig("https://idp.example.com"));
    String foreign = otherIssuer.createAccessToken(creation("web", "user-1", Set.of("orders")));

    assertThat(handler.handle(exchange(foreign).build(), gateway).error().error()).isEqualTo(Errors.INVALID_GRANT);
    String valid = accessToken("web", "user-1", Set.of("orders"));
    assertThat(handler.handle(exchange(valid).withActorToken("junk", TokenTypes.ACCESS_TOKEN).build(), gateway)
        .error().description()).isEqualTo("Invalid actor_token");
  }

  @Test
  void handle_tokenOfAnotherTenant_isInvalidGrant() {
    String subjectToken = accessToken("web", "user-1", Set.of("orders"));

    assertThat(handler.handle(exchange(subjectToken).withTenantId("acme").build(), gateway).error().error())
        .isEqualTo(Errors.INVALID_GRANT);
  }

  @Test
  void handle_unsupportedTokenTypes_areInvalidRequest() {
    String subjectToken = accessToken("web", "user-1", Set.of("orders"));

    assertThat(handler.handle(TokenRequest.builder(GrantTypes.TOKEN_EXCHANGE)
        .withSubjectToken(subjectToken, TokenTypes.REFRESH_TOKEN).build(), gateway).error().error())
        .isEqualTo(Errors.INVALID_REQUEST);
    assertThat(handler.handle(exchange(subjectToken).withRequestedTokenType(TokenTypes.ID_TOKEN).build(), gateway)
        .error().error()).isEqualTo(Errors.INVALID_REQUEST);
  }

  private String accessToken(String clientId, String subject, Set<String> scopes) {
    return issuer.createAccessToken(creation(clientId, subject, scopes));
  }

  private static TokenCreationRequest creation(String clientId, String subject, Set<String> scopes) {
    return new TokenCreationRequest(clientId, null, subject, null, scopes, Map.of(), List.of(), 300, 300, null,
        null, null, null, null);
  }

  private static TokenRequest.Builder exchange(String subjectToken) {
    return TokenRequest.builder(GrantTypes.TOKEN_EXCHANGE).withSubjectToken(subjectToken, TokenTypes.ACCESS_TOKEN);
  }
}
