package com.codeheadsystems.oluso.server.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.codeheadsystems.oluso.model.OidcConstants.Errors;
import com.codeheadsystems.oluso.model.OidcConstants.GrantTypes;
import com.codeheadsystems.oluso.model.OidcConstants.TokenTypes;
import com.codeheadsystems.oluso.server.MutableClock;
import com.codeheadsystems.oluso.server.config.OlusoServerConfig;
import com.codeheadsystems.oluso.server.dpop.DPoPProofValidator;
import com.codeheadsystems.oluso.server.dpop.DPoPValidationContext;
import com.codeheadsystems.oluso.server.dpop.DPoPValidationResult;
import com.codeheadsystems.oluso.server.event.OlusoEvent;
import com.codeheadsystems.oluso.server.grant.ClientCredentialsGrantHandler;
import com.codeheadsystems.oluso.server.grant.GrantHandler;
import com.codeheadsystems.oluso.server.grant.GrantResult;
import com.codeheadsystems.oluso.server.keys.InMemorySigningCredentialStore;
import com.codeheadsystems.oluso.server.request.Scopes;
import com.codeheadsystems.oluso.server.request.TokenRequest;
import com.codeheadsystems.oluso.server.request.ValidatedClient;
import com.codeheadsystems.oluso.server.store.InMemoryClientStore;
import com.codeheadsystems.oluso.server.store.InMemoryRefreshTokenStore;
import com.codeheadsystems.oluso.server.store.RegisteredClient;
import com.codeheadsystems.oluso.server.token.TokenIssuer;
import com.codeheadsystems.oluso.server.token.TokenService;
import com.codeheadsystems.oluso.server.validation.ClientAuthenticator;
import com.codeheadsystems.oluso.server.validation.ScopeValidator;
import com.codeheadsystems.oluso.server.validation.TokenRequestValidator;
import com.nimbusds.jose.jwk.Curve;
import com.nimbusds.jose.jwk.ECKey;
import com.nimbusds.jose.jwk.gen.ECKeyGenerator;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TokenEndpointManagerTest {

  private static final String ISSUER = "https://idp.example.com";

  private static InMemorySigningCredentialStore keys;
  private static ECKey proofKey;

  @Mock private DPoPProofValidator dpopProofValidator;
  @Mock private GrantHandler codeHandler;

  private final List<OlusoEvent> events = new ArrayList<>();
  private final MutableClock clock = MutableClock.atEpoch();
  private InMemoryClientStore clients;
  private TokenEndpointManager manager;

  @BeforeAll
  static void generateKeys() throws Exception {
    keys = new InMemorySigningCredentialStore();
    proofKey = new ECKeyGenerator(Curve.P_256).generate().toPublicJWK();
  }

  @BeforeEach
  void setUp() {
    clients = new InMemoryClientStore();
    clients.save(RegisteredClient.withSecret(ValidatedClient.builder("worker")
        .withAllowedGrantTypes(GrantTypes.CLIENT_CREDENTIALS, GrantTypes.AUTHORIZATION_CODE)
        .withAllowedScopes("reports")
        .withRequirePkce(false)
        .build(), "secret"));
    clients.save(RegisteredClient.withSecret(ValidatedClient.builder("bound")
        .withAllowedGrantTypes(GrantTypes.CLIENT_CREDENTIALS)
        .withAllowedScopes("reports")
        .withRequireDPoP(true)
        .build(), "secret"));
    when(codeHandler.grantType()).thenReturn(GrantTypes.AUTHORIZATION_CODE);
    TokenService tokenService = new TokenService(new TokenIssuer(keys, new InMemoryRefreshTokenStore(),
        new OlusoServerConfig(ISSUER)));
    manager = new TokenEndpointManager(new ClientAuthenticator(clients), new TokenRequestValidator(new ScopeValidator()),
        dpopProofValidator, tokenService, Set.of(new ClientCredentialsGrantHandler(), codeHandler), events::add,
        new OlusoServerConfig(ISSUER), clock);
  }

  @Test
  void token_clientCredentials_issuesBearerTokenAndPublishesEvent() {
    TokenEndpointResult result = manager.token(credentials("worker").withScope("reports").build());

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.status()).isEqualTo(TokenEndpointResult.OK);
    assertThat(result.response().tokenType()).isEqualTo(TokenTypes.BEARER);
    assertThat(result.response().scope()).isEqualTo("reports");
    assertThat(events).singleElement().isInstanceOfSatisfying(OlusoEvent.TokenIssued.class, e -> {
      assertThat(e.clientId()).isEqualTo("worker");
      assertThat(e.dpopBound()).isFalse();
      assertThat(e.occurredAt()).isEqualTo(clock.instant());
    });
    verifyNoInteractions(dpopProofValidator);
  }

  @Test
  void token_badClientCredentials_isUnauthorized() {
    TokenEndpointResult result = manager.token(TokenRequest.builder(GrantTypes.CLIENT_CREDENTIALS)
        .withClientCredentials("worker", "wrong").build());

    assertThat(result.status()).isEqualTo(TokenEndpointResult.UNAUTHORIZED);
    assertThat(result.error().error()).isEqualTo(Errors.INVALID_CLIENT);
    assertThat(events).singleElement().isInstanceOf(OlusoEvent.TokenRequestFailed.class);
  }

  @Test
  void token_unknownGrantType_isUnsupported() {
    TokenEndpointResult result = manager.token(TokenRequest.builder("password")
        .withClientCredentials("worker", "secret").build());

    assertThat(result.status()).isEqualTo(TokenEndpointResult.BAD_REQUEST);
    assertThat(result.error().error()).isEqualTo(Errors.UNSUPPORTED_GRANT_TYPE);
  }

  @Test
  void token_validationFailure_isBadRequest() {
    TokenEndpointResult result = manager.token(credentials("worker").withScope("admin").build());

    assertThat(result.error().error()).isEqualTo(Errors.INVALID_SCOPE);
  }

  @Test
  void token_validDPoPProof_bindsToken() {
    when(dpopProofValidator.validate(any())).thenReturn(DPoPValidationResult.success("jkt-1", proofKey));

    TokenEndpointResult result = manager.token(credentials("bound").withDpopProof("proof").withTenantId("acme").build());

    assertThat(result.response().tokenType()).isEqualTo(TokenTypes.DPOP);
    ArgumentCaptor<DPoPValidationContext> context = ArgumentCaptor.forClass(DPoPValidationContext.class);
    verify(dpopProofValidator).validate(context.capture());
    assertThat(context.getValue().httpMethod()).isEqualTo("POST");
    assertThat(context.getValue().httpUri()).isEqualTo(ISSUER + "/acme/connect/token");
    assertThat(context.getValue().clientId()).isEqualTo("bound");
  }

  @Test
  void token_dpopRequiredButMissing_isInvalidDPoPProof() {
    TokenEndpointResult result = manager.token(credentials("bound").build());

    assertThat(result.error().error()).isEqualTo(Errors.INVALID_DPOP_PROOF);
  }

  @Test
  void token_nonceRequired_returnsNonceAndPublishesRejection() {
    when(dpopProofValidator.validate(any())).thenReturn(DPoPValidationResult.nonceRequired("n-123"));

    TokenEndpointResult result = manager.token(credentials("bound").withDpopProof("proof").build());

    assertThat(result.status()).isEqualTo(TokenEndpointResult.BAD_REQUEST);
    assertThat(result.error().error()).isEqualTo(Errors.USE_DPOP_NONCE);
    assertThat(result.dpopNonce()).isEqualTo("n-123");
    assertThat(events).singleElement().isInstanceOf(OlusoEvent.DPoPProofRejected.class);
  }

  @Test
  void token_invalidProof_isRejected() {
    when(dpopProofValidator.validate(any())).thenReturn(DPoPValidationResult.failure("Invalid DPoP proof signature"));

    TokenEndpointResult result = manager.token(credentials("bound").withDpopProof("proof").build());

    assertThat(result.error().description()).isEqualTo("Invalid DPoP proof signature");
    assertThat(events).hasSize(2).first().isInstanceOf(OlusoEvent.DPoPProofRejected.class);
  }

  @Test
  void token_grantBoundToOtherKey_isRejected() {
    when(codeHandler.handle(any(), any())).thenReturn(new GrantResult("user-1", null, Scopes.parse("reports"), null,
        null, null, null, null, "jkt-original", null, false, null));
    when(dpopProofValidator.validate(any())).thenReturn(DPoPValidationResult.success("jkt-other", proofKey));

    TokenEndpointResult result = manager.token(code().withDpopProof("proof").build());

    assertThat(result.error().description()).contains("does not match");
  }

  @Test
  void token_grantBoundButNoProof_isRejected() {
    when(codeHandler.handle(any(), any())).thenReturn(new GrantResult("user-1", null, Scopes.parse("reports"), null,
        null, null, null, null, "jkt-original", null, false, null));

    assertThat(manager.token(code().build()).error().error()).isEqualTo(Errors.INVALID_DPOP_PROOF);
  }

  @Test
  void token_grantFailure_isPassedThrough() {
    when(codeHandler.handle(any(), any())).thenReturn(GrantResult.failure(Errors.INVALID_GRANT, "Invalid code"));

    TokenEndpointResult result = manager.token(code().build());

    assertThat(result.error().error()).isEqualTo(Errors.INVALID_GRANT);
    assertThat(events).singleElement().isInstanceOfSatisfying(OlusoEvent.TokenRequestFailed.class,
        e -> assertThat(e.error()).isEqualTo(Errors.INVALID_GRANT));
  }

  @Test
  void constructor_duplicateGrantHandlers_areRejected() {
    assertThatThrownBy(() -> new TokenEndpointManager(new ClientAuthenticator(clients),
        new TokenRequestValidator(new ScopeValidator()), dpopProofValidator, null,
        Set.of(new ClientCredentialsGrantHandler(), new ClientCredentialsGrantHandler()), events::add,
        new OlusoServerConfig(ISSUER), clock))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static TokenRequest.Builder credentials(String clientId) {
    return TokenRequest.builder(GrantTypes.CLIENT_CREDENTIALS).withClientCredentials(clientId, "secret");
  }

  private static TokenRequest.Builder code() {
    return TokenRequest.builder(GrantTypes.AUTHORIZATION_CODE).withClientCredentials("worker", "secret").withCode("c1");
  }
}
