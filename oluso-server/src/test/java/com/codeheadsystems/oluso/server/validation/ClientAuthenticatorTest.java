package com.codeheadsystems.oluso.server.validation;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.oluso.model.OidcConstants.ClientAssertionTypes;
import com.codeheadsystems.oluso.model.OidcConstants.Errors;
import com.codeheadsystems.oluso.model.OidcConstants.GrantTypes;
import com.codeheadsystems.oluso.server.request.ClientAuthenticationMethod;
import com.codeheadsystems.oluso.server.request.TokenRequest;
import com.codeheadsystems.oluso.server.request.ValidatedClient;
import com.codeheadsystems.oluso.server.store.InMemoryClientStore;
import com.codeheadsystems.oluso.server.store.RegisteredClient;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ClientAuthenticatorTest {

  private ClientAuthenticator authenticator;

  @BeforeEach
  void setUp() {
    InMemoryClientStore store = new InMemoryClientStore();
    store.save(RegisteredClient.withSecret(ValidatedClient.builder("api").withTenantId("acme").build(), "s3cr:t"));
    store.save(RegisteredClient.publicClient(ValidatedClient.builder("spa")
        .withAuthMethod(ClientAuthenticationMethod.NONE).build()));
    authenticator = new ClientAuthenticator(store);
  }

  @Test
  void authenticate_basicHeader_decodesFormEncodedCredentials() {
    ClientAuthenticationResult result = authenticator.authenticate(request()
        .withAuthorizationHeader(basic("api", "s3cr%3At")).build());

    assertThat(result.isAuthenticated()).isTrue();
    assertThat(result.method()).isEqualTo(ClientAuthenticationMethod.CLIENT_SECRET_BASIC);
    assertThat(result.client().clientId()).isEqualTo("api");
  }

  @Test
  void authenticate_basicHeaderWithWrongSecret_fails() {
    ClientAuthenticationResult result = authenticator.authenticate(request()
        .withAuthorizationHeader(basic("api", "nope")).build());

    assertThat(result.error().error()).isEqualTo(Errors.INVALID_CLIENT);
  }

  @Test
  void authenticate_basicHeaderMismatchingFormClientId_fails() {
    ClientAuthenticationResult result = authenticator.authenticate(request()
        .withClientId("spa")
        .withAuthorizationHeader(basic("api", "s3cr:t")).build());

    assertThat(result.isAuthenticated()).isFalse();
  }

  @Test
  void authenticate_malformedBasicHeader_fails() {
    assertThat(authenticator.authenticate(request().withAuthorizationHeader("Basic !!!").build()).isAuthenticated())
        .isFalse();
    String noColon = "Basic " + Base64.getEncoder().encodeToString("api".getBytes(StandardCharsets.UTF_8));
    assertThat(authenticator.authenticate(request().withAuthorizationHeader(noColon).build()).isAuthenticated())
        .isFalse();
  }

  @Test
  void authenticate_postedSecret_succeeds() {
    ClientAuthenticationResult result = authenticator.authenticate(request()
        .withClientCredentials("api", "s3cr:t").build());

    assertThat(result.method()).isEqualTo(ClientAuthenticationMethod.CLIENT_SECRET_POST);
  }

  @Test
  void authenticate_clientOfAnotherTenant_isUnknown() {
    ClientAuthenticationResult result = authenticator.authenticate(request()
        .withClientCredentials("api", "s3cr:t").withTenantId("globex").build());

    assertThat(result.error().description()).isEqualTo("Unknown client");
  }

  @Test
  void authenticate_clientAssertion_isUnsupported() {
    ClientAuthenticationResult result = authenticator.authenticate(request()
        .withClientId("api")
        .withClientAssertion("eyJ...", ClientAssertionTypes.JWT_BEARER).build());

    assertThat(result.error().error()).isEqualTo(Errors.INVALID_CLIENT);
  }

  @Test
  void authenticate_publicClientById_succeedsOnlyForPublicClients() {
    assertThat(authenticator.authenticate(request().withClientId("spa").build()).method())
        .isEqualTo(ClientAuthenticationMethod.NONE);
    assertThat(authenticator.authenticate(request().withClientId("api").build()).isAuthenticated()).isFalse();
    assertThat(authenticator.authenticate(request().withClientId("ghost").build()).isAuthenticated()).isFalse();
  }

  @Test
  void authenticate_publicClientPresentingSecret_fails() {
    assertThat(authenticator.authenticate(request().withClientCredentials("spa", "x").build()).isAuthenticated())
        .isFalse();
  }

  @Test
  void authenticate_nothingPresented_fails() {
    assertThat(authenticator.authenticate(request().build()).error().error()).isEqualTo(Errors.INVALID_CLIENT);
  }

  private static TokenRequest.Builder request() {
    return TokenRequest.builder(GrantTypes.CLIENT_CREDENTIALS);
  }

  private static String basic(String id, String secret) {
    return "Basic " + Base64.getEncoder().encodeToString((id + ":" + secret).getBytes(StandardCharsets.UTF_8));
  }
}
