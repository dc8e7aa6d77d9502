package com.codeheadsystems.oluso.server.resource;

import static com.codeheadsystems.oluso.server.resource.TokenResourceTest.form;
import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.oluso.model.OidcConstants.Errors;
import com.codeheadsystems.oluso.model.OidcConstants.GrantTypes;
import com.codeheadsystems.oluso.model.ciba.BackchannelAuthenticationResponse;
import com.codeheadsystems.oluso.model.token.TokenErrorResponse;
import com.codeheadsystems.oluso.server.ciba.CibaHintResolver;
import com.codeheadsystems.oluso.server.ciba.CibaRequest;
import com.codeheadsystems.oluso.server.ciba.CibaService;
import com.codeheadsystems.oluso.server.config.OlusoServerConfig;
import com.codeheadsystems.oluso.server.event.EventSink;
import com.codeheadsystems.oluso.server.keys.InMemorySigningCredentialStore;
import com.codeheadsystems.oluso.server.request.ValidatedClient;
import com.codeheadsystems.oluso.server.store.InMemoryCibaStore;
import com.codeheadsystems.oluso.server.store.InMemoryClientStore;
import com.codeheadsystems.oluso.server.store.RegisteredClient;
import com.codeheadsystems.oluso.server.user.InMemoryUserService;
import com.codeheadsystems.oluso.server.user.OlusoUser;
import com.codeheadsystems.oluso.server.validation.ClientAuthenticator;
import jakarta.ws.rs.core.MultivaluedMap;
import jakarta.ws.rs.core.Response;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Base64;
import java.util.Optional;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BackchannelAuthenticationResourceTest {

  private static InMemorySigningCredentialStore keys;

  private InMemoryCibaStore cibaStore;
  private BackchannelAuthenticationResource resource;

  @BeforeAll
  static void generateKeys() {
    keys = new InMemorySigningCredentialStore();
  }

  @BeforeEach
  void setUp() {
    InMemoryClientStore clients = new InMemoryClientStore();
    clients.save(RegisteredClient.withSecret(ValidatedClient.builder("bank")
        .withAllowedGrantTypes(GrantTypes.CIBA)
        .withAllowedScopes("openid", "payments")
        .withCibaEnabled(true)
        .build(), "secret"));
    InMemoryUserService users = new InMemoryUserService();
    users.save(new OlusoUser("user-1", "ada", "ada@example.com"));
    cibaStore = new InMemoryCibaStore();
    CibaService cibaService = new CibaService(cibaStore,
        new CibaHintResolver(users, keys, new OlusoServerConfig(), Clock.systemUTC()),
        Optional.empty(), EventSink.noop(), Clock.systemUTC());
    resource = new BackchannelAuthenticationResource(new ClientAuthenticator(clients), cibaService);
  }

  @Test
  void authenticate_knownUser_returnsAuthReqId() {
    Response response = resource.authenticate(basic("bank", "secret"), null, form(
        "scope", "openid payments", "login_hint", "ada@example.com", "binding_message", "Pay 10 EUR",
        "requested_expiry", "60"));

    assertThat(response.getStatus()).isEqualTo(200);
    BackchannelAuthenticationResponse body = (BackchannelAuthenticationResponse) response.getEntity();
    assertThat(body.expiresIn()).isEqualTo(60);
    assertThat(body.interval()).isEqualTo(5);
    CibaRequest stored = cibaStore.getByAuthReqId(body.authReqId()).orElseThrow();
    assertThat(stored.subjectId()).isEqualTo("user-1");
    assertThat(stored.bindingMessage()).isEqualTo("Pay 10 EUR");
  }

  @Test
  void authenticate_badCredentials_isUnauthorized() {
    Response response = resource.authenticate(basic("bank", "wrong"), null, form("login_hint", "ada"));

    assertThat(response.getStatus()).isEqualTo(401);
    assertThat(((TokenErrorResponse) response.getEntity()).error()).isEqualTo(Errors.INVALID_CLIENT);
  }

  @Test
  void authenticate_unknownUser_isBadRequest() {
    Response response = resource.authenticate(basic("bank", "secret"), null, form("login_hint", "nobody"));

    assertThat(response.getStatus()).isEqualTo(400);
    assertThat(((TokenErrorResponse) response.getEntity()).error()).isEqualTo(Errors.UNKNOWN_USER_ID);
  }

  @Test
  void authenticate_repeatedHint_isInvalidRequest() {
    MultivaluedMap<String, String> form = form("login_hint", "ada");
    form.add("login_hint", "bob");

    Response response = resource.authenticate(basic("bank", "secret"), null, form);

    assertThat(((TokenErrorResponse) response.getEntity()).error()).isEqualTo(Errors.INVALID_REQUEST);
  }

  private static String basic(String id, String secret) {
    return "Basic " + Base64.getEncoder().encodeToString((id + ":" + secret).getBytes(StandardCharsets.UTF_8));
  }
}
