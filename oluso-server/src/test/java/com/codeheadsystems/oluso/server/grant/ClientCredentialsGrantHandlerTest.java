package com.codeheadsystems.oluso.server.grant;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.oluso.model.OidcConstants.Errors;
import com.codeheadsystems.oluso.model.OidcConstants.GrantTypes;
import com.codeheadsystems.oluso.server.request.ClientAuthenticationMethod;
import com.codeheadsystems.oluso.server.request.TokenRequest;
import com.codeheadsystems.oluso.server.request.ValidatedClient;
import org.junit.jupiter.api.Test;

class ClientCredentialsGrantHandlerTest {

  private final ClientCredentialsGrantHandler handler = new ClientCredentialsGrantHandler();
  private final ValidatedClient client = ValidatedClient.builder("worker")
      .withAllowedScopes("openid", "offline_access", "reports", "billing")
      .build();

  @Test
  void handle_noScope_grantsEveryNonUserScope() {
    GrantResult result = handler.handle(TokenRequest.builder(GrantTypes.CLIENT_CREDENTIALS).build(), client);

    assertThat(result.subjectId()).isNull();
    assertThat(result.scopes()).containsExactly("billing", "reports");
  }

  @Test
  void handle_requestedScopes_areGranted() {
    GrantResult result = handler.handle(TokenRequest.builder(GrantTypes.CLIENT_CREDENTIALS)
        .withScope("reports").build(), client);

    assertThat(result.scopes()).containsExactly("reports");
  }

  @Test
  void handle_userScopes_areRefused() {
    GrantResult result = handler.handle(TokenRequest.builder(GrantTypes.CLIENT_CREDENTIALS)
        .withScope("openid reports").build(), client);

    assertThat(result.error().error()).isEqualTo(Errors.INVALID_SCOPE);
  }

  @Test
  void handle_publicClient_isUnauthorized() {
    ValidatedClient publicClient = ValidatedClient.builder("spa").withAuthMethod(ClientAuthenticationMethod.NONE).build();

    assertThat(handler.handle(TokenRequest.builder(GrantTypes.CLIENT_CREDENTIALS).build(), publicClient)
        .error().error()).isEqualTo(Errors.UNAUTHORIZED_CLIENT);
  }
}
