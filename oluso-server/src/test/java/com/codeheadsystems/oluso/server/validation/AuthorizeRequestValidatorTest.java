package com.codeheadsystems.oluso.server.validation;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.oluso.model.OidcConstants.Errors;
import com.codeheadsystems.oluso.model.OidcConstants.GrantTypes;
import com.codeheadsystems.oluso.server.request.AuthorizeRequest;
import com.codeheadsystems.oluso.server.request.ClientAuthenticationMethod;
import com.codeheadsystems.oluso.server.request.ValidatedClient;
import com.codeheadsystems.oluso.server.store.InMemoryClientStore;
import com.codeheadsystems.oluso.server.store.RegisteredClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AuthorizeRequestValidatorTest {

  private static final String REDIRECT = "https://app.example.com/cb";
  private static final String CHALLENGE = "E9Melhoa2OwvFrEMTJguCHaoeK1t8URWbuGJSstw-cM";

  private InMemoryClientStore clientStore;
  private AuthorizeRequestValidator validator;

  @BeforeEach
  void setUp() {
    clientStore = new InMemoryClientStore();
    clientStore.save(RegisteredClient.publicClient(ValidatedClient.builder("spa")
        .withTenantId("acme")
        .withAuthMethod(ClientAuthenticationMethod.NONE)
        .withAllowedGrantTypes(GrantTypes.AUTHORIZATION_CODE)
        .withAllowedScopes("openid", "profile")
        .withRedirectUris(REDIRECT)
        .build()));
    clientStore.save(RegisteredClient.publicClient(ValidatedClient.builder("par-only")
        .withAuthMethod(ClientAuthenticationMethod.NONE)
        .withAllowedGrantTypes(GrantTypes.AUTHORIZATION_CODE)
        .withAllowedScopes("openid")
        .withRedirectUris(REDIRECT)
        .withRequirePushedAuthorization(true)
        .build()));
    clientStore.save(RegisteredClient.publicClient(ValidatedClient.builder("machine")
        .withAuthMethod(ClientAuthenticationMethod.NONE)
        .withAllowedGrantTypes(GrantTypes.CLIENT_CREDENTIALS)
        .withAllowedScopes("openid")
        .withRedirectUris(REDIRECT)
        .build()));
    validator = new AuthorizeRequestValidator(clientStore, new RedirectUriValidator(), new ScopeValidator(),
        new PkceValidator());
  }

  @Test
  void validate_wellFormedRequest_passes() {
    AuthorizeValidationResult result = validator.validate(request("spa").build(), false);

    assertThat(result.isValid()).isTrue();
    assertThat(result.client().clientId()).isEqualTo("spa");
  }

  @Test
  void validate_missingOrUnknownClient_isNotRedirectable() {
    AuthorizeValidationResult missing = validator.validate(request(null).build(), false);
    AuthorizeValidationResult unknown = validator.validate(request("nobody").build(), false);

    assertThat(missing.error().error()).isEqualTo(Errors.INVALID_REQUEST);
    assertThat(missing.error().redirectUriValidated()).isFalse();
    assertThat(unknown.error().error()).isEqualTo(Errors.INVALID_CLIENT);
    assertThat(unknown.client()).isNull();
  }

  @Test
  void validate_clientOfAnotherTenant_isUnknown() {
    AuthorizeValidationResult result = validator.validate(request("spa").withTenantId("globex").build(), false);

    assertThat(result.error().error()).isEqualTo(Errors.INVALID_CLIENT);
  }

  @Test
  void validate_unregisteredRedirect_isNotRedirectable() {
    AuthorizeValidationResult result = validator.validate(
        request("spa").withRedirectUri("https://evil.example.com/cb").build(), false);

    assertThat(result.error().error()).isEqualTo(Errors.INVALID_REQUEST);
    assertThat(result.error().redirectUriValidated()).isFalse();
    assertThat(result.client()).isNotNull();
  }

  @Test
  void validate_errorsAfterRedirectCheck_areRedirectable() {
    AuthorizeValidationResult responseType = validator.validate(request("spa").withResponseType("token").build(), false);
    AuthorizeValidationResult scope = validator.validate(request("spa").withScope("openid admin").build(), false);
    AuthorizeValidationResult pkce = validator.validate(request("spa").withCodeChallenge(null, null).build(), false);

    assertThat(responseType.error().error()).isEqualTo(Errors.UNSUPPORTED_RESPONSE_TYPE);
    assertThat(responseType.error().redirectUriValidated()).isTrue();
    assertThat(scope.error().error()).isEqualTo(Errors.INVALID_SCOPE);
    assertThat(scope.error().redirectUriValidated()).isTrue();
    assertThat(pkce.error().error()).isEqualTo(Errors.INVALID_REQUEST);
    assertThat(pkce.error().redirectUriValidated()).isTrue();
  }

  @Test
  void validate_emptyScope_isInvalidScope() {
    assertThat(validator.validate(request("spa").withScope(" ").build(), false).error().error())
        .isEqualTo(Errors.INVALID_SCOPE);
  }

  @Test
  void validate_pushedAuthorizationRequiredUnlessPushed() {
    assertThat(validator.validate(request("par-only").withScope("openid").build(), false).isValid()).isFalse();
    assertThat(validator.validate(request("par-only").withScope("openid").build(), true).isValid()).isTrue();
  }

  @Test
  void validate_clientWithoutCodeGrant_isUnauthorized() {
    assertThat(validator.validate(request("machine").withScope("openid").build(), false).error().error())
        .isEqualTo(Errors.UNAUTHORIZED_CLIENT);
  }

  @Test
  void validate_hybridResponseTypeNeedsOpenIdAndNonce() {
    AuthorizeValidationResult noNonce = validator.validate(
        request("spa").withResponseType("code id_token").build(), false);
    AuthorizeValidationResult noOpenId = validator.validate(
        request("spa").withResponseType("code id_token").withScope("profile").withNonce("n-1").build(), false);
    AuthorizeValidationResult ok = validator.validate(
        request("spa").withResponseType("code id_token").withNonce("n-1").build(), false);

    assertThat(noNonce.error().description()).contains("nonce");
    assertThat(noOpenId.error().description()).contains("openid");
    assertThat(ok.isValid()).isTrue();
  }

  @Test
  void validate_promptNoneCannotBeCombined() {
    assertThat(validator.validate(request("spa").withPrompt("none login").build(), false).error().error())
        .isEqualTo(Errors.INVALID_REQUEST);
    assertThat(validator.validate(request("spa").withPrompt("none").build(), false).isValid()).isTrue();
  }

  private static AuthorizeRequest.Builder request(String clientId) {
    return AuthorizeRequest.builder()
        .withClientId(clientId)
        .withRedirectUri(REDIRECT)
        .withScope("openid profile")
        .withState("xyz")
        .withCodeChallenge(CHALLENGE, "S256");
  }
}
