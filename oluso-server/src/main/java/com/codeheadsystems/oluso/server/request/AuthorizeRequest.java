package com.codeheadsystems.oluso.server.request;

import com.codeheadsystems.oluso.model.OidcConstants;
import java.util.List;
import java.util.Set;

/**
 * One authorization attempt as received at the authorize (or PAR) endpoint. Never mutated;
 * redemption produces an {@link AuthorizationCodeData}.
 */
public record AuthorizeRequest(String clientId,
                               String responseType,
                               String redirectUri,
                               String scope,
                               String state,
                               String codeChallenge,
                               String codeChallengeMethod,
                               String nonce,
                               String responseMode,
                               String prompt,
                               Integer maxAge,
                               String loginHint,
                               String idTokenHint,
                               String acrValues,
                               String uiLocales,
                               String requestUri,
                               String uiMode,
                               String policy,
                               List<String> resources,
                               String dpopJkt,
                               String tenantId) {

  public AuthorizeRequest {
    resources = resources == null ? List.of() : List.copyOf(resources);
  }

  public Set<String> requestedScopes() {
    return Scopes.parse(scope);
  }

  public boolean isOpenIdRequest() {
    return requestedScopes().contains(OidcConstants.Scopes.OPENID);
  }

  public Set<String> promptModes() {
    return Scopes.parse(prompt);
  }

  public Set<String> acrValueList() {
    return Scopes.parse(acrValues);
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private String clientId;
    private String responseType = OidcConstants.ResponseTypes.CODE;
    private String redirectUri;
    private String scope;
    private String state;
    private String codeChallenge;
    private String codeChallengeMethod;
    private String nonce;
    private String responseMode;
    private String prompt;
    private Integer maxAge;
    private String loginHint;
    private String idTokenHint;
    private String acrValues;
    private String uiLocales;
    private String requestUri;
    private String uiMode;
    private String policy;
    private List<String> resources = List.of();
    private String dpopJkt;
    private String tenantId;

    private Builder() {
    }

    public Builder withClientId(String value) {
      this.clientId = value;
      return this;
    }

    public Builder withResponseType(String value) {
      this.responseType = value;
      return this;
    }

    public Builder withRedirectUri(String value) {
      this.redirectUri = value;
      return this;
    }

    public Builder withScope(String value) {
      this.scope = value;
      return this;
    }

    public Builder withState(String value) {
      this.state = value;
      return this;
    }

    public Builder withCodeChallenge(String challenge, String method) {
      this.codeChallenge = challenge;
      this.codeChallengeMethod = method;
      return this;
    }

    public Builder withNonce(String value) {
      this.nonce = value;
      return this;
    }

    public Builder withResponseMode(String value) {
      this.responseMode = value;
      return this;
    }

    public Builder withPrompt(String value) {
      this.prompt = value;
      return this;
    }

    public Builder withMaxAge(Integer value) {
      this.maxAge = value;
      return this;
    }

    public Builder withLoginHint(String value) {
      this.loginHint = value;
      return this;
    }

    public Builder withIdTokenHint(String value) {
      this.idTokenHint = value;
      return this;
    }

    public Builder withAcrValues(String value) {
      this.acrValues = value;
      return this;
    }

    public Builder withUiLocales(String value) {
      this.uiLocales = value;
      return this;
    }

    public Builder withRequestUri(String value) {
      this.requestUri = value;
      return this;
    }

    public Builder withUiMode(String value) {
      this.uiMode = value;
      return this;
    }

    public Builder withPolicy(String value) {
      this.policy = value;
      return this;
    }

    public Builder withResources(List<String> value) {
      this.resources = value;
      return this;
    }

    public Builder withDpopJkt(String value) {
      this.dpopJkt = value;
      return this;
    }

    public Builder withTenantId(String value) {
      this.tenantId = value;
      return this;
    }

    public AuthorizeRequest build() {
      return new AuthorizeRequest(clientId, responseType, redirectUri, scope, state, codeChallenge,
          codeChallengeMethod, nonce, responseMode, prompt, maxAge, loginHint, idTokenHint, acrValues,
          uiLocales, requestUri, uiMode, policy, resources, dpopJkt, tenantId);
    }
  }
}
