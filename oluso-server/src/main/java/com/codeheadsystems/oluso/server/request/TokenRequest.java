package com.codeheadsystems.oluso.server.request;

import java.util.List;
import java.util.Set;

/**
 * One token endpoint request, covering the parameters of every supported grant type.
 * {@code dpopProof} is the raw {@code DPoP} header and {@code authorizationHeader} the raw
 * {@code Authorization} header.
 */
public record TokenRequest(String grantType,
                           String clientId,
                           String clientSecret,
                           String authorizationHeader,
                           String clientAssertion,
                           String clientAssertionType,
                           String code,
                           String redirectUri,
                           String codeVerifier,
                           String refreshToken,
                           String deviceCode,
                           String authReqId,
                           String subjectToken,
                           String subjectTokenType,
                           String actorToken,
                           String actorTokenType,
                           String requestedTokenType,
                           String audience,
                           String scope,
                           List<String> resources,
                           String dpopProof,
                           String tenantId) {

  public TokenRequest {
    resources = resources == null ? List.of() : List.copyOf(resources);
  }

  public Set<String> requestedScopes() {
    return Scopes.parse(scope);
  }

  public static Builder builder(String grantType) {
    return new Builder(grantType);
  }

  public static final class Builder {
    private final String grantType;
    private String clientId;
    private String clientSecret;
    private String authorizationHeader;
    private String clientAssertion;
    private String clientAssertionType;
    private String code;
    private String redirectUri;
    private String codeVerifier;
    private String refreshToken;
    private String deviceCode;
    private String authReqId;
    private String subjectToken;
    private String subjectTokenType;
    private String actorToken;
    private String actorTokenType;
    private String requestedTokenType;
    private String audience;
    private String scope;
    private List<String> resources = List.of();
    private String dpopProof;
    private String tenantId;

    private Builder(String grantType) {
      this.grantType = grantType;
    }

    public Builder withClientCredentials(String id, String secret) {
      this.clientId = id;
      this.clientSecret = secret;
      return this;
    }

    public Builder withClientId(String value) {
      this.clientId = value;
      return this;
    }

    public Builder withAuthorizationHeader(String value) {
      this.authorizationHeader = value;
      return this;
    }

    public Builder withClientAssertion(String assertion, String assertionType) {
      this.clientAssertion = assertion;
      this.clientAssertionType = assertionType;
      return this;
    }

    public Builder withCode(String value) {
      this.code = value;
      return this;
    }

    public Builder withRedirectUri(String value) {
      this.redirectUri = value;
      return this;
    }

    public Builder withCodeVerifier(String value) {
      this.codeVerifier = value;
      return this;
    }

    public Builder withRefreshToken(String value) {
      this.refreshToken = value;
      return this;
    }

    public Builder withDeviceCode(String value) {
      this.deviceCode = value;
      return this;
    }

    public Builder withAuthReqId(String value) {
      this.authReqId = value;
      return this;
    }

    public Builder withSubjectToken(String token, String tokenType) {
      this.subjectToken = token;
      this.subjectTokenType = tokenType;
      return this;
    }

    public Builder withActorToken(String token, String tokenType) {
      this.actorToken = token;
      this.actorTokenType = tokenType;
      return this;
    }

    public Builder withRequestedTokenType(String value) {
      this.requestedTokenType = value;
      return this;
    }

    public Builder withAudience(String value) {
      this.audience = value;
      return this;
    }

    public Builder withScope(String value) {
      this.scope = value;
      return this;
    }

    public Builder withResources(List<String> value) {
      this.resources = value;
      return this;
    }

    public Builder withDpopProof(String value) {
      this.dpopProof = value;
      return this;
    }

    public Builder withTenantId(String value) {
      this.tenantId = value;
      return this;
    }

    public TokenRequest build() {
      return new TokenRequest(grantType, clientId, clientSecret, authorizationHeader, clientAssertion,
          clientAssertionType, code, redirectUri, codeVerifier, refreshToken, deviceCode, authReqId,
          subjectToken, subjectTokenType, actorToken, actorTokenType, requestedTokenType, audience,
          scope, resources, dpopProof, tenantId);
    }
  }
}
