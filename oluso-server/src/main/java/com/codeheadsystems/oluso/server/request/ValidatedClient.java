package com.codeheadsystems.oluso.server.request;

import com.codeheadsystems.oluso.server.protocol.UiMode;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Snapshot of a client's policy, resolved once per request and immutable for its duration.
 *
 * @param clientId                       the client id
 * @param clientName                     display name
 * @param tenantId                       owning tenant, null for global clients
 * @param authMethod                     token endpoint authentication method
 * @param allowedGrantTypes              grant types this client may use
 * @param allowedScopes                  scopes this client may request
 * @param redirectUris                   registered redirect uris
 * @param requirePkce                    whether authorization code requests must use PKCE
 * @param allowPlainTextPkce             whether the {@code plain} challenge method is accepted
 * @param allowOfflineAccess             whether refresh tokens may be issued
 * @param accessTokenLifetime            access token lifetime in seconds
 * @param identityTokenLifetime          ID token lifetime in seconds
 * @param refreshTokenLifetime           refresh token lifetime in seconds
 * @param rotateRefreshTokens            whether refresh tokens are one-time use
 * @param requireDPoP                    whether tokens must be DPoP bound
 * @param requirePushedAuthorization     whether authorize requests must come through PAR
 * @param requireConsent                 whether the user must consent
 * @param allowedUiModes                 UI modes the client may request, empty for all
 * @param cibaEnabled                    whether the client may use CIBA
 * @param cibaTokenDeliveryMode          poll, ping or push
 * @param cibaClientNotificationEndpoint callback for ping and push modes
 * @param cibaRequestLifetime            maximum CIBA request lifetime in seconds
 * @param cibaPollingInterval            CIBA polling interval in seconds
 * @param cibaRequireUserCode            whether a user code must accompany CIBA requests
 * @param properties                     free-form client properties
 */
public record ValidatedClient(String clientId,
                              String clientName,
                              String tenantId,
                              ClientAuthenticationMethod authMethod,
                              Set<String> allowedGrantTypes,
                              Set<String> allowedScopes,
                              List<String> redirectUris,
                              boolean requirePkce,
                              boolean allowPlainTextPkce,
                              boolean allowOfflineAccess,
                              int accessTokenLifetime,
                              int identityTokenLifetime,
                              int refreshTokenLifetime,
                              boolean rotateRefreshTokens,
                              boolean requireDPoP,
                              boolean requirePushedAuthorization,
                              boolean requireConsent,
                              Set<UiMode> allowedUiModes,
                              boolean cibaEnabled,
                              CibaTokenDeliveryMode cibaTokenDeliveryMode,
                              String cibaClientNotificationEndpoint,
                              int cibaRequestLifetime,
                              int cibaPollingInterval,
                              boolean cibaRequireUserCode,
                              Map<String, String> properties) {

  public ValidatedClient {
    if (clientId == null || clientId.isBlank()) {
      throw new IllegalArgumentException("clientId is required");
    }
    allowedGrantTypes = Set.copyOf(allowedGrantTypes);
    allowedScopes = Set.copyOf(allowedScopes);
    redirectUris = List.copyOf(redirectUris);
    allowedUiModes = Set.copyOf(allowedUiModes);
    properties = Map.copyOf(properties);
  }

  public boolean isPublicClient() {
    return authMethod == ClientAuthenticationMethod.NONE;
  }

  public boolean allowsUiMode(UiMode mode) {
    return allowedUiModes.isEmpty() || allowedUiModes.contains(mode);
  }

  public static Builder builder(String clientId) {
    return new Builder(clientId);
  }

  /**
   * Builder with the defaults new clients get.
   */
  public static final class Builder {
    private final String clientId;
    private String clientName;
    private String tenantId;
    private ClientAuthenticationMethod authMethod = ClientAuthenticationMethod.CLIENT_SECRET_BASIC;
    private Set<String> allowedGrantTypes = Set.of();
    private Set<String> allowedScopes = Set.of();
    private List<String> redirectUris = List.of();
    private boolean requirePkce = true;
    private boolean allowPlainTextPkce;
    private boolean allowOfflineAccess;
    private int accessTokenLifetime = 3600;
    private int identityTokenLifetime = 300;
    private int refreshTokenLifetime = 2_592_000;
    private boolean rotateRefreshTokens = true;
    private boolean requireDPoP;
    private boolean requirePushedAuthorization;
    private boolean requireConsent;
    private Set<UiMode> allowedUiModes = Set.of();
    private boolean cibaEnabled;
    private CibaTokenDeliveryMode cibaTokenDeliveryMode = CibaTokenDeliveryMode.POLL;
    private String cibaClientNotificationEndpoint;
    private int cibaRequestLifetime = 120;
    private int cibaPollingInterval = 5;
    private boolean cibaRequireUserCode;
    private Map<String, String> properties = Map.of();

    private Builder(String clientId) {
      this.clientId = clientId;
    }

    public Builder withClientName(String value) {
      this.clientName = value;
      return this;
    }

    public Builder withTenantId(String value) {
      this.tenantId = value;
      return this;
    }

    public Builder withAuthMethod(ClientAuthenticationMethod value) {
      this.authMethod = value;
      return this;
    }

    public Builder withAllowedGrantTypes(String... values) {
      this.allowedGrantTypes = Set.of(values);
      return this;
    }

    public Builder withAllowedScopes(String... values) {
      this.allowedScopes = Set.of(values);
      return this;
    }

    public Builder withRedirectUris(String... values) {
      this.redirectUris = List.of(values);
      return this;
    }

    public Builder withRequirePkce(boolean value) {
      this.requirePkce = value;
      return this;
    }

    public Builder withAllowPlainTextPkce(boolean value) {
      this.allowPlainTextPkce = value;
      return this;
    }

    public Builder withAllowOfflineAccess(boolean value) {
      this.allowOfflineAccess = value;
      return this;
    }

    public Builder withAccessTokenLifetime(int value) {
      this.accessTokenLifetime = value;
      return this;
    }

    public Builder withIdentityTokenLifetime(int value) {
      this.identityTokenLifetime = value;
      return this;
    }

    public Builder withRefreshTokenLifetime(int value) {
      this.refreshTokenLifetime = value;
      return this;
    }

    public Builder withRotateRefreshTokens(boolean value) {
      this.rotateRefreshTokens = value;
      return this;
    }

    public Builder withRequireDPoP(boolean value) {
      this.requireDPoP = value;
      return this;
    }

    public Builder withRequirePushedAuthorization(boolean value) {
      this.requirePushedAuthorization = value;
      return this;
    }

    public Builder withRequireConsent(boolean value) {
      this.requireConsent = value;
      return this;
    }

    public Builder withAllowedUiModes(UiMode... values) {
      this.allowedUiModes = Set.of(values);
      return this;
    }

    public Builder withCibaEnabled(boolean value) {
      this.cibaEnabled = value;
      return this;
    }

    public Builder withCibaTokenDeliveryMode(CibaTokenDeliveryMode value) {
      this.cibaTokenDeliveryMode = value;
      return this;
    }

    public Builder withCibaClientNotificationEndpoint(String value) {
      this.cibaClientNotificationEndpoint = value;
      return this;
    }

    public Builder withCibaRequestLifetime(int value) {
      this.cibaRequestLifetime = value;
      return this;
    }

    public Builder withCibaPollingInterval(int value) {
      this.cibaPollingInterval = value;
      return this;
    }

    public Builder withCibaRequireUserCode(boolean value) {
      this.cibaRequireUserCode = value;
      return this;
    }

    public Builder withProperties(Map<String, String> value) {
      this.properties = value;
      return this;
    }

    public ValidatedClient build() {
      return new ValidatedClient(clientId, clientName, tenantId, authMethod, allowedGrantTypes,
          allowedScopes, redirectUris, requirePkce, allowPlainTextPkce, allowOfflineAccess,
          accessTokenLifetime, identityTokenLifetime, refreshTokenLifetime, rotateRefreshTokens,
          requireDPoP, requirePushedAuthorization, requireConsent, allowedUiModes, cibaEnabled,
          cibaTokenDeliveryMode, cibaClientNotificationEndpoint, cibaRequestLifetime,
          cibaPollingInterval, cibaRequireUserCode, properties);
    }
  }
}
