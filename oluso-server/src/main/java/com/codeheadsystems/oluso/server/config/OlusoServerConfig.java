package com.codeheadsystems.oluso.server.config;

/**
 * Server-wide protocol settings. Per-client policy lives in
 * {@link com.codeheadsystems.oluso.server.request.ValidatedClient}.
 *
 * @param issuerUri                        base issuer URI, without a trailing slash
 * @param authorizationCodeLifetimeSeconds lifetime of authorization codes
 * @param deviceCodeLifetimeSeconds        lifetime of device and user codes
 * @param deviceCodeInterval               minimum device polling interval in seconds
 * @param verificationUri                  page where users enter device user codes
 * @param parLifetimeSeconds               lifetime of pushed authorization request references
 * @param dpopProofLifetimeSeconds         maximum age of a DPoP proof
 * @param dpopClockSkewSeconds             tolerated clock skew for DPoP {@code iat}
 * @param hintTokenClockSkewSeconds        tolerated clock skew for login_hint_token lifetime
 * @param validateIdTokenHintLifetime      whether an expired id_token_hint is rejected
 * @param journeyLifetimeMinutes           default journey lifetime when a policy sets none
 */
public record OlusoServerConfig(String issuerUri,
                                int authorizationCodeLifetimeSeconds,
                                int deviceCodeLifetimeSeconds,
                                int deviceCodeInterval,
                                String verificationUri,
                                int parLifetimeSeconds,
                                int dpopProofLifetimeSeconds,
                                int dpopClockSkewSeconds,
                                int hintTokenClockSkewSeconds,
                                boolean validateIdTokenHintLifetime,
                                int journeyLifetimeMinutes) {

  public static final String DEFAULT_ISSUER = "https://localhost";

  /**
   * Instantiates a new config with development defaults.
   */
  public OlusoServerConfig() {
    this(DEFAULT_ISSUER);
  }

  /**
   * Instantiates a new config with defaults for the given issuer.
   *
   * @param issuerUri the issuer uri
   */
  public OlusoServerConfig(String issuerUri) {
    this(issuerUri, 300, 300, 5, issuerUri + "/device", 60, 60, 5, 300, false, 30);
  }

  /**
   * Issuer for the given tenant: the base issuer, suffixed with the tenant identifier when
   * one is present.
   *
   * @param tenantId the tenant id, may be null
   * @return the issuer
   */
  public String issuerFor(String tenantId) {
    if (tenantId == null || tenantId.isBlank()) {
      return issuerUri;
    }
    return issuerUri + "/" + tenantId;
  }
}
