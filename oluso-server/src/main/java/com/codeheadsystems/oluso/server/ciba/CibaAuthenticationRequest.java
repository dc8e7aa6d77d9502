package com.codeheadsystems.oluso.server.ciba;

/**
 * Parameters of a backchannel authentication request (CIBA Core section 7.1).
 *
 * @param clientId                the authenticated client
 * @param scope                   requested scopes, space separated
 * @param loginHint               e-mail, user name or subject id
 * @param loginHintToken          JWT identifying the user
 * @param idTokenHint             a previously issued ID token
 * @param bindingMessage          message displayed on both devices
 * @param userCode                secret known to the user
 * @param acrValues               requested acr values
 * @param requestedExpiry         requested lifetime in seconds, may be null
 * @param clientNotificationToken bearer token for ping and push callbacks
 */
public record CibaAuthenticationRequest(String clientId,
                                        String scope,
                                        String loginHint,
                                        String loginHintToken,
                                        String idTokenHint,
                                        String bindingMessage,
                                        String userCode,
                                        String acrValues,
                                        Integer requestedExpiry,
                                        String clientNotificationToken) {

  /**
   * A request identifying the user by login_hint only.
   *
   * @param clientId  the client
   * @param scope     the scope
   * @param loginHint the login hint
   * @return the request
   */
  public static CibaAuthenticationRequest withLoginHint(String clientId, String scope, String loginHint) {
    return new CibaAuthenticationRequest(clientId, scope, loginHint, null, null, null, null, null, null, null);
  }

  public boolean hasAnyHint() {
    return notEmpty(loginHint) || notEmpty(loginHintToken) || notEmpty(idTokenHint);
  }

  private static boolean notEmpty(String value) {
    return value != null && !value.isEmpty();
  }
}
