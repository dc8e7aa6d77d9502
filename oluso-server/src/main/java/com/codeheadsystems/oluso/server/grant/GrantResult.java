package com.codeheadsystems.oluso.server.grant;

import com.codeheadsystems.oluso.server.protocol.ProtocolError;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * What a validated grant entitles the client to.
 *
 * @param subjectId            the user, null for client credentials
 * @param sessionId            the user's session
 * @param scopes               granted scopes
 * @param claims               extra claims for the issued tokens
 * @param nonce                OIDC nonce to echo in the ID token
 * @param authTime             when the user authenticated
 * @param amr                  authentication methods
 * @param acr                  authentication context class
 * @param boundJkt             DPoP key thumbprint the grant is already bound to
 * @param issuedTokenType      token exchange only: the issued token type
 * @param rotatedRefreshToken  refresh grant only: whether a new refresh token must replace the old one
 * @param error                the failure, null on success
 */
public record GrantResult(String subjectId,
                          String sessionId,
                          Set<String> scopes,
                          Map<String, Object> claims,
                          String nonce,
                          Instant authTime,
                          List<String> amr,
                          String acr,
                          String boundJkt,
                          String issuedTokenType,
                          boolean rotatedRefreshToken,
                          ProtocolError error) {

  public GrantResult {
    scopes = scopes == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(scopes));
    claims = claims == null ? Map.of() : Map.copyOf(claims);
    amr = amr == null ? List.of() : List.copyOf(amr);
  }

  public static GrantResult failure(String error, String description) {
    return new GrantResult(null, null, null, null, null, null, null, null, null, null, false,
        ProtocolError.of(error, description));
  }

  /**
   * A grant for a subject with no extra authentication context.
   *
   * @param subjectId the user, may be null
   * @param sessionId the session, may be null
   * @param scopes    the scopes
   * @return the grant result
   */
  public static GrantResult of(String subjectId, String sessionId, Set<String> scopes) {
    return new GrantResult(subjectId, sessionId, scopes, null, null, null, null, null, null, null, false, null);
  }

  public boolean isSuccess() {
    return error == null;
  }
}
