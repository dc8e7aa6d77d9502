package com.codeheadsystems.oluso.server.request;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * State bound to an issued authorization code. Single use: the code store hands it out once.
 *
 * @param code                the code handle
 * @param clientId            the client the code was issued to
 * @param subjectId           the authenticated user
 * @param sessionId           the user's session
 * @param tenantId            the tenant, may be null
 * @param redirectUri         redirect uri of the authorize request, must be repeated exactly
 * @param codeChallenge       PKCE challenge, may be null
 * @param codeChallengeMethod PKCE method, may be null
 * @param dpopJkt             thumbprint of the DPoP key the code is bound to, may be null
 * @param nonce               OIDC nonce to echo in the ID token
 * @param scopes              granted scopes
 * @param claims              extra claims captured at authentication time
 * @param authTime            when the user authenticated
 * @param amr                 authentication methods used
 * @param acr                 authentication context class reached
 * @param expiresAt           code expiry
 */
public record AuthorizationCodeData(String code,
                                    String clientId,
                                    String subjectId,
                                    String sessionId,
                                    String tenantId,
                                    String redirectUri,
                                    String codeChallenge,
                                    String codeChallengeMethod,
                                    String dpopJkt,
                                    String nonce,
                                    Set<String> scopes,
                                    Map<String, Object> claims,
                                    Instant authTime,
                                    List<String> amr,
                                    String acr,
                                    Instant expiresAt) {

  public AuthorizationCodeData {
    scopes = Collections.unmodifiableSet(new LinkedHashSet<>(scopes));
    claims = claims == null ? Map.of() : Map.copyOf(claims);
    amr = amr == null ? List.of() : List.copyOf(amr);
  }

  public boolean isExpired(Instant now) {
    return expiresAt.isBefore(now);
  }
}
