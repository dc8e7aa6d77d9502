package com.codeheadsystems.oluso.server.token;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything the {@link TokenIssuer} needs to mint one set of tokens.
 *
 * @param clientId              the client
 * @param tenantId              the tenant, may be null
 * @param subjectId             the user, null for client credentials
 * @param sessionId             the user's session
 * @param scopes                granted scopes
 * @param claims                extra claims; standard claims always take precedence
 * @param audiences             access token audiences, empty means the client id
 * @param accessTokenLifetime   seconds
 * @param identityTokenLifetime seconds
 * @param dpopJkt               thumbprint to bind via {@code cnf.jkt}, may be null
 * @param nonce                 OIDC nonce
 * @param authTime              authentication time
 * @param amr                   authentication methods
 * @param acr                   authentication context class
 */
public record TokenCreationRequest(String clientId,
                                   String tenantId,
                                   String subjectId,
                                   String sessionId,
                                   Set<String> scopes,
                                   Map<String, Object> claims,
                                   List<String> audiences,
                                   int accessTokenLifetime,
                                   int identityTokenLifetime,
                                   String dpopJkt,
                                   String nonce,
                                   Instant authTime,
                                   List<String> amr,
                                   String acr) {

  public TokenCreationRequest {
    scopes = scopes == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(scopes));
    claims = claims == null ? Map.of() : Map.copyOf(claims);
    audiences = audiences == null ? List.of() : List.copyOf(audiences);
    amr = amr == null ? List.of() : List.copyOf(amr);
  }
}
