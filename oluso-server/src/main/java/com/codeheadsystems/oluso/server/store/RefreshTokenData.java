package com.codeheadsystems.oluso.server.store;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Server-side state behind an opaque refresh token handle.
 *
 * @param handle    the refresh token handle given to the client
 * @param clientId  the client
 * @param subjectId the user
 * @param sessionId the session
 * @param tenantId  the tenant, may be null
 * @param scopes    the scopes originally granted
 * @param dpopJkt   thumbprint of the key the token is bound to, may be null
 * @param claims    claims to carry into refreshed tokens
 * @param createdAt issue time
 * @param expiresAt expiry time
 */
public record RefreshTokenData(String handle,
                               String clientId,
                               String subjectId,
                               String sessionId,
                               String tenantId,
                               Set<String> scopes,
                               String dpopJkt,
                               Map<String, Object> claims,
                               Instant createdAt,
                               Instant expiresAt) {

  public RefreshTokenData {
    scopes = Collections.unmodifiableSet(new LinkedHashSet<>(scopes));
    claims = claims == null ? Map.of() : Map.copyOf(claims);
  }

  public boolean isExpired(Instant now) {
    return expiresAt.isBefore(now);
  }
}
