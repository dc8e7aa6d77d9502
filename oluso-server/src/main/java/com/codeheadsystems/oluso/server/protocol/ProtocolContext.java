package com.codeheadsystems.oluso.server.protocol;

/**
 * Per-request protocol context handed to every endpoint handler. Holds values only.
 *
 * @param endpointType  the endpoint being served
 * @param tenantId      the resolved tenant, null for the global tenant
 * @param clientId      the requesting client, when known
 * @param uiMode        the resolved UI mode
 * @param policyId      the journey policy requested or resolved for this flow, may be null
 * @param correlationId identifier carried across user-agent redirects to recover state
 */
public record ProtocolContext(EndpointType endpointType,
                              String tenantId,
                              String clientId,
                              UiMode uiMode,
                              String policyId,
                              String correlationId) {

  /**
   * Copy of this context bound to a resolved journey policy.
   *
   * @param resolvedPolicyId the policy id
   * @return the protocol context
   */
  public ProtocolContext withPolicyId(String resolvedPolicyId) {
    return new ProtocolContext(endpointType, tenantId, clientId, uiMode, resolvedPolicyId, correlationId);
  }
}
