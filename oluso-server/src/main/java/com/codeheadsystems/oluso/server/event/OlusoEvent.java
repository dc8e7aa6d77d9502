package com.codeheadsystems.oluso.server.event;

import java.time.Instant;
import java.util.Set;

/**
 * Audit events raised by the protocol core. The set of variants is closed so that every sink
 * handles all of them.
 */
public sealed interface OlusoEvent {

  Instant occurredAt();

  String tenantId();

  String clientId();

  /**
   * A backchannel authentication request was accepted.
   */
  record CibaRequestCreated(Instant occurredAt, String tenantId, String clientId, String subjectId,
                            String deliveryMode) implements OlusoEvent {
  }

  /**
   * A backchannel authentication request was approved or denied by the user.
   */
  record CibaRequestCompleted(Instant occurredAt, String tenantId, String clientId, String subjectId,
                              boolean approved) implements OlusoEvent {
  }

  /**
   * Tokens were issued at the token endpoint.
   */
  record TokenIssued(Instant occurredAt, String tenantId, String clientId, String subjectId,
                     String grantType, Set<String> scopes, boolean dpopBound) implements OlusoEvent {
  }

  /**
   * A token request failed with a protocol error.
   */
  record TokenRequestFailed(Instant occurredAt, String tenantId, String clientId, String grantType,
                            String error) implements OlusoEvent {
  }

  /**
   * A DPoP proof was rejected.
   */
  record DPoPProofRejected(Instant occurredAt, String tenantId, String clientId, String reason)
      implements OlusoEvent {
  }

  /**
   * A journey reached a terminal state.
   */
  record JourneyCompleted(Instant occurredAt, String tenantId, String clientId, String journeyId,
                          String policyId, String userId, boolean succeeded) implements OlusoEvent {
  }
}
