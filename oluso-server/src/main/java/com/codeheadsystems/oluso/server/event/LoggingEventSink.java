package com.codeheadsystems.oluso.server.event;

import com.codeheadsystems.oluso.server.event.OlusoEvent.CibaRequestCompleted;
import com.codeheadsystems.oluso.server.event.OlusoEvent.CibaRequestCreated;
import com.codeheadsystems.oluso.server.event.OlusoEvent.DPoPProofRejected;
import com.codeheadsystems.oluso.server.event.OlusoEvent.JourneyCompleted;
import com.codeheadsystems.oluso.server.event.OlusoEvent.TokenIssued;
import com.codeheadsystems.oluso.server.event.OlusoEvent.TokenRequestFailed;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes audit events to the {@code oluso.audit} logger.
 */
@Singleton
public class LoggingEventSink implements EventSink {

  private static final Logger audit = LoggerFactory.getLogger("oluso.audit");

  @Override
  public void publish(OlusoEvent event) {
    audit.info(describe(event));
  }

  /**
   * One-line description of an event.
   *
   * @param event the event
   * @return the description
   */
  public static String describe(OlusoEvent event) {
    if (event instanceof CibaRequestCreated e) {
      return String.format("ciba_request_created client=%s subject=%s mode=%s",
          e.clientId(), e.subjectId(), e.deliveryMode());
    } else if (event instanceof CibaRequestCompleted e) {
      return String.format("ciba_request_%s client=%s subject=%s",
          e.approved() ? "approved" : "denied", e.clientId(), e.subjectId());
    } else if (event instanceof TokenIssued e) {
      return String.format("token_issued client=%s subject=%s grant=%s scopes=%s dpop=%s",
          e.clientId(), e.subjectId(), e.grantType(), String.join(" ", e.scopes()), e.dpopBound());
    } else if (event instanceof TokenRequestFailed e) {
      return String.format("token_request_failed client=%s grant=%s error=%s",
          e.clientId(), e.grantType(), e.error());
    } else if (event instanceof DPoPProofRejected e) {
      return String.format("dpop_proof_rejected client=%s reason=%s", e.clientId(), e.reason());
    } else if (event instanceof JourneyCompleted e) {
      return String.format("journey_%s journey=%s policy=%s user=%s",
          e.succeeded() ? "completed" : "failed", e.journeyId(), e.policyId(), e.userId());
    }
    throw new IllegalArgumentException("Unhandled event type " + event.getClass().getName());
  }
}
