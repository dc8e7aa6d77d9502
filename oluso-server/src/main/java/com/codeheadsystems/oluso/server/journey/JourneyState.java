package com.codeheadsystems.oluso.server.journey;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The running state of one journey: where it is, who it is for, and the data it has collected so
 * far. Owned by the {@link JourneyOrchestrator} for the lifetime of a single flow.
 */
public class JourneyState {

  private final String journeyId;
  private final String tenantId;
  private final String clientId;
  private final String policyId;
  private final String correlationId;
  private final Instant createdAt;
  private final Instant expiresAt;
  private final Map<String, Object> journeyData = new HashMap<>();
  private final List<String> completedSteps = new ArrayList<>();
  private String userId;
  private String currentStepId;
  private JourneyStatus status = JourneyStatus.IN_PROGRESS;
  private Instant updatedAt;

  public JourneyState(String journeyId,
                      String tenantId,
                      String clientId,
                      String policyId,
                      String correlationId,
                      Instant createdAt,
                      Instant expiresAt) {
    this.journeyId = journeyId;
    this.tenantId = tenantId;
    this.clientId = clientId;
    this.policyId = policyId;
    this.correlationId = correlationId;
    this.createdAt = createdAt;
    this.expiresAt = expiresAt;
    this.updatedAt = createdAt;
  }

  public String journeyId() {
    return journeyId;
  }

  public String tenantId() {
    return tenantId;
  }

  public String clientId() {
    return clientId;
  }

  public String policyId() {
    return policyId;
  }

  public String correlationId() {
    return correlationId;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public Instant expiresAt() {
    return expiresAt;
  }

  public Instant updatedAt() {
    return updatedAt;
  }

  public void touch(Instant now) {
    this.updatedAt = now;
  }

  /**
   * Live journey data. Step handlers read and write it directly.
   *
   * @return the data
   */
  public Map<String, Object> journeyData() {
    return journeyData;
  }

  public List<String> completedSteps() {
    return completedSteps;
  }

  public void markCompleted(String stepId) {
    if (!completedSteps.contains(stepId)) {
      completedSteps.add(stepId);
    }
  }

  public String userId() {
    return userId;
  }

  public void userId(String value) {
    this.userId = value;
  }

  public String currentStepId() {
    return currentStepId;
  }

  public void currentStepId(String value) {
    this.currentStepId = value;
  }

  public JourneyStatus status() {
    return status;
  }

  public void status(JourneyStatus value) {
    this.status = value;
  }

  public boolean isExpired(Instant now) {
    return expiresAt != null && now.isAfter(expiresAt);
  }
}
