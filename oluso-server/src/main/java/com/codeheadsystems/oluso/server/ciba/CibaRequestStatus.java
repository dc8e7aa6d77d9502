package com.codeheadsystems.oluso.server.ciba;

/**
 * Lifecycle of a backchannel authentication request. Only {@link #PENDING} may transition;
 * every other state is terminal except {@link #APPROVED}, which moves once to {@link #CONSUMED}.
 */
public enum CibaRequestStatus {
  PENDING,
  APPROVED,
  DENIED,
  EXPIRED,
  CONSUMED
}
