package com.codeheadsystems.oluso.server.store;

import com.codeheadsystems.oluso.server.ciba.CibaRequest;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Storage for pending and completed backchannel authentication requests.
 * <p>
 * Implementations must be thread-safe. {@link #transition} must be atomic: when two callers
 * race to move the same request out of a state, exactly one of them succeeds. Token redemption
 * relies on this to consume an approved request at most once.
 */
public interface CibaStore {

  void storeRequest(CibaRequest request);

  Optional<CibaRequest> getByAuthReqId(String authReqId);

  /**
   * Pending requests for a user, newest first.
   *
   * @param subjectId the user
   * @return the pending requests
   */
  List<CibaRequest> getPendingBySubject(String subjectId);

  /**
   * Unconditionally replaces the stored request.
   *
   * @param request the new state
   */
  void updateRequest(CibaRequest request);

  /**
   * Replaces {@code expected} with {@code updated} only if the stored value still equals
   * {@code expected}.
   *
   * @param expected the state the caller observed
   * @param updated  the new state
   * @return true if the swap happened
   */
  boolean transition(CibaRequest expected, CibaRequest updated);

  void removeRequest(String authReqId);

  /**
   * Removes every request whose expiry is before {@code now}.
   *
   * @param now the current time
   * @return the number of removed requests
   */
  int removeExpiredRequests(Instant now);
}
