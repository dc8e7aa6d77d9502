package com.codeheadsystems.oluso.server.store;

import com.codeheadsystems.oluso.server.journey.JourneyState;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Storage for running journeys. Implementations must be thread-safe.
 */
public interface JourneyStateStore {

  Optional<JourneyState> get(String journeyId);

  void save(JourneyState state);

  void delete(String journeyId);

  /**
   * Journeys belonging to a user, most recently updated first.
   *
   * @param userId the user
   * @return the journeys
   */
  List<JourneyState> getByUser(String userId);

  /**
   * Removes every journey that expired before {@code now}.
   *
   * @param now the current time
   * @return the number of removed journeys
   */
  int cleanupExpired(Instant now);
}
