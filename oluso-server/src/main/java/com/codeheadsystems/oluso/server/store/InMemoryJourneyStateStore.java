package com.codeheadsystems.oluso.server.store;

import com.codeheadsystems.oluso.server.journey.JourneyState;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link JourneyStateStore}.
 * <p>
 * Not shared between instances. Suitable for development and single-node testing only.
 */
public class InMemoryJourneyStateStore implements JourneyStateStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryJourneyStateStore.class);

  private final ConcurrentHashMap<String, JourneyState> journeys = new ConcurrentHashMap<>();

  public InMemoryJourneyStateStore() {
    log.warn("Using InMemoryJourneyStateStore - journeys will NOT survive restarts "
        + "and are not shared between instances.");
  }

  @Override
  public Optional<JourneyState> get(String journeyId) {
    if (journeyId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(journeys.get(journeyId));
  }

  @Override
  public void save(JourneyState state) {
    journeys.put(state.journeyId(), state);
  }

  @Override
  public void delete(String journeyId) {
    journeys.remove(journeyId);
  }

  @Override
  public List<JourneyState> getByUser(String userId) {
    return journeys.values().stream()
        .filter(s -> userId != null && userId.equals(s.userId()))
        .sorted(Comparator.comparing(JourneyState::updatedAt).reversed())
        .collect(Collectors.toList());
  }

  @Override
  public int cleanupExpired(Instant now) {
    int before = journeys.size();
    journeys.values().removeIf(s -> s.isExpired(now));
    int removed = before - journeys.size();
    if (removed > 0) {
      log.debug("Removed {} expired journey(s)", removed);
    }
    return removed;
  }
}
