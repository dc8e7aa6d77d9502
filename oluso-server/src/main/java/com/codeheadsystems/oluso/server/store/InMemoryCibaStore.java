package com.codeheadsystems.oluso.server.store;

import com.codeheadsystems.oluso.server.ciba.CibaRequest;
import com.codeheadsystems.oluso.server.ciba.CibaRequestStatus;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link CibaStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Not shared between instances. Suitable for development and single-node testing only.
 */
public class InMemoryCibaStore implements CibaStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryCibaStore.class);

  private final ConcurrentHashMap<String, CibaRequest> requests = new ConcurrentHashMap<>();

  public InMemoryCibaStore() {
    log.warn("Using InMemoryCibaStore - backchannel requests will NOT survive restarts "
        + "and are not shared between instances.");
  }

  @Override
  public void storeRequest(CibaRequest request) {
    requests.put(request.authReqId(), request);
    log.debug("Stored CIBA request for client {}", request.clientId());
  }

  @Override
  public Optional<CibaRequest> getByAuthReqId(String authReqId) {
    if (authReqId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(requests.get(authReqId));
  }

  @Override
  public List<CibaRequest> getPendingBySubject(String subjectId) {
    return requests.values().stream()
        .filter(r -> r.status() == CibaRequestStatus.PENDING)
        .filter(r -> r.subjectId().equals(subjectId))
        .sorted(Comparator.comparing(CibaRequest::createdAt).reversed())
        .collect(Collectors.toList());
  }

  @Override
  public void updateRequest(CibaRequest request) {
    requests.put(request.authReqId(), request);
  }

  @Override
  public boolean transition(CibaRequest expected, CibaRequest updated) {
    return requests.replace(expected.authReqId(), expected, updated);
  }

  @Override
  public void removeRequest(String authReqId) {
    requests.remove(authReqId);
  }

  @Override
  public int removeExpiredRequests(Instant now) {
    int before = requests.size();
    requests.values().removeIf(r -> r.isExpired(now));
    int removed = before - requests.size();
    if (removed > 0) {
      log.debug("Removed {} expired CIBA request(s)", removed);
    }
    return removed;
  }
}
