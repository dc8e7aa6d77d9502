package com.codeheadsystems.oluso.server.ciba;

import java.util.Set;

/**
 * Snapshot of a backchannel request as seen by a polling client.
 *
 * @param status           the status
 * @param subjectId        the user, null when unknown
 * @param sessionId        session bound on approval
 * @param scopes           requested scopes
 * @param error            error code for denied, expired or foreign requests
 * @param errorDescription error description
 * @param interval         polling interval in seconds
 */
public record CibaStatusResult(CibaRequestStatus status,
                              String subjectId,
                              String sessionId,
                              Set<String> scopes,
                              String error,
                              String errorDescription,
                              int interval) {

  static CibaStatusResult of(CibaRequest request) {
    return new CibaStatusResult(request.status(), request.subjectId(), request.sessionId(), request.scopes(),
        request.error(), request.errorDescription(), request.interval());
  }

  static CibaStatusResult failed(CibaRequestStatus status, String error, String description) {
    return new CibaStatusResult(status, null, null, Set.of(), error, description, 0);
  }
}
