package com.codeheadsystems.oluso.server.user;

import java.util.Optional;

/**
 * User lookups used for hint resolution and grant checks. The account store is external.
 */
public interface UserService {

  Optional<OlusoUser> findByEmail(String email);

  Optional<OlusoUser> findByUsername(String username);

  Optional<OlusoUser> findById(String id);

  /**
   * Whether the subject exists and may still obtain tokens.
   *
   * @param subjectId the subject
   * @return true if active
   */
  default boolean isActive(String subjectId) {
    return findById(subjectId).map(OlusoUser::active).orElse(false);
  }
}
