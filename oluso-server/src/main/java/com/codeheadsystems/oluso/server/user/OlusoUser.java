package com.codeheadsystems.oluso.server.user;

import java.util.List;
import java.util.Map;

/**
 * The slice of a user account the protocol core needs.
 *
 * @param id       the subject identifier
 * @param username the user name
 * @param email    the e-mail address
 * @param active   whether the account may sign in
 * @param claims   profile claims released into tokens
 * @param roles    role names
 */
public record OlusoUser(String id, String username, String email, boolean active,
                        Map<String, Object> claims, List<String> roles) {

  public OlusoUser {
    claims = claims == null ? Map.of() : Map.copyOf(claims);
    roles = roles == null ? List.of() : List.copyOf(roles);
  }

  public OlusoUser(String id, String username, String email) {
    this(id, username, email, true, Map.of(), List.of());
  }
}
