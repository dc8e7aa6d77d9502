package com.codeheadsystems.oluso.server.user;

import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link UserService}. E-mail and user name lookups are case-insensitive.
 */
public class InMemoryUserService implements UserService {

  private static final Logger log = LoggerFactory.getLogger(InMemoryUserService.class);

  private final ConcurrentHashMap<String, OlusoUser> byId = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, String> emailIndex = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, String> usernameIndex = new ConcurrentHashMap<>();

  public InMemoryUserService() {
    log.warn("Using InMemoryUserService - users will NOT survive restarts.");
  }

  public void save(OlusoUser user) {
    byId.put(user.id(), user);
    if (user.email() != null) {
      emailIndex.put(user.email().toLowerCase(Locale.ROOT), user.id());
    }
    if (user.username() != null) {
      usernameIndex.put(user.username().toLowerCase(Locale.ROOT), user.id());
    }
  }

  @Override
  public Optional<OlusoUser> findByEmail(String email) {
    return lookup(emailIndex, email);
  }

  @Override
  public Optional<OlusoUser> findByUsername(String username) {
    return lookup(usernameIndex, username);
  }

  @Override
  public Optional<OlusoUser> findById(String id) {
    return id == null ? Optional.empty() : Optional.ofNullable(byId.get(id));
  }

  private Optional<OlusoUser> lookup(ConcurrentHashMap<String, String> index, String key) {
    if (key == null) {
      return Optional.empty();
    }
    return findById(index.get(key.toLowerCase(Locale.ROOT)));
  }
}
