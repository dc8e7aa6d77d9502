package com.codeheadsystems.oluso.server.validation;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Matches a requested redirect uri against the client's registered ones.
 * <p>
 * Exact string match, except that http loopback uris match on any port (RFC 8252 section 7.3)
 * and custom (native app) schemes compare case-insensitively.
 */
@Singleton
public class RedirectUriValidator {

  private static final Set<String> LOOPBACK_HOSTS = Set.of("127.0.0.1", "[::1]", "::1", "localhost");

  @Inject
  public RedirectUriValidator() {
  }

  public boolean isValid(String redirectUri, List<String> registeredUris) {
    if (redirectUri == null || redirectUri.isEmpty()) {
      return false;
    }
    for (String registered : registeredUris) {
      if (registered.equals(redirectUri)) {
        return true;
      }
      if (matchesLoopback(redirectUri, registered) || matchesCustomScheme(redirectUri, registered)) {
        return true;
      }
    }
    return false;
  }

  private static boolean matchesLoopback(String requested, String registered) {
    URI req = parse(requested);
    URI reg = parse(registered);
    if (req == null || reg == null) {
      return false;
    }
    return "http".equalsIgnoreCase(req.getScheme())
        && "http".equalsIgnoreCase(reg.getScheme())
        && req.getHost() != null
        && LOOPBACK_HOSTS.contains(req.getHost().toLowerCase(Locale.ROOT))
        && req.getHost().equalsIgnoreCase(reg.getHost())
        && Objects.equals(emptyToSlash(req.getPath()), emptyToSlash(reg.getPath()))
        && Objects.equals(req.getQuery(), reg.getQuery());
  }

  private static boolean matchesCustomScheme(String requested, String registered) {
    URI req = parse(requested);
    if (req == null || req.getScheme() == null) {
      return false;
    }
    String scheme = req.getScheme().toLowerCase(Locale.ROOT);
    if (scheme.equals("http") || scheme.equals("https")) {
      return false;
    }
    return requested.equalsIgnoreCase(registered);
  }

  private static String emptyToSlash(String path) {
    return path == null || path.isEmpty() ? "/" : path;
  }

  private static URI parse(String value) {
    try {
      return new URI(value);
    } catch (URISyntaxException e) {
      return null;
    }
  }
}
