package com.codeheadsystems.oluso.server.grant;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.oluso.model.OidcConstants.Errors;
import com.codeheadsystems.oluso.model.OidcConstants.GrantTypes;
import com.codeheadsystems.oluso.server.request.TokenRequest;
import com.codeheadsystems.oluso.server.request.ValidatedClient;
import com.codeheadsystems.oluso.server.store.InMemoryRefreshTokenStore;
import com.codeheadsystems.oluso.server.store.RefreshTokenData;
import com.codeheadsystems.oluso.server.user.InMemoryUserService;
import com.codeheadsystems.oluso.server.user.OlusoUser;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RefreshTokenGrantHandlerTest {

  private final ValidatedClient rotating = ValidatedClient.builder("web").build();
  private final ValidatedClient reusable = ValidatedClient.builder("web").withRotateRefreshTokens(false).build();
  private InMemoryRefreshTokenStore store;
  private InMemoryUserService users;
  private RefreshTokenGrantHandler handler;

  @BeforeEach
  void setUp() {
    store = new InMemoryRefreshTokenStore();
    users = new InMemoryUserService();
    users.save(new OlusoUser("user-1", "ada", "ada@example.com"));
    handler = new RefreshTokenGrantHandler(store, users, Clock.systemUTC());
    Instant now = Instant.now();
    store.store(new RefreshTokenData("rt-1", "web", "user-1", "sess-1", null,
        Set.of("openid", "profile", "offline_access"), "jkt-1", Map.of("tier", "gold"), now,
        now.plus(Duration.ofDays(30))));
  }

  @Test
  void handle_rotatingClient_spendsTokenAndFlagsRotation() {
    GrantResult result = handler.handle(refresh("rt-1", null), rotating);

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.rotatedRefreshToken()).isTrue();
    assertThat(result.scopes()).containsExactlyInAnyOrder("openid", "profile", "offline_access");
    assertThat(result.claims()).containsEntry("tier", "gold");
    assertThat(result.boundJkt()).isEqualTo("jkt-1");
    assertThat(store.load("rt-1")).isEmpty();
  }

  @Test
  void handle_nonRotatingClient_keepsToken() {
    GrantResult result = handler.handle(refresh("rt-1", null), reusable);

    assertThat(result.rotatedRefreshToken()).isFalse();
    assertThat(store.load("rt-1")).isPresent();
  }

  @Test
  void handle_requestedScopesMayOnlyNarrow() {
    assertThat(handler.handle(refresh("rt-1", "openid"), reusable).scopes()).containsExactly("openid");
    assertThat(handler.handle(refresh("rt-1", "openid admin"), reusable).error().error())
        .isEqualTo(Errors.INVALID_SCOPE);
  }

  @Test
  void handle_unknownOrForeignToken_isInvalidGrant() {
    assertThat(handler.handle(refresh("rt-404", null), rotating).error().error()).isEqualTo(Errors.INVALID_GRANT);
    assertThat(handler.handle(refresh("rt-1", null), ValidatedClient.builder("other").build()).error().error())
        .isEqualTo(Errors.INVALID_GRANT);
    assertThat(store.load("rt-1")).isPresent();
  }

  @Test
  void handle_expiredToken_isInvalidGrantAndRemoved() {
    RefreshTokenGrantHandler later = new RefreshTokenGrantHandler(store, users,
        Clock.offset(Clock.systemUTC(), Duration.ofDays(31)));

    assertThat(later.handle(refresh("rt-1", null), reusable).error().description()).contains("expired");
    assertThat(store.load("rt-1")).isEmpty();
  }

  @Test
  void handle_inactiveUser_isInvalidGrant() {
    users.save(new OlusoUser("user-1", "ada", "ada@example.com", false, Map.of(), List.of()));

    assertThat(handler.handle(refresh("rt-1", null), rotating).error().description()).isEqualTo("User is not active");
  }

  private static TokenRequest refresh(String handle, String scope) {
    return TokenRequest.builder(GrantTypes.REFRESH_TOKEN).withRefreshToken(handle).withScope(scope).build();
  }
}
