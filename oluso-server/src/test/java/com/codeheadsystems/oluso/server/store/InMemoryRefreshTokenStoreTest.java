package com.codeheadsystems.oluso.server.store;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryRefreshTokenStoreTest {

  private InMemoryRefreshTokenStore store;

  @BeforeEach
  void setUp() {
    store = new InMemoryRefreshTokenStore();
  }

  @Test
  void consume_removesTheToken() {
    store.store(token("rt-1", "web", "user-1", "sid-1", Instant.now().plus(1, ChronoUnit.DAYS)));

    assertThat(store.load("rt-1")).isPresent();
    assertThat(store.consume("rt-1")).map(RefreshTokenData::subjectId).contains("user-1");
    assertThat(store.consume("rt-1")).isEmpty();
    assertThat(store.load("rt-1")).isEmpty();
  }

  @Test
  void load_expiredToken_isEvicted() {
    store.store(token("rt-old", "web", "user-1", "sid-1", Instant.now().minusSeconds(1)));

    assertThat(store.load("rt-old")).isEmpty();
    assertThat(store.consume("rt-old")).isEmpty();
  }

  @Test
  void revokeBySession_onlyMatchingSession() {
    Instant later = Instant.now().plus(1, ChronoUnit.DAYS);
    store.store(token("a", "web", "user-1", "sid-1", later));
    store.store(token("b", "web", "user-1", "sid-2", later));
    store.store(token("c", "mobile", "user-1", "sid-1", later));

    assertThat(store.revokeBySession("user-1", "web", "sid-1")).isEqualTo(1);
    assertThat(store.load("a")).isEmpty();
    assertThat(store.load("b")).isPresent();
    assertThat(store.load("c")).isPresent();
  }

  @Test
  void revokeBySession_withoutSessionRevokesEveryTokenOfTheClient() {
    Instant later = Instant.now().plus(1, ChronoUnit.DAYS);
    store.store(token("a", "web", "user-1", "sid-1", later));
    store.store(token("b", "web", "user-1", "sid-2", later));

    assertThat(store.revokeBySession("user-1", "web", null)).isEqualTo(2);
  }

  private static RefreshTokenData token(String handle, String clientId, String subjectId, String sessionId,
                                        Instant expiresAt) {
    return new RefreshTokenData(handle, clientId, subjectId, sessionId, null, Set.of("openid", "offline_access"),
        null, null, expiresAt.minus(1, ChronoUnit.DAYS), expiresAt);
  }
}
