package com.codeheadsystems.oluso.server.ciba;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

import com.codeheadsystems.oluso.model.OidcConstants.Errors;
import com.codeheadsystems.oluso.model.OidcConstants.GrantTypes;
import com.codeheadsystems.oluso.server.MutableClock;
import com.codeheadsystems.oluso.server.config.OlusoServerConfig;
import com.codeheadsystems.oluso.server.event.OlusoEvent;
import com.codeheadsystems.oluso.server.keys.InMemorySigningCredentialStore;
import com.codeheadsystems.oluso.server.keys.SigningCredentialStore;
import com.codeheadsystems.oluso.server.request.CibaTokenDeliveryMode;
import com.codeheadsystems.oluso.server.request.ValidatedClient;
import com.codeheadsystems.oluso.server.store.InMemoryCibaStore;
import com.codeheadsystems.oluso.server.user.InMemoryUserService;
import com.codeheadsystems.oluso.server.user.OlusoUser;
import com.nimbusds.jose.jwk.RSAKey;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CibaServiceTest {

  private static final String CLIENT_ID = "ciba-client";
  private static final String SUBJECT = "user-1";

  @Mock private CibaUserNotificationService notificationService;

  private final List<OlusoEvent> events = new ArrayList<>();
  private MutableClock clock;
  private InMemoryCibaStore store;
  private CibaService service;
  private ValidatedClient pollClient;

  @BeforeEach
  void setUp() {
    clock = MutableClock.atEpoch();
    store = new InMemoryCibaStore();
    InMemoryUserService users = new InMemoryUserService();
    users.save(new OlusoUser(SUBJECT, "alice", "user@example.com"));
    CibaHintResolver resolver = new CibaHintResolver(users, new InMemorySigningCredentialStore(),
        new OlusoServerConfig(), clock);
    service = new CibaService(store, resolver, Optional.of(notificationService), events::add, clock);
    pollClient = ValidatedClient.builder(CLIENT_ID)
        .withAllowedGrantTypes(GrantTypes.CIBA)
        .withAllowedScopes("openid", "profile")
        .withCibaEnabled(true)
        .withCibaTokenDeliveryMode(CibaTokenDeliveryMode.POLL)
        .withCibaRequestLifetime(120)
        .withCibaPollingInterval(5)
        .build();
  }

  @Test
  void authenticate_pollClientWithLoginHint_createsPendingRequestThatCanBeApproved() {
    CibaAuthenticationResult result = service.authenticate(
        CibaAuthenticationRequest.withLoginHint(CLIENT_ID, "openid profile", "user@example.com"), pollClient);

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.expiresIn()).isEqualTo(120);
    assertThat(result.interval()).isEqualTo(5);
    assertThat(service.getStatus(result.authReqId(), CLIENT_ID).status()).isEqualTo(CibaRequestStatus.PENDING);

    assertThat(service.approveRequest(result.authReqId(), SUBJECT, "session-1")).isTrue();

    CibaStatusResult status = service.getStatus(result.authReqId(), CLIENT_ID);
    assertThat(status.status()).isEqualTo(CibaRequestStatus.APPROVED);
    assertThat(status.subjectId()).isEqualTo(SUBJECT);
    assertThat(status.sessionId()).isEqualTo("session-1");
    assertThat(status.scopes()).containsExactlyInAnyOrder("openid", "profile");
  }

  @Test
  void authenticate_authReqIdIsUrlSafeAndUnpadded() {
    CibaAuthenticationResult first = service.authenticate(
        CibaAuthenticationRequest.withLoginHint(CLIENT_ID, "openid", "alice"), pollClient);
    CibaAuthenticationResult second = service.authenticate(
        CibaAuthenticationRequest.withLoginHint(CLIENT_ID, "openid", "alice"), pollClient);

    assertThat(first.authReqId()).hasSize(43).doesNotContain("+", "/", "=");
    assertThat(first.authReqId()).isNotEqualTo(second.authReqId());
  }

  @Test
  void authenticate_pingModeWithoutNotificationToken_returnsInvalidRequest() {
    ValidatedClient pingClient = ValidatedClient.builder(CLIENT_ID)
        .withCibaEnabled(true)
        .withCibaTokenDeliveryMode(CibaTokenDeliveryMode.PING)
        .withCibaClientNotificationEndpoint("https://client.example.com/cb")
        .build();

    CibaAuthenticationResult result = service.authenticate(
        CibaAuthenticationRequest.withLoginHint(CLIENT_ID, "openid", "user@example.com"), pingClient);

    assertThat(result.isSuccess()).isFalse();
    assertThat(result.error().error()).isEqualTo(Errors.INVALID_REQUEST);
  }

  @Test
  void authenticate_pingModeWithoutEndpoint_returnsInvalidRequest() {
    ValidatedClient pingClient = ValidatedClient.builder(CLIENT_ID)
        .withCibaEnabled(true)
        .withCibaTokenDeliveryMode(CibaTokenDeliveryMode.PING)
        .build();
    CibaAuthenticationRequest request = new CibaAuthenticationRequest(CLIENT_ID, "openid", "alice", null, null,
        null, null, null, null, "notify-token");

    CibaAuthenticationResult result = service.authenticate(request, pingClient);

    assertThat(result.error().error()).isEqualTo(Errors.INVALID_REQUEST);
  }

  @Test
  void authenticate_clientWithoutCiba_returnsUnauthorizedClient() {
    ValidatedClient plain = ValidatedClient.builder(CLIENT_ID).build();

    CibaAuthenticationResult result = service.authenticate(
        CibaAuthenticationRequest.withLoginHint(CLIENT_ID, "openid", "alice"), plain);

    assertThat(result.error().error()).isEqualTo(Errors.UNAUTHORIZED_CLIENT);
  }

  @Test
  void authenticate_noHint_returnsInvalidRequest() {
    CibaAuthenticationResult result = service.authenticate(
        CibaAuthenticationRequest.withLoginHint(CLIENT_ID, "openid", null), pollClient);

    assertThat(result.error().error()).isEqualTo(Errors.INVALID_REQUEST);
  }

  @Test
  void authenticate_unknownUser_returnsUnknownUserId() {
    CibaAuthenticationResult result = service.authenticate(
        CibaAuthenticationRequest.withLoginHint(CLIENT_ID, "openid", "nobody@example.com"), pollClient);

    assertThat(result.error().error()).isEqualTo(Errors.UNKNOWN_USER_ID);
  }

  @Test
  void authenticate_bindingMessageTooLong_returnsInvalidBindingMessage() {
    CibaAuthenticationRequest request = new CibaAuthenticationRequest(CLIENT_ID, "openid", "alice", null, null,
        "x".repeat(CibaService.MAX_BINDING_MESSAGE_LENGTH + 1), null, null, null, null);

    CibaAuthenticationResult result = service.authenticate(request, pollClient);

    assertThat(result.error().error()).isEqualTo(Errors.INVALID_BINDING_MESSAGE);
  }

  @Test
  void authenticate_userCodeRequiredButMissing_returnsInvalidRequest() {
    ValidatedClient client = ValidatedClient.builder(CLIENT_ID)
        .withCibaEnabled(true)
        .withCibaRequireUserCode(true)
        .build();

    CibaAuthenticationResult result = service.authenticate(
        CibaAuthenticationRequest.withLoginHint(CLIENT_ID, "openid", "alice"), client);

    assertThat(result.error().error()).isEqualTo(Errors.INVALID_REQUEST);
  }

  @Test
  void authenticate_requestedExpiryAboveLifetime_isCappedAtClientLifetime() {
    CibaAuthenticationRequest request = new CibaAuthenticationRequest(CLIENT_ID, "openid", "alice", null, null,
        null, null, null, 86_400, null);

    CibaAuthenticationResult result = service.authenticate(request, pollClient);

    assertThat(result.expiresIn()).isEqualTo(120);
    assertThat(store.getByAuthReqId(result.authReqId()).orElseThrow().expiresAt())
        .isEqualTo(clock.instant().plusSeconds(120));
  }

  @Test
  void effectiveExpiry_shorterRequestWins_nonPositiveIgnored() {
    assertThat(CibaService.effectiveExpiry(30, 120)).isEqualTo(30);
    assertThat(CibaService.effectiveExpiry(null, 120)).isEqualTo(120);
    assertThat(CibaService.effectiveExpiry(0, 120)).isEqualTo(120);
    assertThat(CibaService.effectiveExpiry(-5, 120)).isEqualTo(120);
  }

  @Test
  void authenticate_blankScope_defaultsToOpenid() {
    CibaAuthenticationResult result = service.authenticate(
        CibaAuthenticationRequest.withLoginHint(CLIENT_ID, " ", "alice"), pollClient);

    assertThat(store.getByAuthReqId(result.authReqId()).orElseThrow().scopes()).containsExactly("openid");
  }

  @Test
  void authenticate_notifiesUserAndPublishesEvent() {
    CibaAuthenticationResult result = service.authenticate(
        CibaAuthenticationRequest.withLoginHint(CLIENT_ID, "openid", "alice"), pollClient);

    ArgumentCaptor<CibaRequest> captor = ArgumentCaptor.forClass(CibaRequest.class);
    verify(notificationService).notifyUser(captor.capture());
    assertThat(captor.getValue().authReqId()).isEqualTo(result.authReqId());
    assertThat(events).singleElement().isInstanceOfSatisfying(OlusoEvent.CibaRequestCreated.class, e -> {
      assertThat(e.subjectId()).isEqualTo(SUBJECT);
      assertThat(e.deliveryMode()).isEqualTo("poll");
    });
  }

  @Test
  void authenticate_notificationFailure_stillSucceeds() {
    doThrow(new IllegalStateException("push gateway down")).when(notificationService).notifyUser(any());

    CibaAuthenticationResult result = service.authenticate(
        CibaAuthenticationRequest.withLoginHint(CLIENT_ID, "openid", "alice"), pollClient);

    assertThat(result.isSuccess()).isTrue();
  }

  @Test
  void getStatus_unknownRequest_returnsExpiredToken() {
    CibaStatusResult status = service.getStatus("does-not-exist", CLIENT_ID);

    assertThat(status.status()).isEqualTo(CibaRequestStatus.EXPIRED);
    assertThat(status.error()).isEqualTo(Errors.EXPIRED_TOKEN);
  }

  @Test
  void getStatus_otherClient_returnsAccessDenied() {
    String authReqId = createRequest();

    CibaStatusResult status = service.getStatus(authReqId, "someone-else");

    assertThat(status.error()).isEqualTo(Errors.ACCESS_DENIED);
    assertThat(store.getByAuthReqId(authReqId).orElseThrow().status()).isEqualTo(CibaRequestStatus.PENDING);
  }

  @Test
  void getStatus_afterExpiry_marksExpiredAndRepeatsTheSameAnswer() {
    String authReqId = createRequest();
    clock.advance(Duration.ofSeconds(121));

    CibaStatusResult first = service.getStatus(authReqId, CLIENT_ID);
    CibaStatusResult second = service.getStatus(authReqId, CLIENT_ID);

    assertThat(first.status()).isEqualTo(CibaRequestStatus.EXPIRED);
    assertThat(first.error()).isEqualTo(Errors.EXPIRED_TOKEN);
    assertThat(second).isEqualTo(first);
    assertThat(store.getByAuthReqId(authReqId).orElseThrow().status()).isEqualTo(CibaRequestStatus.EXPIRED);
  }

  @Test
  void approveRequest_twice_secondCallFails() {
    String authReqId = createRequest();

    assertThat(service.approveRequest(authReqId, SUBJECT, "s1")).isTrue();
    assertThat(service.approveRequest(authReqId, SUBJECT, "s2")).isFalse();
    assertThat(store.getByAuthReqId(authReqId).orElseThrow().sessionId()).isEqualTo("s1");
  }

  @Test
  void approveRequest_differentSubject_isRejected() {
    String authReqId = createRequest();

    assertThat(service.approveRequest(authReqId, "intruder", "s1")).isFalse();
    assertThat(store.getByAuthReqId(authReqId).orElseThrow().status()).isEqualTo(CibaRequestStatus.PENDING);
  }

  @Test
  void approveRequest_afterExpiry_isRejected() {
    String authReqId = createRequest();
    clock.advance(Duration.ofMinutes(5));

    assertThat(service.approveRequest(authReqId, SUBJECT, "s1")).isFalse();
  }

  @Test
  void denyRequest_thenApprove_staysDenied() {
    String authReqId = createRequest();

    assertThat(service.denyRequest(authReqId)).isTrue();
    assertThat(service.denyRequest(authReqId)).isFalse();
    assertThat(service.approveRequest(authReqId, SUBJECT, "s1")).isFalse();

    CibaStatusResult status = service.getStatus(authReqId, CLIENT_ID);
    assertThat(status.status()).isEqualTo(CibaRequestStatus.DENIED);
    assertThat(status.error()).isEqualTo(Errors.ACCESS_DENIED);
  }

  @Test
  void getStatus_deniedRequestPastExpiry_keepsDeniedInTheStore() {
    String authReqId = createRequest();
    service.denyRequest(authReqId);
    clock.advance(Duration.ofSeconds(500));

    CibaStatusResult status = service.getStatus(authReqId, CLIENT_ID);

    assertThat(status.error()).isEqualTo(Errors.EXPIRED_TOKEN);
    assertThat(store.getByAuthReqId(authReqId).orElseThrow().status()).isEqualTo(CibaRequestStatus.DENIED);
  }

  @Test
  void authenticate_keyStoreFailure_returnsUnknownUserId() {
    CibaHintResolver resolver = new CibaHintResolver(new InMemoryUserService(), new SigningCredentialStore() {
      @Override
      public RSAKey getSigningKey() {
        throw new IllegalStateException("store down");
      }

      @Override
      public List<RSAKey> getValidationKeys() {
        throw new IllegalStateException("store down");
      }
    }, new OlusoServerConfig(), clock);
    CibaService broken = new CibaService(store, resolver, Optional.empty(), events::add, clock);
    CibaAuthenticationRequest request = new CibaAuthenticationRequest(CLIENT_ID, "openid", null,
        "eyJhbGciOiJSUzI1NiJ9.eyJzdWIiOiJ1c2VyLTEifQ.c2ln", null, null, null, null, null, null);

    CibaAuthenticationResult result = broken.authenticate(request, pollClient);

    assertThat(result.isSuccess()).isFalse();
    assertThat(result.error().error()).isEqualTo(Errors.UNKNOWN_USER_ID);
  }

  @Test
  void approveAndDeny_publishCompletionEvents() {
    String approved = createRequest();
    String denied = createRequest();
    events.clear();

    service.approveRequest(approved, SUBJECT, "s1");
    service.denyRequest(denied);

    assertThat(events).hasSize(2);
    assertThat(events.get(0)).isInstanceOfSatisfying(OlusoEvent.CibaRequestCompleted.class,
        e -> assertThat(e.approved()).isTrue());
    assertThat(events.get(1)).isInstanceOfSatisfying(OlusoEvent.CibaRequestCompleted.class,
        e -> assertThat(e.approved()).isFalse());
  }

  @Test
  void cleanupExpired_removesOnlyExpiredRequests() {
    String old = createRequest();
    clock.advance(Duration.ofSeconds(100));
    String fresh = createRequest();
    clock.advance(Duration.ofSeconds(30));

    assertThat(service.cleanupExpired()).isEqualTo(1);
    assertThat(store.getByAuthReqId(old)).isEmpty();
    assertThat(store.getByAuthReqId(fresh)).isPresent();
  }

  private String createRequest() {
    return service.authenticate(
        CibaAuthenticationRequest.withLoginHint(CLIENT_ID, "openid", "user@example.com"), pollClient).authReqId();
  }
}
