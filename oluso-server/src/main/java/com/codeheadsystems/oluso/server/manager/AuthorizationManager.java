package com.codeheadsystems.oluso.server.manager;

import com.codeheadsystems.oluso.model.OidcConstants.Errors;
import com.codeheadsystems.oluso.model.OidcConstants.PromptModes;
import com.codeheadsystems.oluso.model.OidcConstants.ProtocolEndpoints;
import com.codeheadsystems.oluso.model.OidcConstants.ResponseModes;
import com.codeheadsystems.oluso.server.config.OlusoServerConfig;
import com.codeheadsystems.oluso.server.policy.JourneyPolicy;
import com.codeheadsystems.oluso.server.policy.JourneyPolicyMatchContext;
import com.codeheadsystems.oluso.server.policy.JourneyType;
import com.codeheadsystems.oluso.server.protocol.EndpointType;
import com.codeheadsystems.oluso.server.protocol.ProtocolContext;
import com.codeheadsystems.oluso.server.protocol.ProtocolContextResolver;
import com.codeheadsystems.oluso.server.protocol.ProtocolError;
import com.codeheadsystems.oluso.server.protocol.UiMode;
import com.codeheadsystems.oluso.server.request.AuthorizationCodeData;
import com.codeheadsystems.oluso.server.request.AuthorizeRequest;
import com.codeheadsystems.oluso.server.request.ValidatedClient;
import com.codeheadsystems.oluso.server.store.AuthorizationCodeStore;
import com.codeheadsystems.oluso.server.store.JourneyPolicyStore;
import com.codeheadsystems.oluso.server.validation.AuthorizeRequestValidator;
import com.codeheadsystems.oluso.server.validation.AuthorizeValidationResult;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic authorize endpoint.
 * <p>
 * {@link #authorize} validates the request (redeeming a pushed request when a
 * {@code request_uri} is given), resolves the protocol context and, in journey mode, the journey
 * policy. Once the user has authenticated, {@link #issueCode} mints the authorization code and
 * builds the redirect back to the client.
 */
@Singleton
public class AuthorizationManager {

  private static final Logger log = LoggerFactory.getLogger(AuthorizationManager.class);
  private static final Base64.Encoder B64URL = Base64.getUrlEncoder().withoutPadding();

  private final AuthorizeRequestValidator validator;
  private final PushedAuthorizationManager pushedAuthorizationManager;
  private final ProtocolContextResolver contextResolver;
  private final JourneyPolicyStore policyStore;
  private final AuthorizationCodeStore codeStore;
  private final OlusoServerConfig config;
  private final Clock clock;
  private final SecureRandom random = new SecureRandom();

  @Inject
  public AuthorizationManager(AuthorizeRequestValidator validator,
                              PushedAuthorizationManager pushedAuthorizationManager,
                              ProtocolContextResolver contextResolver,
                              JourneyPolicyStore policyStore,
                              AuthorizationCodeStore codeStore,
                              OlusoServerConfig config) {
    this(validator, pushedAuthorizationManager, contextResolver, policyStore, codeStore, config, Clock.systemUTC());
  }

  public AuthorizationManager(AuthorizeRequestValidator validator,
                              PushedAuthorizationManager pushedAuthorizationManager,
                              ProtocolContextResolver contextResolver,
                              JourneyPolicyStore policyStore,
                              AuthorizationCodeStore codeStore,
                              OlusoServerConfig config,
                              Clock clock) {
    this.validator = validator;
    this.pushedAuthorizationManager = pushedAuthorizationManager;
    this.contextResolver = contextResolver;
    this.policyStore = policyStore;
    this.codeStore = codeStore;
    this.config = config;
    this.clock = clock;
    log.info("AuthorizationManager()");
  }

  /**
   * Validates an authorize request and resolves how the user will be taken through it.
   *
   * @param incoming   the request as received
   * @param parameters the raw request parameters, for {@code correlation_id} and friends
   * @return the result
   */
  public AuthorizationResult authorize(AuthorizeRequest incoming, Map<String, String> parameters) {
    AuthorizeRequest request = incoming;
    boolean pushed = false;
    if (incoming.requestUri() != null) {
      Optional<AuthorizeRequest> redeemed = pushedAuthorizationManager.redeem(incoming.requestUri(), incoming.clientId());
      if (redeemed.isEmpty()) {
        log.debug("Unknown or expired request_uri for client {}", incoming.clientId());
        return AuthorizationResult.failure(incoming, null,
            ProtocolError.of(Errors.INVALID_REQUEST_URI, "Invalid or expired request_uri"));
      }
      request = redeemed.get();
      pushed = true;
    }
    AuthorizeValidationResult validation = validator.validate(request, pushed);
    if (!validation.isValid()) {
      return AuthorizationResult.failure(request, validation.client(), validation.error());
    }
    ValidatedClient client = validation.client();

    Map<String, String> contextParameters = new HashMap<>(parameters);
    putIfPresent(contextParameters, ProtocolEndpoints.UI_MODE_QUERY_PARAM, request.uiMode());
    putIfPresent(contextParameters, ProtocolEndpoints.POLICY_QUERY_PARAM, request.policy());
    ProtocolContext context = contextResolver.resolve(EndpointType.AUTHORIZE, request.tenantId(), client,
        contextParameters);
    if (context.uiMode() == UiMode.JOURNEY) {
      Optional<JourneyPolicy> policy = resolvePolicy(request, context);
      if (policy.isPresent()) {
        context = context.withPolicyId(policy.get().id());
      }
    }
    log.debug("Authorize request accepted for client {} in {} mode", client.clientId(), context.uiMode());
    return AuthorizationResult.success(request, client, context);
  }

  /**
   * Issues an authorization code for an authenticated user and builds the redirect to the
   * client.
   *
   * @param authorized the successful authorize result
   * @param subjectId  the authenticated user
   * @param sessionId  the user's session
   * @param authTime   when the user authenticated
   * @param amr        authentication methods used
   * @param acr        authentication context class reached, may be null
   * @return the redirect uri carrying the code
   */
  public String issueCode(AuthorizationResult authorized,
                          String subjectId,
                          String sessionId,
                          Instant authTime,
                          List<String> amr,
                          String acr) {
    if (!authorized.isSuccess()) {
      throw new IllegalArgumentException("Cannot issue a code for a rejected request");
    }
    if (subjectId == null || subjectId.isBlank()) {
      throw new IllegalArgumentException("subjectId is required");
    }
    AuthorizeRequest request = authorized.request();
    byte[] bytes = new byte[32];
    random.nextBytes(bytes);
    String code = B64URL.encodeToString(bytes);
    Instant expiresAt = clock.instant().plusSeconds(config.authorizationCodeLifetimeSeconds());
    codeStore.store(new AuthorizationCodeData(code, request.clientId(), subjectId, sessionId, request.tenantId(),
        request.redirectUri(), request.codeChallenge(), request.codeChallengeMethod(), request.dpopJkt(),
        request.nonce(), request.requestedScopes(), Map.of(), authTime, amr, acr, expiresAt));
    log.debug("Issued authorization code for client {}", request.clientId());

    Map<String, String> response = new LinkedHashMap<>();
    response.put("code", code);
    putIfPresent(response, "state", request.state());
    response.put("iss", config.issuerFor(request.tenantId()));
    return responseUri(request, response);
  }

  /**
   * Builds the redirect carrying an error back to the client. Only valid for errors raised after
   * the redirect uri was validated.
   *
   * @param request the request
   * @param error   the error
   * @return the redirect uri
   */
  public String errorResponseUri(AuthorizeRequest request, ProtocolError error) {
    if (!error.redirectUriValidated()) {
      throw new IllegalArgumentException("Error may not be sent to an unvalidated redirect_uri");
    }
    Map<String, String> response = new LinkedHashMap<>();
    response.put("error", error.error());
    putIfPresent(response, "error_description", error.description());
    putIfPresent(response, "state", request.state());
    response.put("iss", config.issuerFor(request.tenantId()));
    return responseUri(request, response);
  }

  private Optional<JourneyPolicy> resolvePolicy(AuthorizeRequest request, ProtocolContext context) {
    if (context.policyId() != null) {
      Optional<JourneyPolicy> requested = policyStore.getById(context.policyId())
          .filter(JourneyPolicy::enabled)
          .filter(p -> p.tenantId() == null || p.tenantId().equals(request.tenantId()));
      if (requested.isPresent()) {
        return requested;
      }
      log.debug("Requested journey policy {} is not available, matching instead", context.policyId());
    }
    JourneyType type = request.promptModes().contains(PromptModes.CREATE) ? JourneyType.SIGN_UP : JourneyType.SIGN_IN;
    Map<String, String> additional = new HashMap<>();
    putIfPresent(additional, "prompt", request.prompt());
    putIfPresent(additional, "ui_locales", request.uiLocales());
    putIfPresent(additional, "login_hint", request.loginHint());
    return policyStore.findMatching(new JourneyPolicyMatchContext(request.tenantId(), request.clientId(), type,
        request.requestedScopes(), request.acrValues(), additional));
  }

  private static String responseUri(AuthorizeRequest request, Map<String, String> parameters) {
    String query = parameters.entrySet().stream()
        .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
        .collect(Collectors.joining("&"));
    String redirectUri = request.redirectUri();
    if (ResponseModes.FRAGMENT.equals(request.responseMode())) {
      return redirectUri + "#" + query;
    }
    return redirectUri + (redirectUri.contains("?") ? "&" : "?") + query;
  }

  private static void putIfPresent(Map<String, String> map, String key, String value) {
    if (value != null && !value.isBlank()) {
      map.putIfAbsent(key, value);
    }
  }
}
