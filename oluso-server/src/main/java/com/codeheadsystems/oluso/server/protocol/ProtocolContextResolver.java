package com.codeheadsystems.oluso.server.protocol;

import com.codeheadsystems.oluso.model.OidcConstants.ProtocolEndpoints;
import com.codeheadsystems.oluso.server.request.ValidatedClient;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the {@link ProtocolContext} for an incoming request.
 * <p>
 * UI mode precedence: a client that opts out of journeys ({@value #USE_JOURNEY_FLOW_PROPERTY}
 * set to {@code false}) always gets standalone pages; otherwise a {@code ui_mode} parameter the
 * client allows wins; otherwise journey mode, or the first mode the client allows when it does
 * not allow journeys.
 */
@Singleton
public class ProtocolContextResolver {

  /** Client property that turns journey UI off for a client. */
  public static final String USE_JOURNEY_FLOW_PROPERTY = "useJourneyFlow";
  /** Request parameter that carries the correlation id across redirects. */
  public static final String CORRELATION_ID_PARAM = "correlation_id";

  private static final Logger log = LoggerFactory.getLogger(ProtocolContextResolver.class);
  private static final Pattern CORRELATION_ID = Pattern.compile("[A-Za-z0-9_-]{1,128}");

  @Inject
  public ProtocolContextResolver() {
  }

  /**
   * Resolves the context for a request.
   *
   * @param endpointType the endpoint being served
   * @param tenantId     the tenant, may be null
   * @param client       the client, may be null before the client is known
   * @param parameters   the request parameters
   * @return the context
   */
  public ProtocolContext resolve(EndpointType endpointType,
                                 String tenantId,
                                 ValidatedClient client,
                                 Map<String, String> parameters) {
    UiMode uiMode = resolveUiMode(client, parameters.get(ProtocolEndpoints.UI_MODE_QUERY_PARAM));
    String policyId = policyId(parameters).orElse(null);
    String correlationId = correlationId(parameters.get(CORRELATION_ID_PARAM));
    ProtocolContext context = new ProtocolContext(endpointType, tenantId,
        client == null ? null : client.clientId(), uiMode, policyId, correlationId);
    log.debug("Resolved {} context: uiMode={}, policy={}, correlation={}",
        endpointType, uiMode, policyId, correlationId);
    return context;
  }

  /**
   * Resolves the UI mode for a client and an optional {@code ui_mode} parameter.
   *
   * @param client    the client, may be null
   * @param requested the raw parameter, may be null
   * @return the UI mode
   */
  public UiMode resolveUiMode(ValidatedClient client, String requested) {
    if (client != null && "false".equalsIgnoreCase(client.properties().get(USE_JOURNEY_FLOW_PROPERTY))) {
      return UiMode.STANDALONE;
    }
    Optional<UiMode> mode = UiMode.parse(requested);
    if (mode.isPresent()) {
      if (client == null || client.allowsUiMode(mode.get())) {
        return mode.get();
      }
      log.debug("Client {} does not allow ui_mode {}", client.clientId(), mode.get().value());
    }
    if (client == null || client.allowsUiMode(UiMode.JOURNEY)) {
      return UiMode.JOURNEY;
    }
    return Arrays.stream(UiMode.values())
        .filter(client::allowsUiMode)
        .findFirst()
        .orElse(UiMode.JOURNEY);
  }

  /**
   * Maps a request path to its endpoint, ignoring any tenant prefix.
   *
   * @param path the request path
   * @return the endpoint, empty when the path is not a protocol endpoint
   */
  public Optional<EndpointType> endpointFor(String path) {
    if (path == null) {
      return Optional.empty();
    }
    String normalized = path.endsWith("/") && path.length() > 1 ? path.substring(0, path.length() - 1) : path;
    if (normalized.endsWith(ProtocolEndpoints.AUTHORIZE)) {
      return Optional.of(EndpointType.AUTHORIZE);
    } else if (normalized.endsWith(ProtocolEndpoints.TOKEN)) {
      return Optional.of(EndpointType.TOKEN);
    } else if (normalized.endsWith(ProtocolEndpoints.DISCOVERY)) {
      return Optional.of(EndpointType.METADATA);
    } else if (normalized.endsWith(ProtocolEndpoints.USER_INFO)) {
      return Optional.of(EndpointType.USER_INFO);
    } else if (normalized.endsWith(ProtocolEndpoints.END_SESSION)) {
      return Optional.of(EndpointType.LOGOUT);
    } else if (normalized.endsWith(ProtocolEndpoints.INTROSPECTION)) {
      return Optional.of(EndpointType.INTROSPECTION);
    } else if (normalized.endsWith(ProtocolEndpoints.REVOCATION)) {
      return Optional.of(EndpointType.REVOCATION);
    } else if (normalized.endsWith(ProtocolEndpoints.DEVICE_AUTHORIZATION)) {
      return Optional.of(EndpointType.DEVICE_AUTHORIZATION);
    } else if (normalized.endsWith(ProtocolEndpoints.PUSHED_AUTHORIZATION)) {
      return Optional.of(EndpointType.PUSHED_AUTHORIZATION);
    } else if (normalized.endsWith(ProtocolEndpoints.BACKCHANNEL_AUTHENTICATION)) {
      return Optional.of(EndpointType.BACKCHANNEL_AUTHENTICATION);
    }
    return Optional.empty();
  }

  private static Optional<String> policyId(Map<String, String> parameters) {
    String policy = parameters.get(ProtocolEndpoints.POLICY_QUERY_PARAM);
    if (policy == null || policy.isBlank()) {
      policy = parameters.get(ProtocolEndpoints.POLICY_QUERY_PARAM_SHORT);
    }
    return policy == null || policy.isBlank() ? Optional.empty() : Optional.of(policy.trim());
  }

  private static String correlationId(String incoming) {
    if (incoming != null && CORRELATION_ID.matcher(incoming).matches()) {
      return incoming;
    }
    return UUID.randomUUID().toString();
  }
}
