package com.codeheadsystems.oluso.server.resource;

import com.codeheadsystems.oluso.model.OidcConstants.GrantTypes;
import com.codeheadsystems.oluso.model.OidcConstants.ProtocolEndpoints;
import com.codeheadsystems.oluso.model.ciba.BackchannelAuthenticationResponse;
import com.codeheadsystems.oluso.server.ciba.CibaAuthenticationRequest;
import com.codeheadsystems.oluso.server.ciba.CibaAuthenticationResult;
import com.codeheadsystems.oluso.server.ciba.CibaService;
import com.codeheadsystems.oluso.server.request.TokenRequest;
import com.codeheadsystems.oluso.server.validation.ClientAuthenticationResult;
import com.codeheadsystems.oluso.server.validation.ClientAuthenticator;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.MultivaluedMap;
import jakarta.ws.rs.core.Response;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The backchannel authentication endpoint (CIBA Core section 7).
 */
@Singleton
@Path(ProtocolEndpoints.BACKCHANNEL_AUTHENTICATION)
public class BackchannelAuthenticationResource {
  private static final Logger log = LoggerFactory.getLogger(BackchannelAuthenticationResource.class);

  private final ClientAuthenticator clientAuthenticator;
  private final CibaService cibaService;

  @Inject
  public BackchannelAuthenticationResource(final ClientAuthenticator clientAuthenticator,
                                           final CibaService cibaService) {
    this.clientAuthenticator = clientAuthenticator;
    this.cibaService = cibaService;
    log.info("BackchannelAuthenticationResource({})", cibaService);
  }

  @POST
  @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
  @Produces(MediaType.APPLICATION_JSON)
  public Response authenticate(@HeaderParam(HttpHeaders.AUTHORIZATION) final String authorization,
                               @HeaderParam(ProtocolResponses.TENANT_HEADER) final String tenantId,
                               final MultivaluedMap<String, String> form) {
    FormParameters params = new FormParameters(form);
    Optional<String> repeated = params.repeatedParameter();
    if (repeated.isPresent()) {
      return ProtocolResponses.repeated(repeated.get());
    }
    ClientAuthenticationResult auth = clientAuthenticator.authenticate(TokenRequest.builder(GrantTypes.CIBA)
        .withClientCredentials(params.get("client_id"), params.get("client_secret"))
        .withAuthorizationHeader(authorization)
        .withClientAssertion(params.get("client_assertion"), params.get("client_assertion_type"))
        .withTenantId(tenantId)
        .build());
    if (!auth.isAuthenticated()) {
      return ProtocolResponses.error(auth.error(), ProtocolResponses.UNAUTHORIZED);
    }
    CibaAuthenticationRequest request = new CibaAuthenticationRequest(auth.client().clientId(),
        params.get("scope"),
        params.get("login_hint"),
        params.get("login_hint_token"),
        params.get("id_token_hint"),
        params.get("binding_message"),
        params.get("user_code"),
        params.get("acr_values"),
        params.getInt("requested_expiry"),
        params.get("client_notification_token"));
    CibaAuthenticationResult result = cibaService.authenticate(request, auth.client());
    if (!result.isSuccess()) {
      return ProtocolResponses.error(result.error(), ProtocolResponses.statusFor(result.error()));
    }
    return ProtocolResponses.ok(
        new BackchannelAuthenticationResponse(result.authReqId(), result.expiresIn(), result.interval()));
  }
}
