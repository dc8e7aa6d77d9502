package com.codeheadsystems.oluso.server.resource;

import com.codeheadsystems.oluso.model.OidcConstants.ProtocolEndpoints;
import com.codeheadsystems.oluso.server.manager.TokenEndpointManager;
import com.codeheadsystems.oluso.server.manager.TokenEndpointResult;
import com.codeheadsystems.oluso.server.request.TokenRequest;
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
 * The token endpoint.
 */
@Singleton
@Path(ProtocolEndpoints.TOKEN)
public class TokenResource {
  private static final Logger log = LoggerFactory.getLogger(TokenResource.class);

  private final TokenEndpointManager tokenEndpointManager;

  @Inject
  public TokenResource(final TokenEndpointManager tokenEndpointManager) {
    this.tokenEndpointManager = tokenEndpointManager;
    log.info("TokenResource({})", tokenEndpointManager);
  }

  /**
   * Token request.
   *
   * @param authorization the Authorization header, for client_secret_basic
   * @param dpop          the DPoP proof header
   * @param tenantId      the tenant header
   * @param form          the form parameters
   * @return the token or error response
   */
  @POST
  @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
  @Produces(MediaType.APPLICATION_JSON)
  public Response token(@HeaderParam(HttpHeaders.AUTHORIZATION) final String authorization,
                        @HeaderParam("DPoP") final String dpop,
                        @HeaderParam(ProtocolResponses.TENANT_HEADER) final String tenantId,
                        final MultivaluedMap<String, String> form) {
    FormParameters params = new FormParameters(form);
    log.trace("token(grant_type={})", params.get("grant_type"));
    Optional<String> repeated = params.repeatedParameter();
    if (repeated.isPresent()) {
      return ProtocolResponses.repeated(repeated.get());
    }
    TokenRequest request = TokenRequest.builder(params.get("grant_type"))
        .withClientCredentials(params.get("client_id"), params.get("client_secret"))
        .withAuthorizationHeader(authorization)
        .withClientAssertion(params.get("client_assertion"), params.get("client_assertion_type"))
        .withCode(params.get("code"))
        .withRedirectUri(params.get("redirect_uri"))
        .withCodeVerifier(params.get("code_verifier"))
        .withRefreshToken(params.get("refresh_token"))
        .withDeviceCode(params.get("device_code"))
        .withAuthReqId(params.get("auth_req_id"))
        .withSubjectToken(params.get("subject_token"), params.get("subject_token_type"))
        .withActorToken(params.get("actor_token"), params.get("actor_token_type"))
        .withRequestedTokenType(params.get("requested_token_type"))
        .withAudience(params.get("audience"))
        .withScope(params.get("scope"))
        .withResources(params.all("resource"))
        .withDpopProof(dpop)
        .withTenantId(tenantId)
        .build();

    TokenEndpointResult result = tokenEndpointManager.token(request);
    if (result.isSuccess()) {
      return ProtocolResponses.ok(result.response());
    }
    Response response = ProtocolResponses.error(result.error(), result.status());
    if (result.dpopNonce() != null) {
      return Response.fromResponse(response).header(ProtocolResponses.DPOP_NONCE_HEADER, result.dpopNonce()).build();
    }
    return response;
  }
}
