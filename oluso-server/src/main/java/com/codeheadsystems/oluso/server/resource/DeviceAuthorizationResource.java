package com.codeheadsystems.oluso.server.resource;

import com.codeheadsystems.oluso.model.OidcConstants.GrantTypes;
import com.codeheadsystems.oluso.model.OidcConstants.ProtocolEndpoints;
import com.codeheadsystems.oluso.server.manager.DeviceAuthorizationManager;
import com.codeheadsystems.oluso.server.manager.DeviceAuthorizationResult;
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
 * The device authorization endpoint (RFC 8628 section 3.1).
 */
@Singleton
@Path(ProtocolEndpoints.DEVICE_AUTHORIZATION)
public class DeviceAuthorizationResource {
  private static final Logger log = LoggerFactory.getLogger(DeviceAuthorizationResource.class);

  private final ClientAuthenticator clientAuthenticator;
  private final DeviceAuthorizationManager deviceAuthorizationManager;

  @Inject
  public DeviceAuthorizationResource(final ClientAuthenticator clientAuthenticator,
                                     final DeviceAuthorizationManager deviceAuthorizationManager) {
    this.clientAuthenticator = clientAuthenticator;
    this.deviceAuthorizationManager = deviceAuthorizationManager;
    log.info("DeviceAuthorizationResource({})", deviceAuthorizationManager);
  }

  @POST
  @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
  @Produces(MediaType.APPLICATION_JSON)
  public Response authorize(@HeaderParam(HttpHeaders.AUTHORIZATION) final String authorization,
                            @HeaderParam(ProtocolResponses.TENANT_HEADER) final String tenantId,
                            final MultivaluedMap<String, String> form) {
    FormParameters params = new FormParameters(form);
    Optional<String> repeated = params.repeatedParameter();
    if (repeated.isPresent()) {
      return ProtocolResponses.repeated(repeated.get());
    }
    ClientAuthenticationResult auth = clientAuthenticator.authenticate(TokenRequest.builder(GrantTypes.DEVICE_CODE)
        .withClientCredentials(params.get("client_id"), params.get("client_secret"))
        .withAuthorizationHeader(authorization)
        .withTenantId(tenantId)
        .build());
    if (!auth.isAuthenticated()) {
      return ProtocolResponses.error(auth.error(), ProtocolResponses.UNAUTHORIZED);
    }
    DeviceAuthorizationResult result = deviceAuthorizationManager.authorize(auth.client(), params.get("scope"));
    if (!result.isSuccess()) {
      return ProtocolResponses.error(result.error(), ProtocolResponses.statusFor(result.error()));
    }
    return ProtocolResponses.ok(result.response());
  }
}
