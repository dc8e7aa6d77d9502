package com.codeheadsystems.oluso.server.validation;

import com.codeheadsystems.oluso.model.OidcConstants.Errors;
import com.codeheadsystems.oluso.model.OidcConstants.GrantTypes;
import com.codeheadsystems.oluso.server.request.TokenRequest;
import com.codeheadsystems.oluso.server.request.ValidatedClient;
import java.util.Set;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Checks that a token request carries the parameters its grant type needs and that the client
 * may use that grant type. Grant-specific state (codes, tokens, handles) is checked by the grant
 * handlers.
 */
@Singleton
public class TokenRequestValidator {

  private static final Set<String> SUPPORTED_GRANT_TYPES = Set.of(GrantTypes.AUTHORIZATION_CODE,
      GrantTypes.CLIENT_CREDENTIALS, GrantTypes.REFRESH_TOKEN, GrantTypes.DEVICE_CODE, GrantTypes.CIBA,
      GrantTypes.TOKEN_EXCHANGE);

  private final ScopeValidator scopeValidator;

  @Inject
  public TokenRequestValidator(ScopeValidator scopeValidator) {
    this.scopeValidator = scopeValidator;
  }

  public ValidationResult validate(TokenRequest request, ValidatedClient client) {
    String grantType = request.grantType();
    if (grantType == null || grantType.isBlank()) {
      return ValidationResult.failure(Errors.INVALID_REQUEST, "grant_type is required");
    }
    if (!SUPPORTED_GRANT_TYPES.contains(grantType)) {
      return ValidationResult.failure(Errors.UNSUPPORTED_GRANT_TYPE, "Unsupported grant type");
    }
    if (!client.allowedGrantTypes().contains(grantType)) {
      return ValidationResult.failure(Errors.UNAUTHORIZED_CLIENT, "Client is not allowed to use " + grantType);
    }
    switch (grantType) {
      case GrantTypes.AUTHORIZATION_CODE:
        ValidationResult code = require(request.code(), "code");
        if (code.isValid() && client.requirePkce()) {
          return require(request.codeVerifier(), "code_verifier");
        }
        return code;
      case GrantTypes.REFRESH_TOKEN:
        return require(request.refreshToken(), "refresh_token");
      case GrantTypes.DEVICE_CODE:
        return require(request.deviceCode(), "device_code");
      case GrantTypes.CIBA:
        return require(request.authReqId(), "auth_req_id");
      case GrantTypes.TOKEN_EXCHANGE:
        ValidationResult subject = require(request.subjectToken(), "subject_token");
        return subject.isValid() ? require(request.subjectTokenType(), "subject_token_type") : subject;
      case GrantTypes.CLIENT_CREDENTIALS:
        return scopeValidator.validate(request.requestedScopes(), client);
      default:
        return ValidationResult.success();
    }
  }

  private static ValidationResult require(String value, String name) {
    if (value == null || value.isBlank()) {
      return ValidationResult.failure(Errors.INVALID_REQUEST, name + " is required");
    }
    return ValidationResult.success();
  }
}
