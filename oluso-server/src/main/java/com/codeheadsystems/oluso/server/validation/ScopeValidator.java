package com.codeheadsystems.oluso.server.validation;

import com.codeheadsystems.oluso.model.OidcConstants.Errors;
import com.codeheadsystems.oluso.model.OidcConstants.Scopes;
import com.codeheadsystems.oluso.server.request.ValidatedClient;
import java.util.Set;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Requested scopes must be a subset of the client's allowed scopes.
 */
@Singleton
public class ScopeValidator {

  @Inject
  public ScopeValidator() {
  }

  public ValidationResult validate(Set<String> requestedScopes, ValidatedClient client) {
    for (String scope : requestedScopes) {
      if (Scopes.OFFLINE_ACCESS.equals(scope)) {
        if (!client.allowOfflineAccess()) {
          return ValidationResult.failure(Errors.INVALID_SCOPE, "Client is not allowed offline access");
        }
        continue;
      }
      if (!client.allowedScopes().contains(scope)) {
        return ValidationResult.failure(Errors.INVALID_SCOPE, "Scope not allowed: " + scope);
      }
    }
    return ValidationResult.success();
  }
}
