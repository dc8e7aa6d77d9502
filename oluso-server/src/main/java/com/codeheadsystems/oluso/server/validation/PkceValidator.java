package com.codeheadsystems.oluso.server.validation;

import com.codeheadsystems.oluso.model.OidcConstants.CodeChallengeMethods;
import com.codeheadsystems.oluso.model.OidcConstants.Errors;
import com.codeheadsystems.oluso.server.request.ValidatedClient;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.regex.Pattern;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Proof Key for Code Exchange (RFC 7636) checks.
 */
@Singleton
public class PkceValidator {

  public static final int MIN_LENGTH = 43;
  public static final int MAX_LENGTH = 128;

  // RFC 7636 section 4.1 unreserved characters
  private static final Pattern UNRESERVED = Pattern.compile("^[A-Za-z0-9\\-._~]+$");
  private static final Base64.Encoder B64URL = Base64.getUrlEncoder().withoutPadding();

  @Inject
  public PkceValidator() {
  }

  /**
   * Validates the challenge sent with an authorize request.
   *
   * @param codeChallenge the code challenge, may be null
   * @param method        the challenge method, null means plain
   * @param client        the requesting client
   * @return the validation result
   */
  public ValidationResult validateCodeChallenge(String codeChallenge, String method, ValidatedClient client) {
    if (codeChallenge == null || codeChallenge.isEmpty()) {
      if (client.requirePkce()) {
        return ValidationResult.failure(Errors.INVALID_REQUEST, "code_challenge is required");
      }
      return ValidationResult.success();
    }
    if (!isWellFormed(codeChallenge)) {
      return ValidationResult.failure(Errors.INVALID_REQUEST, "Invalid code_challenge format");
    }
    String effective = method == null || method.isEmpty() ? CodeChallengeMethods.PLAIN : method;
    if (!CodeChallengeMethods.PLAIN.equals(effective) && !CodeChallengeMethods.S256.equals(effective)) {
      return ValidationResult.failure(Errors.INVALID_REQUEST, "Unsupported code_challenge_method");
    }
    if (CodeChallengeMethods.PLAIN.equals(effective) && !client.allowPlainTextPkce()) {
      return ValidationResult.failure(Errors.INVALID_REQUEST, "Plain code_challenge_method is not allowed");
    }
    return ValidationResult.success();
  }

  /**
   * Checks a code verifier against the challenge stored with the authorization code.
   *
   * @param codeVerifier  the verifier from the token request
   * @param codeChallenge the stored challenge
   * @param method        the stored method, null means plain
   * @return the validation result, failures are {@code invalid_grant}
   */
  public ValidationResult validateCodeVerifier(String codeVerifier, String codeChallenge, String method) {
    if (codeVerifier == null || codeVerifier.isEmpty()) {
      return ValidationResult.failure(Errors.INVALID_GRANT, "code_verifier is required");
    }
    if (!isWellFormed(codeVerifier)) {
      return ValidationResult.failure(Errors.INVALID_GRANT, "Invalid code_verifier format");
    }
    String expected = CodeChallengeMethods.S256.equals(method)
        ? computeS256Challenge(codeVerifier)
        : codeVerifier;
    boolean matches = MessageDigest.isEqual(
        expected.getBytes(StandardCharsets.US_ASCII),
        codeChallenge.getBytes(StandardCharsets.US_ASCII));
    if (!matches) {
      return ValidationResult.failure(Errors.INVALID_GRANT, "Invalid code_verifier");
    }
    return ValidationResult.success();
  }

  /**
   * BASE64URL(SHA256(ASCII(verifier))).
   *
   * @param codeVerifier the verifier
   * @return the S256 challenge
   */
  public static String computeS256Challenge(String codeVerifier) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return B64URL.encodeToString(digest.digest(codeVerifier.getBytes(StandardCharsets.US_ASCII)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  private static boolean isWellFormed(String value) {
    return value.length() >= MIN_LENGTH && value.length() <= MAX_LENGTH
        && UNRESERVED.matcher(value).matches();
  }
}
