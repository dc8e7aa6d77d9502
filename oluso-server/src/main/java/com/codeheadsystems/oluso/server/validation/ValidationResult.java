package com.codeheadsystems.oluso.server.validation;

import com.codeheadsystems.oluso.server.protocol.ProtocolError;

/**
 * Outcome of a validation step. A failure carries the protocol error to return.
 *
 * @param error the error, null when valid
 */
public record ValidationResult(ProtocolError error) {

  private static final ValidationResult SUCCESS = new ValidationResult(null);

  public static ValidationResult success() {
    return SUCCESS;
  }

  public static ValidationResult failure(String error, String description) {
    return new ValidationResult(ProtocolError.of(error, description));
  }

  public boolean isValid() {
    return error == null;
  }
}
