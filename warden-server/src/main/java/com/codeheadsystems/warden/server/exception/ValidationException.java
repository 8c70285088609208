package com.codeheadsystems.warden.server.exception;

import com.codeheadsystems.warden.server.model.RejectionReason;

/**
 * Malformed or missing request input, or a new secret that breaks the strength policy.
 * Maps to HTTP 400.
 */
public class ValidationException extends IllegalArgumentException {

  private final String reason;

  public ValidationException(String reason, String message) {
    super(message);
    this.reason = reason;
  }

  public ValidationException(RejectionReason reason, String message) {
    this(reason.code(), message);
  }

  /**
   * Machine readable reason code, for example {@code complexity}.
   *
   * @return the reason
   */
  public String reason() {
    return reason;
  }
}
